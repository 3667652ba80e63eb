package vcg.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * Node stored in an {@link AstArena}. Links to parent and children are arena indices, not references.
 */
public abstract class AstNode {
  /** Closed set of node variants; every traversal switches over it. */
  public enum NodeKind { DesignUnit, ModuleDeclaration, ParameterDeclaration, PortDeclaration }

  private int index = -1;
  private int parent = -1;
  private final List<Integer> children = new ArrayList<>();
  private final int sourceLine;

  protected AstNode(int sourceLine) { this.sourceLine = sourceLine; }

  public abstract NodeKind getKind();

  public int getIndex() { return index; }
  public OptionalInt getParent() { return parent < 0 ? OptionalInt.empty() : OptionalInt.of(parent); }
  public List<Integer> getChildren() { return Collections.unmodifiableList(children); }
  public int getSourceLine() { return sourceLine; }

  void attach(int index, int parent) {
    this.index = index;
    this.parent = parent;
  }
  void addChild(int childIndex) { children.add(childIndex); }

  @Override
  public String toString() {
    return getKind() + "@" + sourceLine;
  }
}
