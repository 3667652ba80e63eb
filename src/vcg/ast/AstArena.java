package vcg.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Owns all nodes of one parse. Nodes reference each other by index into this arena.
 */
public class AstArena {
  private final List<AstNode> nodes = new ArrayList<>();

  /**
   * Adds a node to the arena.
   * @param node the new node, not yet part of any arena
   * @param parent index of the parent node, or -1 for a root
   * @return the index of the added node
   */
  public int add(AstNode node, int parent) {
    if (node.getIndex() >= 0)
      throw new IllegalArgumentException("Node " + node + " already belongs to an arena");
    if (parent >= nodes.size())
      throw new IndexOutOfBoundsException("Parent index " + parent + " out of range");
    int index = nodes.size();
    nodes.add(node);
    node.attach(index, parent);
    if (parent >= 0)
      nodes.get(parent).addChild(index);
    return index;
  }

  public AstNode get(int index) { return nodes.get(index); }

  public <T extends AstNode> T get(int index, Class<T> nodeClass) { return nodeClass.cast(nodes.get(index)); }

  public int size() { return nodes.size(); }

  /** Children of the given node, in insertion order. */
  public Stream<AstNode> children(int index) { return nodes.get(index).getChildren().stream().map(nodes::get); }

  /** Children of the given node that are instances of the given class, in insertion order. */
  public <T extends AstNode> Stream<T> children(int index, Class<T> nodeClass) {
    return children(index).filter(nodeClass::isInstance).map(nodeClass::cast);
  }

  /**
   * Depth-first pre-order walk starting at the given node.
   */
  public void walk(int index, AstVisitor visitor) {
    AstNode node = nodes.get(index);
    boolean descend = switch (node.getKind()) {
      case DesignUnit -> visitor.visitDesignUnit((DesignUnit)node);
      case ModuleDeclaration -> visitor.visitModuleDeclaration((ModuleDeclaration)node);
      case ParameterDeclaration -> visitor.visitParameterDeclaration((ParameterDeclaration)node);
      case PortDeclaration -> visitor.visitPortDeclaration((PortDeclaration)node);
    };
    if (descend) {
      for (int child : node.getChildren())
        walk(child, visitor);
    }
  }
}
