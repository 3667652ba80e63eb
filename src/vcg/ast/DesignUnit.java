package vcg.ast;

import java.util.Optional;

/**
 * Root of a parse. Holds at most one module.
 */
public class DesignUnit extends AstNode {
  private final AstArena arena;

  public DesignUnit(AstArena arena) {
    super(0);
    this.arena = arena;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.DesignUnit;
  }

  public AstArena getArena() { return arena; }

  public Optional<ModuleDeclaration> getModule() { return arena.children(getIndex(), ModuleDeclaration.class).findFirst(); }

  public boolean isEmpty() { return getChildren().isEmpty(); }
}
