package vcg.ast;

/**
 * Callback for {@link AstArena#walk(int, AstVisitor)}. Each method returns whether to descend into the node's children.
 */
public interface AstVisitor {
  default boolean visitDesignUnit(DesignUnit node) { return true; }
  default boolean visitModuleDeclaration(ModuleDeclaration node) { return true; }
  default boolean visitParameterDeclaration(ParameterDeclaration node) { return true; }
  default boolean visitPortDeclaration(PortDeclaration node) { return true; }
}
