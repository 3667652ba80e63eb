package vcg.ast;

import java.util.List;
import java.util.stream.Collectors;

public class ModuleDeclaration extends AstNode {
  private final String name;
  private final AstArena arena;

  public ModuleDeclaration(AstArena arena, String name, int sourceLine) {
    super(sourceLine);
    this.arena = arena;
    this.name = name;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ModuleDeclaration;
  }

  public String getName() { return name; }

  /** Parameters in declaration order (header list first, then body declarations). */
  public List<ParameterDeclaration> getParameters() {
    return arena.children(getIndex(), ParameterDeclaration.class).collect(Collectors.toList());
  }

  /** Ports in header order; only ports with a resolved direction are present. */
  public List<PortDeclaration> getPorts() { return arena.children(getIndex(), PortDeclaration.class).collect(Collectors.toList()); }

  /** Statement bodies are skipped, never retained. */
  public boolean isBodyIgnored() { return true; }

  @Override
  public String toString() {
    return "module " + name;
  }
}
