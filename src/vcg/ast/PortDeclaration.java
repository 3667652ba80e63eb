package vcg.ast;

import java.util.Optional;

public class PortDeclaration extends AstNode {
  private final String identifier;
  private final PortDirection direction;
  private final NetKind netKind;
  private final RangeExpression range;

  public PortDeclaration(String identifier, PortDirection direction, NetKind netKind, RangeExpression range, int sourceLine) {
    super(sourceLine);
    this.identifier = identifier;
    this.direction = direction;
    this.netKind = netKind;
    this.range = range;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.PortDeclaration;
  }

  public String getIdentifier() { return identifier; }
  public PortDirection getDirection() { return direction; }
  public NetKind getNetKind() { return netKind; }
  public Optional<RangeExpression> getRange() { return Optional.ofNullable(range); }

  @Override
  public String toString() {
    return direction + " " + netKind + (range != null ? " " + range.toDeclarationString() : "") + " " + identifier;
  }
}
