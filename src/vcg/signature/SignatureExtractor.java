package vcg.signature;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import vcg.ast.AstVisitor;
import vcg.ast.DesignUnit;
import vcg.ast.ModuleDeclaration;
import vcg.ast.ParameterDeclaration;
import vcg.ast.PortDeclaration;

/**
 * Walks a design unit and collects the module's ports and parameters into a {@link ModuleSignature}.
 */
public class SignatureExtractor implements AstVisitor {
  private String moduleName = null;
  private final List<PortInfo> ports = new ArrayList<>();
  private final List<ParameterInfo> parameters = new ArrayList<>();

  /** @return the signature of the unit's module, or empty if the unit holds no module */
  public static Optional<ModuleSignature> extract(DesignUnit unit) {
    SignatureExtractor extractor = new SignatureExtractor();
    unit.getArena().walk(unit.getIndex(), extractor);
    if (extractor.moduleName == null)
      return Optional.empty();
    return Optional.of(new ModuleSignature(extractor.moduleName, extractor.ports, extractor.parameters));
  }

  @Override
  public boolean visitModuleDeclaration(ModuleDeclaration node) {
    if (moduleName != null)
      return false;
    moduleName = node.getName();
    return true;
  }

  @Override
  public boolean visitParameterDeclaration(ParameterDeclaration node) {
    parameters.add(ParameterInfo.of(node));
    return false;
  }

  @Override
  public boolean visitPortDeclaration(PortDeclaration node) {
    ports.add(PortInfo.of(node));
    return false;
  }
}
