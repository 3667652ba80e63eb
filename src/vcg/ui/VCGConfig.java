package vcg.ui;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;
import vcg.VCGFileException;
import vcg.gen.InstanceGenerator;
import vcg.gen.WireGenerator;
import vcg.preprocess.MacroSet;

/**
 * Data-Class to hold tool options.
 */
public class VCGConfig {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Macro name to value; a null or empty value means "defined". */
  public Map<String, Object> macros = new LinkedHashMap<>();

  public int instance_alignment = InstanceGenerator.DEFAULT_ALIGNMENT;
  public int wire_spacing = WireGenerator.DEFAULT_SPACING;
  public String indent = InstanceGenerator.DEFAULT_INDENT;

  /** Retry with the unprocessed text if the preprocessor fails. */
  public boolean preprocess_fallback = true;

  /**
   * Loads a configuration from a YAML mapping. Keys not present keep their defaults.
   */
  public static VCGConfig load(Path file) throws VCGFileException {
    Yaml yamlConfig = new Yaml(new Constructor(VCGConfig.class, new LoaderOptions()));
    try (InputStream readFile = Files.newInputStream(file)) {
      VCGConfig config = yamlConfig.load(readFile);
      if (config == null)
        config = new VCGConfig();
      if (config.macros == null)
        config.macros = new LinkedHashMap<>();
      logger.debug("Loaded configuration {}: {} macros", file, config.macros.size());
      return config;
    } catch (NoSuchFileException e) {
      throw new VCGFileException(file, "Configuration file not found", e);
    } catch (IOException e) {
      throw new VCGFileException(file, "Cannot read configuration file", e);
    } catch (YAMLException e) {
      throw new VCGFileException(file, "Invalid configuration file (" + e.getMessage() + ")", e);
    }
  }

  /** Converts the configured macros; values are rendered with toString. */
  public MacroSet toMacroSet() {
    MacroSet macroSet = new MacroSet();
    if (macros != null)
      macros.forEach((name, value) -> macroSet.define(name, value == null ? null : value.toString()));
    return macroSet;
  }
}
