package vcg;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.frontend.ParseContext;
import vcg.frontend.ParseResult;
import vcg.frontend.VerilogParser;
import vcg.gen.InstanceGenerator;
import vcg.gen.WireGenerator;
import vcg.preprocess.MacroSet;
import vcg.preprocess.PreprocessException;
import vcg.preprocess.VerilogPreprocessor;
import vcg.rules.RuleEngine;
import vcg.script.GeneratorHost;
import vcg.signature.ModuleSignature;
import vcg.signature.SignatureExtractor;
import vcg.ui.VCGConfig;
import vcg.util.MarkerBlockProcessor;

/**
 * Entry point of the connection generator: parses module headers into signatures and processes files with embedded
 * generator blocks.
 */
public class VCG {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final VCGConfig cfg;
  private final MacroSet macros;

  public VCG() { this(new VCGConfig(), MacroSet.empty()); }

  /**
   * @param cfg tool options
   * @param extraMacros macros that override the configured ones
   */
  public VCG(VCGConfig cfg, MacroSet extraMacros) {
    this.cfg = cfg;
    this.macros = cfg.toMacroSet();
    if (extraMacros != null)
      this.macros.putAll(extraMacros);
    logger.debug("VCG. Using macros {}", this.macros);
  }

  public VCGConfig getConfig() { return cfg; }
  public MacroSet getMacros() { return macros.copy(); }

  /**
   * Preprocesses and parses a text. If preprocessing fails and the configuration allows it, the unprocessed text is parsed instead.
   * @throws PreprocessException if preprocessing fails and no fallback is configured
   */
  public ParseResult parse(String text, MacroSet macroSet, ParseContext context) throws PreprocessException {
    String reduced;
    try {
      reduced = new VerilogPreprocessor(macroSet, context).reduce(text);
    } catch (PreprocessException e) {
      if (!cfg.preprocess_fallback)
        throw e;
      logger.warn("{}. Using original code of {}", e.getMessage(), context.getSourceName());
      reduced = text;
    }
    logger.trace("Reduced text of {}:\n{}", context.getSourceName(), reduced);
    return new VerilogParser(reduced, context).parse();
  }

  /**
   * Parses a module header into its signature.
   * @param sourceName name used in diagnostics
   * @throws VCGParseException if the text declares no module
   */
  public ModuleSignature parseModule(String text, String sourceName) throws VCGException {
    ParseContext context = new ParseContext(sourceName);
    ParseResult result = parse(text, macros, context);
    Optional<ModuleSignature> signature = SignatureExtractor.extract(result.designUnit());
    if (signature.isEmpty())
      throw new VCGParseException("Cannot parse Verilog module: " + context.getSourceName(), result.diagnostics());
    logger.debug("Parsed module '{}' from {}: {} ports, {} parameters, {} errors", signature.get().getName(), context.getSourceName(),
                 signature.get().getPortCount(), signature.get().getParameters().size(), result.errorCount());
    return signature.get();
  }

  /**
   * Reads and parses a module file. The file is read as UTF-8, or as ISO-8859-1 if it is not valid UTF-8.
   * @throws VCGFileException if the file cannot be read
   * @throws VCGParseException if the file declares no module
   */
  public ModuleSignature parseFile(Path file) throws VCGException { return parseModule(readSource(file), file.toString()); }

  public static String readSource(Path file) throws VCGFileException {
    try {
      try {
        return Files.readString(file, StandardCharsets.UTF_8);
      } catch (CharacterCodingException e) {
        logger.debug("{} is not valid UTF-8, reading as ISO-8859-1", file);
        return Files.readString(file, StandardCharsets.ISO_8859_1);
      }
    } catch (NoSuchFileException e) {
      throw new VCGFileException(file, "Cannot find Verilog file", e);
    } catch (IOException e) {
      throw new VCGFileException(file, "Cannot read Verilog file", e);
    }
  }

  public InstanceGenerator newInstanceGenerator(RuleEngine rules) { return new InstanceGenerator(rules, cfg.instance_alignment, cfg.indent); }

  public WireGenerator newWireGenerator(RuleEngine rules) { return new WireGenerator(rules, cfg.wire_spacing); }

  /**
   * Creates a script host with a fresh rule engine. Relative module files are looked up in baseDir first.
   */
  public GeneratorHost newGeneratorHost(Path baseDir) {
    RuleEngine rules = new RuleEngine(new ParseContext("rules"));
    return new GeneratorHost(rules, newInstanceGenerator(rules), newWireGenerator(rules), this::parseFile, baseDir);
  }

  /**
   * Executes the generator blocks of a file and writes the generated sections.
   * Every block runs on its own host, so rules of one block never reach another.
   *
   * @param outFile result file; null to update the file in place
   * @return the number of processed blocks
   */
  public int processFile(Path file, Path outFile) throws VCGException {
    Path baseDir = file.toAbsolutePath().getParent();
    MarkerBlockProcessor processor = new MarkerBlockProcessor((block, script) -> newGeneratorHost(baseDir).execute(script));
    return processor.process(file, outFile);
  }
}
