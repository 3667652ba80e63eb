package vcg.ui;

import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.cli.*;
import org.apache.logging.log4j.*;
import org.apache.logging.log4j.core.appender.*;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.core.config.builder.api.*;
import org.apache.logging.log4j.core.config.builder.impl.*;
import vcg.VCG;
import vcg.VCGException;
import vcg.preprocess.MacroSet;

public class VCGCmd {
  // logging
  protected static Logger logger = null;

  static final String LOG_PATTERN = "%-5level: %msg%n%throwable";

  // object and function for help text generation
  private static HelpFormatter helper = new HelpFormatter();
  private static void printHelp(Options options) {
    helper.printHelp("vcg [options] <file> - generate Verilog instances and wires from //VCG_BEGIN blocks", options);
  };

  static Options buildOptions() {
    Options options = new Options();
    options.addOption(Option.builder("m")
                          .longOpt("macros")
                          .argName("A,B=2")
                          .hasArg()
                          .required(false)
                          .desc("Comma separated macro definitions for `ifdef evaluation; a name without value is defined as 1")
                          .build());
    options.addOption(
        Option.builder("c").longOpt("config").argName("config.yaml").hasArg().required(false).desc("YAML-file with tool options").build());
    options.addOption(Option.builder("o")
                          .longOpt("out")
                          .argName("file")
                          .hasArg()
                          .required(false)
                          .desc("Write the result to this file instead of updating the input in place")
                          .build());
    options.addOption(
        Option.builder("l").longOpt("log-file").argName("file").hasArg().required(false).desc("Additionally write all messages to this file").build());
    options.addOption(Option.builder("h").longOpt("help").required(false).desc("Print this message").build());
    options.addOption(Option.builder("q").longOpt("quiet").required(false).desc("Turn off all messages").build());
    options.addOption(Option.builder("v").longOpt("verbose").required(false).desc("Verbose printing").build());
    options.addOption(Option.builder("vv").longOpt("vverbose").required(false).desc("Print debug information and enable -v").build());
    return options;
  }

  /**
   * Sets up console logging and, if a file is given, file logging.
   */
  static void initLogging(String logFile) {
    // get builder to create new appender
    ConfigurationBuilder<BuiltConfiguration> builder = ConfigurationBuilderFactory.newConfigurationBuilder();
    // generate appender for stdout writing
    AppenderComponentBuilder appenderBuilder =
        builder.newAppender("Stdout", "CONSOLE").addAttribute("target", ConsoleAppender.Target.SYSTEM_OUT);
    // set printing layout
    appenderBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", LOG_PATTERN));
    builder.add(appenderBuilder);
    RootLoggerComponentBuilder rootLogger = builder.newRootLogger(Level.INFO).add(builder.newAppenderRef("Stdout"));
    if (logFile != null) {
      AppenderComponentBuilder fileBuilder = builder.newAppender("LogFile", "File").addAttribute("fileName", logFile).addAttribute("append", false);
      fileBuilder.add(builder.newLayout("PatternLayout").addAttribute("pattern", "%d{HH:mm:ss.SSS} " + LOG_PATTERN));
      builder.add(fileBuilder);
      rootLogger.add(builder.newAppenderRef("LogFile"));
    }
    builder.add(rootLogger);
    // initialize logging and generate logger for current class
    Configurator.initialize(builder.build());
    logger = LogManager.getLogger();
  }

  // entrypoint
  public static void main(String[] args) { System.exit(run(args)); }

  /**
   * Runs the tool.
   * @return the process exit code: 0 on success, 1 if generation failed, 2 for invalid arguments
   */
  public static int run(String[] args) {
    Options options = buildOptions();
    CommandLineParser parser = new DefaultParser();

    //////////   collect options   //////////
    CommandLine line;
    try {
      line = parser.parse(options, args);
    } catch (ParseException exp) {
      // parsing failed - raise error to user
      System.err.println(exp.getMessage());
      printHelp(options);
      return 2;
    }
    if (line.hasOption("h")) {
      printHelp(options);
      return 0;
    }
    if (line.getArgList().size() != 1) {
      System.err.println(line.getArgList().isEmpty() ? "No input file given" : "Only one input file may be given");
      printHelp(options);
      return 2;
    }

    initLogging(line.getOptionValue("l"));
    // set verbosity of printing
    Level logLvl = Level.INFO;
    if (line.hasOption("q"))
      logLvl = Level.OFF;
    if (line.hasOption("v"))
      logLvl = Level.DEBUG;
    if (line.hasOption("vv"))
      logLvl = Level.TRACE;
    Configurator.setAllLevels(LogManager.getRootLogger().getName(), logLvl);

    Path file = Path.of(line.getArgList().get(0));
    Path outFile = line.hasOption("o") ? Path.of(line.getOptionValue("o")) : null;

    //////////   invoke generation   //////////
    try {
      if (!Files.isRegularFile(file))
        throw new VCGException("Input file not found: " + file);
      VCGConfig cfg = line.hasOption("c") ? VCGConfig.load(Path.of(line.getOptionValue("c"))) : new VCGConfig();
      MacroSet macros = line.hasOption("m") ? MacroSet.parse(line.getOptionValue("m")) : MacroSet.empty();
      VCG vcg = new VCG(cfg, macros);
      vcg.processFile(file, outFile);
    } catch (VCGException | IllegalArgumentException e) {
      logger.error(e.getMessage());
      logger.debug("Failure details", e);
      System.err.println(e.getMessage());
      return 1;
    }
    System.out.println("VCG generate Done: " + (outFile == null ? file : outFile));
    return 0;
  }
}
