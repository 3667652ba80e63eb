package vcg.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.VCGException;
import vcg.VCGFileException;

/**
 * Runs the generator blocks embedded in a source file and writes their output back between markers.
 * <p>
 * A block is the text between a line containing {@value #VCG_BEGIN} and the next line containing {@value #VCG_END}; its
 * lines are commented out with {@code //}. The output of block {@code n} is placed between
 * {@code //VCG_GEN_BEGIN_n} and {@code //VCG_GEN_END_n}, which follow the block's end marker. Existing generated
 * sections are replaced, missing ones are created.
 */
public class MarkerBlockProcessor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String VCG_BEGIN = "//VCG_BEGIN";
  public static final String VCG_END = "//VCG_END";
  public static final String VCG_GEN_BEGIN = "//VCG_GEN_BEGIN";
  public static final String VCG_GEN_END = "//VCG_GEN_END";

  private static final Pattern GEN_BEGIN_ID = Pattern.compile("VCG_GEN_BEGIN_(\\d+)");
  private static final Pattern LINE_COMMENT = Pattern.compile("^\\s*//");

  /**
   * One embedded block.
   * @param startLine 0-based line of the begin marker
   * @param endLine 0-based line of the end marker
   * @param code the raw lines between the markers
   */
  public record Block(int id, int startLine, int endLine, String code) {
    /** The block's code with comment markers and common indentation removed. */
    public String script() { return toScript(code); }
  }

  /** Produces the generated text for one block. */
  @FunctionalInterface
  public interface BlockExecutor {
    String execute(Block block, String script) throws VCGException;
  }

  private final BlockExecutor executor;

  public MarkerBlockProcessor(BlockExecutor executor) { this.executor = executor; }

  /**
   * Processes a file.
   *
   * @param outFile file to write the result to; null or the input file to update in place
   * @return the number of blocks that were executed
   * @throws VCGFileException if the file cannot be read or written
   * @throws VCGException if a block fails
   */
  public int process(Path file, Path outFile) throws VCGException {
    logger.info("Starting to process file: {}", file.getFileName());
    String content = read(file);
    List<String> lines = Arrays.asList(content.split("\n", -1));
    logger.debug("File loaded - Size: {} chars, Lines: {}", content.length(), lines.size());

    List<Block> blocks = extractBlocks(lines);
    boolean inplace = (outFile == null || outFile.equals(file));
    if (blocks.isEmpty()) {
      logger.info("No VCG blocks found - skipping file");
      if (!inplace)
        write(outFile, content, file);
      return 0;
    }
    logger.info("Found {} VCG block(s) to process", blocks.size());

    Map<Integer, String> generated = new HashMap<>();
    for (Block block : blocks) {
      logger.debug("Processing VCG block {} (lines {}-{})", block.id(), block.startLine() + 1, block.endLine() + 1);
      String script = block.script();
      if (logger.isTraceEnabled()) {
        String[] scriptLines = script.split("\n", -1);
        for (int i = 0; i < scriptLines.length; ++i)
          logger.trace("  {}: {}", String.format("%2d", i + 1), scriptLines[i]);
      }
      generated.put(block.id(), executor.execute(block, script));
    }

    logger.debug("Injecting generated content back to file");
    List<String> updated = inject(lines, generated);
    String updatedContent = String.join("\n", updated);
    write(inplace ? file : outFile, updatedContent, file);

    logger.info("File processing completed - Lines: {} → {} ({})", lines.size(), updated.size(),
                String.format("%+d", updated.size() - lines.size()));
    return blocks.size();
  }

  /** Finds the embedded blocks; a begin marker without an end marker is ignored. */
  public static List<Block> extractBlocks(List<String> lines) {
    List<Block> blocks = new ArrayList<>();
    boolean inBlock = false;
    List<String> current = new ArrayList<>();
    int startLine = -1;
    for (int lineNum = 0; lineNum < lines.size(); ++lineNum) {
      String line = lines.get(lineNum);
      if (line.contains(VCG_BEGIN)) {
        inBlock = true;
        startLine = lineNum;
        current = new ArrayList<>();
      } else if (line.contains(VCG_END)) {
        if (inBlock) {
          blocks.add(new Block(blocks.size(), startLine, lineNum, String.join("\n", current)));
          logger.trace("VCG block {} extracted: {} lines", blocks.size() - 1, current.size());
        }
        inBlock = false;
      } else if (inBlock) {
        current.add(line);
      }
    }
    return blocks;
  }

  /**
   * Strips the leading {@code //} of every line, drops blank lines and removes the common indentation.
   */
  public static String toScript(String code) {
    List<String> lines = Arrays.stream(code.split("\n", -1))
                             .map(line -> LINE_COMMENT.matcher(line).replaceFirst(""))
                             .filter(line -> !line.isBlank())
                             .collect(Collectors.toList());
    if (lines.isEmpty())
      return "";
    int minIndent = lines.stream().mapToInt(line -> line.length() - line.stripLeading().length()).min().getAsInt();
    return lines.stream().map(line -> line.substring(minIndent)).collect(Collectors.joining("\n"));
  }

  /**
   * Places the generated text of every block after its end marker, replacing the content of existing generated
   * sections.
   *
   * @param generated block id to generated text
   */
  public static List<String> inject(List<String> lines, Map<Integer, String> generated) {
    List<String> result = new ArrayList<>();
    int currentBlockId = 0;
    boolean inGenBlock = false;

    for (int i = 0; i < lines.size(); ++i) {
      String line = lines.get(i);
      if (line.contains(VCG_END)) {
        result.add(line);
        String beginMarker = VCG_GEN_BEGIN + "_" + currentBlockId;
        boolean hasExisting = i + 1 < lines.size() && lines.get(i + 1).contains(beginMarker);
        if (!hasExisting) {
          logger.debug("Creating new generation block for VCG block {}", currentBlockId);
          result.add(beginMarker);
          addContent(result, generated.get(currentBlockId));
          result.add(VCG_GEN_END + "_" + currentBlockId);
        } else {
          logger.debug("Updating existing generation block for VCG block {}", currentBlockId);
        }
        currentBlockId++;
      } else if (line.contains(VCG_GEN_BEGIN)) {
        result.add(line);
        inGenBlock = true;
        Matcher match = GEN_BEGIN_ID.matcher(line);
        if (match.find())
          addContent(result, generated.get(blockId(match.group(1))));
      } else if (line.contains(VCG_GEN_END)) {
        result.add(line);
        inGenBlock = false;
      } else if (!inGenBlock) {
        result.add(line);
      }
    }
    return result;
  }

  /** Block number of a generated-section marker; -1 if it cannot belong to any block. */
  private static int blockId(String digits) {
    try {
      return Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      logger.warn("Ignoring generated section marker with block number {}", digits);
      return -1;
    }
  }

  private static void addContent(List<String> result, String content) {
    if (content == null)
      return;
    content = content.stripTrailing();
    if (!content.isEmpty())
      result.add(content);
  }

  private static String read(Path file) throws VCGFileException {
    try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      StringBuilder content = new StringBuilder();
      char[] buffer = new char[8192];
      int count;
      while ((count = in.read(buffer)) >= 0)
        content.append(buffer, 0, count);
      return content.toString();
    } catch (NoSuchFileException e) {
      throw new VCGFileException(file, "File not found", e);
    } catch (IOException e) {
      throw new VCGFileException(file, "Read file Error", e);
    }
  }

  /** Writes through a temporary file next to the target, which then replaces the target. */
  private static void write(Path target, String content, Path source) throws VCGFileException {
    logger.info("Updating {}", target);
    try {
      Path parent = target.toAbsolutePath().getParent();
      Files.createDirectories(parent);
      Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
      try (PrintWriter out = new PrintWriter(Files.newBufferedWriter(temp, StandardCharsets.UTF_8))) {
        out.print(content);
        if (out.checkError())
          throw new IOException("Write to " + temp + " failed");
      } catch (IOException e) {
        Files.deleteIfExists(temp);
        throw e;
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new VCGFileException(target, "Cannot write file (input " + source + ")", e);
    }
  }
}
