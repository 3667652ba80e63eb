package vcg;

import java.nio.file.Path;

/** An input file is missing or could not be read or written. */
public class VCGFileException extends VCGException {
  private static final long serialVersionUID = 1L;

  private final Path path;

  public VCGFileException(Path path, String message) {
    super(message + ": " + path);
    this.path = path;
  }

  public VCGFileException(Path path, String message, Throwable cause) {
    super(message + ": " + path, cause);
    this.path = path;
  }

  public Path getPath() { return path; }
}
