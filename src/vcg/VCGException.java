package vcg;

/**
 * Base of all failures that abort processing of an input.
 * Recoverable issues are reported as diagnostics instead.
 */
public class VCGException extends Exception {
  private static final long serialVersionUID = 1L;

  public VCGException(String message) { super(message); }

  public VCGException(String message, Throwable cause) { super(message, cause); }
}
