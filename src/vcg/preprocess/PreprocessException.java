package vcg.preprocess;

import vcg.VCGException;

/** Preprocessing could not reduce the input; callers may retry with the unprocessed text. */
public class PreprocessException extends VCGException {
  private static final long serialVersionUID = 1L;

  public PreprocessException(String message, Throwable cause) { super("Preprocess Failed: " + message, cause); }
}
