package vcg.script;

import vcg.VCGException;

/** A generator statement is malformed or failed while executing. */
public class VCGScriptException extends VCGException {
  private static final long serialVersionUID = 1L;

  public VCGScriptException(String message) { super(message); }

  public VCGScriptException(String message, Throwable cause) { super(message, cause); }
}
