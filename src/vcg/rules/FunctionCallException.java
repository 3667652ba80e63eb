package vcg.rules;

/** A <code>${...}</code> expression could not be evaluated. */
public class FunctionCallException extends Exception {
  private static final long serialVersionUID = 1L;

  public FunctionCallException(String message) { super(message); }
}
