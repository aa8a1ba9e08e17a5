package exm.dpc.common.exceptions;

/**
 * A configuration property is missing or has a value of the wrong form.
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
