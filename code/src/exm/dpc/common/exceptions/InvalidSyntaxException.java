package exm.dpc.common.exceptions;

/**
 * Malformed program text handed to the reader
 */
public class InvalidSyntaxException extends UserException {

  public InvalidSyntaxException(String file, int line, String message) {
    super(file, line, message);
  }

  private static final long serialVersionUID = 1L;
}
