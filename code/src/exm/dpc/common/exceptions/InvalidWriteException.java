package exm.dpc.common.exceptions;

import exm.dpc.common.lang.FilePosition;

/**
 * Used when a register may be written twice in one pass through the
 * pipeline
 */
public class InvalidWriteException extends UserException {

  private static final long serialVersionUID = 1L;

  public InvalidWriteException(String message) {
    super(message);
  }
  public InvalidWriteException(FilePosition pos, String message) {
    super(pos, message);
  }

}
