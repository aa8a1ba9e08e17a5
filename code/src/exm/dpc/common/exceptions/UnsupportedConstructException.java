package exm.dpc.common.exceptions;

import exm.dpc.common.lang.FilePosition;

/**
 * A statement has a shape that cannot be turned into hardware
 * tables and actions.
 */
public class UnsupportedConstructException extends UserException {

  public UnsupportedConstructException(FilePosition pos, String message) {
    super(pos, "action formation: " + message);
  }

  private static final long serialVersionUID = 1L;
}
