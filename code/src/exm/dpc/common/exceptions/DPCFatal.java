package exm.dpc.common.exceptions;

/**
 * Used to signal that program should quit.
 */
public class DPCFatal extends RuntimeException {
  public final int exitCode;

  public DPCFatal(int exitCode) {
    super();
    this.exitCode = exitCode;
  }

  private static final long serialVersionUID = 1L;
}
