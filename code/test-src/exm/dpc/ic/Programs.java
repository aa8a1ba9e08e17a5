package exm.dpc.ic;

import java.util.Arrays;

import exm.dpc.common.exceptions.InvalidSyntaxException;
import exm.dpc.frontend.ProgramReader;
import exm.dpc.ic.tree.ICTree.Program;

/**
 * Small programs for tests, one source line per argument
 */
public class Programs {

  public static final String FILE_NAME = "test.dpt";

  public static Program parse(String ...lines) throws InvalidSyntaxException {
    return ProgramReader.parse(FILE_NAME, Arrays.asList(lines));
  }

  /**
   * Parse and number statements without normalizing
   */
  public static Program numbered(String ...lines)
                                    throws InvalidSyntaxException {
    Program program = parse(lines);
    program.renumber();
    return program;
  }
}
