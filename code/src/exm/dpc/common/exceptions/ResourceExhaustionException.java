/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.dpc.common.exceptions;

/**
 * A statement could not be placed in any pipeline stage, or a stage
 * exceeds its capacity after all transformations.
 */
public class ResourceExhaustionException extends UserException {

  private final String statement;
  private final int stage;

  /**
   * @param phase name of failing phase
   * @param statement offending statement, or null if a whole stage
   * @param stage stage involved, or -1 if none could be found
   * @param detail description of stage state
   */
  public ResourceExhaustionException(String phase, String statement,
                                     int stage, String detail) {
    super(phase + ": " + (statement != null ? "cannot place " + statement
              + (stage >= 0 ? " at or after stage " + stage : "") :
              "stage " + stage + " over capacity") + ": " + detail);
    this.statement = statement;
    this.stage = stage;
  }

  public String getStatement() {
    return statement;
  }

  public int getStage() {
    return stage;
  }

  private static final long serialVersionUID = 1L;
}
