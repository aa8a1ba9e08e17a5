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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * The merged dependency graph is cyclic, so no stage ordering exists.
 * The message lists the full chain of statements, closing the cycle,
 * and the variables carried by the edges along it.
 */
public class DependencyCycleException extends UserException {

  private final List<String> chain;
  private final List<String> variables;

  /**
   * @param chain statements on the cycle, first statement repeated at end
   * @param variables variables implicated, one per edge where known
   */
  public DependencyCycleException(List<String> chain, List<String> variables) {
    super("dependency analysis: cyclic dependency"
        + (variables.isEmpty() ? "" :
            " on " + StringUtils.join(variables, ", "))
        + ": " + StringUtils.join(chain, " -> "));
    this.chain = Collections.unmodifiableList(new ArrayList<String>(chain));
    this.variables = Collections.unmodifiableList(
                                    new ArrayList<String>(variables));
  }

  public List<String> getChain() {
    return chain;
  }

  public List<String> getVariables() {
    return variables;
  }

  private static final long serialVersionUID = 1L;
}
