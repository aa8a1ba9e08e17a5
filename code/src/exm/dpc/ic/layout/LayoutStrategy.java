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
package exm.dpc.ic.layout;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.ResourceExhaustionException;

/**
 * Assigns every node of a layout problem to a pipeline stage.
 *
 * Implementations must be deterministic and must respect every
 * dependence (strict edges to a later stage, others to the same or a
 * later stage) and the capacity of every stage.  They may differ in how
 * many stages they use.
 */
public interface LayoutStrategy {
  public abstract String getName();

  public abstract Layout layout(Logger logger, LayoutProblem problem)
                                    throws ResourceExhaustionException;
}
