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
package exm.dpc.ic.graph;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import exm.dpc.common.exceptions.InvalidWriteException;
import exm.dpc.common.lang.Var;

/**
 * Computes data dependence edges between statements that access the
 * same variable.  An edge from u to t is only added if control can flow
 * from u to t: statements in mutually exclusive arms never conflict.
 */
public class DataDependence {

  private DataDependence() {
    // static methods only
  }

  /**
   * @return data edges, ordered by target then by source kind
   * @throws InvalidWriteException if a register can be written twice
   *            in one pass through the pipeline
   */
  public static List<DepEdge> analyze(Logger logger, ControlFlowGraph cfg,
            UseDefMap useDef) throws InvalidWriteException {
    List<DepEdge> edges = new ArrayList<DepEdge>();
    for (int t = 0; t < useDef.size(); t++) {
      // Writers of variables we read must go first
      for (Var v: useDef.getReads(t)) {
        for (int w: useDef.writers(v)) {
          if (w != t && cfg.pathExists(w, t)) {
            addEdge(logger, edges, DepEdge.data(w, t, EdgeKind.DATA_RAW, v));
          }
        }
      }

      for (Var v: useDef.getWrites(t)) {
        // Readers of variables we overwrite must go first
        for (int r: useDef.readers(v)) {
          if (r != t && cfg.pathExists(r, t)) {
            addEdge(logger, edges, DepEdge.data(r, t, EdgeKind.DATA_WAR, v));
          }
        }

        for (int w: useDef.writers(v)) {
          if (w != t && cfg.pathExists(w, t)) {
            if (v.isRegister()) {
              throw new InvalidWriteException("dependency analysis: register "
                  + v.name() + " may be written more than once per pass, by "
                  + cfg.nodeLabel(w) + " and by " + cfg.nodeLabel(t));
            }
            addEdge(logger, edges, DepEdge.data(w, t, EdgeKind.DATA_WAW, v));
          }
        }
      }
    }
    logger.debug("Found " + edges.size() + " data dependences");
    return edges;
  }

  private static void addEdge(Logger logger, List<DepEdge> edges,
                              DepEdge edge) {
    if (logger.isTraceEnabled()) {
      logger.trace("Data dependence: " + edge);
    }
    edges.add(edge);
  }
}
