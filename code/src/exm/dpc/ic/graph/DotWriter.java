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

/**
 * Accumulates a directed graph in the dot format understood by
 * graphviz.  Nodes are identified by integer index.
 */
public class DotWriter {
  private final StringBuilder sb = new StringBuilder();
  private boolean finished = false;

  public DotWriter(String graphName) {
    sb.append("digraph " + graphName + " {\n");
    sb.append("  node [shape=box, fontname=\"monospace\"];\n");
  }

  public DotWriter node(int id, String label) {
    sb.append("  n" + id + " [label=\"" + escape(label) + "\"];\n");
    return this;
  }

  public DotWriter edge(int from, int to, String label, boolean dashed) {
    sb.append("  n" + from + " -> n" + to);
    if (label != null || dashed) {
      sb.append(" [");
      if (label != null) {
        sb.append("label=\"" + escape(label) + "\"");
        if (dashed) sb.append(", ");
      }
      if (dashed) {
        sb.append("style=dashed");
      }
      sb.append("]");
    }
    sb.append(";\n");
    return this;
  }

  private static String escape(String s) {
    return s.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  @Override
  public String toString() {
    if (!finished) {
      sb.append("}\n");
      finished = true;
    }
    return sb.toString();
  }
}
