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
package exm.dpc.common;

/**
 * Receives optional diagnostic artifacts produced during compilation.
 * Nothing written here is needed for correctness.
 */
public interface DiagnosticSink {

  /**
   * @param name short graph name, e.g. "cfg"
   * @param dot graph in dot format
   */
  public void graph(String name, String dot);

  /**
   * @param phase name of phase that just finished
   * @param text program as printed after the phase
   */
  public void program(String phase, String text);

  /**
   * @param report rendered per-stage utilization report
   */
  public void utilization(String report);

  /**
   * Discards everything
   */
  public static final DiagnosticSink NONE = new DiagnosticSink() {
    @Override
    public void graph(String name, String dot) {
      // Nothing
    }

    @Override
    public void program(String phase, String text) {
      // Nothing
    }

    @Override
    public void utilization(String report) {
      // Nothing
    }
  };
}
