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
 * Kinds of ordering constraint between two statements.  A strict edge
 * requires the target in a later stage than the source, other edges
 * allow the same stage.
 */
public enum EdgeKind {
  /** Branch to a statement directly inside one of its arms */
  CONTROL(false, "ctl"),
  /** Branch to a table call inside one of its arms: needs its own stage */
  CONTROL_CALL(true, "call"),
  /** Write then read of the same variable */
  DATA_RAW(true, "raw"),
  /** Read then write of the same variable */
  DATA_WAR(true, "war"),
  /** Two writes of the same variable */
  DATA_WAW(true, "waw");

  private final boolean strict;
  private final String shortName;

  private EdgeKind(boolean strict, String shortName) {
    this.strict = strict;
    this.shortName = shortName;
  }

  public boolean isStrict() {
    return strict;
  }

  public boolean isData() {
    return this == DATA_RAW || this == DATA_WAR || this == DATA_WAW;
  }

  public String shortName() {
    return shortName;
  }
}
