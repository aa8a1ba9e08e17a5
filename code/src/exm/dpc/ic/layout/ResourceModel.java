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

import exm.dpc.common.CompileOptions;
import exm.dpc.common.Settings;

/**
 * Number of pipeline stages and the capacity of each stage
 */
public class ResourceModel {
  public final int stages;
  public final int maxTables;
  public final int maxAlu;
  public final int maxKeyWidth;
  public final int maxHash;

  public ResourceModel(int stages, int maxTables, int maxAlu,
                       int maxKeyWidth, int maxHash) {
    this.stages = stages;
    this.maxTables = maxTables;
    this.maxAlu = maxAlu;
    this.maxKeyWidth = maxKeyWidth;
    this.maxHash = maxHash;
  }

  public static ResourceModel fromOptions(CompileOptions opts) {
    return new ResourceModel(opts.getInt(Settings.LAYOUT_STAGES),
                             opts.getInt(Settings.LAYOUT_MAX_TABLES),
                             opts.getInt(Settings.LAYOUT_MAX_ALU),
                             opts.getInt(Settings.LAYOUT_MAX_KEY_WIDTH),
                             opts.getInt(Settings.LAYOUT_MAX_HASH));
  }

  @Override
  public String toString() {
    return stages + " stages of " + maxTables + " tables, " + maxAlu +
        " register ALUs, " + maxKeyWidth + " key bits, " + maxHash +
        " hash units";
  }
}
