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

/**
 * Resources consumed in one stage
 */
public class StageUsage {
  public int tables = 0;
  public int keyWidth = 0;
  public int alu = 0;
  public int hash = 0;

  public void addTable(int width) {
    tables++;
    keyWidth += width;
  }

  /**
   * @return description of first exceeded capacity, or null if within
   *         capacity
   */
  public String overCapacity(ResourceModel model) {
    if (tables > model.maxTables) {
      return tables + " tables > " + model.maxTables;
    } else if (keyWidth > model.maxKeyWidth) {
      return keyWidth + " key bits > " + model.maxKeyWidth;
    } else if (alu > model.maxAlu) {
      return alu + " register ALUs > " + model.maxAlu;
    } else if (hash > model.maxHash) {
      return hash + " hash units > " + model.maxHash;
    }
    return null;
  }

  @Override
  public String toString() {
    return "tables=" + tables + " key=" + keyWidth + " alu=" + alu
         + " hash=" + hash;
  }
}
