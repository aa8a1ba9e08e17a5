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
package exm.dpc.common.lang;

/**
 * Position of a statement in the input program
 */
public class FilePosition {
  public final String file;
  public final int line;

  public FilePosition(String file, int line) {
    super();
    this.file = file;
    this.line = line;
  }

  public String toString() {
    return file + ":" + line;
  }
}
