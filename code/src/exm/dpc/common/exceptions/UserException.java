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

import exm.dpc.common.lang.FilePosition;

/**
 * Represents an error caused by the input program.
 * Thus, this should contain good error message information
 * */
public class UserException
extends Exception
{
  public UserException(FilePosition pos, String message)
  {
    this(pos == null ? null : pos.file, pos == null ? 0 : pos.line, message);
  }

  public UserException(String file, int line, String message) {
    super((file == null ? "" : file + ":" + line + ": ") + message);
  }

  public UserException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
