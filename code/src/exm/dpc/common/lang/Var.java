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

import java.util.Collections;
import java.util.List;

/**
 * A named storage location.  Locals live for one pass through the
 * pipeline and may be freely copied, registers are persistent hardware
 * state that can only be accessed by register ALU operations.
 *
 * Identity is by name: the program is expected to have unique names.
 */
public class Var implements Comparable<Var> {

  public static final List<Var> NONE = Collections.emptyList();

  public static enum VarKind {
    LOCAL,
    REGISTER,
  }

  private final String name;
  private final VarKind kind;
  private final int width;
  /** Initial value for registers, null if unspecified */
  private final Long initVal;

  public Var(String name, VarKind kind, int width, Long initVal) {
    assert(name != null);
    assert(width > 0) : name + " " + width;
    this.name = name;
    this.kind = kind;
    this.width = width;
    this.initVal = initVal;
  }

  public static Var local(String name, int width) {
    return new Var(name, VarKind.LOCAL, width, null);
  }

  public static Var register(String name, int width, long initVal) {
    return new Var(name, VarKind.REGISTER, width, initVal);
  }

  public String name() {
    return name;
  }

  public VarKind kind() {
    return kind;
  }

  public boolean isRegister() {
    return kind == VarKind.REGISTER;
  }

  public int width() {
    return width;
  }

  public Long initVal() {
    return initVal;
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Var))
      return false;
    return name.equals(((Var)obj).name);
  }

  @Override
  public int compareTo(Var o) {
    return name.compareTo(o.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
