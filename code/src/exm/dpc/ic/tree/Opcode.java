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
package exm.dpc.ic.tree;

/**
 * Opcodes of atomic instructions in the normalized program.
 * Each opcode can be evaluated by one ALU, one stateful register ALU,
 * one hash unit or one table.
 */
public enum Opcode {
  // Plain assignment out = in
  ASSIGN,

  // Arithmetic and bitwise: out = in1 op in2
  ADD, SUB, AND, OR, XOR, SHL, SHR,

  // Hash units: out = hash(seed, in1, ...)
  HASH, CHECKSUM,

  // Stateful register ALU. Input 0 is the register
  REG_GET, REG_SET, REG_UPDATE,

  // Apply a declared user table to key arguments
  TABLE_MATCH;

  public String mnemonic() {
    return name().toLowerCase();
  }

  public static Opcode fromMnemonic(String s) {
    for (Opcode op: values()) {
      if (op.mnemonic().equals(s)) {
        return op;
      }
    }
    return null;
  }

  public boolean isBinaryOp() {
    switch (this) {
      case ADD:
      case SUB:
      case AND:
      case OR:
      case XOR:
      case SHL:
      case SHR:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return true if uses a stateful register ALU slot
   */
  public boolean isRegisterOp() {
    switch (this) {
      case REG_GET:
      case REG_SET:
      case REG_UPDATE:
        return true;
      default:
        return false;
    }
  }

  /**
   * @return true if uses a hash unit
   */
  public boolean isHashOp() {
    return this == HASH || this == CHECKSUM;
  }

  /**
   * Operations whose hardware units are scarce enough that it is worth
   * sharing actions that contain them
   */
  public boolean isScarce() {
    return isHashOp() || isRegisterOp();
  }

  /**
   * @return true if the register operand is read
   */
  public boolean readsRegister() {
    return this == REG_GET || this == REG_UPDATE;
  }

  /**
   * @return true if the register operand is written
   */
  public boolean writesRegister() {
    return this == REG_SET || this == REG_UPDATE;
  }
}
