/*
 *  This file is part of the Jikes RVM project (http://jikesrvm.org).
 *
 *  This file is licensed to You under the Eclipse Public License (EPL);
 *  You may not use this file except in compliance with the License. You
 *  may obtain a copy of the License at
 *
 *      http://www.opensource.org/licenses/eclipse-1.0.php
 *
 *  See the COPYRIGHT.txt file distributed with this work for information
 *  regarding copyright ownership.
 */
package org.cflift.ir;

/**
 * One occurrence of a value as an operand or as a successor argument.
 */
public final class Use {
  private final OperandList holder;
  private final int index;

  Use(OperandList holder, int index) {
    this.holder = holder;
    this.index = index;
  }

  /**
   * @return the operation holding this use (for successor arguments, the terminator)
   */
  public Operation getOwner() {
    return holder.getOwner();
  }

  public Value get() {
    return holder.get(index);
  }

  /**
   * Make this use refer to another value.
   *
   * @param v the new value
   */
  public void set(Value v) {
    holder.set(index, v);
  }

  int getIndex() {
    return index;
  }

  OperandList getHolder() {
    return holder;
  }
}
