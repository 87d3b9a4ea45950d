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
 * A value produced by an operation.
 */
public final class OpResult extends Value {
  private final Operation owner;
  private final int index;

  OpResult(Operation owner, int index, Type type) {
    super(type);
    this.owner = owner;
    this.index = index;
  }

  public Operation getOwner() {
    return owner;
  }

  public int getIndex() {
    return index;
  }

  @Override
  public BasicBlock getDefiningBlock() {
    return owner.getBlock();
  }

  @Override
  public String toString() {
    return owner.getName() + "#" + index;
  }
}
