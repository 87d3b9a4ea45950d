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
 * A value bound on entry to a block by the arguments of the incoming edge.
 */
public final class BlockParameter extends Value {
  private final BasicBlock owner;
  private int index;

  BlockParameter(BasicBlock owner, int index, Type type) {
    super(type);
    this.owner = owner;
    this.index = index;
  }

  public BasicBlock getOwner() {
    return owner;
  }

  public int getIndex() {
    return index;
  }

  void setIndex(int index) {
    this.index = index;
  }

  @Override
  public BasicBlock getDefiningBlock() {
    return owner;
  }

  @Override
  public String toString() {
    return owner + "#" + index;
  }
}
