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
package org.cflift.controlflow;

import org.cflift.ir.BasicBlock;
import org.cflift.util.BitVector;

/**
 * This structure holds dominator-related information for a basic block.
 */
final class DominatorInfo {
  /**
   * Position of the block in reverse post-order, which is also its bit in
   * every dominator set of the same snapshot.
   */
  final int number;
  /**
   * A BitVector which represents the dominators of the basic block
   */
  final BitVector dominators;
  /**
   * The basic block's immediate dominator, null for the entry.
   */
  BasicBlock idom;

  DominatorInfo(int number, BitVector dominators) {
    this.number = number;
    this.dominators = dominators;
  }

  /**
   * Is the basic block represented by this structure dominated by another
   * basic block?
   *
   * @param master the potential dominator
   * @return true or false
   */
  boolean isDominatedBy(DominatorInfo master) {
    return dominators.get(master.number);
  }
}
