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

/**
 * Outcome of structuring one body.
 */
public final class StructuringResult {
  private final boolean changed;
  private final StructuredNode root;
  private final int loops;
  private final int branchConstructs;
  private final int multiplexers;
  private final int dispatchFlags;

  StructuringResult(boolean changed, StructuredNode root, int loops, int branchConstructs,
                    int multiplexers, int dispatchFlags) {
    this.changed = changed;
    this.root = root;
    this.loops = loops;
    this.branchConstructs = branchConstructs;
    this.multiplexers = multiplexers;
    this.dispatchFlags = dispatchFlags;
  }

  /**
   * @return false if the body was already a single block and was left alone
   */
  public boolean isChanged() {
    return changed;
  }

  public StructuredNode getRoot() {
    return root;
  }

  public int getLoops() {
    return loops;
  }

  public int getBranchConstructs() {
    return branchConstructs;
  }

  /**
   * @return entry and continuation multiplexer blocks created
   */
  public int getMultiplexers() {
    return multiplexers;
  }

  /**
   * @return dispatch flags introduced, counting entry, exit and repeat flags
   */
  public int getDispatchFlags() {
    return dispatchFlags;
  }

  @Override
  public String toString() {
    return "changed=" + changed + " loops=" + loops + " branches=" + branchConstructs +
        " multiplexers=" + multiplexers + " flags=" + dispatchFlags;
  }
}
