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

import java.util.IdentityHashMap;

import org.cflift.Lift;
import org.cflift.ir.Body;

/**
 * Remembers the last dominance snapshot computed for each body and hands
 * it out again while the body's modification stamp is unchanged.
 * Not thread safe; use one cache per thread.
 */
public final class DominanceCache {
  static final boolean DEBUG = false;

  private final DominanceOracle oracle;
  private final IdentityHashMap<Body, DominanceInfo> snapshots = new IdentityHashMap<Body, DominanceInfo>();
  private int computations;
  private int hits;

  public DominanceCache(DominanceOracle oracle) {
    this.oracle = oracle;
  }

  public DominanceCache() {
    this(new IterativeDominators());
  }

  /**
   * @param body the body to analyse
   * @return a snapshot that is current for body
   */
  public DominanceInfo get(Body body) {
    DominanceInfo info = snapshots.get(body);
    if (info != null && !info.isStale()) {
      hits++;
      return info;
    }
    info = oracle.compute(body);
    computations++;
    if (DEBUG) Lift.sysWriteln("recomputed dominators, stamp ", info.getModificationCount());
    snapshots.put(body, info);
    return info;
  }

  /**
   * Forget the snapshot of a body that is about to be discarded.
   */
  public void invalidate(Body body) {
    snapshots.remove(body);
  }

  public int getComputations() {
    return computations;
  }

  public int getHits() {
    return hits;
  }
}
