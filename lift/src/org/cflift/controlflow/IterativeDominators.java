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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

import org.cflift.Lift;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.util.BitVector;

/**
 * Computes dominators by solving the dataflow equations
 * <pre>
 *   dom(entry) = {entry}
 *   dom(b)     = {b} MEET (intersection of dom(p) for each predecessor p)
 * </pre>
 * iterating over the blocks in reverse post-order until nothing changes.
 */
public final class IterativeDominators implements DominanceOracle {
  static final boolean DEBUG = false;

  @Override
  public DominanceInfo compute(Body body) {
    BasicBlock entry = body.getEntry();
    if (Lift.VerifyAssertions) Lift._assert(entry != null, "dominators of an empty body");
    List<BasicBlock> rpo = reversePostorder(entry);
    int n = rpo.size();
    IdentityHashMap<BasicBlock, Integer> number = new IdentityHashMap<BasicBlock, Integer>();
    for (int i = 0; i < n; i++) {
      number.put(rpo.get(i), i);
    }
    // predecessor numbers, reachable predecessors only
    List<List<Integer>> preds = new ArrayList<List<Integer>>(n);
    for (int i = 0; i < n; i++) {
      preds.add(new ArrayList<Integer>(2));
    }
    for (int i = 0; i < n; i++) {
      for (BasicBlock s : rpo.get(i).getSuccessors()) {
        preds.get(number.get(s)).add(i);
      }
    }
    BitVector[] dominators = new BitVector[n];
    for (int i = 0; i < n; i++) {
      dominators[i] = new BitVector(n);
      if (i == 0) {
        dominators[i].set(0);
      } else {
        dominators[i].setAll();
      }
    }
    boolean changed = true;
    int passes = 0;
    while (changed) {
      changed = false;
      passes++;
      for (int i = 1; i < n; i++) {
        if (meet(dominators, i, preds.get(i))) {
          changed = true;
        }
      }
    }
    if (DEBUG) {
      Lift.sysWriteln("dominators converged after " + passes + " passes over " + n + " blocks");
    }
    return new DominanceInfo(body, rpo, dominators);
  }

  /**
   * Evaluate the MEET equation for one block.
   *
   * @return true if the dominator set of the block changed
   */
  private static boolean meet(BitVector[] dominators, int block, List<Integer> preds) {
    BitVector newDominators = new BitVector(dominators[block].size());
    newDominators.setAll();
    for (int p : preds) {
      newDominators.and(dominators[p]);
    }
    newDominators.set(block);
    if (newDominators.equals(dominators[block])) {
      return false;
    }
    dominators[block] = newDominators;
    return true;
  }

  /**
   * Depth-first search from the entry, without recursion.
   */
  static List<BasicBlock> reversePostorder(BasicBlock entry) {
    ArrayList<BasicBlock> post = new ArrayList<BasicBlock>();
    IdentityHashMap<BasicBlock, Boolean> visited = new IdentityHashMap<BasicBlock, Boolean>();
    ArrayList<BasicBlock> stack = new ArrayList<BasicBlock>();
    ArrayList<Integer> next = new ArrayList<Integer>();
    stack.add(entry);
    next.add(0);
    visited.put(entry, Boolean.TRUE);
    while (!stack.isEmpty()) {
      int top = stack.size() - 1;
      BasicBlock b = stack.get(top);
      List<BasicBlock> succs = b.getSuccessors();
      int i = next.get(top);
      if (i < succs.size()) {
        next.set(top, i + 1);
        BasicBlock s = succs.get(i);
        if (visited.put(s, Boolean.TRUE) == null) {
          stack.add(s);
          next.add(0);
        }
      } else {
        post.add(b);
        stack.remove(top);
        next.remove(top);
      }
    }
    ArrayList<BasicBlock> rpo = new ArrayList<BasicBlock>(post.size());
    for (int i = post.size() - 1; i >= 0; i--) {
      rpo.add(post.get(i));
    }
    return rpo;
  }
}
