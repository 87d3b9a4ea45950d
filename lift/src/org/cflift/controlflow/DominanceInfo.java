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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;

import org.cflift.Lift;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.Value;
import org.cflift.util.BitVector;

/**
 * Dominance facts for one state of a body.  Instances are never mutated;
 * once the body changes the snapshot is stale and a new one must be
 * computed.  Blocks unreachable from the entry are not covered: they
 * dominate nothing and are dominated by nothing.
 */
public final class DominanceInfo {
  private final Body body;
  private final int modificationCount;
  private final List<BasicBlock> reversePostorder;
  private final IdentityHashMap<BasicBlock, DominatorInfo> info;
  private final IdentityHashMap<BasicBlock, List<BasicBlock>> children;

  /**
   * @param body the body described
   * @param reversePostorder its reachable blocks, entry first
   * @param dominators for each block of reversePostorder, the set of
   *        positions of its dominators
   */
  DominanceInfo(Body body, List<BasicBlock> reversePostorder, BitVector[] dominators) {
    this.body = body;
    this.modificationCount = body.getModificationCount();
    this.reversePostorder = Collections.unmodifiableList(new ArrayList<BasicBlock>(reversePostorder));
    this.info = new IdentityHashMap<BasicBlock, DominatorInfo>();
    this.children = new IdentityHashMap<BasicBlock, List<BasicBlock>>();
    for (int i = 0; i < reversePostorder.size(); i++) {
      info.put(reversePostorder.get(i), new DominatorInfo(i, dominators[i]));
      children.put(reversePostorder.get(i), new ArrayList<BasicBlock>(2));
    }
    // the immediate dominator is the strict dominator with one dominator fewer
    for (int i = 1; i < reversePostorder.size(); i++) {
      BasicBlock b = reversePostorder.get(i);
      DominatorInfo bi = info.get(b);
      int want = bi.dominators.populationCount() - 1;
      for (int d = bi.dominators.nextSetBit(0); d >= 0; d = bi.dominators.nextSetBit(d + 1)) {
        if (d != i && dominators[d].populationCount() == want) {
          bi.idom = reversePostorder.get(d);
          break;
        }
      }
      if (Lift.VerifyAssertions) Lift._assert(bi.idom != null, "no immediate dominator for", b.toString());
      children.get(bi.idom).add(b);
    }
  }

  public Body getBody() {
    return body;
  }

  /**
   * @return true if the body changed since this snapshot was taken
   */
  public boolean isStale() {
    return body.getModificationCount() != modificationCount;
  }

  public int getModificationCount() {
    return modificationCount;
  }

  public boolean isReachable(BasicBlock b) {
    return info.containsKey(b);
  }

  /**
   * Does a dominate b?  Every block dominates itself.
   */
  public boolean dominates(BasicBlock a, BasicBlock b) {
    DominatorInfo ai = info.get(a);
    DominatorInfo bi = info.get(b);
    if (ai == null || bi == null) return false;
    return bi.isDominatedBy(ai);
  }

  public boolean properlyDominates(BasicBlock a, BasicBlock b) {
    return a != b && dominates(a, b);
  }

  /**
   * Is a value available at the end of a block?  True when the block
   * defining the value dominates it.
   *
   * @param v a value defined at the top level of the body
   * @param b a block of the body
   */
  public boolean isAvailableAt(Value v, BasicBlock b) {
    BasicBlock def = v.getDefiningBlock();
    return def != null && dominates(def, b);
  }

  /**
   * @return b's immediate dominator, or null for the entry and unreachable blocks
   */
  public BasicBlock getImmediateDominator(BasicBlock b) {
    DominatorInfo bi = info.get(b);
    return bi == null ? null : bi.idom;
  }

  /**
   * @return the blocks b immediately dominates, in reverse post-order
   */
  public List<BasicBlock> getChildren(BasicBlock b) {
    List<BasicBlock> c = children.get(b);
    if (c == null) {
      return Collections.emptyList();
    }
    return Collections.unmodifiableList(c);
  }

  /**
   * @return the blocks dominated by root, in dominator-tree preorder
   */
  public List<BasicBlock> getPreorder(BasicBlock root) {
    ArrayList<BasicBlock> order = new ArrayList<BasicBlock>();
    if (!isReachable(root)) {
      return order;
    }
    ArrayList<BasicBlock> stack = new ArrayList<BasicBlock>();
    stack.add(root);
    while (!stack.isEmpty()) {
      BasicBlock b = stack.remove(stack.size() - 1);
      order.add(b);
      List<BasicBlock> c = children.get(b);
      for (int i = c.size() - 1; i >= 0; i--) {
        stack.add(c.get(i));
      }
    }
    return order;
  }

  public List<BasicBlock> getPreorder() {
    return getPreorder(body.getEntry());
  }

  /**
   * @return the reachable blocks, entry first, every block before its
   * successors except along back edges
   */
  public List<BasicBlock> getReversePostorder() {
    return reversePostorder;
  }

  public List<BasicBlock> getPostorder() {
    ArrayList<BasicBlock> post = new ArrayList<BasicBlock>(reversePostorder);
    Collections.reverse(post);
    return post;
  }
}
