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

import org.cflift.ir.BasicBlock;

/**
 * This class computes strongly connected components of the block graph
 * with Tarjan's algorithm, using an explicit stack instead of recursion.
 * The search can be confined to a subset of blocks and a subset of edges.
 */
public final class StronglyConnectedComponents {

  /** Selects the blocks that take part in a search. */
  public interface BlockFilter {
    boolean accept(BasicBlock b);
  }

  /** Selects the edges that take part in a search. */
  public interface EdgeFilter {
    boolean accept(BasicBlock source, BasicBlock target);
  }

  public static final EdgeFilter ALL_EDGES = new EdgeFilter() {
    @Override
    public boolean accept(BasicBlock source, BasicBlock target) {
      return true;
    }
  };

  private final BlockFilter member;
  private final EdgeFilter edgeFilter;

  private final IdentityHashMap<BasicBlock, Integer> index = new IdentityHashMap<BasicBlock, Integer>();
  private final IdentityHashMap<BasicBlock, Integer> lowLink = new IdentityHashMap<BasicBlock, Integer>();
  private final IdentityHashMap<BasicBlock, Boolean> onStack = new IdentityHashMap<BasicBlock, Boolean>();
  private final ArrayList<BasicBlock> sccStack = new ArrayList<BasicBlock>();
  private final ArrayList<List<BasicBlock>> components = new ArrayList<List<BasicBlock>>();

  private StronglyConnectedComponents(BlockFilter member, EdgeFilter edgeFilter) {
    this.member = member;
    this.edgeFilter = edgeFilter;
  }

  /**
   * Compute the components reachable from a set of roots.
   *
   * @param roots where to start the search
   * @param member which blocks take part
   * @param edgeFilter which edges (source, target) take part
   * @return the components in topological order: a component comes before
   * every component it has an edge to
   */
  public static List<List<BasicBlock>> compute(List<BasicBlock> roots, BlockFilter member,
                                               EdgeFilter edgeFilter) {
    StronglyConnectedComponents engine = new StronglyConnectedComponents(member, edgeFilter);
    for (BasicBlock r : roots) {
      if (member.accept(r) && !engine.index.containsKey(r)) {
        engine.search(r);
      }
    }
    Collections.reverse(engine.components);
    return engine.components;
  }

  /**
   * Does a component contain a cycle?  Either it has more than one block or
   * its only block branches to itself.
   */
  public static boolean isCyclic(List<BasicBlock> component, EdgeFilter edgeFilter) {
    if (component.size() > 1) return true;
    BasicBlock b = component.get(0);
    for (BasicBlock s : b.getSuccessors()) {
      if (s == b && edgeFilter.accept(b, s)) return true;
    }
    return false;
  }

  private List<BasicBlock> successors(BasicBlock b) {
    ArrayList<BasicBlock> result = new ArrayList<BasicBlock>();
    for (BasicBlock s : b.getSuccessors()) {
      if (member.accept(s) && edgeFilter.accept(b, s)) {
        result.add(s);
      }
    }
    return result;
  }

  private void visit(BasicBlock b) {
    int n = index.size();
    index.put(b, n);
    lowLink.put(b, n);
    sccStack.add(b);
    onStack.put(b, Boolean.TRUE);
  }

  private void search(BasicBlock root) {
    ArrayList<BasicBlock> callStack = new ArrayList<BasicBlock>();
    ArrayList<List<BasicBlock>> pending = new ArrayList<List<BasicBlock>>();
    ArrayList<Integer> cursor = new ArrayList<Integer>();
    visit(root);
    callStack.add(root);
    pending.add(successors(root));
    cursor.add(0);
    while (!callStack.isEmpty()) {
      int top = callStack.size() - 1;
      BasicBlock v = callStack.get(top);
      List<BasicBlock> succs = pending.get(top);
      int i = cursor.get(top);
      if (i < succs.size()) {
        cursor.set(top, i + 1);
        BasicBlock w = succs.get(i);
        if (!index.containsKey(w)) {
          visit(w);
          callStack.add(w);
          pending.add(successors(w));
          cursor.add(0);
        } else if (onStack.containsKey(w)) {
          lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
        }
        continue;
      }
      // v is finished
      if (lowLink.get(v).intValue() == index.get(v).intValue()) {
        ArrayList<BasicBlock> component = new ArrayList<BasicBlock>();
        BasicBlock w;
        do {
          w = sccStack.remove(sccStack.size() - 1);
          onStack.remove(w);
          component.add(w);
        } while (w != v);
        Collections.reverse(component);
        components.add(component);
      }
      callStack.remove(top);
      pending.remove(top);
      cursor.remove(top);
      if (top > 0) {
        BasicBlock parent = callStack.get(top - 1);
        lowLink.put(parent, Math.min(lowLink.get(parent), lowLink.get(v)));
      }
    }
  }
}
