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
import org.cflift.MalformedRegionException;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.IRVerifier;
import org.cflift.ir.Terminator;

/**
 * Partitions the blocks of a body into single-entry regions.
 */
public final class RegionExtractor {
  static final boolean DEBUG = false;

  private RegionExtractor() {}

  /**
   * Reject bodies that cannot be presented as a single-entry region.
   *
   * @param body the body to check
   * @throws MalformedRegionException if the body has no entry, a block is
   * unreachable or a branch leaves the body
   */
  public static void validate(Body body) {
    if (body.getEntry() == null) {
      throw new MalformedRegionException("region with no entry");
    }
    IRVerifier.verifySingleEntry(body);
  }

  /**
   * Find the cycles reachable from a block.
   *
   * @param body the body holding entry
   * @param entry where to start
   * @return one cyclic region per strongly connected component with a
   * cycle, in topological order
   */
  public static List<Region> findCycles(final Body body, BasicBlock entry) {
    List<BasicBlock> rpo = IterativeDominators.reversePostorder(entry);
    StronglyConnectedComponents.BlockFilter inBody = new StronglyConnectedComponents.BlockFilter() {
      @Override
      public boolean accept(BasicBlock b) {
        return b.getBody() == body;
      }
    };
    List<List<BasicBlock>> sccs =
        StronglyConnectedComponents.compute(Collections.singletonList(entry), inBody,
                                            StronglyConnectedComponents.ALL_EDGES);
    ArrayList<Region> cycles = new ArrayList<Region>();
    for (List<BasicBlock> scc : sccs) {
      if (StronglyConnectedComponents.isCyclic(scc, StronglyConnectedComponents.ALL_EDGES)) {
        cycles.add(cyclicRegion(body, scc, rpo));
      }
    }
    if (DEBUG) Lift.sysWriteln("cycles reachable from " + entry + ": ", cycles.size());
    return cycles;
  }

  /**
   * Build a cyclic region from its blocks, classifying the edges that
   * touch it as they are now.
   *
   * @param body the body holding the blocks
   * @param blocks a strongly connected set of blocks
   * @param order gives the order of the member blocks
   */
  static Region cyclicRegion(Body body, List<BasicBlock> blocks, List<BasicBlock> order) {
    IdentityHashMap<BasicBlock, Boolean> inside = new IdentityHashMap<BasicBlock, Boolean>();
    for (BasicBlock b : blocks) {
      inside.put(b, Boolean.TRUE);
    }
    ArrayList<BasicBlock> members = new ArrayList<BasicBlock>(blocks.size());
    for (BasicBlock b : order) {
      if (inside.containsKey(b)) members.add(b);
    }
    if (Lift.VerifyAssertions) Lift._assert(members.size() == blocks.size());
    ArrayList<Edge> entryEdges = new ArrayList<Edge>();
    for (BasicBlock b : body.getBlocks()) {
      if (inside.containsKey(b)) continue;
      for (Edge e : Edge.successorEdges(b)) {
        if (inside.containsKey(e.getTarget())) entryEdges.add(e);
      }
    }
    ArrayList<BasicBlock> entries = new ArrayList<BasicBlock>();
    for (BasicBlock b : members) {
      for (Edge e : entryEdges) {
        if (e.getTarget() == b) {
          entries.add(b);
          break;
        }
      }
    }
    if (entries.isEmpty()) {
      throw new MalformedRegionException("cycle through " + members.get(0) + " has no entry");
    }
    ArrayList<Edge> backEdges = new ArrayList<Edge>();
    ArrayList<Edge> exitEdges = new ArrayList<Edge>();
    for (BasicBlock b : members) {
      for (Edge e : Edge.successorEdges(b)) {
        BasicBlock t = e.getTarget();
        if (!inside.containsKey(t)) {
          exitEdges.add(e);
        } else if (entries.contains(t)) {
          backEdges.add(e);
        }
      }
    }
    return new Region(RegionKind.CYCLIC, entries, members, entryEdges, backEdges, exitEdges);
  }

  /**
   * Compute the arms of the branch ending a block.  The block must dominate
   * every block of its body and the body must be acyclic.
   *
   * @param entry the branching block
   * @param dom current dominance of entry's body
   */
  public static BranchRegions findBranchRegions(BasicBlock entry, DominanceInfo dom) {
    Body body = entry.getBody();
    if (Lift.VerifyAssertions) Lift._assert(!dom.isStale(), "stale dominance for branch regions");
    IdentityHashMap<BasicBlock, Integer> incoming = new IdentityHashMap<BasicBlock, Integer>();
    for (BasicBlock b : body.getBlocks()) {
      for (BasicBlock s : b.getSuccessors()) {
        Integer n = incoming.get(s);
        incoming.put(s, n == null ? 1 : n + 1);
      }
    }
    ArrayList<Region> regions = new ArrayList<Region>();
    ArrayList<Edge> continuation = new ArrayList<Edge>();
    ArrayList<BasicBlock> pulled = new ArrayList<BasicBlock>();
    for (Edge in : Edge.successorEdges(entry)) {
      BasicBlock target = in.getTarget();
      ArrayList<BasicBlock> blocks = new ArrayList<BasicBlock>();
      if (incoming.get(target) == 1) {
        for (BasicBlock b : dom.getPreorder(target)) {
          if (isReturnLikeExit(b)) {
            pulled.add(b);
          } else {
            blocks.add(b);
          }
        }
      }
      if (blocks.isEmpty()) {
        regions.add(new Region(RegionKind.ACYCLIC, Collections.<BasicBlock>emptyList(), blocks,
                               Collections.singletonList(in), Collections.<Edge>emptyList(),
                               Collections.singletonList(in)));
        continuation.add(in);
        continue;
      }
      IdentityHashMap<BasicBlock, Boolean> inside = new IdentityHashMap<BasicBlock, Boolean>();
      for (BasicBlock b : blocks) {
        inside.put(b, Boolean.TRUE);
      }
      ArrayList<Edge> exits = new ArrayList<Edge>();
      for (BasicBlock b : blocks) {
        for (Edge e : Edge.successorEdges(b)) {
          if (!inside.containsKey(e.getTarget())) {
            exits.add(e);
          }
        }
      }
      regions.add(new Region(RegionKind.ACYCLIC, Collections.singletonList(target), blocks,
                             Collections.singletonList(in), Collections.<Edge>emptyList(), exits));
      continuation.addAll(exits);
    }
    return new BranchRegions(regions, continuation, pulled);
  }

  private static boolean isReturnLikeExit(BasicBlock b) {
    Terminator t = b.getTerminator();
    return t != null && t.isReturnLike();
  }

  /**
   * Build the loop-nesting forest of a body.  The root is an acyclic region
   * holding every reachable block; each cyclic region's children are the
   * cycles left once the edges into its entries are removed.
   * <p>
   * This is a query for clients that want the whole nesting up front.
   * {@link CFGStructurer} does not use it: every loop it builds changes
   * the graph, so it asks {@link #findCycles} again for each body it
   * visits.
   *
   * @param body the body
   * @param dom current dominance of body
   * @return the root region
   */
  public static Region extract(Body body, DominanceInfo dom) {
    validate(body);
    List<BasicBlock> rpo = dom.getReversePostorder();
    Region root = new Region(RegionKind.ACYCLIC, Collections.singletonList(body.getEntry()), rpo,
                             Collections.<Edge>emptyList(), Collections.<Edge>emptyList(),
                             Collections.<Edge>emptyList());
    for (Region cycle : findCycles(body, body.getEntry())) {
      root.addChild(cycle);
      addNestedCycles(body, cycle, rpo);
    }
    if (DEBUG) Lift.sysWriteln("region tree: ", root);
    return root;
  }

  private static void addNestedCycles(Body body, final Region parent, List<BasicBlock> order) {
    StronglyConnectedComponents.BlockFilter inParent = new StronglyConnectedComponents.BlockFilter() {
      @Override
      public boolean accept(BasicBlock b) {
        return parent.contains(b);
      }
    };
    StronglyConnectedComponents.EdgeFilter notIntoEntry = new StronglyConnectedComponents.EdgeFilter() {
      @Override
      public boolean accept(BasicBlock source, BasicBlock target) {
        return !parent.isEntry(target);
      }
    };
    List<List<BasicBlock>> sccs = StronglyConnectedComponents.compute(parent.getBlocks(), inParent, notIntoEntry);
    for (List<BasicBlock> scc : sccs) {
      if (StronglyConnectedComponents.isCyclic(scc, notIntoEntry)) {
        Region child = cyclicRegion(body, scc, order);
        parent.addChild(child);
        addNestedCycles(body, child, order);
      }
    }
  }
}
