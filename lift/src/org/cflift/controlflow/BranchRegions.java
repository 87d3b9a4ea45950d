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
import java.util.List;

import org.cflift.ir.BasicBlock;

/**
 * The arms of a multi-way branch: one acyclic region per successor edge of
 * the branching block, and the edges through which control leaves them
 * to reach the code after the branch.
 */
public final class BranchRegions {
  private final List<Region> regions;
  private final List<Edge> continuationEdges;
  private final List<BasicBlock> pulledExits;

  BranchRegions(List<Region> regions, List<Edge> continuationEdges, List<BasicBlock> pulledExits) {
    this.regions = Collections.unmodifiableList(new ArrayList<Region>(regions));
    this.continuationEdges = Collections.unmodifiableList(new ArrayList<Edge>(continuationEdges));
    this.pulledExits = Collections.unmodifiableList(new ArrayList<BasicBlock>(pulledExits));
  }

  /**
   * @return one region per successor of the branch, by successor index;
   * a region is empty when its target has other incoming edges
   */
  public List<Region> getRegions() {
    return regions;
  }

  public List<Edge> getContinuationEdges() {
    return continuationEdges;
  }

  public List<BasicBlock> getContinuationTargets() {
    return Region.distinctTargets(continuationEdges);
  }

  /**
   * @return return-like exit blocks that were dominated by a branch target
   * and were left out of its region
   */
  public List<BasicBlock> getPulledExits() {
    return pulledExits;
  }
}
