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
 * A set of blocks entered through a known set of entry blocks.  Acyclic
 * regions have at most one entry; cyclic regions with more than one entry
 * are irreducible.
 */
public final class Region {
  private final RegionKind kind;
  private final List<BasicBlock> entries;
  private final List<BasicBlock> blocks;
  private final IdentityHashMap<BasicBlock, Boolean> members = new IdentityHashMap<BasicBlock, Boolean>();
  private final List<Edge> entryEdges;
  private final List<Edge> backEdges;
  private final List<Edge> exitEdges;
  private final ArrayList<Region> children = new ArrayList<Region>();

  Region(RegionKind kind, List<BasicBlock> entries, List<BasicBlock> blocks,
         List<Edge> entryEdges, List<Edge> backEdges, List<Edge> exitEdges) {
    this.kind = kind;
    this.entries = Collections.unmodifiableList(new ArrayList<BasicBlock>(entries));
    this.blocks = Collections.unmodifiableList(new ArrayList<BasicBlock>(blocks));
    for (BasicBlock b : blocks) {
      members.put(b, Boolean.TRUE);
    }
    this.entryEdges = Collections.unmodifiableList(new ArrayList<Edge>(entryEdges));
    this.backEdges = Collections.unmodifiableList(new ArrayList<Edge>(backEdges));
    this.exitEdges = Collections.unmodifiableList(new ArrayList<Edge>(exitEdges));
  }

  public RegionKind getKind() {
    return kind;
  }

  public List<BasicBlock> getEntries() {
    return entries;
  }

  /**
   * @return the only entry, or null if the region is empty
   */
  public BasicBlock getEntry() {
    if (entries.isEmpty()) return null;
    if (entries.size() > 1) {
      throw new IllegalStateException("region has " + entries.size() + " entries");
    }
    return entries.get(0);
  }

  public boolean isEntry(BasicBlock b) {
    return entries.contains(b);
  }

  /**
   * @return the member blocks; every block comes after its dominators
   */
  public List<BasicBlock> getBlocks() {
    return blocks;
  }

  public boolean contains(BasicBlock b) {
    return members.containsKey(b);
  }

  public boolean isEmpty() {
    return blocks.isEmpty();
  }

  /** Edges from outside into the region. */
  public List<Edge> getEntryEdges() {
    return entryEdges;
  }

  /** Edges from inside the region to one of its entries. */
  public List<Edge> getBackEdges() {
    return backEdges;
  }

  /** Edges leaving the region. */
  public List<Edge> getExitEdges() {
    return exitEdges;
  }

  /**
   * @return the distinct targets of the exit edges, in edge order
   */
  public List<BasicBlock> getExitTargets() {
    return distinctTargets(exitEdges);
  }

  public List<Region> getChildren() {
    return Collections.unmodifiableList(children);
  }

  void addChild(Region r) {
    children.add(r);
  }

  static List<BasicBlock> distinctTargets(List<Edge> edges) {
    ArrayList<BasicBlock> targets = new ArrayList<BasicBlock>();
    for (Edge e : edges) {
      BasicBlock t = e.getTarget();
      if (!targets.contains(t)) {
        targets.add(t);
      }
    }
    return targets;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    dump(sb, 0);
    return sb.toString();
  }

  private void dump(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) sb.append("  ");
    sb.append(kind).append(" entries=").append(entries).append(" blocks=").append(blocks).append('\n');
    for (Region c : children) {
      c.dump(sb, depth + 1);
    }
  }
}
