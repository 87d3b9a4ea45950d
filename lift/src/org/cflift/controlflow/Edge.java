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
import java.util.List;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.Terminator;
import org.cflift.ir.Value;

/**
 * A control flow edge, identified by its source block and the index of
 * the successor in the source's terminator.  Edges are positions, not
 * snapshots: the target and arguments are read from the terminator.
 */
public final class Edge {
  private final BasicBlock source;
  private final int index;

  public Edge(BasicBlock source, int index) {
    this.source = source;
    this.index = index;
  }

  public BasicBlock getSource() {
    return source;
  }

  public BasicBlock getTarget() {
    return source.getTerminator().getSuccessor(index);
  }

  public List<Value> getArguments() {
    return new ArrayList<Value>(source.getTerminator().getSuccessorArguments(index));
  }

  /**
   * Point this edge at another block.
   *
   * @param target the new target
   * @param args one argument per parameter of target
   */
  public void redirect(BasicBlock target, List<Value> args) {
    source.getTerminator().setSuccessor(index, target, args);
  }

  /**
   * @return every outgoing edge of a block
   */
  public static List<Edge> successorEdges(BasicBlock b) {
    Terminator t = b.getTerminator();
    int n = t == null ? 0 : t.getNumSuccessors();
    ArrayList<Edge> edges = new ArrayList<Edge>(n);
    for (int i = 0; i < n; i++) {
      edges.add(new Edge(b, i));
    }
    return edges;
  }

  /**
   * @return every edge of the body ending in target, in block order
   */
  public static List<Edge> incomingEdges(Body body, BasicBlock target) {
    ArrayList<Edge> edges = new ArrayList<Edge>();
    for (BasicBlock b : body.getBlocks()) {
      for (Edge e : successorEdges(b)) {
        if (e.getTarget() == target) {
          edges.add(e);
        }
      }
    }
    return edges;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Edge)) return false;
    Edge e = (Edge) o;
    return e.source == source && e.index == index;
  }

  @Override
  public int hashCode() {
    return System.identityHashCode(source) * 31 + index;
  }

  @Override
  public String toString() {
    return source + "[" + index + "] -> " + getTarget();
  }
}
