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

import org.cflift.Lift;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.BlockParameter;
import org.cflift.ir.Body;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * A block that funnels edges to several targets through one place.  It
 * takes the parameters of every target, back to back, plus an {@code i32}
 * dispatch flag when there is more than one target, and ends in a switch
 * on the flag: target {@code k < n-1} is case {@code k}, the last target
 * is the default.
 */
public final class EdgeMultiplexer {
  private final StructuredControlFlowMaterializer materializer;
  private final BasicBlock block;
  private final List<BasicBlock> targets;
  private final int[] offsets;
  private final BlockParameter flag;

  private EdgeMultiplexer(StructuredControlFlowMaterializer materializer, BasicBlock block,
                          List<BasicBlock> targets, int[] offsets, BlockParameter flag) {
    this.materializer = materializer;
    this.block = block;
    this.targets = targets;
    this.offsets = offsets;
    this.flag = flag;
  }

  /**
   * Create the multiplexer block at the end of a body.
   *
   * @param body the body to add the block to
   * @param targets the distinct blocks to dispatch to
   * @param materializer builds the dispatch
   */
  public static EdgeMultiplexer create(Body body, List<BasicBlock> targets,
                                       StructuredControlFlowMaterializer materializer) {
    if (targets.isEmpty()) {
      throw new IllegalArgumentException("multiplexer without targets");
    }
    List<BasicBlock> copy = Collections.unmodifiableList(new ArrayList<BasicBlock>(targets));
    BasicBlock mux = new BasicBlock("mux");
    int[] offsets = new int[copy.size() + 1];
    for (int i = 0; i < copy.size(); i++) {
      offsets[i] = mux.getNumParameters();
      mux.addParameters(copy.get(i).getParameterTypes());
    }
    offsets[copy.size()] = mux.getNumParameters();
    BlockParameter flag = copy.size() > 1 ? mux.addParameter(Type.I32) : null;
    body.addBlock(mux);
    EdgeMultiplexer m = new EdgeMultiplexer(materializer, mux, copy, offsets, flag);
    m.emitDispatch();
    return m;
  }

  private List<Value> slice(int k) {
    return new ArrayList<Value>(block.getParameters().subList(offsets[k], offsets[k + 1]));
  }

  private void emitDispatch() {
    IRBuilder builder = new IRBuilder(block);
    int n = targets.size();
    if (flag == null) {
      materializer.createSingleDestinationBranch(builder, targets.get(0), slice(0));
      return;
    }
    int[] caseValues = new int[n - 1];
    ArrayList<List<Value>> caseArgs = new ArrayList<List<Value>>(n - 1);
    for (int k = 0; k < n - 1; k++) {
      caseValues[k] = k;
      caseArgs.add(slice(k));
    }
    materializer.createSwitch(builder, flag, caseValues, targets.subList(0, n - 1), caseArgs,
                              targets.get(n - 1), slice(n - 1));
  }

  public BasicBlock getBlock() {
    return block;
  }

  /**
   * @return the dispatch flag parameter, or null with a single target
   */
  public BlockParameter getFlag() {
    return flag;
  }

  private int indexOf(BasicBlock target) {
    for (int k = 0; k < targets.size(); k++) {
      if (targets.get(k) == target) return k;
    }
    throw new IllegalArgumentException(target + " is not a target of " + block);
  }

  /**
   * Translate the arguments of an edge to target into arguments for the
   * multiplexer block.  Slots of other targets get undefined values.
   *
   * @param builder where to create constants and undefined values
   * @param target the original destination
   * @param args the original arguments
   */
  public List<Value> getArguments(IRBuilder builder, BasicBlock target, List<Value> args) {
    int k = indexOf(target);
    if (Lift.VerifyAssertions) Lift._assert(args.size() == offsets[k + 1] - offsets[k]);
    ArrayList<Value> result = new ArrayList<Value>(block.getNumParameters());
    for (int j = 0; j < targets.size(); j++) {
      if (j == k) {
        result.addAll(args);
      } else {
        for (int p = offsets[j]; p < offsets[j + 1]; p++) {
          result.add(materializer.getUndefValue(builder, block.getParameter(p).getType()));
        }
      }
    }
    if (flag != null) {
      result.add(materializer.getSwitchValue(builder, k));
    }
    return result;
  }

  /**
   * Send an edge through the multiplexer.  Values are created at the end
   * of the edge's source.
   */
  public void redirect(Edge e) {
    IRBuilder builder = new IRBuilder(e.getSource());
    List<Value> args = getArguments(builder, e.getTarget(), e.getArguments());
    e.redirect(block, args);
  }
}
