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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

import org.cflift.Lift;
import org.cflift.MalformedInputException;
import org.cflift.UnsupportedConstructException;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.BlockParameter;
import org.cflift.ir.Body;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Goto;
import org.cflift.ir.Operation;
import org.cflift.ir.SwitchBranch;
import org.cflift.ir.Terminator;
import org.cflift.ir.Type;
import org.cflift.ir.Use;
import org.cflift.ir.UseFilter;
import org.cflift.ir.Value;

/**
 * Turns the control flow graph of a body into structured constructs: a
 * single block whose operations nest branch constructs and do-while
 * loops, built by a {@link StructuredControlFlowMaterializer}.
 * <p>
 * The body is processed as a worklist of body entry blocks.  For each
 * item, every cycle reachable from it becomes a loop whose body is pushed
 * as a new item; then the item's terminator is examined.  A single
 * successor is merged into the item.  A multi-way branch becomes a branch
 * construct whose arms are pushed as new items, and the code after the
 * branch is merged into the item, which is processed again.
 * <p>
 * The work happens on a copy of the body.  The original is replaced only
 * when everything succeeded; on failure it is left exactly as it was.
 */
public final class CFGStructurer {
  static final boolean DEBUG = false;

  private final StructuredControlFlowMaterializer materializer;
  private final DominanceCache dominance;

  private enum ConstructKind { IF, SWITCH, LOOP }

  /** What the structurer knows about a construct it had built. */
  private static final class Construct {
    final ConstructKind kind;
    final List<Body> bodies;
    final int[] caseValues;
    final int dispatchFlags;
    final boolean entryDispatch;

    Construct(ConstructKind kind, List<Body> bodies, int[] caseValues, int dispatchFlags, boolean entryDispatch) {
      this.kind = kind;
      this.bodies = bodies;
      this.caseValues = caseValues;
      this.dispatchFlags = dispatchFlags;
      this.entryDispatch = entryDispatch;
    }
  }

  private final IdentityHashMap<Operation, Construct> constructs = new IdentityHashMap<Operation, Construct>();
  private final ArrayDeque<BasicBlock> worklist = new ArrayDeque<BasicBlock>();
  private final ArrayList<Body> analysed = new ArrayList<Body>();
  /** Bodies and terminators taken out of the working copy during a run. */
  private final ArrayList<Body> detachedBodies = new ArrayList<Body>();
  private final ArrayList<Terminator> detachedTerminators = new ArrayList<Terminator>();
  private int loops;
  private int branchConstructs;
  private int multiplexers;
  private int dispatchFlags;

  public CFGStructurer(StructuredControlFlowMaterializer materializer, DominanceCache dominance) {
    this.materializer = materializer;
    this.dominance = dominance;
  }

  public CFGStructurer(StructuredControlFlowMaterializer materializer) {
    this(materializer, new DominanceCache());
  }

  /**
   * Structure a body in place.
   *
   * @param body a non-empty body whose blocks all end in terminators and
   *        are reachable from its entry
   * @return the outcome; the body is unchanged when it is already a single
   *         block without predecessors
   * @throws org.cflift.StructuringException if the body cannot be
   *         structured, in which case it is left untouched
   */
  public StructuringResult perform(Body body) {
    RegionExtractor.validate(body);
    constructs.clear();
    loops = branchConstructs = multiplexers = dispatchFlags = 0;
    BasicBlock entry = body.getEntry();
    if (body.size() == 1 && body.getPredecessors(entry).isEmpty()) {
      return new StructuringResult(false, buildNode(body), 0, 0, 0, 0);
    }
    Body work = body.clone(new IRMapping());
    work.setParentOp(body.getParentOp());
    boolean done = false;
    try {
      structure(work);
      done = true;
    } finally {
      if (!done) {
        discard(work);
      }
      worklist.clear();
      detachedBodies.clear();
      detachedTerminators.clear();
      for (Body b : analysed) {
        dominance.invalidate(b);
      }
      analysed.clear();
    }
    body.takeBlocksFrom(work);
    StructuringResult result =
        new StructuringResult(true, buildNode(body), loops, branchConstructs, multiplexers, dispatchFlags);
    constructs.clear();
    if (DEBUG) Lift.sysWriteln("structured: ", result);
    return result;
  }

  /**
   * Release every use held by the working copy, including the parts of it
   * that were taken out and not yet placed in a construct, so values
   * defined around the original body see only their original uses.
   */
  private void discard(Body work) {
    work.dropAllReferences();
    for (Body b : detachedBodies) {
      b.dropAllReferences();
    }
    for (Terminator t : detachedTerminators) {
      t.dropAllReferences();
    }
    constructs.clear();
  }

  private DominanceInfo dominance(Body body) {
    if (!analysed.contains(body)) {
      analysed.add(body);
    }
    return dominance.get(body);
  }

  private void structure(Body work) {
    BasicBlock entry = work.getEntry();
    if (!work.getPredecessors(entry).isEmpty()) {
      BasicBlock fresh = new BasicBlock("entry");
      List<BlockParameter> params = fresh.addParameters(entry.getParameterTypes());
      work.insertBlock(0, fresh);
      materializer.createSingleDestinationBranch(new IRBuilder(fresh), entry, new ArrayList<Value>(params));
      entry = fresh;
    }
    worklist.push(entry);
    while (!worklist.isEmpty()) {
      processItem(worklist.pop());
    }
  }

  private void processItem(BasicBlock item) {
    Body body = item.getBody();
    if (Lift.VerifyAssertions) Lift._assert(body.getEntry() == item, "worklist item is not a body entry");
    for (Region cycle : RegionExtractor.findCycles(body, item)) {
      transformCycle(body, cycle.getBlocks());
    }
    unifyReturnLikeExits(body);
    Terminator t = item.getTerminator();
    while (t.getNumSuccessors() == 1) {
      BasicBlock next = t.getSuccessor(0);
      if (Lift.VerifyAssertions) Lift._assert(body.getPredecessors(next).size() == 1, "merging a join block");
      next.replaceParameters(t.getSuccessorArguments(0));
      t.erase();
      next.moveContentsTo(item);
      body.removeBlock(next);
      t = item.getTerminator();
    }
    if (t.getNumSuccessors() > 1) {
      transformBranch(item);
    }
  }

  //----------------------------------------------------------------------//
  //                         Exits.                                       //
  //----------------------------------------------------------------------//

  /**
   * Make the body leave through one block.  All return-like terminators
   * are replaced by branches to a new block holding a copy of the first.
   */
  private void unifyReturnLikeExits(Body body) {
    ArrayList<BasicBlock> exits = new ArrayList<BasicBlock>();
    for (BasicBlock b : body.getBlocks()) {
      if (b.getTerminator().isReturnLike()) {
        exits.add(b);
      }
    }
    if (exits.size() < 2) {
      return;
    }
    Terminator proto = exits.get(0).getTerminator();
    List<Type> types = new ArrayList<Type>();
    for (Value v : proto.getOperands()) {
      types.add(v.getType());
    }
    for (BasicBlock b : exits) {
      Terminator t = b.getTerminator();
      if (!t.getName().equals(proto.getName())) {
        throw new UnsupportedConstructException("cannot merge exits " + proto.getName() + " and " + t.getName());
      }
      if (t.getNumOperands() != types.size()) {
        throw new MalformedInputException(t.getName() + " in " + b + " has " + t.getNumOperands() +
                                          " operands, expected " + types.size());
      }
      for (int i = 0; i < types.size(); i++) {
        if (t.getOperand(i).getType() != types.get(i)) {
          throw new MalformedInputException(t.getName() + " in " + b + ": operand " + i + " has type " +
                                            t.getOperand(i).getType() + ", expected " + types.get(i));
        }
      }
    }
    BasicBlock exit = new BasicBlock("exit");
    List<BlockParameter> params = exit.addParameters(types);
    body.addBlock(exit);
    Terminator unified = (Terminator) proto.clone(new IRMapping());
    unified.setOperands(new ArrayList<Value>(params));
    exit.setTerminator(unified);
    for (BasicBlock b : exits) {
      Terminator t = b.detachTerminator();
      List<Value> values = new ArrayList<Value>(t.getOperands());
      t.dropAllReferences();
      materializer.createSingleDestinationBranch(new IRBuilder(b), exit, values);
    }
    if (DEBUG) Lift.sysWriteln("merged exits: ", exits.size());
  }

  //----------------------------------------------------------------------//
  //                         Cycles.                                      //
  //----------------------------------------------------------------------//

  /**
   * Replace a strongly connected set of blocks by a do-while loop.
   * <p>
   * The loop body is entered through one header and left through one
   * latch.  The latch takes, in order: the header parameters, one group
   * of parameters per exit target, an exit flag when there are several
   * exit targets, the values escaping the cycle, and the repeat flag.
   * All but the repeat flag are carried to the next iteration and become
   * the loop results.
   */
  private void transformCycle(Body body, List<BasicBlock> blocks) {
    DominanceInfo dom = dominance(body);
    Region cycle = RegionExtractor.cyclicRegion(body, blocks, dom.getReversePostorder());
    ArrayList<BasicBlock> members = new ArrayList<BasicBlock>(cycle.getBlocks());
    IdentityHashMap<BasicBlock, Boolean> inside = new IdentityHashMap<BasicBlock, Boolean>();
    for (BasicBlock b : members) {
      inside.put(b, Boolean.TRUE);
    }
    List<Value> escapes = escapingValues(body, members, inside, null);
    IdentityHashMap<BasicBlock, boolean[]> available = availability(dom, members, escapes);

    BasicBlock header;
    boolean entryDispatch = cycle.getEntries().size() > 1;
    if (entryDispatch) {
      EdgeMultiplexer mux = EdgeMultiplexer.create(body, cycle.getEntries(), materializer);
      for (Edge e : cycle.getEntryEdges()) {
        mux.redirect(e);
      }
      for (Edge e : cycle.getBackEdges()) {
        mux.redirect(e);
      }
      header = mux.getBlock();
      members.add(0, header);
      inside.put(header, Boolean.TRUE);
      multiplexers++;
      dispatchFlags++;
    } else {
      header = cycle.getEntries().get(0);
    }

    ArrayList<Edge> entryEdges = new ArrayList<Edge>();
    for (Edge e : Edge.incomingEdges(body, header)) {
      if (!inside.containsKey(e.getSource())) entryEdges.add(e);
    }
    ArrayList<Edge> backEdges = new ArrayList<Edge>();
    ArrayList<Edge> exitEdges = new ArrayList<Edge>();
    for (BasicBlock b : members) {
      for (Edge e : Edge.successorEdges(b)) {
        BasicBlock t = e.getTarget();
        if (t == header) {
          backEdges.add(e);
        } else if (!inside.containsKey(t)) {
          exitEdges.add(e);
        }
      }
    }
    List<BasicBlock> exitTargets = Region.distinctTargets(exitEdges);
    int nExits = exitTargets.size();

    // latch parameter layout
    List<Type> headerTypes = header.getParameterTypes();
    BasicBlock latch = new BasicBlock("latch");
    latch.addParameters(headerTypes);
    int[] slotOffsets = new int[nExits + 1];
    for (int k = 0; k < nExits; k++) {
      slotOffsets[k] = latch.getNumParameters();
      latch.addParameters(exitTargets.get(k).getParameterTypes());
    }
    slotOffsets[nExits] = latch.getNumParameters();
    int exitFlagIndex = -1;
    if (nExits > 1) {
      exitFlagIndex = latch.getNumParameters();
      latch.addParameter(Type.I32);
    }
    int escapeOffset = latch.getNumParameters();
    for (Value v : escapes) {
      latch.addParameter(v.getType());
    }
    BlockParameter repeat = latch.addParameter(Type.I32);
    body.addBlock(latch);

    for (Edge e : backEdges) {
      IRBuilder b = new IRBuilder(e.getSource());
      ArrayList<Value> args = new ArrayList<Value>(e.getArguments());
      for (int p = headerTypes.size(); p < escapeOffset; p++) {
        args.add(materializer.getUndefValue(b, latch.getParameter(p).getType()));
      }
      for (Value v : escapes) {
        args.add(materializer.getUndefValue(b, v.getType()));
      }
      args.add(materializer.getSwitchValue(b, 1));
      e.redirect(latch, args);
    }
    for (Edge e : exitEdges) {
      IRBuilder b = new IRBuilder(e.getSource());
      int k = exitTargets.indexOf(e.getTarget());
      ArrayList<Value> args = new ArrayList<Value>();
      for (Type t : headerTypes) {
        args.add(materializer.getUndefValue(b, t));
      }
      for (int j = 0; j < nExits; j++) {
        if (j == k) {
          args.addAll(e.getArguments());
        } else {
          for (int p = slotOffsets[j]; p < slotOffsets[j + 1]; p++) {
            args.add(materializer.getUndefValue(b, latch.getParameter(p).getType()));
          }
        }
      }
      if (exitFlagIndex >= 0) {
        args.add(materializer.getSwitchValue(b, k));
      }
      args.addAll(escapeArguments(b, available, escapes));
      args.add(materializer.getSwitchValue(b, 0));
      e.redirect(latch, args);
    }

    // every iteration value is a header parameter
    for (int p = headerTypes.size(); p < escapeOffset + escapes.size(); p++) {
      header.addParameter(latch.getParameter(p).getType());
    }

    BasicBlock pre = new BasicBlock("loop");
    List<BlockParameter> preParams = pre.addParameters(headerTypes);
    body.insertBlock(body.indexOf(header), pre);
    for (Edge e : entryEdges) {
      e.redirect(pre, e.getArguments());
    }

    Body loopBody = new Body();
    detachedBodies.add(loopBody);
    body.removeBlock(header);
    loopBody.addBlock(header);
    for (BasicBlock b : members) {
      if (b != header) {
        body.removeBlock(b);
        loopBody.addBlock(b);
      }
    }
    body.removeBlock(latch);
    loopBody.addBlock(latch);

    IRBuilder builder = new IRBuilder(pre);
    ArrayList<Value> init = new ArrayList<Value>(preParams);
    for (int p = headerTypes.size(); p < header.getNumParameters(); p++) {
      init.add(materializer.getUndefValue(builder, header.getParameter(p).getType()));
    }
    ArrayList<Value> next = new ArrayList<Value>(latch.getParameters());
    next.remove(next.size() - 1);
    Operation loop = materializer.createDoWhileLoop(builder, init, repeat, next, loopBody);
    replaceEscapingUses(loop, escapes, escapeOffset);

    List<? extends Value> results = loop.getResults();
    if (nExits == 0) {
      materializer.createUnreachableTerminator(builder, body);
    } else if (nExits == 1) {
      materializer.createSingleDestinationBranch(builder, exitTargets.get(0), slot(results, slotOffsets, 0));
    } else {
      int[] caseValues = new int[nExits - 1];
      ArrayList<List<Value>> caseArgs = new ArrayList<List<Value>>();
      for (int k = 0; k < nExits - 1; k++) {
        caseValues[k] = k;
        caseArgs.add(slot(results, slotOffsets, k));
      }
      materializer.createSwitch(builder, results.get(exitFlagIndex), caseValues, exitTargets.subList(0, nExits - 1),
                                caseArgs, exitTargets.get(nExits - 1), slot(results, slotOffsets, nExits - 1));
    }

    int flags = 1 + (nExits > 1 ? 1 : 0) + (entryDispatch ? 1 : 0);
    ArrayList<Body> bodies = new ArrayList<Body>();
    bodies.add(loopBody);
    constructs.put(loop, new Construct(ConstructKind.LOOP, bodies, null, flags, entryDispatch));
    loops++;
    dispatchFlags += flags - (entryDispatch ? 1 : 0);
    if (DEBUG) {
      Lift.sysWriteln("loop over " + members.size() + " blocks, exits ", nExits);
    }
    worklist.push(header);
  }

  private static List<Value> slot(List<? extends Value> values, int[] offsets, int k) {
    return new ArrayList<Value>(values.subList(offsets[k], offsets[k + 1]));
  }

  //----------------------------------------------------------------------//
  //                         Branches.                                    //
  //----------------------------------------------------------------------//

  /**
   * Replace the multi-way branch ending item by a branch construct.  Each
   * arm yields the arguments of the edge to the code after the construct
   * (the continuation) followed by the values escaping the arms.
   */
  private void transformBranch(BasicBlock item) {
    Body body = item.getBody();
    DominanceInfo dom = dominance(body);
    BranchRegions arms = RegionExtractor.findBranchRegions(item, dom);
    List<BasicBlock> targets = arms.getContinuationTargets();

    ArrayList<Value> escapes = new ArrayList<Value>();
    ArrayList<BasicBlock> armBlocks = new ArrayList<BasicBlock>();
    for (Region r : arms.getRegions()) {
      if (r.isEmpty()) continue;
      IdentityHashMap<BasicBlock, Boolean> inside = new IdentityHashMap<BasicBlock, Boolean>();
      for (BasicBlock b : r.getBlocks()) {
        inside.put(b, Boolean.TRUE);
      }
      escapes.addAll(escapingValues(body, r.getBlocks(), inside, r.getEntry()));
      armBlocks.addAll(r.getBlocks());
    }
    IdentityHashMap<BasicBlock, boolean[]> available = availability(dom, armBlocks, escapes);

    EdgeMultiplexer mux = null;
    BasicBlock continuation = null;
    if (targets.size() > 1 || (!targets.isEmpty() && !arms.getPulledExits().isEmpty())) {
      mux = EdgeMultiplexer.create(body, targets, materializer);
      continuation = mux.getBlock();
      multiplexers++;
      if (mux.getFlag() != null) dispatchFlags++;
    } else if (targets.size() == 1) {
      continuation = targets.get(0);
    }
    List<Type> continuationTypes = continuation == null ? new ArrayList<Type>() : continuation.getParameterTypes();
    ArrayList<Type> resultTypes = new ArrayList<Type>(continuationTypes);
    for (Value v : escapes) {
      resultTypes.add(v.getType());
    }

    ArrayList<Body> bodies = new ArrayList<Body>();
    ArrayList<BasicBlock> yieldBlocks = new ArrayList<BasicBlock>();
    ArrayList<List<Value>> yieldValues = new ArrayList<List<Value>>();
    for (Region region : arms.getRegions()) {
      Edge in = region.getEntryEdges().get(0);
      Body arm = new Body();
      detachedBodies.add(arm);
      bodies.add(arm);
      if (region.isEmpty()) {
        BasicBlock b = new BasicBlock("arm");
        arm.addBlock(b);
        IRBuilder builder = new IRBuilder(b);
        List<Value> values = continuationArguments(mux, builder, in);
        for (Value v : escapes) {
          values.add(materializer.getUndefValue(builder, v.getType()));
        }
        yieldBlocks.add(b);
        yieldValues.add(values);
        continue;
      }
      BasicBlock target = region.getEntry();
      for (BasicBlock b : region.getBlocks()) {
        body.removeBlock(b);
        arm.addBlock(b);
      }
      target.replaceParameters(in.getArguments());
      List<Edge> exits = region.getExitEdges();
      if (exits.isEmpty()) {
        continue;
      }
      if (exits.size() == 1 && exits.get(0).getSource().getTerminator() instanceof Goto) {
        Edge e = exits.get(0);
        BasicBlock source = e.getSource();
        IRBuilder builder = new IRBuilder(source);
        List<Value> values = continuationArguments(mux, builder, e);
        values.addAll(escapeArguments(builder, available, escapes));
        source.detachTerminator().dropAllReferences();
        yieldBlocks.add(source);
        yieldValues.add(values);
        continue;
      }
      BasicBlock join = new BasicBlock("yield");
      List<BlockParameter> joinParams = join.addParameters(resultTypes);
      arm.addBlock(join);
      for (Edge e : exits) {
        IRBuilder builder = new IRBuilder(e.getSource());
        List<Value> values = continuationArguments(mux, builder, e);
        values.addAll(escapeArguments(builder, available, escapes));
        e.redirect(join, values);
      }
      yieldBlocks.add(join);
      yieldValues.add(new ArrayList<Value>(joinParams));
    }

    Terminator branch = item.detachTerminator();
    detachedTerminators.add(branch);
    IRBuilder builder = new IRBuilder(item);
    Operation construct = materializer.createStructuredBranchRegion(builder, branch, resultTypes, bodies);
    for (int i = 0; i < yieldBlocks.size(); i++) {
      materializer.createBranchRegionTerminator(new IRBuilder(yieldBlocks.get(i)), construct, yieldValues.get(i));
    }
    if (branch instanceof SwitchBranch) {
      constructs.put(construct, new Construct(ConstructKind.SWITCH, bodies, ((SwitchBranch) branch).getCaseValues(), 0, false));
    } else if (bodies.size() == 2) {
      constructs.put(construct, new Construct(ConstructKind.IF, bodies, null, 0, false));
    } else {
      int[] caseValues = new int[bodies.size() - 1];
      for (int k = 0; k < caseValues.length; k++) {
        caseValues[k] = k;
      }
      constructs.put(construct, new Construct(ConstructKind.SWITCH, bodies, caseValues, 0, false));
    }
    branch.dropAllReferences();
    branchConstructs++;

    replaceEscapingUses(construct, escapes, continuationTypes.size());
    if (continuation == null) {
      materializer.createUnreachableTerminator(builder, body);
    } else {
      List<? extends Value> results = construct.getResults();
      continuation.replaceParameters(results.subList(0, continuationTypes.size()));
      continuation.moveContentsTo(item);
      body.removeBlock(continuation);
      worklist.push(item);
    }
    for (Body arm : bodies) {
      worklist.push(arm.getEntry());
    }
    if (DEBUG) {
      Lift.sysWriteln("branch construct with " + bodies.size() + " arms, results ", resultTypes.size());
    }
  }

  private List<Value> continuationArguments(EdgeMultiplexer mux, IRBuilder builder, Edge e) {
    if (mux == null) {
      return e.getArguments();
    }
    return mux.getArguments(builder, e.getTarget(), e.getArguments());
  }

  /**
   * The values a region exit passes for the escaping values: each value
   * where it is available at the exit's source, undef elsewhere.
   */
  private List<Value> escapeArguments(IRBuilder builder, IdentityHashMap<BasicBlock, boolean[]> available,
                                      List<Value> escapes) {
    boolean[] here = available.get(builder.getInsertionBlock());
    if (Lift.VerifyAssertions) Lift._assert(here != null, "exit from a block that was not analysed");
    ArrayList<Value> values = new ArrayList<Value>(escapes.size());
    for (int i = 0; i < escapes.size(); i++) {
      Value v = escapes.get(i);
      values.add(here[i] ? v : materializer.getUndefValue(builder, v.getType()));
    }
    return values;
  }

  /**
   * Which escaping values are available at the end of each block.  Asked
   * before the body is rewritten, while the dominance snapshot is current.
   */
  private static IdentityHashMap<BasicBlock, boolean[]> availability(DominanceInfo dom, List<BasicBlock> blocks,
                                                                     List<Value> values) {
    IdentityHashMap<BasicBlock, boolean[]> result = new IdentityHashMap<BasicBlock, boolean[]>();
    for (BasicBlock b : blocks) {
      boolean[] here = new boolean[values.size()];
      for (int i = 0; i < here.length; i++) {
        here[i] = dom.isAvailableAt(values.get(i), b);
      }
      result.put(b, here);
    }
    return result;
  }

  //----------------------------------------------------------------------//
  //                         Escaping values.                             //
  //----------------------------------------------------------------------//

  /**
   * Values defined at the top level of a set of blocks and used outside it.
   *
   * @param skipParamsOf a block whose parameters are not considered, or null
   */
  private static List<Value> escapingValues(Body body, List<BasicBlock> blocks,
                                            IdentityHashMap<BasicBlock, Boolean> inside, BasicBlock skipParamsOf) {
    ArrayList<Value> escapes = new ArrayList<Value>();
    for (BasicBlock b : blocks) {
      if (b != skipParamsOf) {
        for (BlockParameter p : b.getParameters()) {
          if (usedOutside(body, p, inside)) escapes.add(p);
        }
      }
      for (Operation op : b.getOperations()) {
        for (Value r : op.getResults()) {
          if (usedOutside(body, r, inside)) escapes.add(r);
        }
      }
    }
    return escapes;
  }

  private static boolean usedOutside(Body body, Value v, IdentityHashMap<BasicBlock, Boolean> inside) {
    for (Use use : v.getUses()) {
      BasicBlock b = topLevelBlock(body, use.getOwner());
      if (b != null && !inside.containsKey(b)) {
        return true;
      }
    }
    return false;
  }

  /**
   * @return the block of body holding op, directly or through nesting, or null
   */
  private static BasicBlock topLevelBlock(Body body, Operation op) {
    Operation o = op;
    while (o != null) {
      BasicBlock b = o.getBlock();
      if (b == null || b.getBody() == null) return null;
      if (b.getBody() == body) return b;
      o = b.getBody().getParentOp();
    }
    return null;
  }

  /**
   * Route the uses of escaping values outside a new construct through its
   * results.
   */
  private static void replaceEscapingUses(final Operation construct, List<Value> escapes, int offset) {
    UseFilter outside = new UseFilter() {
      @Override
      public boolean accept(Use use) {
        return !construct.isProperAncestor(use.getOwner());
      }
    };
    for (int i = 0; i < escapes.size(); i++) {
      escapes.get(i).replaceUsesWithIf(construct.getResult(offset + i), outside);
    }
  }

  //----------------------------------------------------------------------//
  //                         Node tree.                                   //
  //----------------------------------------------------------------------//

  private StructuredNode buildNode(Body body) {
    ArrayList<StructuredNode> children = new ArrayList<StructuredNode>();
    ArrayList<Operation> leaf = new ArrayList<Operation>();
    for (BasicBlock b : body.getBlocks()) {
      for (Operation op : b.getOperations()) {
        Construct c = constructs.get(op);
        if (c == null) {
          leaf.add(op);
          continue;
        }
        if (!leaf.isEmpty()) {
          children.add(new LeafNode(leaf));
          leaf.clear();
        }
        children.add(buildConstructNode(op, c));
      }
      if (b.getTerminator() != null) {
        leaf.add(b.getTerminator());
      }
    }
    if (!leaf.isEmpty()) {
      children.add(new LeafNode(leaf));
    }
    return new SequenceNode(children);
  }

  private StructuredNode buildConstructNode(Operation op, Construct c) {
    Value selector = op.getNumOperands() > 0 ? op.getOperand(0) : null;
    switch (c.kind) {
      case IF:
        return new IfNode(op, selector, buildNode(c.bodies.get(0)), buildNode(c.bodies.get(1)));
      case SWITCH: {
        ArrayList<StructuredNode> cases = new ArrayList<StructuredNode>();
        for (int i = 1; i < c.bodies.size(); i++) {
          cases.add(buildNode(c.bodies.get(i)));
        }
        return new SwitchNode(op, selector, c.caseValues, cases, buildNode(c.bodies.get(0)));
      }
      default: {
        Body loopBody = c.bodies.get(0);
        Terminator last = loopBody.isEmpty() ? null : loopBody.getBlocks().get(loopBody.size() - 1).getTerminator();
        Value condition = last != null && last.getNumOperands() > 0 ? last.getOperand(0) : null;
        return new LoopNode(op, buildNode(loopBody), condition, c.dispatchFlags, c.entryDispatch);
      }
    }
  }
}
