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
package org.cflift.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The last operation of a basic block.  A terminator transfers control to
 * zero or more successor blocks, binding the successor's parameters to the
 * arguments of the edge.
 * <p>
 * Callers may subclass this for their own terminator kinds; the structurer
 * only relies on the successor list and, for exits, {@link #isReturnLike()}.
 */
public abstract class Terminator extends Operation {
  private final ArrayList<BasicBlock> targets = new ArrayList<BasicBlock>(2);
  private final ArrayList<OperandList> arguments = new ArrayList<OperandList>(2);

  protected Terminator(String name, List<Value> operands, List<BasicBlock> successors,
                       List<? extends List<Value>> successorArguments) {
    super(name, operands, null);
    if (successors.size() != successorArguments.size()) {
      throw new IllegalArgumentException("successor/argument count mismatch in " + name);
    }
    for (int i = 0; i < successors.size(); i++) {
      targets.add(successors.get(i));
      arguments.add(new OperandList(this, successorArguments.get(i)));
    }
  }

  @Override
  public final boolean isTerminator() {
    return true;
  }

  /**
   * Does executing this terminator leave the enclosing body with values
   * for its parent (a function return, a region yield)?  Exits that are not
   * return-like, such as unreachable, never leave the body.
   */
  public boolean isReturnLike() {
    return false;
  }

  public final int getNumSuccessors() {
    return targets.size();
  }

  public final BasicBlock getSuccessor(int i) {
    return targets.get(i);
  }

  public final List<BasicBlock> getSuccessors() {
    return Collections.unmodifiableList(targets);
  }

  public final List<Value> getSuccessorArguments(int i) {
    return arguments.get(i).asList();
  }

  /**
   * Redirect an edge.
   *
   * @param i the successor index
   * @param target the new target block
   * @param args the new edge arguments, one per parameter of target
   */
  public final void setSuccessor(int i, BasicBlock target, List<Value> args) {
    targets.set(i, target);
    arguments.get(i).setAll(args);
    BasicBlock b = getBlock();
    if (b != null && b.getBody() != null) {
      b.getBody().touch();
    }
  }

  @Override
  final List<OperandList> operandLists() {
    ArrayList<OperandList> lists = new ArrayList<OperandList>(arguments.size() + 1);
    lists.addAll(super.operandLists());
    lists.addAll(arguments);
    return lists;
  }

  /**
   * Helper for {@link #createCopy}: the mapped successor blocks.
   */
  protected final List<BasicBlock> mappedSuccessors(IRMapping mapping) {
    ArrayList<BasicBlock> result = new ArrayList<BasicBlock>(targets.size());
    for (BasicBlock b : targets) {
      result.add(mapping.lookup(b));
    }
    return result;
  }

  /**
   * Helper for {@link #createCopy}: the mapped successor arguments.
   */
  protected final List<List<Value>> mappedSuccessorArguments(IRMapping mapping) {
    ArrayList<List<Value>> result = new ArrayList<List<Value>>(arguments.size());
    for (OperandList args : arguments) {
      result.add(mapping.lookupAll(args.asList()));
    }
    return result;
  }
}
