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
 * A basic block: parameters, a straight-line list of operations and a
 * terminator.  Blocks belong to at most one {@link Body} at a time.
 */
public final class BasicBlock {
  private String label;
  private final ArrayList<BlockParameter> params = new ArrayList<BlockParameter>();
  private final ArrayList<Operation> ops = new ArrayList<Operation>();
  private Terminator terminator;
  private Body body;

  public BasicBlock() {
    this(null);
  }

  /**
   * @param label a debugging name, printed by {@link #toString()}
   */
  public BasicBlock(String label) {
    this.label = label;
  }

  public String getLabel() {
    return label;
  }

  public Body getBody() {
    return body;
  }

  void setBody(Body body) {
    this.body = body;
  }

  //----------------------------------------------------------------------//
  //                         Parameters.                                  //
  //----------------------------------------------------------------------//

  public BlockParameter addParameter(Type type) {
    BlockParameter p = new BlockParameter(this, params.size(), type);
    params.add(p);
    return p;
  }

  public List<BlockParameter> addParameters(List<Type> types) {
    ArrayList<BlockParameter> added = new ArrayList<BlockParameter>(types.size());
    for (Type t : types) {
      added.add(addParameter(t));
    }
    return added;
  }

  public List<BlockParameter> getParameters() {
    return Collections.unmodifiableList(params);
  }

  public BlockParameter getParameter(int i) {
    return params.get(i);
  }

  public int getNumParameters() {
    return params.size();
  }

  public List<Type> getParameterTypes() {
    ArrayList<Type> types = new ArrayList<Type>(params.size());
    for (BlockParameter p : params) {
      types.add(p.getType());
    }
    return types;
  }

  /**
   * Remove all parameters.  None of them may still be used.
   */
  public void eraseParameters() {
    for (BlockParameter p : params) {
      if (p.hasUses()) {
        throw new IllegalStateException("erasing parameter " + p + " that still has uses");
      }
    }
    params.clear();
  }

  /**
   * Substitute each parameter with a value and remove the parameters.
   *
   * @param values one replacement per parameter
   */
  public void replaceParameters(List<? extends Value> values) {
    if (values.size() != params.size()) {
      throw new IllegalArgumentException("expected " + params.size() + " values for " + this + ", got " + values.size());
    }
    for (int i = 0; i < params.size(); i++) {
      params.get(i).replaceAllUsesWith(values.get(i));
    }
    eraseParameters();
  }

  //----------------------------------------------------------------------//
  //                         Operations.                                  //
  //----------------------------------------------------------------------//

  /**
   * @return the non-terminator operations, in order
   */
  public List<Operation> getOperations() {
    return Collections.unmodifiableList(ops);
  }

  public void appendOperation(Operation op) {
    insertOperation(ops.size(), op);
  }

  public void insertOperation(int index, Operation op) {
    if (op.isTerminator()) {
      throw new IllegalArgumentException("use setTerminator for " + op.getName());
    }
    if (op.getBlock() != null) {
      throw new IllegalStateException(op.getName() + " is already placed in " + op.getBlock());
    }
    ops.add(index, op);
    op.setBlock(this);
  }

  void removeOperation(Operation op) {
    if (op == terminator) {
      detachTerminator();
      return;
    }
    for (int i = 0; i < ops.size(); i++) {
      if (ops.get(i) == op) {
        ops.remove(i);
        op.setBlock(null);
        return;
      }
    }
    throw new IllegalStateException(op.getName() + " is not in " + this);
  }

  public Terminator getTerminator() {
    return terminator;
  }

  public void setTerminator(Terminator t) {
    if (terminator != null) {
      throw new IllegalStateException(this + " already has a terminator");
    }
    if (t.getBlock() != null) {
      throw new IllegalStateException(t.getName() + " is already placed in " + t.getBlock());
    }
    terminator = t;
    t.setBlock(this);
    touch();
  }

  /**
   * Take the terminator out of this block without dropping its references.
   *
   * @return the old terminator, or null
   */
  public Terminator detachTerminator() {
    Terminator t = terminator;
    if (t != null) {
      t.setBlock(null);
      terminator = null;
      touch();
    }
    return t;
  }

  /**
   * Move every operation and the terminator of this block to the end of
   * another block, which must not have a terminator yet.
   *
   * @param dest the receiving block
   */
  public void moveContentsTo(BasicBlock dest) {
    if (dest.terminator != null) {
      throw new IllegalStateException(dest + " already has a terminator");
    }
    for (Operation op : ops) {
      op.setBlock(null);
      dest.appendOperation(op);
    }
    ops.clear();
    Terminator t = detachTerminator();
    if (t != null) {
      dest.setTerminator(t);
    }
  }

  public List<BasicBlock> getSuccessors() {
    if (terminator == null) {
      return Collections.emptyList();
    }
    return terminator.getSuccessors();
  }

  private void touch() {
    if (body != null) {
      body.touch();
    }
  }

  public void walk(OperationVisitor visitor) {
    for (Operation op : new ArrayList<Operation>(ops)) {
      op.walk(visitor);
    }
    if (terminator != null) {
      terminator.walk(visitor);
    }
  }

  void dropAllReferences() {
    for (Operation op : ops) {
      op.dropAllReferences();
    }
    if (terminator != null) {
      terminator.dropAllReferences();
    }
  }

  @Override
  public String toString() {
    if (label != null) {
      return label;
    }
    return "bb@" + Integer.toHexString(System.identityHashCode(this));
  }
}
