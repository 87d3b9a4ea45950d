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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A generic operation: a name, operands, typed results, attributes and any
 * number of nested bodies.  The structurer treats operations it does not
 * create as opaque; they are moved with their block, never reordered or
 * duplicated.
 */
public class Operation {
  private final String name;
  private final OperandList operands;
  private final List<OpResult> results;
  private final List<Body> bodies = new ArrayList<Body>(1);
  private final Map<String, Object> attributes = new LinkedHashMap<String, Object>();

  /** The block holding this operation, null while detached. */
  private BasicBlock block;

  public Operation(String name, List<Value> operands, List<Type> resultTypes) {
    this.name = name;
    this.operands = new OperandList(this, operands);
    if (resultTypes == null || resultTypes.isEmpty()) {
      this.results = Collections.emptyList();
    } else {
      ArrayList<OpResult> r = new ArrayList<OpResult>(resultTypes.size());
      for (int i = 0; i < resultTypes.size(); i++) {
        r.add(new OpResult(this, i, resultTypes.get(i)));
      }
      this.results = Collections.unmodifiableList(r);
    }
  }

  public final String getName() {
    return name;
  }

  //----------------------------------------------------------------------//
  //                         Operands and results.                        //
  //----------------------------------------------------------------------//

  public final List<Value> getOperands() {
    return operands.asList();
  }

  public final int getNumOperands() {
    return operands.size();
  }

  public final Value getOperand(int i) {
    return operands.get(i);
  }

  public final void setOperand(int i, Value v) {
    operands.set(i, v);
  }

  public final void setOperands(List<Value> values) {
    operands.setAll(values);
  }

  public final List<OpResult> getResults() {
    return results;
  }

  public final OpResult getResult(int i) {
    return results.get(i);
  }

  public final int getNumResults() {
    return results.size();
  }

  public final List<Type> getResultTypes() {
    ArrayList<Type> types = new ArrayList<Type>(results.size());
    for (OpResult r : results) {
      types.add(r.getType());
    }
    return types;
  }

  /**
   * @return every operand list of this operation, including the argument
   * lists of successors for terminators
   */
  List<OperandList> operandLists() {
    return Collections.singletonList(operands);
  }

  //----------------------------------------------------------------------//
  //                         Attributes and bodies.                       //
  //----------------------------------------------------------------------//

  public final Object getAttribute(String key) {
    return attributes.get(key);
  }

  public final void setAttribute(String key, Object value) {
    attributes.put(key, value);
  }

  public final Map<String, Object> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public final List<Body> getBodies() {
    return Collections.unmodifiableList(bodies);
  }

  public final Body getBody(int i) {
    return bodies.get(i);
  }

  /**
   * Adopt a body as the next nested body of this operation.
   *
   * @param body a body not owned by any other operation
   */
  public final void addBody(Body body) {
    if (body.getParentOp() != null && body.getParentOp() != this) {
      throw new IllegalStateException("body already owned by " + body.getParentOp().getName());
    }
    body.setParentOp(this);
    bodies.add(body);
  }

  //----------------------------------------------------------------------//
  //                         Placement.                                   //
  //----------------------------------------------------------------------//

  public final BasicBlock getBlock() {
    return block;
  }

  final void setBlock(BasicBlock block) {
    this.block = block;
  }

  public boolean isTerminator() {
    return false;
  }

  /**
   * Is this operation an ancestor of another one (through nested bodies)?
   *
   * @param other the potential descendant
   * @return true if other is nested, at any depth, inside this operation
   */
  public final boolean isProperAncestor(Operation other) {
    Operation op = other;
    while (op != null) {
      BasicBlock b = op.getBlock();
      if (b == null || b.getBody() == null) {
        return false;
      }
      op = b.getBody().getParentOp();
      if (op == this) {
        return true;
      }
    }
    return false;
  }

  /**
   * Detach this operation from its block and drop all its references.
   */
  public final void erase() {
    if (block != null) {
      block.removeOperation(this);
    }
    dropAllReferences();
  }

  /**
   * Drop every use this operation (and everything nested in it) holds, so
   * that the values it referenced no longer see it.
   */
  public void dropAllReferences() {
    for (OperandList list : operandLists()) {
      list.clear();
    }
    for (Body b : bodies) {
      b.dropAllReferences();
    }
  }

  /**
   * Visit this operation and every operation nested in it, outer first.
   *
   * @param visitor the visitor
   */
  public final void walk(OperationVisitor visitor) {
    visitor.visit(this);
    for (Body b : bodies) {
      b.walk(visitor);
    }
  }

  //----------------------------------------------------------------------//
  //                         Cloning.                                     //
  //----------------------------------------------------------------------//

  /**
   * Deep-copy this operation.  Operands are looked up in the mapping;
   * results and nested blocks are recorded in it.
   *
   * @param mapping value and block mapping, updated in place
   * @return the detached copy
   */
  public final Operation clone(IRMapping mapping) {
    Operation copy = createCopy(mapping);
    copy.attributes.putAll(attributes);
    for (int i = 0; i < results.size(); i++) {
      mapping.map(results.get(i), copy.getResult(i));
    }
    for (Body b : bodies) {
      copy.addBody(b.clone(mapping));
    }
    return copy;
  }

  /**
   * Create a copy without attributes or bodies.  Subclasses with extra
   * state override this.
   *
   * @param mapping used to translate operands
   * @return the new shell
   */
  protected Operation createCopy(IRMapping mapping) {
    return new Operation(name, mapping.lookupAll(getOperands()), getResultTypes());
  }

  /**
   * Re-point operands that refer to values recorded in the mapping.
   * Used after cloning a body whose block order does not follow dominance.
   */
  final void remapOperands(IRMapping mapping) {
    for (OperandList list : operandLists()) {
      for (int i = 0; i < list.size(); i++) {
        Value mapped = mapping.lookupOrNull(list.get(i));
        if (mapped != null) {
          list.set(i, mapped);
        }
      }
    }
  }

  @Override
  public String toString() {
    return name;
  }
}
