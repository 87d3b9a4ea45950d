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

import java.util.Collections;
import java.util.List;

import org.cflift.ir.Operation;
import org.cflift.ir.Value;

/**
 * A do-while loop.  The body runs once, then again while the condition
 * computed at its end is non-zero.
 * <p>
 * Dispatch flags are the {@code i32} values the loop carries to reach a
 * single entry and a single exit: always the repeat flag, one more when
 * the loop had several exit targets, and one more when it had several
 * entry blocks.
 */
public final class LoopNode extends StructuredNode {
  private final Operation construct;
  private final StructuredNode body;
  private final Value condition;
  private final int dispatchFlags;
  private final boolean entryDispatch;

  public LoopNode(Operation construct, StructuredNode body, Value condition, int dispatchFlags, boolean entryDispatch) {
    this.construct = construct;
    this.body = body;
    this.condition = condition;
    this.dispatchFlags = dispatchFlags;
    this.entryDispatch = entryDispatch;
  }

  public Operation getConstruct() {
    return construct;
  }

  public StructuredNode getBody() {
    return body;
  }

  /**
   * @return the continuation condition, or null if the loop body's
   * terminator carries none
   */
  public Value getCondition() {
    return condition;
  }

  /**
   * @return the initial values of the loop-carried variables
   */
  public List<Value> getLoopCarried() {
    return construct.getOperands();
  }

  @Override
  public List<? extends Value> getOutputs() {
    return construct.getResults();
  }

  public int getDispatchFlags() {
    return dispatchFlags;
  }

  /**
   * @return whether the loop was irreducible and dispatches on entry
   */
  public boolean hasEntryDispatch() {
    return entryDispatch;
  }

  @Override
  public List<StructuredNode> getChildren() {
    return Collections.singletonList(body);
  }

  @Override
  void dump(StringBuilder sb, int depth) {
    indent(sb, depth);
    sb.append("loop carried=").append(getLoopCarried().size()).append(" flags=").append(dispatchFlags);
    if (entryDispatch) {
      sb.append(" entry-dispatch");
    }
    sb.append('\n');
    body.dump(sb, depth + 1);
  }
}
