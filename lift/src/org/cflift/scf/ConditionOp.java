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
package org.cflift.scf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Terminator;
import org.cflift.ir.Value;

/**
 * {@code scf.condition}: ends the body of a {@link DoWhileOp}.  Operand 0
 * is the {@code i32} repeat flag, the rest are forwarded.
 */
public final class ConditionOp extends Terminator {
  public static final String NAME = "scf.condition";

  public ConditionOp(Value condition, List<Value> forwarded) {
    super(NAME, operands(condition, forwarded), Collections.<BasicBlock>emptyList(),
          Collections.<List<Value>>emptyList());
  }

  private static List<Value> operands(Value condition, List<Value> forwarded) {
    ArrayList<Value> all = new ArrayList<Value>(forwarded.size() + 1);
    all.add(condition);
    all.addAll(forwarded);
    return all;
  }

  public Value getCondition() {
    return getOperand(0);
  }

  public List<Value> getForwarded() {
    List<Value> all = getOperands();
    return all.subList(1, all.size());
  }

  @Override
  public boolean isReturnLike() {
    return true;
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    List<Value> all = mapping.lookupAll(getOperands());
    return new ConditionOp(all.get(0), all.subList(1, all.size()));
  }
}
