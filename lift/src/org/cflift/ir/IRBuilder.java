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

import java.util.Collections;
import java.util.List;

/**
 * Creates operations at the end of a block.  Terminators become the
 * block's terminator; everything else is appended before it.
 */
public final class IRBuilder {
  private BasicBlock block;

  public IRBuilder() {
  }

  public IRBuilder(BasicBlock block) {
    this.block = block;
  }

  public void setInsertionPointToEnd(BasicBlock b) {
    this.block = b;
  }

  public BasicBlock getInsertionBlock() {
    return block;
  }

  /**
   * Place an operation at the insertion point.
   *
   * @param op a detached operation
   * @return op
   */
  public <T extends Operation> T insert(T op) {
    if (block == null) {
      throw new IllegalStateException("no insertion point for " + op.getName());
    }
    if (op instanceof Terminator) {
      block.setTerminator((Terminator) op);
    } else {
      block.appendOperation(op);
    }
    return op;
  }

  public Operation create(String name, List<Value> operands, List<Type> resultTypes) {
    return insert(new Operation(name, operands, resultTypes));
  }

  public Value createSingle(String name, List<Value> operands, Type resultType) {
    return create(name, operands, Collections.singletonList(resultType)).getResult(0);
  }

  public Value constant(Type type, long value) {
    return insert(new ConstantOp(type, value)).getResult(0);
  }

  public Goto br(BasicBlock dest, List<Value> args) {
    return insert(new Goto(dest, args));
  }

  public CondBranch condBr(Value condition, BasicBlock trueDest, List<Value> trueArgs,
                           BasicBlock falseDest, List<Value> falseArgs) {
    return insert(new CondBranch(condition, trueDest, trueArgs, falseDest, falseArgs));
  }

  public SwitchBranch switchBr(Value flag, BasicBlock defaultDest, List<Value> defaultArgs,
                               int[] caseValues, List<BasicBlock> caseDests, List<? extends List<Value>> caseArgs) {
    return insert(new SwitchBranch(flag, defaultDest, defaultArgs, caseValues, caseDests, caseArgs));
  }

  public Return ret(List<Value> values) {
    return insert(new Return(values));
  }

  public Unreachable unreachable() {
    return insert(new Unreachable());
  }
}
