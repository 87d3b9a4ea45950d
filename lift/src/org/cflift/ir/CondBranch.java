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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Two-way branch on an {@code i1} condition.  Successor 0 is taken when
 * the condition holds, successor 1 otherwise.
 */
public final class CondBranch extends Terminator {
  public static final String NAME = "cf.cond_br";

  public CondBranch(Value condition, BasicBlock trueTarget, List<Value> trueArgs,
                    BasicBlock falseTarget, List<Value> falseArgs) {
    super(NAME, Collections.singletonList(condition), Arrays.asList(trueTarget, falseTarget),
          Arrays.asList(trueArgs, falseArgs));
  }

  public Value getCondition() {
    return getOperand(0);
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    List<BasicBlock> succs = mappedSuccessors(mapping);
    List<List<Value>> args = mappedSuccessorArguments(mapping);
    return new CondBranch(mapping.lookupOrDefault(getCondition()), succs.get(0), args.get(0), succs.get(1), args.get(1));
  }
}
