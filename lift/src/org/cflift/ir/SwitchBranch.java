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
 * Multi-way branch on an integer flag.  Successor 0 is the default
 * destination; successor {@code i + 1} is taken when the flag equals
 * {@code getCaseValue(i)}.  There is no fallthrough between cases.
 */
public final class SwitchBranch extends Terminator {
  public static final String NAME = "cf.switch";

  private final int[] caseValues;

  public SwitchBranch(Value flag, BasicBlock defaultTarget, List<Value> defaultArgs,
                      int[] caseValues, List<BasicBlock> caseTargets, List<? extends List<Value>> caseArgs) {
    super(NAME, Collections.singletonList(flag), successors(defaultTarget, caseTargets),
          arguments(defaultArgs, caseArgs));
    if (caseValues.length != caseTargets.size()) {
      throw new IllegalArgumentException("case value/target count mismatch");
    }
    this.caseValues = caseValues.clone();
  }

  private static List<BasicBlock> successors(BasicBlock defaultTarget, List<BasicBlock> caseTargets) {
    ArrayList<BasicBlock> succs = new ArrayList<BasicBlock>(caseTargets.size() + 1);
    succs.add(defaultTarget);
    succs.addAll(caseTargets);
    return succs;
  }

  private static List<List<Value>> arguments(List<Value> defaultArgs, List<? extends List<Value>> caseArgs) {
    ArrayList<List<Value>> args = new ArrayList<List<Value>>(caseArgs.size() + 1);
    args.add(defaultArgs);
    args.addAll(caseArgs);
    return args;
  }

  public Value getFlag() {
    return getOperand(0);
  }

  public int getNumCases() {
    return caseValues.length;
  }

  public int getCaseValue(int i) {
    return caseValues[i];
  }

  public int[] getCaseValues() {
    return caseValues.clone();
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    List<BasicBlock> succs = mappedSuccessors(mapping);
    List<List<Value>> args = mappedSuccessorArguments(mapping);
    return new SwitchBranch(mapping.lookupOrDefault(getFlag()), succs.get(0), args.get(0), caseValues,
                            succs.subList(1, succs.size()), args.subList(1, args.size()));
  }
}
