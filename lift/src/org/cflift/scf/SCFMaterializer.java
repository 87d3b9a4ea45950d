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
import java.util.List;

import org.cflift.InvalidTopLevelOpException;
import org.cflift.UnknownTerminatorException;
import org.cflift.UnsupportedUnreachableException;
import org.cflift.controlflow.StructuredControlFlowMaterializer;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.CondBranch;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.Operation;
import org.cflift.ir.SwitchBranch;
import org.cflift.ir.Terminator;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * Materializes structured control flow as {@code scf} operations:
 * conditional branches become {@link IfOp}, switches become
 * {@link IndexSwitchOp} and loops become {@link DoWhileOp}.  Dispatch
 * flags are {@code arith.constant} values, don't-care values are
 * {@code ub.poison}.
 */
public class SCFMaterializer implements StructuredControlFlowMaterializer {

  @Override
  public Operation createStructuredBranchRegion(IRBuilder builder, Terminator branch, List<Type> resultTypes,
                                                List<Body> bodies) {
    Operation construct;
    if (branch instanceof CondBranch) {
      construct = new IfOp(((CondBranch) branch).getCondition(), resultTypes);
    } else if (branch instanceof SwitchBranch) {
      SwitchBranch s = (SwitchBranch) branch;
      construct = new IndexSwitchOp(s.getFlag(), s.getCaseValues(), resultTypes);
    } else {
      throw new UnknownTerminatorException("cannot lift " + branch.getName() + " to a structured branch");
    }
    for (Body b : bodies) {
      construct.addBody(b);
    }
    return builder.insert(construct);
  }

  @Override
  public void createBranchRegionTerminator(IRBuilder builder, Operation construct, List<Value> results) {
    builder.insert(new YieldOp(results));
  }

  @Override
  public Operation createDoWhileLoop(IRBuilder builder, List<Value> init, Value condition, List<Value> next,
                                    Body body) {
    List<Type> types = new ArrayList<Type>(next.size());
    for (Value v : next) {
      types.add(v.getType());
    }
    BasicBlock last = body.getBlocks().get(body.size() - 1);
    new IRBuilder(last).insert(new ConditionOp(condition, next));
    DoWhileOp loop = new DoWhileOp(init, types);
    loop.addBody(body);
    return builder.insert(loop);
  }

  @Override
  public Value getSwitchValue(IRBuilder builder, int value) {
    return builder.constant(Type.I32, value);
  }

  @Override
  public void createSwitch(IRBuilder builder, Value flag, int[] caseValues, List<BasicBlock> caseDestinations,
                           List<List<Value>> caseArguments, BasicBlock defaultDestination,
                           List<Value> defaultArguments) {
    builder.switchBr(flag, defaultDestination, defaultArguments, caseValues, caseDestinations, caseArguments);
  }

  @Override
  public Value getUndefValue(IRBuilder builder, Type type) {
    return builder.insert(new PoisonOp(type)).getResult(0);
  }

  @Override
  public void createUnreachableTerminator(IRBuilder builder, Body body) {
    Operation parent = body.getParentOp();
    if (parent == null) {
      throw new UnsupportedUnreachableException("cannot leave a body that has no parent operation");
    }
    if (parent instanceof FunctionOp) {
      builder.ret(poisons(builder, ((FunctionOp) parent).getFunctionResultTypes()));
    } else if (parent instanceof IfOp || parent instanceof IndexSwitchOp) {
      builder.insert(new YieldOp(poisons(builder, parent.getResultTypes())));
    } else if (parent instanceof DoWhileOp) {
      Value condition = getUndefValue(builder, Type.I32);
      builder.insert(new ConditionOp(condition, poisons(builder, parent.getResultTypes())));
    } else {
      throw new InvalidTopLevelOpException("cannot create an unreachable terminator inside " + parent.getName());
    }
  }

  @Override
  public void createSingleDestinationBranch(IRBuilder builder, BasicBlock destination, List<Value> arguments) {
    builder.br(destination, arguments);
  }

  private List<Value> poisons(IRBuilder builder, List<Type> types) {
    ArrayList<Value> values = new ArrayList<Value>(types.size());
    for (Type t : types) {
      values.add(getUndefValue(builder, t));
    }
    return values;
  }
}
