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

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.cflift.tests.util.TestingTools.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.cflift.InvalidTopLevelOpException;
import org.cflift.UnknownTerminatorException;
import org.cflift.UnsupportedUnreachableException;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.CondBranch;
import org.cflift.ir.ConstantOp;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.Goto;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.OpResult;
import org.cflift.ir.Operation;
import org.cflift.ir.Return;
import org.cflift.ir.SwitchBranch;
import org.cflift.ir.Terminator;
import org.cflift.ir.Type;
import org.cflift.ir.Value;
import org.junit.Before;
import org.junit.Test;

public class SCFMaterializerTest {

  private SCFMaterializer materializer;
  private FunctionOp f;
  private BasicBlock entry;
  private IRBuilder builder;

  @Before
  public void createFunction() {
    materializer = new SCFMaterializer();
    f = new FunctionOp("m", types(Type.I32), types(Type.I32, Type.I64));
    entry = f.getEntryBlock();
    builder = new IRBuilder(entry);
  }

  private static Body bodyWithOneBlock() {
    Body body = new Body();
    body.addBlock(new BasicBlock("b"));
    return body;
  }

  @Test
  public void testConditionalBranchBecomesIf() {
    BasicBlock t = block(f, "t");
    BasicBlock e = block(f, "e");
    Value c = builder.constant(Type.I1, 1);
    CondBranch branch = new CondBranch(c, t, noValues(), e, noValues());
    Body thenBody = bodyWithOneBlock();
    Body elseBody = bodyWithOneBlock();

    Operation op = materializer.createStructuredBranchRegion(builder, branch, types(Type.I32),
                                                             Arrays.asList(thenBody, elseBody));
    assertThat(op, instanceOf(IfOp.class));
    IfOp construct = (IfOp) op;
    assertSame(c, construct.getCondition());
    assertSame(thenBody, construct.getThenBody());
    assertSame(elseBody, construct.getElseBody());
    assertSame(construct, thenBody.getParentOp());
    assertEquals(1, construct.getNumResults());
    assertSame(entry, construct.getBlock());
  }

  @Test
  public void testSwitchBecomesIndexSwitch() {
    BasicBlock d = block(f, "d");
    BasicBlock c0 = block(f, "c0");
    BasicBlock c5 = block(f, "c5");
    Value flag = builder.constant(Type.I32, 5);
    SwitchBranch branch = new SwitchBranch(flag, d, noValues(), new int[]{0, 5}, blocks(c0, c5),
                                           argLists(noValues(), noValues()));
    List<Body> bodies = Arrays.asList(bodyWithOneBlock(), bodyWithOneBlock(), bodyWithOneBlock());

    IndexSwitchOp construct =
        (IndexSwitchOp) materializer.createStructuredBranchRegion(builder, branch, types(), bodies);
    assertSame(flag, construct.getSelector());
    assertEquals(2, construct.getNumCases());
    assertEquals(5, construct.getCaseValue(1));
    assertSame(bodies.get(0), construct.getDefaultBody());
    assertSame(bodies.get(2), construct.getCaseBody(1));
  }

  @Test(expected = UnknownTerminatorException.class)
  public void testUnconditionalBranchIsNotABranchRegion() {
    BasicBlock t = block(f, "t");
    materializer.createStructuredBranchRegion(builder, new Goto(t, noValues()), types(),
                                              Arrays.asList(bodyWithOneBlock()));
  }

  @Test
  public void testDoWhileTerminatesLastBlock() {
    Body body = new Body();
    BasicBlock first = block(body, "first", Type.I32);
    BasicBlock last = block(body, "last");
    new IRBuilder(first).br(last, noValues());
    IRBuilder lb = new IRBuilder(last);
    Value cond = lb.constant(Type.I32, 0);
    Value next = lb.constant(Type.I32, 4);
    Value init = builder.constant(Type.I32, 1);

    Operation loop = materializer.createDoWhileLoop(builder, values(init), cond, values(next), body);
    assertThat(loop, instanceOf(DoWhileOp.class));
    assertEquals(Arrays.asList(init), ((DoWhileOp) loop).getInit());
    assertSame(body, ((DoWhileOp) loop).getLoopBody());
    assertEquals(types(Type.I32), loop.getResultTypes());
    Terminator t = last.getTerminator();
    assertThat(t, instanceOf(ConditionOp.class));
    assertSame(cond, ((ConditionOp) t).getCondition());
    assertEquals(Arrays.asList(next), ((ConditionOp) t).getForwarded());
  }

  @Test
  public void testDispatchValuesAndFillers() {
    Value flag = materializer.getSwitchValue(builder, 3);
    assertEquals(3L, ((ConstantOp) ((OpResult) flag).getOwner()).getValue());
    assertSame(Type.I32, flag.getType());
    Value undef = materializer.getUndefValue(builder, Type.F64);
    assertSame(Type.F64, undef.getType());
    assertEquals(PoisonOp.NAME, ((OpResult) undef).getOwner().getName());
  }

  @Test
  public void testSingleDestinationIsGoto() {
    BasicBlock t = block(f, "t", Type.I32);
    Value v = builder.constant(Type.I32, 2);
    materializer.createSingleDestinationBranch(builder, t, values(v));
    assertThat(entry.getTerminator(), instanceOf(Goto.class));
    assertSame(t, ((Goto) entry.getTerminator()).getTarget());
  }

  @Test
  public void testUnreachableInFunctionReturnsPoison() {
    materializer.createUnreachableTerminator(builder, f.getFunctionBody());
    Terminator t = entry.getTerminator();
    assertThat(t, instanceOf(Return.class));
    assertEquals(2, t.getNumOperands());
    assertSame(Type.I64, t.getOperand(1).getType());
    assertEquals(2, count(f.getFunctionBody(), PoisonOp.NAME));
  }

  @Test
  public void testUnreachableInBranchRegionYieldsPoison() {
    IfOp construct = new IfOp(builder.constant(Type.I1, 0), types(Type.I32));
    Body arm = bodyWithOneBlock();
    construct.addBody(arm);
    IRBuilder ab = new IRBuilder(arm.getEntry());
    materializer.createUnreachableTerminator(ab, arm);
    assertThat(arm.getEntry().getTerminator(), instanceOf(YieldOp.class));
    assertEquals(1, arm.getEntry().getTerminator().getNumOperands());
  }

  @Test
  public void testUnreachableInLoopStopsLoop() {
    DoWhileOp loop = new DoWhileOp(new ArrayList<Value>(), types(Type.I32, Type.I32));
    Body body = bodyWithOneBlock();
    loop.addBody(body);
    materializer.createUnreachableTerminator(new IRBuilder(body.getEntry()), body);
    Terminator t = body.getEntry().getTerminator();
    assertThat(t, instanceOf(ConditionOp.class));
    assertEquals(2, ((ConditionOp) t).getForwarded().size());
    assertSame(Type.I32, ((ConditionOp) t).getCondition().getType());
  }

  @Test
  public void testUnreachableInUnknownContainer() {
    Operation holder = new Operation("test.region", noValues(), null);
    Body body = bodyWithOneBlock();
    holder.addBody(body);
    try {
      materializer.createUnreachableTerminator(new IRBuilder(body.getEntry()), body);
      fail("made a terminator for an unknown container");
    } catch (InvalidTopLevelOpException expected) {
      assertThat(expected.getMessage(), containsString("test.region"));
    }
    assertNull(body.getEntry().getTerminator());
  }

  @Test(expected = UnsupportedUnreachableException.class)
  public void testUnreachableWithoutContainer() {
    Body body = bodyWithOneBlock();
    materializer.createUnreachableTerminator(new IRBuilder(body.getEntry()), body);
  }
}
