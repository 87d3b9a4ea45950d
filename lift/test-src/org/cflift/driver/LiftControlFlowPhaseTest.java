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
package org.cflift.driver;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.cflift.tests.util.TestingTools.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.Arrays;

import org.cflift.Lift;
import org.cflift.UnknownTerminatorException;
import org.cflift.controlflow.StructuringResult;
import org.cflift.ir.BasicBlock;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.IRPrinter;
import org.cflift.ir.Module;
import org.cflift.ir.Type;
import org.cflift.ir.Value;
import org.cflift.tests.util.IndirectBranch;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LiftControlFlowPhaseTest {

  private ByteArrayOutputStream captured;
  private PrintStream saved;

  @Before
  public void captureOutput() {
    captured = new ByteArrayOutputStream();
    saved = Lift.setOutput(new PrintStream(captured, true));
  }

  @After
  public void restoreOutput() {
    Lift.setOutput(saved);
  }

  /** if (x < 0) x = -x; return x */
  private static FunctionOp abs(String name) {
    FunctionOp f = function(name, 1);
    BasicBlock entry = f.getEntryBlock();
    BasicBlock neg = block(f, "neg");
    BasicBlock done = block(f, "done", Type.I32);
    Value x = entry.getParameter(0);
    IRBuilder b = new IRBuilder(entry);
    b.condBr(cmpi(b, "slt", x, b.constant(Type.I32, 0)), neg, noValues(), done, values(x));
    b.setInsertionPointToEnd(neg);
    b.br(done, values(muli(b, x, b.constant(Type.I32, -1))));
    b.setInsertionPointToEnd(done);
    b.ret(values(done.getParameter(0)));
    return f;
  }

  private static FunctionOp constant(String name) {
    FunctionOp f = function(name, 0);
    IRBuilder b = new IRBuilder(f.getEntryBlock());
    b.ret(values(b.constant(Type.I32, 42)));
    return f;
  }

  /** A two way branch through a terminator the phase cannot lift. */
  private static FunctionOp indirect(String name) {
    FunctionOp f = function(name, 1, 0);
    BasicBlock a = block(f, "a");
    BasicBlock c = block(f, "c");
    f.getEntryBlock().setTerminator(new IndirectBranch(f.getArguments().get(0), blocks(a, c),
                                                       argLists(noValues(), noValues())));
    new IRBuilder(a).ret(noValues());
    new IRBuilder(c).ret(noValues());
    return f;
  }

  private static Module module(FunctionOp... functions) {
    Module m = new Module("test");
    for (FunctionOp f : functions) {
      m.addFunction(f);
    }
    return m;
  }

  @Test
  public void testStructuresEveryFunction() {
    Module m = module(abs("first"), constant("second"),
                      FunctionOp.declaration("external", types(Type.I32), types()), abs("third"));
    LiftControlFlowPhase phase = new LiftControlFlowPhase(new LiftOptions());
    phase.performPhase(m, new LiftOptions());

    assertTrue(phase.isChanged());
    assertEquals(Arrays.asList("first", "second", "third"), Arrays.asList(phase.getResults().keySet().toArray()));
    assertTrue(phase.getResults().get("first").isChanged());
    assertFalse(phase.getResults().get("second").isChanged());
    assertEquals(1, phase.getResults().get("third").getBranchConstructs());
    assertTrue(phase.getFailed().isEmpty());
    assertTrue(phase.getDominanceComputations() > 0);
    assertFullyStructured(m.lookup("first").getFunctionBody());
    assertFullyStructured(m.lookup("third").getFunctionBody());
    assertTrue(m.lookup("external").getFunctionBody().isEmpty());
  }

  @Test
  public void testNothingToDo() {
    LiftControlFlowPhase phase = new LiftControlFlowPhase(new LiftOptions());
    phase.perform(module(constant("only")));
    assertFalse(phase.isChanged());
    assertEquals(0, phase.getDominanceComputations());
  }

  @Test
  public void testAbortOnFailure() {
    FunctionOp bad = indirect("bad");
    Module m = module(abs("before"), bad, abs("after"));
    String badBefore = IRPrinter.print(bad);
    LiftControlFlowPhase phase = new LiftControlFlowPhase(new LiftOptions());
    try {
      phase.perform(m);
      fail("structured an unknown terminator");
    } catch (UnknownTerminatorException expected) {
      assertEquals("@bad", expected.getContainer());
      assertThat(expected.getMessage(), startsWith("@bad: "));
    }
    assertThat(captured.toString(), containsString("lift: cannot structure @bad: "));
    assertEquals(badBefore, IRPrinter.print(bad));
    assertFullyStructured(m.lookup("before").getFunctionBody());
    assertEquals(3, m.lookup("after").getFunctionBody().size());
  }

  @Test
  public void testSkipOnFailure() {
    FunctionOp bad = indirect("bad");
    Module m = module(abs("before"), bad, abs("after"));
    String badBefore = IRPrinter.print(bad);
    LiftOptions options = new LiftOptions();
    options.processAll("failureMode=skip");
    LiftControlFlowPhase phase = new LiftControlFlowPhase(options);
    phase.perform(m);

    assertEquals(Arrays.asList("bad"), phase.getFailed());
    assertFalse(phase.getResults().containsKey("bad"));
    assertTrue(phase.isChanged());
    assertEquals(badBefore, IRPrinter.print(bad));
    assertFullyStructured(m.lookup("after").getFunctionBody());
  }

  @Test
  public void testSharedDominanceCache() {
    LiftOptions options = new LiftOptions();
    options.processAll("reuseRootDominance=true");
    LiftControlFlowPhase shared = new LiftControlFlowPhase(options);
    shared.perform(module(abs("a"), abs("b")));
    LiftControlFlowPhase separate = new LiftControlFlowPhase(new LiftOptions());
    separate.perform(module(abs("a"), abs("b")));

    assertEquals(separate.getDominanceComputations(), shared.getDominanceComputations());
    StructuringResult a = shared.getResults().get("a");
    assertEquals(separate.getResults().get("a").toString(), a.toString());
  }

  @Test
  public void testPrintStructured() {
    LiftOptions options = new LiftOptions();
    options.processAll("printStructured", "verifyIR=false");
    new LiftControlFlowPhase(options).perform(module(abs("shown")));
    String out = captured.toString();
    assertThat(out, containsString("Structured @shown: changed=true"));
    assertThat(out, containsString("branches=1"));
  }

  @Test
  public void testEchoOptionsAtStart() {
    LiftOptions options = new LiftOptions();
    options.processAll("echoOptions=true");
    captured.reset();
    new LiftControlFlowPhase(options).perform(module(constant("c")));
    assertThat(captured.toString(), containsString("Option 'failureMode' = abort"));
  }

  @Test
  public void testPhaseIdentity() {
    LiftControlFlowPhase phase = new LiftControlFlowPhase(new LiftOptions());
    assertEquals("Lift Control Flow", phase.getName());
    assertTrue(phase.shouldPerform(new LiftOptions()));
    assertFalse(phase.printingEnabled(new LiftOptions(), true));
  }
}
