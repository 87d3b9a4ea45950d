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

import static org.junit.Assert.*;
import static org.cflift.tests.util.TestingTools.*;

import org.cflift.scf.IfOp;
import org.cflift.scf.YieldOp;
import org.junit.Test;

public class BodyTest {

  /** entry(x) -> loop(i) -> loop | exit; exit returns x + i */
  private static FunctionOp counter() {
    FunctionOp f = function("counter", 1);
    Value x = f.getArguments().get(0);
    BasicBlock loop = block(f, "loop", Type.I32);
    BasicBlock exit = block(f, "exit");
    IRBuilder b = new IRBuilder(f.getEntryBlock());
    b.br(loop, values(x));
    b.setInsertionPointToEnd(loop);
    Value i = addi(b, loop.getParameter(0), b.constant(Type.I32, 1));
    Value c = cmpi(b, "slt", i, x);
    b.condBr(c, loop, values(i), exit, noValues());
    b.setInsertionPointToEnd(exit);
    b.ret(values(addi(b, x, loop.getParameter(0))));
    return f;
  }

  @Test
  public void testCloneIsIndependent() {
    FunctionOp f = counter();
    Body body = f.getFunctionBody();
    String before = IRPrinter.print(body);
    IRMapping mapping = new IRMapping();
    Body copy = body.clone(mapping);

    assertNull(copy.getParentOp());
    assertEquals(3, copy.size());
    assertEquals(before, IRPrinter.print(copy));
    BasicBlock loop = body.getBlocks().get(1);
    BasicBlock loopCopy = mapping.lookup(loop);
    assertNotSame(loop, loopCopy);
    assertSame(copy, loopCopy.getBody());
    assertSame(loopCopy.getParameter(0), mapping.lookupOrNull(loop.getParameter(0)));
    assertSame(copy.getEntry().getParameter(0), mapping.lookupOrNull(f.getArguments().get(0)));

    copy.getBlocks().get(2).getTerminator().erase();
    assertEquals(before, IRPrinter.print(body));
  }

  @Test
  public void testTakeBlocksFromMovesEverything() {
    FunctionOp f = counter();
    Body body = f.getFunctionBody();
    Value oldArgument = f.getArguments().get(0);
    int uses = oldArgument.getUses().size();
    Body copy = body.clone(new IRMapping());

    BasicBlock newEntry = copy.getEntry();
    body.takeBlocksFrom(copy);
    assertTrue(copy.isEmpty());
    assertSame(newEntry, body.getEntry());
    assertSame(body, newEntry.getBody());
    assertFalse(oldArgument.hasUses());
    assertEquals(uses, f.getArguments().get(0).getUses().size());
    IRVerifier.verify(f);
  }

  @Test
  public void testDropAllReferencesReleasesOuterValues() {
    FunctionOp f = function("outer", 1);
    Value x = f.getArguments().get(0);
    IRBuilder b = new IRBuilder(f.getEntryBlock());
    IfOp construct = new IfOp(b.constant(Type.I1, 1), types(Type.I32));
    Body arm = new Body();
    IRBuilder ab = new IRBuilder(block(arm, "arm"));
    ab.insert(new YieldOp(values(addi(ab, x, x))));
    construct.addBody(arm);
    b.insert(construct);
    assertEquals(2, x.getUses().size());

    Body copy = arm.clone(new IRMapping());
    assertEquals(4, x.getUses().size());
    copy.dropAllReferences();
    assertEquals(2, x.getUses().size());
  }

  @Test
  public void testPredecessorsAreCountedPerEdge() {
    FunctionOp f = function("twice", 0, 0);
    BasicBlock t = block(f, "t");
    IRBuilder b = new IRBuilder(f.getEntryBlock());
    b.condBr(b.constant(Type.I1, 0), t, noValues(), t, noValues());
    new IRBuilder(t).ret(noValues());
    assertEquals(blocks(f.getEntryBlock(), f.getEntryBlock()), f.getFunctionBody().getPredecessors(t));
  }

  @Test
  public void testReplaceParametersRewritesUses() {
    FunctionOp f = counter();
    BasicBlock loop = f.getFunctionBody().getBlocks().get(1);
    BlockParameter p = loop.getParameter(0);
    Value seven = new IRBuilder(f.getEntryBlock()).constant(Type.I32, 7);
    int uses = p.getUses().size();
    loop.replaceParameters(values(seven));
    assertEquals(0, loop.getNumParameters());
    assertFalse(p.hasUses());
    assertEquals(uses, seven.getUses().size());
  }

  @Test
  public void testReplaceUsesWithIfKeepsOtherUses() {
    FunctionOp f = counter();
    Value x = f.getArguments().get(0);
    final BasicBlock exit = f.getFunctionBody().getBlocks().get(2);
    Value seven = new IRBuilder(f.getEntryBlock()).constant(Type.I32, 7);
    assertEquals(3, x.getUses().size());
    x.replaceUsesWithIf(seven, new UseFilter() {
      @Override
      public boolean accept(Use use) {
        return use.getOwner().getBlock() == exit;
      }
    });
    assertEquals(2, x.getUses().size());
    assertEquals(1, seven.getUses().size());
    assertSame(exit, seven.getUses().get(0).getOwner().getBlock());
  }

  @Test(expected = IllegalStateException.class)
  public void testEraseUsedParameter() {
    counter().getFunctionBody().getBlocks().get(1).eraseParameters();
  }

  @Test
  public void testModificationCountTracksEdits() {
    FunctionOp f = counter();
    Body body = f.getFunctionBody();
    int before = body.getModificationCount();
    block(body, "extra");
    assertTrue(body.getModificationCount() > before);
  }
}
