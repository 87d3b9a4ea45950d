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

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static org.cflift.tests.util.TestingTools.*;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.Type;
import org.cflift.ir.Value;
import org.junit.Before;
import org.junit.Test;

public class IterativeDominatorsTest {

  private FunctionOp f;
  private Body body;
  private BasicBlock entry;

  @Before
  public void createFunction() {
    f = function("dom", 0, 0);
    body = f.getFunctionBody();
    entry = f.getEntryBlock();
  }

  private Value cond(BasicBlock b) {
    return new IRBuilder(b).constant(Type.I1, 1);
  }

  @Test
  public void testDiamond() {
    BasicBlock a = block(body, "a");
    BasicBlock b = block(body, "b");
    BasicBlock join = block(body, "join");
    new IRBuilder(entry).condBr(cond(entry), a, noValues(), b, noValues());
    new IRBuilder(a).br(join, noValues());
    new IRBuilder(b).br(join, noValues());
    new IRBuilder(join).ret(noValues());

    DominanceInfo dom = new IterativeDominators().compute(body);
    assertSame(entry, dom.getImmediateDominator(join));
    assertSame(entry, dom.getImmediateDominator(a));
    assertNull(dom.getImmediateDominator(entry));
    assertTrue(dom.dominates(entry, join));
    assertTrue(dom.dominates(join, join));
    assertFalse(dom.properlyDominates(join, join));
    assertFalse(dom.dominates(a, join));
    assertSame(entry, dom.getReversePostorder().get(0));
    assertSame(join, dom.getReversePostorder().get(3));
    assertSame(join, dom.getPostorder().get(0));
    assertEquals(3, dom.getChildren(entry).size());
    assertEquals(4, dom.getPreorder().size());
    assertSame(entry, dom.getPreorder().get(0));
  }

  @Test
  public void testLoop() {
    BasicBlock header = block(body, "header");
    BasicBlock latch = block(body, "latch");
    BasicBlock exit = block(body, "exit");
    new IRBuilder(entry).br(header, noValues());
    new IRBuilder(header).condBr(cond(header), latch, noValues(), exit, noValues());
    new IRBuilder(latch).br(header, noValues());
    new IRBuilder(exit).ret(noValues());

    DominanceInfo dom = new IterativeDominators().compute(body);
    assertSame(header, dom.getImmediateDominator(latch));
    assertSame(header, dom.getImmediateDominator(exit));
    assertTrue(dom.properlyDominates(header, latch));
    assertFalse(dom.dominates(latch, header));
    assertThat(dom.getPreorder(header), hasItems(header, latch, exit));
    assertEquals(1, dom.getPreorder(latch).size());
  }

  @Test
  public void testUnreachableBlock() {
    BasicBlock dead = block(body, "dead");
    new IRBuilder(entry).ret(noValues());
    new IRBuilder(dead).br(entry, noValues());

    DominanceInfo dom = new IterativeDominators().compute(body);
    assertTrue(dom.isReachable(entry));
    assertFalse(dom.isReachable(dead));
    assertNull(dom.getImmediateDominator(dead));
    assertFalse(dom.dominates(dead, entry));
    assertFalse(dom.dominates(entry, dead));
    assertTrue(dom.getChildren(dead).isEmpty());
    assertTrue(dom.getPreorder(dead).isEmpty());
  }

  @Test
  public void testValueAvailability() {
    BasicBlock a = block(body, "a");
    BasicBlock b = block(body, "b");
    IRBuilder builder = new IRBuilder(entry);
    Value inEntry = builder.constant(Type.I32, 1);
    builder.condBr(cond(entry), a, noValues(), b, noValues());
    Value inA = new IRBuilder(a).constant(Type.I32, 2);
    new IRBuilder(a).br(b, noValues());
    new IRBuilder(b).ret(noValues());

    DominanceInfo dom = new IterativeDominators().compute(body);
    assertTrue(dom.isAvailableAt(inEntry, b));
    assertTrue(dom.isAvailableAt(inA, a));
    assertFalse(dom.isAvailableAt(inA, b));
  }

  @Test
  public void testCacheReusesCurrentSnapshot() {
    new IRBuilder(entry).ret(noValues());
    DominanceCache cache = new DominanceCache();
    DominanceInfo first = cache.get(body);
    assertSame(first, cache.get(body));
    assertEquals(1, cache.getComputations());
    assertEquals(1, cache.getHits());
    assertFalse(first.isStale());

    BasicBlock next = block(body, "next");
    entry.detachTerminator().dropAllReferences();
    new IRBuilder(entry).br(next, noValues());
    new IRBuilder(next).ret(noValues());
    assertTrue(first.isStale());
    DominanceInfo second = cache.get(body);
    assertNotSame(first, second);
    assertEquals(2, cache.getComputations());
    assertSame(entry, second.getImmediateDominator(next));

    cache.invalidate(body);
    cache.get(body);
    assertEquals(3, cache.getComputations());
  }
}
