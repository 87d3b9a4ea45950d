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
package org.cflift.tests.util;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.Operation;
import org.cflift.ir.OperationVisitor;
import org.cflift.ir.Terminator;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

public final class TestingTools {

  public static final String EFFECT = "test.effect";

  private TestingTools() {}

  public static List<Value> values(Value... vs) {
    return new ArrayList<Value>(Arrays.asList(vs));
  }

  public static List<Value> noValues() {
    return new ArrayList<Value>();
  }

  public static List<Type> types(Type... ts) {
    return new ArrayList<Type>(Arrays.asList(ts));
  }

  @SafeVarargs
  public static List<List<Value>> argLists(List<Value>... lists) {
    return new ArrayList<List<Value>>(Arrays.asList(lists));
  }

  public static List<BasicBlock> blocks(BasicBlock... bs) {
    return new ArrayList<BasicBlock>(Arrays.asList(bs));
  }

  /**
   * A function from {@code nargs} i32 values to one i32 value.
   */
  public static FunctionOp function(String name, int nargs) {
    return function(name, nargs, 1);
  }

  public static FunctionOp function(String name, int nargs, int nresults) {
    return new FunctionOp(name, Collections.nCopies(nargs, Type.I32), Collections.nCopies(nresults, Type.I32));
  }

  /**
   * Append a new block to a body.
   */
  public static BasicBlock block(Body body, String label, Type... params) {
    BasicBlock b = new BasicBlock(label);
    b.addParameters(Arrays.asList(params));
    body.addBlock(b);
    return b;
  }

  public static BasicBlock block(FunctionOp f, String label, Type... params) {
    return block(f.getFunctionBody(), label, params);
  }

  /**
   * An operation with no results the interpreter records in its trace.
   */
  public static Operation effect(IRBuilder b, int tag, Value... operands) {
    Operation op = new Operation(EFFECT, values(operands), null);
    op.setAttribute("tag", tag);
    return b.insert(op);
  }

  public static Value addi(IRBuilder b, Value x, Value y) {
    return b.createSingle("arith.addi", values(x, y), x.getType());
  }

  public static Value muli(IRBuilder b, Value x, Value y) {
    return b.createSingle("arith.muli", values(x, y), x.getType());
  }

  public static Value andi(IRBuilder b, Value x, Value y) {
    return b.createSingle("arith.andi", values(x, y), x.getType());
  }

  /**
   * @param predicate one of eq, ne, slt, sgt
   */
  public static Value cmpi(IRBuilder b, String predicate, Value x, Value y) {
    Operation op = new Operation("arith.cmpi", values(x, y), types(Type.I1));
    op.setAttribute("predicate", predicate);
    return b.insert(op).getResult(0);
  }

  /**
   * Count the operations with a name in a body and everything nested in it.
   */
  public static int count(Body body, final String name) {
    final int[] n = new int[1];
    body.walk(new OperationVisitor() {
      @Override
      public void visit(Operation op) {
        if (op.getName().equals(name)) n[0]++;
      }
    });
    return n[0];
  }

  public static int count(Operation root, String name) {
    int n = 0;
    for (Body b : root.getBodies()) {
      n += count(b, name);
    }
    return n;
  }

  /**
   * Assert that a body and every body nested in it is a single block
   * without branches.
   */
  public static void assertFullyStructured(Body body) {
    assertEquals("blocks in body", 1, body.size());
    Terminator t = body.getEntry().getTerminator();
    assertNotNull("missing terminator", t);
    assertEquals("successors of " + t.getName(), 0, t.getNumSuccessors());
    body.walk(new OperationVisitor() {
      @Override
      public void visit(Operation op) {
        assertFalse("unstructured " + op.getName(), op.getName().startsWith("cf."));
        for (Body nested : op.getBodies()) {
          assertEquals("blocks in body of " + op.getName(), 1, nested.size());
        }
      }
    });
  }
}
