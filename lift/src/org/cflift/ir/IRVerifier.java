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

import java.util.ArrayDeque;
import java.util.IdentityHashMap;
import java.util.List;

import org.cflift.MalformedInputException;
import org.cflift.MalformedRegionException;

/**
 * Checks the structural preconditions of a body and, recursively, of
 * every body nested in it:
 * <ul>
 *   <li>every block has a terminator</li>
 *   <li>successors stay inside the body</li>
 *   <li>edge arguments match the target's parameters in number and type</li>
 *   <li>every block is reachable from the entry</li>
 *   <li>operands are defined in the same body or an enclosing one</li>
 * </ul>
 * Dominance of definitions over uses is not checked.
 */
public final class IRVerifier {

  private IRVerifier() {}

  public static void verify(Module m) {
    for (FunctionOp f : m.getFunctions()) {
      verify(f);
    }
  }

  public static void verify(FunctionOp f) {
    Body body = f.getFunctionBody();
    if (!body.isEmpty() && body.getEntry().getNumParameters() != f.getArgumentTypes().size()) {
      throw new MalformedInputException(f + ": entry block does not match the function signature");
    }
    verify(body);
  }

  public static void verify(Body body) {
    if (body.isEmpty()) return;
    for (BasicBlock b : body.getBlocks()) {
      verifyBlock(body, b);
    }
    verifyReachable(body);
  }

  /**
   * Check only what makes a body a single-entry region: every block ends
   * in a terminator, no edge leaves the body and every block is reachable
   * from the entry.  Nested bodies are not visited.
   *
   * @param body a body with at least one block
   */
  public static void verifySingleEntry(Body body) {
    for (BasicBlock b : body.getBlocks()) {
      verifyEdges(body, b);
    }
    verifyReachable(body);
  }

  private static Terminator verifyEdges(Body body, BasicBlock b) {
    Terminator t = b.getTerminator();
    if (t == null) {
      throw new MalformedInputException("block " + b + " has no terminator");
    }
    for (BasicBlock s : t.getSuccessors()) {
      if (s.getBody() != body) {
        throw new MalformedRegionException("edge " + b + " -> " + s + " leaves its body");
      }
    }
    return t;
  }

  private static void verifyBlock(Body body, BasicBlock b) {
    Terminator t = verifyEdges(body, b);
    for (int i = 0; i < t.getNumSuccessors(); i++) {
      BasicBlock s = t.getSuccessor(i);
      List<Value> args = t.getSuccessorArguments(i);
      if (args.size() != s.getNumParameters()) {
        throw new MalformedInputException("edge " + b + " -> " + s + " passes " + args.size() +
                                          " arguments to " + s.getNumParameters() + " parameters");
      }
      for (int j = 0; j < args.size(); j++) {
        if (args.get(j).getType() != s.getParameter(j).getType()) {
          throw new MalformedInputException("edge " + b + " -> " + s + ": argument " + j + " has type " +
                                            args.get(j).getType() + ", expected " + s.getParameter(j).getType());
        }
      }
    }
    for (Operation op : b.getOperations()) {
      verifyOperation(body, op);
    }
    verifyOperation(body, t);
  }

  private static void verifyOperation(Body body, Operation op) {
    for (OperandList list : op.operandLists()) {
      for (int i = 0; i < list.size(); i++) {
        Value v = list.get(i);
        BasicBlock def = v.getDefiningBlock();
        if (def == null || def.getBody() == null) {
          throw new MalformedInputException(op.getName() + " in " + op.getBlock() + " uses erased value " + v);
        }
        if (!isVisibleIn(def.getBody(), body)) {
          throw new MalformedInputException(op.getName() + " in " + op.getBlock() + " uses " + v +
                                            " which is not defined in an enclosing body");
        }
      }
    }
    for (Body nested : op.getBodies()) {
      verify(nested);
    }
  }

  /**
   * Is a value defined at the top level of {@code defBody} visible inside {@code useBody}?
   */
  private static boolean isVisibleIn(Body defBody, Body useBody) {
    Body b = useBody;
    while (b != null) {
      if (b == defBody) return true;
      Operation parent = b.getParentOp();
      if (parent == null || parent.getBlock() == null) return false;
      b = parent.getBlock().getBody();
    }
    return false;
  }

  private static void verifyReachable(Body body) {
    IdentityHashMap<BasicBlock, Boolean> seen = new IdentityHashMap<BasicBlock, Boolean>();
    ArrayDeque<BasicBlock> work = new ArrayDeque<BasicBlock>();
    work.push(body.getEntry());
    seen.put(body.getEntry(), Boolean.TRUE);
    while (!work.isEmpty()) {
      BasicBlock b = work.pop();
      for (BasicBlock s : b.getSuccessors()) {
        if (seen.put(s, Boolean.TRUE) == null) {
          work.push(s);
        }
      }
    }
    for (BasicBlock b : body.getBlocks()) {
      if (!seen.containsKey(b)) {
        throw new MalformedRegionException("block " + b + " is unreachable from " + body.getEntry());
      }
    }
  }
}
