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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.CondBranch;
import org.cflift.ir.ConstantOp;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.Goto;
import org.cflift.ir.Operation;
import org.cflift.ir.SwitchBranch;
import org.cflift.ir.Terminator;
import org.cflift.ir.Unreachable;
import org.cflift.ir.Value;
import org.cflift.scf.ConditionOp;
import org.cflift.scf.DoWhileOp;
import org.cflift.scf.IfOp;
import org.cflift.scf.IndexSwitchOp;

/**
 * Executes functions before and after structuring so that their
 * behaviour can be compared.  Values are longs; a poison value is null.
 * Execution stops after a number of {@code test.effect} operations or
 * after a number of steps, whichever comes first.
 */
public final class CFGInterpreter {

  public enum Status { RETURNED, BUDGET, DIVERGED }

  public static final int EFFECT_BUDGET = 200;
  public static final int STEP_LIMIT = 200000;

  /** Raised when execution depends on a poison value or reaches unreachable code. */
  public static final class UndefinedBehaviorException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    UndefinedBehaviorException(String s) {
      super(s);
    }
  }

  private static final class Stop extends RuntimeException {
    private static final long serialVersionUID = 1L;
    final Status status;

    Stop(Status status) {
      super(status.name(), null, false, false);
      this.status = status;
    }
  }

  public static final class Outcome {
    private final Status status;
    private final List<String> trace;
    private final List<Long> returned;

    Outcome(Status status, List<String> trace, List<Long> returned) {
      this.status = status;
      this.trace = Collections.unmodifiableList(trace);
      this.returned = returned;
    }

    public Status getStatus() {
      return status;
    }

    public List<String> getTrace() {
      return trace;
    }

    /** @return the returned values, or null if the function did not return */
    public List<Long> getReturned() {
      return returned;
    }

    @Override
    public String toString() {
      return status + " " + returned + " " + trace;
    }
  }

  private static final class Exit {
    final Terminator terminator;
    final List<Long> values;

    Exit(Terminator terminator, List<Long> values) {
      this.terminator = terminator;
      this.values = values;
    }
  }

  private final IdentityHashMap<Value, Long> env = new IdentityHashMap<Value, Long>();
  private final ArrayList<String> trace = new ArrayList<String>();
  private int steps;

  private CFGInterpreter() {}

  public static Outcome run(FunctionOp f, long... args) {
    CFGInterpreter interp = new CFGInterpreter();
    ArrayList<Long> in = new ArrayList<Long>(args.length);
    for (long a : args) {
      in.add(a);
    }
    try {
      Exit e = interp.runBody(f.getFunctionBody(), in);
      return new Outcome(Status.RETURNED, interp.trace, e.values);
    } catch (Stop s) {
      return new Outcome(s.status, interp.trace, null);
    }
  }

  private Exit runBody(Body body, List<Long> args) {
    BasicBlock b = body.getEntry();
    bind(b.getParameters(), args);
    while (true) {
      for (Operation op : b.getOperations()) {
        execute(op);
      }
      Terminator t = b.getTerminator();
      step();
      if (t instanceof Unreachable) {
        throw new UndefinedBehaviorException("reached unreachable in " + b);
      }
      if (t.getNumSuccessors() == 0) {
        return new Exit(t, read(t.getOperands()));
      }
      int s = chooseSuccessor(t);
      List<Long> next = read(t.getSuccessorArguments(s));
      b = t.getSuccessor(s);
      bind(b.getParameters(), next);
    }
  }

  private int chooseSuccessor(Terminator t) {
    if (t instanceof Goto) {
      return 0;
    }
    if (t instanceof CondBranch) {
      return defined(t.getOperand(0), t) != 0 ? 0 : 1;
    }
    if (t instanceof SwitchBranch) {
      SwitchBranch s = (SwitchBranch) t;
      long flag = defined(s.getFlag(), t);
      for (int i = 0; i < s.getNumCases(); i++) {
        if (s.getCaseValue(i) == flag) return i + 1;
      }
      return 0;
    }
    throw new IllegalStateException("cannot interpret " + t.getName());
  }

  private void execute(Operation op) {
    step();
    String name = op.getName();
    if (op instanceof ConstantOp) {
      env.put(op.getResult(0), ((ConstantOp) op).getValue());
    } else if (name.equals("ub.poison")) {
      env.put(op.getResult(0), null);
    } else if (name.equals("arith.addi") || name.equals("arith.muli") || name.equals("arith.andi")) {
      Long x = read(op.getOperand(0));
      Long y = read(op.getOperand(1));
      Long r = null;
      if (x != null && y != null) {
        if (name.equals("arith.addi")) {
          r = x + y;
        } else if (name.equals("arith.muli")) {
          r = x * y;
        } else {
          r = x & y;
        }
      }
      env.put(op.getResult(0), r);
    } else if (name.equals("arith.cmpi")) {
      Long x = read(op.getOperand(0));
      Long y = read(op.getOperand(1));
      Long r = null;
      if (x != null && y != null) {
        r = compare((String) op.getAttribute("predicate"), x, y) ? 1L : 0L;
      }
      env.put(op.getResult(0), r);
    } else if (name.equals(TestingTools.EFFECT)) {
      List<Long> vs = read(op.getOperands());
      StringBuilder sb = new StringBuilder();
      sb.append(op.getAttribute("tag"));
      for (Long v : vs) {
        sb.append(' ').append(v == null ? "poison" : v.toString());
      }
      trace.add(sb.toString());
      if (trace.size() >= EFFECT_BUDGET) {
        throw new Stop(Status.BUDGET);
      }
    } else if (op instanceof IfOp) {
      Body arm = defined(op.getOperand(0), op) != 0 ? op.getBody(0) : op.getBody(1);
      bindResults(op, runBody(arm, Collections.<Long>emptyList()));
    } else if (op instanceof IndexSwitchOp) {
      IndexSwitchOp s = (IndexSwitchOp) op;
      long selector = defined(s.getSelector(), op);
      Body arm = s.getDefaultBody();
      for (int i = 0; i < s.getNumCases(); i++) {
        if (s.getCaseValue(i) == selector) {
          arm = s.getCaseBody(i);
          break;
        }
      }
      bindResults(op, runBody(arm, Collections.<Long>emptyList()));
    } else if (op instanceof DoWhileOp) {
      DoWhileOp loop = (DoWhileOp) op;
      List<Long> args = read(loop.getInit());
      while (true) {
        Exit e = runBody(loop.getLoopBody(), args);
        if (!(e.terminator instanceof ConditionOp)) {
          throw new IllegalStateException("loop body left through " + e.terminator.getName());
        }
        Long cond = e.values.get(0);
        if (cond == null) {
          throw new UndefinedBehaviorException("loop condition is poison");
        }
        args = e.values.subList(1, e.values.size());
        if (cond == 0) {
          break;
        }
      }
      for (int i = 0; i < op.getNumResults(); i++) {
        env.put(op.getResult(i), args.get(i));
      }
    } else {
      throw new IllegalStateException("cannot interpret " + name);
    }
  }

  private void bindResults(Operation op, Exit e) {
    if (op.getNumResults() != e.values.size()) {
      throw new IllegalStateException(op.getName() + " expects " + op.getNumResults() + " values, got " +
                                      e.values.size());
    }
    for (int i = 0; i < op.getNumResults(); i++) {
      env.put(op.getResult(i), e.values.get(i));
    }
  }

  private static boolean compare(String predicate, long x, long y) {
    if (predicate.equals("eq")) return x == y;
    if (predicate.equals("ne")) return x != y;
    if (predicate.equals("slt")) return x < y;
    if (predicate.equals("sgt")) return x > y;
    throw new IllegalStateException("unknown predicate " + predicate);
  }

  private void step() {
    if (++steps > STEP_LIMIT) {
      throw new Stop(Status.DIVERGED);
    }
  }

  private void bind(List<? extends Value> params, List<Long> values) {
    if (params.size() != values.size()) {
      throw new IllegalStateException("expected " + params.size() + " values, got " + values.size());
    }
    for (int i = 0; i < params.size(); i++) {
      env.put(params.get(i), values.get(i));
    }
  }

  private Long read(Value v) {
    if (!env.containsKey(v)) {
      throw new IllegalStateException("read of undefined value " + v);
    }
    return env.get(v);
  }

  private List<Long> read(List<? extends Value> vs) {
    ArrayList<Long> out = new ArrayList<Long>(vs.size());
    for (Value v : vs) {
      out.add(read(v));
    }
    return out;
  }

  private long defined(Value v, Operation user) {
    Long x = read(v);
    if (x == null) {
      throw new UndefinedBehaviorException(user.getName() + " depends on poison");
    }
    return x;
  }
}
