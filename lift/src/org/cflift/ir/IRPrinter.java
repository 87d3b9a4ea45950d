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

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Textual dump of the IR.  Values and blocks are numbered in print order,
 * so two structurally identical bodies print identically.
 */
public final class IRPrinter {
  private final StringBuilder out = new StringBuilder();
  private final IdentityHashMap<Value, Integer> valueNumbers = new IdentityHashMap<Value, Integer>();
  private final IdentityHashMap<BasicBlock, Integer> blockNumbers = new IdentityHashMap<BasicBlock, Integer>();

  private IRPrinter() {}

  public static String print(Module m) {
    IRPrinter p = new IRPrinter();
    p.out.append("module @").append(m.getName()).append(" {\n");
    for (FunctionOp f : m.getFunctions()) {
      p.number(f);
    }
    for (FunctionOp f : m.getFunctions()) {
      p.printOperation(f, 1);
    }
    p.out.append("}\n");
    return p.out.toString();
  }

  public static String print(Operation op) {
    IRPrinter p = new IRPrinter();
    p.number(op);
    p.printOperation(op, 0);
    return p.out.toString();
  }

  public static String print(Body body) {
    IRPrinter p = new IRPrinter();
    p.number(body);
    p.printBody(body, 0);
    return p.out.toString();
  }

  //----------------------------------------------------------------------//
  //                         Numbering.                                   //
  //----------------------------------------------------------------------//

  private void number(Operation op) {
    for (Value r : op.getResults()) {
      valueNumbers.put(r, valueNumbers.size());
    }
    for (Body b : op.getBodies()) {
      number(b);
    }
  }

  private void number(Body body) {
    for (BasicBlock b : body.getBlocks()) {
      blockNumbers.put(b, blockNumbers.size());
      for (BlockParameter p : b.getParameters()) {
        valueNumbers.put(p, valueNumbers.size());
      }
      for (Operation op : b.getOperations()) {
        number(op);
      }
      if (b.getTerminator() != null) {
        number(b.getTerminator());
      }
    }
  }

  private String name(Value v) {
    Integer n = valueNumbers.get(v);
    return n == null ? "%<" + v + ">" : "%" + n;
  }

  private String name(BasicBlock b) {
    Integer n = blockNumbers.get(b);
    return n == null ? "^<" + b + ">" : "^bb" + n;
  }

  //----------------------------------------------------------------------//
  //                         Printing.                                    //
  //----------------------------------------------------------------------//

  private void indent(int depth) {
    for (int i = 0; i < depth; i++) {
      out.append("  ");
    }
  }

  private void printBody(Body body, int depth) {
    for (BasicBlock b : body.getBlocks()) {
      indent(depth);
      out.append(name(b));
      if (b.getNumParameters() > 0) {
        out.append('(');
        List<BlockParameter> params = b.getParameters();
        for (int i = 0; i < params.size(); i++) {
          if (i > 0) out.append(", ");
          out.append(name(params.get(i))).append(": ").append(params.get(i).getType());
        }
        out.append(')');
      }
      out.append(":\n");
      for (Operation op : b.getOperations()) {
        printOperation(op, depth + 1);
      }
      if (b.getTerminator() == null) {
        indent(depth + 1);
        out.append("<no terminator>\n");
      } else {
        printOperation(b.getTerminator(), depth + 1);
      }
    }
  }

  private void printValues(List<? extends Value> values) {
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) out.append(", ");
      out.append(name(values.get(i)));
    }
  }

  private void printOperation(Operation op, int depth) {
    indent(depth);
    if (op instanceof FunctionOp) {
      FunctionOp f = (FunctionOp) op;
      out.append(FunctionOp.NAME).append(" @").append(f.getFunctionName())
          .append(f.getArgumentTypes()).append(" -> ").append(f.getFunctionResultTypes()).append(" {\n");
      printBody(f.getFunctionBody(), depth);
      indent(depth);
      out.append("}\n");
      return;
    }
    if (op.getNumResults() > 0) {
      printValues(op.getResults());
      out.append(" = ");
    }
    out.append(op.getName());
    if (op.getNumOperands() > 0) {
      out.append(' ');
      printValues(op.getOperands());
    }
    if (op instanceof Terminator) {
      printSuccessors((Terminator) op);
    }
    if (!op.getAttributes().isEmpty()) {
      out.append(" {");
      boolean first = true;
      for (Map.Entry<String, Object> e : op.getAttributes().entrySet()) {
        if (!first) out.append(", ");
        first = false;
        out.append(e.getKey()).append(" = ").append(e.getValue());
      }
      out.append('}');
    }
    if (op.getNumResults() > 0) {
      out.append(" : ").append(op.getResultTypes());
    }
    if (op.getBodies().isEmpty()) {
      out.append('\n');
      return;
    }
    out.append(" (\n");
    for (Body b : op.getBodies()) {
      indent(depth);
      out.append("{\n");
      printBody(b, depth + 1);
      indent(depth);
      out.append("}\n");
    }
    indent(depth);
    out.append(")\n");
  }

  private void printSuccessors(Terminator t) {
    for (int i = 0; i < t.getNumSuccessors(); i++) {
      out.append(i == 0 ? " " : ", ");
      if (t instanceof SwitchBranch) {
        SwitchBranch s = (SwitchBranch) t;
        out.append(i == 0 ? "default: " : s.getCaseValue(i - 1) + ": ");
      }
      out.append(name(t.getSuccessor(i)));
      List<Value> args = t.getSuccessorArguments(i);
      if (!args.isEmpty()) {
        out.append('(');
        printValues(args);
        out.append(')');
      }
    }
  }
}
