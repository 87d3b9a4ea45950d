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

import java.util.Arrays;
import java.util.List;

import org.cflift.ir.Operation;
import org.cflift.ir.Value;

/**
 * Two-way conditional.
 */
public final class IfNode extends StructuredNode {
  private final Operation construct;
  private final Value condition;
  private final StructuredNode thenNode;
  private final StructuredNode elseNode;

  public IfNode(Operation construct, Value condition, StructuredNode thenNode, StructuredNode elseNode) {
    this.construct = construct;
    this.condition = condition;
    this.thenNode = thenNode;
    this.elseNode = elseNode;
  }

  public Operation getConstruct() {
    return construct;
  }

  public Value getCondition() {
    return condition;
  }

  public StructuredNode getThen() {
    return thenNode;
  }

  public StructuredNode getElse() {
    return elseNode;
  }

  @Override
  public List<? extends Value> getOutputs() {
    return construct.getResults();
  }

  @Override
  public List<StructuredNode> getChildren() {
    return Arrays.asList(thenNode, elseNode);
  }

  @Override
  void dump(StringBuilder sb, int depth) {
    indent(sb, depth);
    sb.append("if outputs=").append(getOutputs().size()).append('\n');
    thenNode.dump(sb, depth + 1);
    elseNode.dump(sb, depth + 1);
  }
}
