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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cflift.ir.Operation;
import org.cflift.ir.Value;

/**
 * Multi-way dispatch on an integer selector.
 */
public final class SwitchNode extends StructuredNode {
  private final Operation construct;
  private final Value selector;
  private final int[] caseValues;
  private final List<StructuredNode> cases;
  private final StructuredNode defaultNode;

  public SwitchNode(Operation construct, Value selector, int[] caseValues, List<StructuredNode> cases,
                    StructuredNode defaultNode) {
    this.construct = construct;
    this.selector = selector;
    this.caseValues = caseValues.clone();
    this.cases = Collections.unmodifiableList(new ArrayList<StructuredNode>(cases));
    this.defaultNode = defaultNode;
  }

  public Operation getConstruct() {
    return construct;
  }

  public Value getSelector() {
    return selector;
  }

  public int[] getCaseValues() {
    return caseValues.clone();
  }

  public List<StructuredNode> getCases() {
    return cases;
  }

  public StructuredNode getDefault() {
    return defaultNode;
  }

  @Override
  public List<? extends Value> getOutputs() {
    return construct.getResults();
  }

  @Override
  public List<StructuredNode> getChildren() {
    ArrayList<StructuredNode> all = new ArrayList<StructuredNode>(cases.size() + 1);
    all.add(defaultNode);
    all.addAll(cases);
    return all;
  }

  @Override
  void dump(StringBuilder sb, int depth) {
    indent(sb, depth);
    sb.append("switch cases=").append(Arrays.toString(caseValues))
        .append(" outputs=").append(getOutputs().size()).append('\n');
    defaultNode.dump(sb, depth + 1);
    for (StructuredNode c : cases) {
      c.dump(sb, depth + 1);
    }
  }
}
