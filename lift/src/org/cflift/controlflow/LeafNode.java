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
import java.util.Collections;
import java.util.List;

import org.cflift.ir.Operation;

/**
 * A run of operations executed in order.
 */
public final class LeafNode extends StructuredNode {
  private final List<Operation> operations;

  public LeafNode(List<Operation> operations) {
    this.operations = Collections.unmodifiableList(new ArrayList<Operation>(operations));
  }

  public List<Operation> getOperations() {
    return operations;
  }

  @Override
  public List<StructuredNode> getChildren() {
    return Collections.emptyList();
  }

  @Override
  void dump(StringBuilder sb, int depth) {
    indent(sb, depth);
    sb.append("leaf ").append(operations).append('\n');
  }
}
