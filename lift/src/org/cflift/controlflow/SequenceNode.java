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

/**
 * The contents of one body, in execution order.
 */
public final class SequenceNode extends StructuredNode {
  private final List<StructuredNode> children;

  public SequenceNode(List<StructuredNode> children) {
    this.children = Collections.unmodifiableList(new ArrayList<StructuredNode>(children));
  }

  @Override
  public List<StructuredNode> getChildren() {
    return children;
  }

  @Override
  void dump(StringBuilder sb, int depth) {
    indent(sb, depth);
    sb.append("sequence\n");
    for (StructuredNode c : children) {
      c.dump(sb, depth + 1);
    }
  }
}
