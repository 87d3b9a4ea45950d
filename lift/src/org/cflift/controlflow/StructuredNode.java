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

import java.util.Collections;
import java.util.List;

import org.cflift.ir.Value;

/**
 * A node of the tree of structured constructs produced by the
 * {@link CFGStructurer}.
 */
public abstract class StructuredNode {

  /**
   * @return the values this node makes available to the code after it
   */
  public List<? extends Value> getOutputs() {
    return Collections.emptyList();
  }

  public abstract List<StructuredNode> getChildren();

  abstract void dump(StringBuilder sb, int depth);

  static void indent(StringBuilder sb, int depth) {
    for (int i = 0; i < depth; i++) {
      sb.append("  ");
    }
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    dump(sb, 0);
    return sb.toString();
  }
}
