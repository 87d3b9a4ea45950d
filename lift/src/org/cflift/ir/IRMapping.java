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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;

/**
 * Old-to-new map for values and blocks, filled while cloning.
 */
public final class IRMapping {
  private final IdentityHashMap<Value, Value> values = new IdentityHashMap<Value, Value>();
  private final IdentityHashMap<BasicBlock, BasicBlock> blocks = new IdentityHashMap<BasicBlock, BasicBlock>();

  public void map(Value from, Value to) {
    values.put(from, to);
  }

  public void map(BasicBlock from, BasicBlock to) {
    blocks.put(from, to);
  }

  public Value lookupOrNull(Value v) {
    return values.get(v);
  }

  /**
   * @return the mapped value, or v itself for values defined outside the
   * cloned region
   */
  public Value lookupOrDefault(Value v) {
    Value mapped = values.get(v);
    return mapped == null ? v : mapped;
  }

  public List<Value> lookupAll(List<? extends Value> vs) {
    ArrayList<Value> result = new ArrayList<Value>(vs.size());
    for (Value v : vs) {
      result.add(lookupOrDefault(v));
    }
    return result;
  }

  public BasicBlock lookup(BasicBlock b) {
    BasicBlock mapped = blocks.get(b);
    if (mapped == null) {
      throw new IllegalStateException("block " + b + " was not cloned");
    }
    return mapped;
  }
}
