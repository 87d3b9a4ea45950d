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
import java.util.Collections;
import java.util.List;

/**
 * An ordered list of values that keeps the use lists of its values in
 * sync.  Operations hold one for their operands and terminators hold one
 * per successor for the successor arguments.
 */
final class OperandList {
  private final Operation owner;
  private final ArrayList<Value> values = new ArrayList<Value>();
  private final ArrayList<Use> uses = new ArrayList<Use>();

  OperandList(Operation owner, List<Value> initial) {
    this.owner = owner;
    if (initial != null) {
      for (Value v : initial) {
        add(v);
      }
    }
  }

  Operation getOwner() {
    return owner;
  }

  int size() {
    return values.size();
  }

  Value get(int i) {
    return values.get(i);
  }

  List<Value> asList() {
    return Collections.unmodifiableList(values);
  }

  void add(Value v) {
    if (v == null) {
      throw new IllegalArgumentException("null operand for " + owner.getName());
    }
    Use use = new Use(this, values.size());
    values.add(v);
    uses.add(use);
    v.addUse(use);
  }

  void set(int i, Value v) {
    if (v == null) {
      throw new IllegalArgumentException("null operand for " + owner.getName());
    }
    Value old = values.get(i);
    if (old == v) {
      return;
    }
    Use use = uses.get(i);
    old.removeUse(use);
    values.set(i, v);
    v.addUse(use);
  }

  void clear() {
    for (int i = 0; i < values.size(); i++) {
      values.get(i).removeUse(uses.get(i));
    }
    values.clear();
    uses.clear();
  }

  void setAll(List<Value> newValues) {
    clear();
    for (Value v : newValues) {
      add(v);
    }
  }
}
