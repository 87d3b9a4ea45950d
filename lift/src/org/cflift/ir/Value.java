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
 * An SSA value.  Every value is either a block parameter or the result of
 * an operation, and knows all of its uses.
 */
public abstract class Value {
  private final Type type;
  private final ArrayList<Use> uses = new ArrayList<Use>();

  protected Value(Type type) {
    if (type == null) {
      throw new IllegalArgumentException("value without a type");
    }
    this.type = type;
  }

  public final Type getType() {
    return type;
  }

  /**
   * @return the block whose top level defines this value
   */
  public abstract BasicBlock getDefiningBlock();

  public final List<Use> getUses() {
    return Collections.unmodifiableList(uses);
  }

  public final boolean hasUses() {
    return !uses.isEmpty();
  }

  void addUse(Use use) {
    uses.add(use);
  }

  void removeUse(Use use) {
    for (int i = uses.size() - 1; i >= 0; i--) {
      if (uses.get(i) == use) {
        uses.remove(i);
        return;
      }
    }
  }

  /**
   * Replace every use of this value with another value.
   *
   * @param other the replacement
   */
  public final void replaceAllUsesWith(Value other) {
    if (other == this) {
      return;
    }
    for (Use use : new ArrayList<Use>(uses)) {
      use.set(other);
    }
  }

  /**
   * Replace the uses accepted by a filter.
   *
   * @param other the replacement
   * @param filter decides, per use, whether to replace it
   */
  public final void replaceUsesWithIf(Value other, UseFilter filter) {
    if (other == this) {
      return;
    }
    for (Use use : new ArrayList<Use>(uses)) {
      if (filter.accept(use)) {
        use.set(other);
      }
    }
  }
}
