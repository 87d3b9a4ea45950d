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

import java.util.Collections;
import java.util.List;

/**
 * Marks a point control never reaches (a trap, a call that does not
 * return).  It has no successors and does not leave its body.
 */
public final class Unreachable extends Terminator {
  public static final String NAME = "ub.unreachable";

  public Unreachable() {
    super(NAME, null, Collections.<BasicBlock>emptyList(), Collections.<List<Value>>emptyList());
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new Unreachable();
  }
}
