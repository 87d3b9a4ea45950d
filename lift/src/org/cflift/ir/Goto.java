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
 * Unconditional branch.
 */
public final class Goto extends Terminator {
  public static final String NAME = "cf.br";

  public Goto(BasicBlock target, List<Value> args) {
    super(NAME, null, Collections.singletonList(target), Collections.singletonList(args));
  }

  public BasicBlock getTarget() {
    return getSuccessor(0);
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new Goto(mappedSuccessors(mapping).get(0), mappedSuccessorArguments(mapping).get(0));
  }
}
