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
package org.cflift.scf;

import java.util.Collections;

import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Type;

/**
 * {@code ub.poison}: a value of the given type whose contents must not be
 * observed.
 */
public final class PoisonOp extends Operation {
  public static final String NAME = "ub.poison";

  public PoisonOp(Type type) {
    super(NAME, null, Collections.singletonList(type));
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new PoisonOp(getResult(0).getType());
  }
}
