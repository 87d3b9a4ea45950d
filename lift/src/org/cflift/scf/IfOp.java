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
import java.util.List;

import org.cflift.ir.Body;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * {@code scf.if}: runs the then body when the {@code i1} condition holds,
 * the else body otherwise.  Both bodies end in {@link YieldOp}.
 */
public final class IfOp extends Operation {
  public static final String NAME = "scf.if";

  public IfOp(Value condition, List<Type> resultTypes) {
    super(NAME, Collections.singletonList(condition), resultTypes);
  }

  public Value getCondition() {
    return getOperand(0);
  }

  public Body getThenBody() {
    return getBody(0);
  }

  public Body getElseBody() {
    return getBody(1);
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new IfOp(mapping.lookupOrDefault(getCondition()), getResultTypes());
  }
}
