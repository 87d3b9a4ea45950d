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

import java.util.List;

import org.cflift.ir.Body;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * {@code scf.do_while}: binds the initial values to the parameters of the
 * body's entry and runs the body.  The body ends in a {@link ConditionOp};
 * a non-zero condition runs the body again with the forwarded values,
 * zero ends the loop with them as results.
 */
public final class DoWhileOp extends Operation {
  public static final String NAME = "scf.do_while";

  public DoWhileOp(List<Value> init, List<Type> resultTypes) {
    super(NAME, init, resultTypes);
  }

  public List<Value> getInit() {
    return getOperands();
  }

  public Body getLoopBody() {
    return getBody(0);
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new DoWhileOp(mapping.lookupAll(getOperands()), getResultTypes());
  }
}
