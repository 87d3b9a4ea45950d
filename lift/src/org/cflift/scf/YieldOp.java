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

import org.cflift.ir.BasicBlock;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Terminator;
import org.cflift.ir.Value;

/**
 * {@code scf.yield}: leaves an arm of an {@link IfOp} or {@link IndexSwitchOp},
 * handing values to the construct's results.
 */
public final class YieldOp extends Terminator {
  public static final String NAME = "scf.yield";

  public YieldOp(List<Value> values) {
    super(NAME, values, Collections.<BasicBlock>emptyList(), Collections.<List<Value>>emptyList());
  }

  @Override
  public boolean isReturnLike() {
    return true;
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new YieldOp(mapping.lookupAll(getOperands()));
  }
}
