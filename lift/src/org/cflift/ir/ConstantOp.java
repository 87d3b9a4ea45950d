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

/**
 * An integer constant.
 */
public final class ConstantOp extends Operation {
  public static final String NAME = "arith.constant";

  private final long value;

  public ConstantOp(Type type, long value) {
    super(NAME, null, Collections.singletonList(type));
    this.value = value;
    setAttribute("value", value);
  }

  public long getValue() {
    return value;
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new ConstantOp(getResult(0).getType(), value);
  }
}
