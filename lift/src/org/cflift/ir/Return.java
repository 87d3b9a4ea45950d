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
 * Function return.
 */
public final class Return extends Terminator {
  public static final String NAME = "func.return";

  public Return(List<Value> values) {
    super(NAME, values, Collections.<BasicBlock>emptyList(), Collections.<List<Value>>emptyList());
  }

  @Override
  public boolean isReturnLike() {
    return true;
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new Return(mapping.lookupAll(getOperands()));
  }
}
