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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.cflift.ir.Body;
import org.cflift.ir.IRMapping;
import org.cflift.ir.Operation;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * {@code scf.index_switch}: body 0 is the default, body {@code i + 1}
 * runs when the selector equals case value {@code i}.
 */
public final class IndexSwitchOp extends Operation {
  public static final String NAME = "scf.index_switch";

  private final int[] caseValues;

  public IndexSwitchOp(Value selector, int[] caseValues, List<Type> resultTypes) {
    super(NAME, Collections.singletonList(selector), resultTypes);
    this.caseValues = caseValues.clone();
    setAttribute("cases", Arrays.toString(caseValues));
  }

  public Value getSelector() {
    return getOperand(0);
  }

  public int getNumCases() {
    return caseValues.length;
  }

  public int getCaseValue(int i) {
    return caseValues[i];
  }

  public Body getDefaultBody() {
    return getBody(0);
  }

  public Body getCaseBody(int i) {
    return getBody(i + 1);
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new IndexSwitchOp(mapping.lookupOrDefault(getSelector()), caseValues, getResultTypes());
  }
}
