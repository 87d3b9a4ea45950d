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
 * An ordered collection of functions.
 */
public final class Module {
  private final String name;
  private final ArrayList<FunctionOp> functions = new ArrayList<FunctionOp>();

  public Module(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void addFunction(FunctionOp f) {
    if (lookup(f.getFunctionName()) != null) {
      throw new IllegalArgumentException("duplicate function @" + f.getFunctionName());
    }
    functions.add(f);
  }

  public List<FunctionOp> getFunctions() {
    return Collections.unmodifiableList(functions);
  }

  /**
   * @param functionName the symbol to look for
   * @return the function, or null
   */
  public FunctionOp lookup(String functionName) {
    for (FunctionOp f : functions) {
      if (f.getFunctionName().equals(functionName)) return f;
    }
    return null;
  }
}
