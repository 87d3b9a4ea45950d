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
 * A function: a named container with one body whose entry block
 * parameters are the function arguments.  Its body is left by
 * {@link Return} terminators carrying one value per result type.
 */
public final class FunctionOp extends Operation {
  public static final String NAME = "func.func";

  private final String functionName;
  private final List<Type> argumentTypes;
  private final List<Type> functionResultTypes;

  /**
   * Create a function with an entry block holding one parameter per
   * argument type.
   */
  public FunctionOp(String functionName, List<Type> argumentTypes, List<Type> resultTypes) {
    this(functionName, argumentTypes, resultTypes, true);
  }

  private FunctionOp(String functionName, List<Type> argumentTypes, List<Type> resultTypes, boolean withBody) {
    super(NAME, null, null);
    this.functionName = functionName;
    this.argumentTypes = Collections.unmodifiableList(new ArrayList<Type>(argumentTypes));
    this.functionResultTypes = Collections.unmodifiableList(new ArrayList<Type>(resultTypes));
    setAttribute("sym_name", functionName);
    if (withBody) {
      Body body = new Body();
      BasicBlock entry = new BasicBlock("entry");
      entry.addParameters(argumentTypes);
      body.addBlock(entry);
      addBody(body);
    }
  }

  /**
   * Create an external declaration: a function whose body has no blocks.
   */
  public static FunctionOp declaration(String functionName, List<Type> argumentTypes, List<Type> resultTypes) {
    FunctionOp f = new FunctionOp(functionName, argumentTypes, resultTypes, false);
    f.addBody(new Body());
    return f;
  }

  public String getFunctionName() {
    return functionName;
  }

  public List<Type> getArgumentTypes() {
    return argumentTypes;
  }

  public List<Type> getFunctionResultTypes() {
    return functionResultTypes;
  }

  public Body getFunctionBody() {
    return getBody(0);
  }

  public BasicBlock getEntryBlock() {
    return getFunctionBody().getEntry();
  }

  public List<BlockParameter> getArguments() {
    BasicBlock entry = getEntryBlock();
    if (entry == null) {
      return Collections.emptyList();
    }
    return entry.getParameters();
  }

  @Override
  protected Operation createCopy(IRMapping mapping) {
    return new FunctionOp(functionName, argumentTypes, functionResultTypes, false);
  }

  @Override
  public String toString() {
    return "@" + functionName;
  }
}
