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
package org.cflift.controlflow;

import java.util.Collections;
import java.util.List;

import org.cflift.ir.BasicBlock;
import org.cflift.ir.Body;
import org.cflift.ir.IRBuilder;
import org.cflift.ir.Operation;
import org.cflift.ir.Terminator;
import org.cflift.ir.Type;
import org.cflift.ir.Value;

/**
 * Builds the structured constructs of a target dialect on behalf of the
 * {@link CFGStructurer}.  The structurer decides where constructs go and
 * what flows through them; implementations decide what they look like.
 * <p>
 * Every method inserts at the builder's insertion point.  Implementations
 * report constructs they cannot build by throwing a subclass of
 * {@link org.cflift.UnsupportedConstructException}.
 * <p>
 * The structured node tree reads two things back from the constructs:
 * the selector of a branch construct is its first operand, and the
 * initial values of a loop are its operands.
 */
public interface StructuredControlFlowMaterializer {

  /**
   * Replace a multi-way branch by a construct that runs exactly one of the
   * given bodies.
   *
   * @param builder positioned at the end of the block that held branch
   * @param branch the detached branch; body {@code i} corresponds to its
   *        successor {@code i}
   * @param resultTypes the types of the values each body yields
   * @param bodies the bodies, to be adopted by the construct
   * @return the construct, with one result per result type
   * @throws org.cflift.UnknownTerminatorException if branch is of a kind
   *         this materializer cannot lift
   */
  Operation createStructuredBranchRegion(IRBuilder builder, Terminator branch, List<Type> resultTypes,
                                         List<Body> bodies);

  /**
   * Terminate one body of a branch construct, handing values to the
   * construct's results.
   *
   * @param builder positioned at the end of a block without terminator
   * @param construct the construct returned by {@link #createStructuredBranchRegion}
   * @param results one value per result of the construct
   */
  void createBranchRegionTerminator(IRBuilder builder, Operation construct, List<Value> results);

  /**
   * Build a loop that runs body at least once and again as long as
   * condition is non-zero.  The implementation terminates the last block
   * of body, which has no terminator yet; the terminator's first operand is
   * the condition.
   *
   * @param builder where the loop goes
   * @param init values bound to the parameters of body's entry on the first
   *        iteration
   * @param condition an {@code i32} value available in body's last block
   * @param next values bound to the entry parameters on the next
   *        iteration, which become the loop results on exit
   * @param body the loop body, to be adopted by the loop
   * @return the loop construct
   */
  Operation createDoWhileLoop(IRBuilder builder, List<Value> init, Value condition, List<Value> next, Body body);

  /**
   * @return an {@code i32} value usable as a dispatch flag
   */
  Value getSwitchValue(IRBuilder builder, int value);

  /**
   * Terminate a block with a multi-way branch on a dispatch flag.
   */
  void createSwitch(IRBuilder builder, Value flag, int[] caseValues, List<BasicBlock> caseDestinations,
                    List<List<Value>> caseArguments, BasicBlock defaultDestination, List<Value> defaultArguments);

  /**
   * @return a value of the given type whose contents do not matter
   */
  Value getUndefValue(IRBuilder builder, Type type);

  /**
   * Terminate a block in a way that leaves body, for a point the program
   * never reaches.  The values passed out are don't-cares.
   *
   * @param builder positioned at the end of a block of body
   * @param body the body; its parent operation decides the terminator
   * @throws org.cflift.InvalidTopLevelOpException if the parent is of an
   *         unknown kind
   * @throws org.cflift.UnsupportedUnreachableException if the body has no parent
   */
  void createUnreachableTerminator(IRBuilder builder, Body body);

  /**
   * Terminate a block with an unconditional branch.  Unless overridden this
   * is a switch with only a default destination.
   */
  default void createSingleDestinationBranch(IRBuilder builder, BasicBlock destination, List<Value> arguments) {
    createSwitch(builder, getSwitchValue(builder, 0), new int[0], Collections.<BasicBlock>emptyList(),
                 Collections.<List<Value>>emptyList(), destination, arguments);
  }
}
