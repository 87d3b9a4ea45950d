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
package org.cflift.driver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.cflift.Lift;
import org.cflift.StructuringException;
import org.cflift.controlflow.CFGStructurer;
import org.cflift.controlflow.DominanceCache;
import org.cflift.controlflow.StructuredControlFlowMaterializer;
import org.cflift.controlflow.StructuringResult;
import org.cflift.ir.Body;
import org.cflift.ir.FunctionOp;
import org.cflift.ir.IRVerifier;
import org.cflift.ir.Module;
import org.cflift.scf.SCFMaterializer;

/**
 * Lifts the control flow graph of every function of a module to
 * structured control flow.  Functions without a body are skipped.
 * <p>
 * A function that cannot be structured keeps its original body.  With
 * {@code failureMode=abort} the failure is rethrown after it has been
 * reported; with {@code failureMode=skip} the remaining functions are
 * still processed.
 */
public final class LiftControlFlowPhase extends CompilerPhase {
  static final boolean DEBUG = false;

  private final LiftOptions options;
  private final StructuredControlFlowMaterializer materializer;

  private boolean changed;
  private final LinkedHashMap<String, StructuringResult> results = new LinkedHashMap<String, StructuringResult>();
  private final ArrayList<String> failed = new ArrayList<String>();
  private int dominanceComputations;

  public LiftControlFlowPhase(LiftOptions options, StructuredControlFlowMaterializer materializer) {
    this.options = options;
    this.materializer = materializer;
  }

  public LiftControlFlowPhase(LiftOptions options) {
    this(options, new SCFMaterializer());
  }

  @Override
  public String getName() {
    return "Lift Control Flow";
  }

  @Override
  public boolean printingEnabled(LiftOptions options, boolean before) {
    return DEBUG;
  }

  @Override
  public void perform(Module module) {
    changed = false;
    results.clear();
    failed.clear();
    dominanceComputations = 0;
    if (options.echoOptions()) {
      options.logAll();
    }
    // a shared cache only pools the counters: every snapshot belongs to a
    // working copy of one function and is invalidated when it is done
    DominanceCache shared = options.reuseRootDominance() ? new DominanceCache() : null;
    for (FunctionOp f : module.getFunctions()) {
      Body body = f.getFunctionBody();
      if (body.isEmpty()) {
        continue;
      }
      DominanceCache cache = shared != null ? shared : new DominanceCache();
      try {
        if (options.verifyIR()) {
          IRVerifier.verify(f);
        }
        StructuringResult result = new CFGStructurer(materializer, cache).perform(body);
        if (options.verifyIR()) {
          IRVerifier.verify(f);
        }
        results.put(f.getFunctionName(), result);
        changed |= result.isChanged();
        if (options.printStructured()) {
          Lift.sysWriteln("Structured @" + f.getFunctionName() + ": " + result);
          Lift.sysWrite(result.getRoot().toString());
        }
      } catch (StructuringException e) {
        e.inContainer("@" + f.getFunctionName());
        Lift.sysWriteln("lift: cannot structure " + e.getMessage());
        if (options.failureMode() != LiftOptions.FAILURE_SKIP) {
          throw e;
        }
        failed.add(f.getFunctionName());
      } finally {
        if (shared == null) {
          dominanceComputations += cache.getComputations();
        }
      }
    }
    if (shared != null) {
      dominanceComputations = shared.getComputations();
    }
  }

  /**
   * @return true if the last run changed any function
   */
  public boolean isChanged() {
    return changed;
  }

  /**
   * @return the outcome per function of the last run, in module order
   */
  public Map<String, StructuringResult> getResults() {
    return Collections.unmodifiableMap(results);
  }

  /**
   * @return the functions the last run had to leave unstructured
   */
  public List<String> getFailed() {
    return Collections.unmodifiableList(failed);
  }

  /**
   * @return how many dominance snapshots the last run computed
   */
  public int getDominanceComputations() {
    return dominanceComputations;
  }
}
