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

import org.cflift.Lift;
import org.cflift.ir.IRPrinter;
import org.cflift.ir.Module;

/**
 * A transformation applied to a whole module.
 */
public abstract class CompilerPhase {

  /**
   * @return a String which is the name of the phase.
   */
  public abstract String getName();

  /**
   * This method determines if the phase should be run, based on the
   * options.  Phases that are always performed keep the default.
   *
   * @param options controlling options
   * @return true if the phase should be performed
   */
  public boolean shouldPerform(LiftOptions options) {
    return true;
  }

  /**
   * Should the IR be printed before and/or after this phase?
   *
   * @param options controlling options
   * @param before query control
   * @return true or false.
   */
  public boolean printingEnabled(LiftOptions options, boolean before) {
    return false;
  }

  /**
   * Main driver.
   *
   * @param module the module to transform
   */
  public abstract void perform(Module module);

  /**
   * Run the phase if the options ask for it, dumping the module around
   * it as requested.
   *
   * @param module the module to transform
   * @param options controlling options
   */
  public final void performPhase(Module module, LiftOptions options) {
    if (!shouldPerform(options)) {
      return;
    }
    if (printingEnabled(options, true)) {
      dumpIR(module, "Before " + getName());
    }
    perform(module);
    if (printingEnabled(options, false)) {
      dumpIR(module, "After " + getName());
    }
  }

  public static void dumpIR(Module module, String tag) {
    Lift.sysWriteln("********* START OF IR DUMP  " + tag + " FOR @" + module.getName());
    Lift.sysWrite(IRPrinter.print(module));
    Lift.sysWriteln("*********   END OF IR DUMP  " + tag + " FOR @" + module.getName());
  }
}
