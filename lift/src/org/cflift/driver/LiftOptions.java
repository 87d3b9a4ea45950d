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
import org.cflift.options.BooleanOption;
import org.cflift.options.EnumOption;
import org.cflift.options.Option;
import org.cflift.options.OptionSet;

/**
 * Options controlling the control flow lifting phase.  Options are set
 * from {@code key=value} strings, where the key is the option name in
 * camel case: {@code failureMode=skip}, {@code verifyIR=false}.
 */
public final class LiftOptions extends OptionSet {

  public static final int FAILURE_ABORT = 0;
  public static final int FAILURE_SKIP = 1;

  private final BooleanOption reuseRootDominance =
      new BooleanOption(this, "Reuse Root Dominance",
                        "Share one dominance cache and its counters across all functions of a module;"
                        + " snapshots are per body, so no function reuses another's", false);

  private final BooleanOption verifyIR =
      new BooleanOption(this, "Verify IR", "Verify each function before and after structuring", true);

  private final BooleanOption printStructured =
      new BooleanOption(this, "Print Structured", "Print the structured node tree of each function", false);

  private final BooleanOption echoOptions =
      new BooleanOption(this, "Echo Options", "Echo when options are set", false) {
        @Override
        protected void validate() {
          setLoggingChanges(getValue());
        }
      };

  private final EnumOption failureMode =
      new EnumOption(this, "Failure Mode", "What to do when a function cannot be structured",
                     new String[]{"abort", "skip"}, "abort");

  public boolean reuseRootDominance() {
    return reuseRootDominance.getValue();
  }

  public boolean verifyIR() {
    return verifyIR.getValue();
  }

  public boolean printStructured() {
    return printStructured.getValue();
  }

  public boolean echoOptions() {
    return echoOptions.getValue();
  }

  public int failureMode() {
    return failureMode.getValue();
  }

  /**
   * Process a list of arguments.
   *
   * @param args arguments of the form {@code key=value}
   * @throws IllegalArgumentException if an argument names no option
   */
  public void processAll(String... args) {
    for (String arg : args) {
      if (!process(arg)) {
        throw new IllegalArgumentException("Unrecognized option '" + arg + "'");
      }
    }
  }

  /**
   * Take a string (most likely a command-line argument) and try to
   * process it as an option command.  Return true if the string was
   * understood, false otherwise.
   *
   * @param arg a String to try to process as an option command
   * @return true if successful, false otherwise
   */
  @Override
  public boolean process(String arg) {
    if (arg.equals("help")) {
      printHelp();
      return true;
    }
    if (arg.equals("printOptions")) {
      logAll();
      return true;
    }
    return super.process(arg);
  }

  /**
   * Print a short description of every option
   */
  public void printHelp() {
    Lift.sysWriteln("Commands");
    Lift.sysWriteln("help\t\t\t\tPrint brief description of arguments");
    Lift.sysWriteln("printOptions\t\t\tPrint the current values of options");
    Lift.sysWriteln();

    Lift.sysWriteln("Boolean Options (<option>=true or <option>=false)");
    Lift.sysWriteln("Option                                 Description");
    Option o = getFirst();
    while (o != null) {
      if (o.getType() == Option.BOOLEAN_OPTION) {
        padded(o.getKey(), 39);
        Lift.sysWriteln(o.getDescription());
      }
      o = o.getNext();
    }

    Lift.sysWriteln("\nSelection Options (set option to one of an enumeration of possible values)");
    o = getFirst();
    while (o != null) {
      if (o.getType() == Option.ENUM_OPTION) {
        padded(o.getKey(), 31);
        Lift.sysWriteln(o.getDescription());
        Lift.sysWrite("    { ");
        boolean first = true;
        for (String val : ((EnumOption)o).getValues()) {
          Lift.sysWrite(first ? "" : ", ");
          Lift.sysWrite(val);
          first = false;
        }
        Lift.sysWriteln(" }");
      }
      o = o.getNext();
    }
  }

  private static void padded(String key, int width) {
    Lift.sysWrite(key);
    for (int c = key.length(); c < width; c++) {
      Lift.sysWrite(" ");
    }
  }

  @Override
  protected String computeKey(String name) {
    StringBuilder key = new StringBuilder(name.length());
    boolean first = true;
    for (String word : name.split(" ")) {
      if (word.isEmpty()) continue;
      key.append(first ? Character.toLowerCase(word.charAt(0)) : word.charAt(0));
      key.append(word, 1, word.length());
      first = false;
    }
    return key.toString();
  }

  @Override
  protected void logString(String s) {
    Lift.sysWrite(s);
  }

  @Override
  protected void logNewLine() {
    Lift.sysWriteln();
  }

  @Override
  protected void warn(Option o, String message) {
    Lift.sysWriteln("WARNING: Option '" + o.getKey() + "' : " + message);
  }

  @Override
  protected void fail(Option o, String message) {
    throw new IllegalArgumentException("Error: Option '" + o.getKey() + "' : " + message);
  }
}
