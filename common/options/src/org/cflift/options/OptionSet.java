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
package org.cflift.options;

/**
 * The abstract base class for all option sets.
 * <p>
 * Concrete sets create their options in their constructor and supply
 * the policy for keys, logging, warnings and failures.
 */
public abstract class OptionSet {
  private Option head;
  private Option tail;
  private boolean loggingChanges;

  /**
   * Initialize the option set so that options can be created.
   */
  protected OptionSet() {
    head = null;
    tail = null;
    loggingChanges = false;
  }

  /**
   * Register the option to this set, computing its key in the process.
   *
   * @param o The option to register.
   * @param name The name to derive the key from.
   */
  final String register(Option o, String name) {
    String key = computeKey(name);
    if (getOption(key) != null) {
      throw new IllegalArgumentException("duplicate option key " + key);
    }
    if (tail == null) {
      tail = head = o;
    } else {
      tail.setNext(o);
      tail = o;
    }
    return key;
  }

  /**
   * Look up an option by key.
   *
   * @param key The (unique) option key.
   * @return The option, or null.
   */
  public final Option getOption(String key) {
    for (Option o = getFirst(); o != null; o = o.getNext()) {
      if (o.getKey().equals(key)) {
        return o;
      }
    }
    return null;
  }

  /**
   * Return the first option. This can be used with the getNext method to
   * iterate through the options.
   *
   * @return The first option, or null if no options exist.
   */
  public final Option getFirst() {
    return head;
  }

  /**
   * Process a single {@code key=value} argument.  A bare key sets a
   * boolean option to true.
   *
   * @param arg the argument
   * @return true if the argument named an option of this set
   */
  public boolean process(String arg) {
    int eq = arg.indexOf('=');
    String key = eq < 0 ? arg.trim() : arg.substring(0, eq).trim();
    Option o = getOption(key);
    if (o == null) {
      return false;
    }
    if (eq < 0) {
      if (o.getType() != Option.BOOLEAN_OPTION) {
        fail(o, "missing value");
        return true;
      }
      o.setValueFromString("true");
    } else {
      o.setValueFromString(arg.substring(eq + 1).trim());
    }
    return true;
  }

  /**
   * Start or stop echoing option changes.
   */
  public void setLoggingChanges(boolean value) {
    loggingChanges = value;
  }

  public boolean isLoggingChanges() {
    return loggingChanges;
  }

  /**
   * Log an option change
   * @param o The option that changed
   */
  public void logChange(Option o) {
    if (loggingChanges) {
      logString("Option Update: ");
      log(o);
    }
  }

  /**
   * Log the option value in plain text.
   *
   * @param o The option to log.
   */
  public void log(Option o) {
    logString("Option '");
    logString(o.getKey());
    logString("' = ");
    logString(o.getValueAsString());
    logNewLine();
  }

  /**
   * Log every option of the set.
   */
  public void logAll() {
    for (Option o = getFirst(); o != null; o = o.getNext()) {
      log(o);
    }
  }

  /**
   * Log a string.
   */
  protected abstract void logString(String s);

  /**
   * Print a new line.
   */
  protected abstract void logNewLine();

  /**
   * Determine the key for a given option name. Option names are space
   * delimited with capitalised words (e.g. "Failure Mode").
   *
   * @param name The option name.
   * @return The key.
   */
  protected abstract String computeKey(String name);

  /**
   * A non-fatal error occurred during the setting of an option.
   *
   * @param o The responsible option.
   * @param message The message associated with the warning.
   */
  protected abstract void warn(Option o, String message);

  /**
   * A fatal error occurred during the setting of an option. Implementations
   * must not return normally.
   *
   * @param o The responsible option.
   * @param message The error message associated with the failure.
   */
  protected abstract void fail(Option o, String message);
}
