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
 * The abstract base class for all options.
 * <p>
 * All options within a set should have a unique name. No two options
 * shall have a name that is the same when a case insensitive comparison
 * between the names with spaces removed is performed. Only basic
 * alphanumeric characters and spaces are allowed.
 * <p>
 * The option set maps each name to a key, e.g. "Failure Mode" to
 * {@code failureMode}; keys are what {@link OptionSet#process} accepts.
 */
public abstract class Option {
  // Option types
  public static final int BOOLEAN_OPTION = 1;
  public static final int ENUM_OPTION = 3;

  // Per option values
  private final int type;
  private final String name;
  private final String description;
  private final String key;
  private Option next;

  protected final OptionSet set;

  /**
   * Construct a new option and link it onto the option list of its set.
   *
   * @param set The option set this option belongs to.
   * @param type The option type as defined in this class.
   * @param name The unique name of the option.
   * @param description A short description of the option and purpose.
   */
  protected Option(OptionSet set, int type, String name, String description) {
    this.type = type;
    this.name = name;
    this.description = description;
    this.set = set;
    this.key = set.register(this, name);
  }

  /**
   * Return the key for an option
   *
   * @return The key.
   */
  public String getKey() {
    return this.key;
  }

  /**
   * Update the next pointer in the Option chain.
   */
  void setNext(Option o) {
    next = o;
  }

  /**
   * Return the next option in the linked list.
   *
   * @return The next option or null if this is the last option.
   */
  public Option getNext() {
    return this.next;
  }

  public String getName() {
    return this.name;
  }

  public String getDescription() {
    return this.description;
  }

  public int getType() {
    return this.type;
  }

  /**
   * Set the option from its textual form.
   *
   * @param value the text after the '=' of a command line argument
   */
  protected abstract void setValueFromString(String value);

  /**
   * @return the current value in the form accepted by {@link #setValueFromString}
   */
  public abstract String getValueAsString();

  /**
   * This is a validation method that can be implemented by leaf option
   * classes to provide additional validation. The validate method works
   * against the current value of the option (post-set).
   */
  protected void validate() {}

  /**
   * A fatal error occurred during the setting of an option.  The set
   * decides how to stop.
   *
   * @param message The error message associated with the failure.
   */
  protected void fail(String message) {
    set.fail(this, message);
  }

  /**
   * A non-fatal error occurred during the setting of an option.
   *
   * @param message The message associated with the warning.
   */
  protected void warn(String message) {
    set.warn(this, message);
  }
}
