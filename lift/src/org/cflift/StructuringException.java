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
package org.cflift;

/**
 * Use this exception if the structurer encounters a situation it cannot
 * handle.  Throwing it aborts the transformation of the whole container;
 * the container's original body is left exactly as given.
 */
public class StructuringException extends RuntimeException {
  /** Support for exception serialization */
  static final long serialVersionUID = 4325826184624129021L;

  /**
   * Name of the container (function) being structured, if known.
   */
  private String container;

  public StructuringException(String s) {
    super(s);
  }

  public StructuringException(String s, Throwable cause) {
    super(s, cause);
  }

  /**
   * @return the container the failure was reported for, or null
   */
  public String getContainer() {
    return container;
  }

  /**
   * Record which container failed.  Only the first attribution sticks.
   *
   * @param name the container name
   * @return this exception
   */
  public StructuringException inContainer(String name) {
    if (container == null) {
      container = name;
    }
    return this;
  }

  @Override
  public String getMessage() {
    String msg = super.getMessage();
    return container == null ? msg : container + ": " + msg;
  }
}
