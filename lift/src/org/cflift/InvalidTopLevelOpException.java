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
 * The operation enclosing a body is not a container kind the materializer
 * knows how to terminate.
 */
public final class InvalidTopLevelOpException extends UnsupportedConstructException {
  /** Support for exception serialization */
  static final long serialVersionUID = -5731701797088209175L;

  public InvalidTopLevelOpException(String s) {
    super(s);
  }
}
