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
 * An unreachable terminator was requested for a body whose result arity
 * cannot be synthesized.
 */
public final class UnsupportedUnreachableException extends UnsupportedConstructException {
  /** Support for exception serialization */
  static final long serialVersionUID = 3389514102648723357L;

  public UnsupportedUnreachableException(String s) {
    super(s);
  }
}
