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
 * The materializer cannot turn a branching terminator kind into a
 * structured construct.
 */
public final class UnknownTerminatorException extends UnsupportedConstructException {
  /** Support for exception serialization */
  static final long serialVersionUID = 2160388357917011746L;

  public UnknownTerminatorException(String s) {
    super(s);
  }
}
