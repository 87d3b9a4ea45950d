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
 * A precondition documented for callers of the structurer was violated,
 * e.g. a block without a terminator or a branch leaving its body.
 * Not retried.
 */
public class MalformedInputException extends StructuringException {
  /** Support for exception serialization */
  static final long serialVersionUID = -1982756602113742510L;

  public MalformedInputException(String s) {
    super(s);
  }
}
