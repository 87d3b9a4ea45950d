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
 * A set of blocks presented as a region is not single-entry.
 */
public final class MalformedRegionException extends MalformedInputException {
  /** Support for exception serialization */
  static final long serialVersionUID = 7781209365561820934L;

  public MalformedRegionException(String s) {
    super(s);
  }
}
