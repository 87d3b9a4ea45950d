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
 * Use this exception when the materializer is asked to lift a construct
 * it does not know about.  The message is surfaced verbatim and there is
 * no recovery: the original control flow graph is retained.
 */
public class UnsupportedConstructException extends StructuringException {
  /** Support for exception serialization */
  static final long serialVersionUID = -7215437494493545076L;

  public UnsupportedConstructException(String s) {
    super(s);
  }
}
