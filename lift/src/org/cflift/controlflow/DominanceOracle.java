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
package org.cflift.controlflow;

import org.cflift.ir.Body;

/**
 * Supplies dominance facts for a body.
 */
public interface DominanceOracle {

  /**
   * Compute dominance for the current state of a body.
   *
   * @param body a body with an entry block
   * @return an immutable snapshot; it goes stale when the body changes
   */
  DominanceInfo compute(Body body);
}
