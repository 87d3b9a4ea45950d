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

/**
 * Shape of a region.
 */
public enum RegionKind {
  /** No cycle through the entry; becomes a branch construct or a sequence. */
  ACYCLIC,
  /** A strongly connected set of blocks; becomes a do-while loop. */
  CYCLIC
}
