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
package org.cflift.util;

import static org.junit.Assert.*;

import org.junit.Test;

public class BitVectorTest {

  private static final int SMALL_VECTOR=31;
  private static final int LARGE_VECTOR=130;

  @Test
  public void testSetAll() {
    BitVector vector1 = new BitVector(SMALL_VECTOR);
    vector1.setAll();
    assertEquals(SMALL_VECTOR, vector1.populationCount());
    BitVector vector2 = new BitVector(LARGE_VECTOR);
    vector2.setAll();
    assertEquals(LARGE_VECTOR, vector2.populationCount());
    assertEquals(-1, vector2.nextSetBit(LARGE_VECTOR));
  }

  @Test
  public void testSetAndGet() {
    BitVector vector1 = new BitVector(SMALL_VECTOR);
    vector1.set(3);
    assertTrue(vector1.get(3));
    assertFalse(vector1.get(4));
    BitVector vector2 = new BitVector(LARGE_VECTOR);
    vector2.set(129);
    assertTrue(vector2.get(129));
    assertFalse(vector2.get(65));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void testSetOutOfRange() {
    new BitVector(SMALL_VECTOR).set(SMALL_VECTOR);
  }

  @Test
  public void testClearAll() {
    BitVector vector1 = new BitVector(LARGE_VECTOR);
    vector1.set(3);
    vector1.set(100);
    vector1.clearAll();
    assertTrue(vector1.isZero());
  }

  @Test
  public void testClear() {
    BitVector vector1 = new BitVector(SMALL_VECTOR);
    vector1.set(3);
    vector1.clear(3);
    assertTrue(vector1.isZero());
    BitVector vector2 = new BitVector(LARGE_VECTOR);
    vector2.set(70);
    vector2.clear(70);
    assertTrue(vector2.isZero());
  }

  @Test
  public void testAndReportsChange() {
    BitVector vector1 = new BitVector(LARGE_VECTOR);
    BitVector vector2 = new BitVector(LARGE_VECTOR);
    vector1.set(1);
    vector1.set(90);
    vector2.set(90);
    assertTrue(vector1.and(vector2));
    assertEquals(vector2, vector1);
    assertFalse(vector1.and(vector2));
  }

  @Test
  public void testOrReportsChange() {
    BitVector vector1 = new BitVector(LARGE_VECTOR);
    BitVector vector2 = new BitVector(LARGE_VECTOR);
    vector2.set(64);
    assertTrue(vector1.or(vector2));
    assertTrue(vector1.get(64));
    assertFalse(vector1.or(vector2));
  }

  @Test
  public void testNextSetBit() {
    BitVector vector1 = new BitVector(LARGE_VECTOR);
    vector1.set(5);
    vector1.set(64);
    vector1.set(128);
    assertEquals(5, vector1.nextSetBit(0));
    assertEquals(64, vector1.nextSetBit(6));
    assertEquals(128, vector1.nextSetBit(65));
    assertEquals(-1, vector1.nextSetBit(129));
  }

  @Test
  public void testDupIsIndependent() {
    BitVector vector1 = new BitVector(SMALL_VECTOR);
    vector1.set(2);
    BitVector vector2 = vector1.dup();
    assertEquals(vector1, vector2);
    assertEquals(vector1.hashCode(), vector2.hashCode());
    vector2.set(7);
    assertFalse(vector1.get(7));
  }

  @Test
  public void testToString() {
    BitVector vector1 = new BitVector(SMALL_VECTOR);
    vector1.set(0);
    vector1.set(3);
    assertEquals("{0, 3}", vector1.toString());
    assertEquals("{}", new BitVector(SMALL_VECTOR).toString());
  }
}
