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

import java.util.Arrays;

/**
 * A fixed-size set of small non-negative integers, used for the
 * dominator sets of blocks numbered densely from zero.
 */
public final class BitVector {
  private static final int LOG_BITS_PER_UNIT = 6;
  private static final int LOW_MASK = 0x3f;
  private final long[] bits;
  private final int nbits;

  /**
   * Convert bitIndex to a subscript into the bits[] array.
   */
  private static int subscript(int bitIndex) {
    return bitIndex >> LOG_BITS_PER_UNIT;
  }

  /**
   * Creates an empty set able to hold {@code 0 .. nbits-1}.
   * @param nbits the size of the set
   */
  public BitVector(int nbits) {
    bits = new long[subscript(nbits + LOW_MASK)];
    this.nbits = nbits;
  }

  /**
   * Creates a copy of a set.
   * @param s the set to copy
   */
  public BitVector(BitVector s) {
    bits = s.bits.clone();
    nbits = s.nbits;
  }

  public int size() {
    return nbits;
  }

  /**
   * Sets every bit below {@link #size()}.
   */
  public void setAll() {
    Arrays.fill(bits, -1L);
    int tail = nbits & LOW_MASK;
    if (tail != 0) {
      bits[bits.length - 1] = (1L << tail) - 1;
    }
  }

  public void set(int bit) {
    checkIndex(bit);
    bits[subscript(bit)] |= 1L << (bit & LOW_MASK);
  }

  public void clear(int bit) {
    checkIndex(bit);
    bits[subscript(bit)] &= ~(1L << (bit & LOW_MASK));
  }

  public void clearAll() {
    Arrays.fill(bits, 0L);
  }

  public boolean get(int bit) {
    checkIndex(bit);
    return (bits[subscript(bit)] & (1L << (bit & LOW_MASK))) != 0;
  }

  private void checkIndex(int bit) {
    if (bit < 0 || bit >= nbits) {
      throw new IndexOutOfBoundsException("bit " + bit + " of " + nbits);
    }
  }

  /**
   * Intersect this set with another of the same size.
   * @param set the set to AND with
   * @return whether this set changed
   */
  public boolean and(BitVector set) {
    if (this == set) {
      return false;
    }
    boolean changed = false;
    for (int i = bits.length; i-- > 0;) {
      long v = bits[i] & set.bits[i];
      if (v != bits[i]) {
        bits[i] = v;
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Union this set with another of the same size.
   * @param set the set to OR with
   * @return whether this set changed
   */
  public boolean or(BitVector set) {
    if (this == set) {
      return false;
    }
    boolean changed = false;
    for (int i = bits.length; i-- > 0;) {
      long v = bits[i] | set.bits[i];
      if (v != bits[i]) {
        bits[i] = v;
        changed = true;
      }
    }
    return changed;
  }

  public boolean isZero() {
    for (long w : bits) {
      if (w != 0) return false;
    }
    return true;
  }

  /**
   * How many bits are set?
   */
  public int populationCount() {
    int count = 0;
    for (long w : bits) {
      count += Long.bitCount(w);
    }
    return count;
  }

  /**
   * @param from the first index to examine
   * @return the index of the first set bit at or after from, or -1
   */
  public int nextSetBit(int from) {
    if (from >= nbits) return -1;
    int u = subscript(from);
    long word = bits[u] & (-1L << (from & LOW_MASK));
    while (true) {
      if (word != 0) {
        return (u << LOG_BITS_PER_UNIT) + Long.numberOfTrailingZeros(word);
      }
      if (++u == bits.length) return -1;
      word = bits[u];
    }
  }

  public BitVector dup() {
    return new BitVector(this);
  }

  @Override
  public int hashCode() {
    return 31 * nbits + Arrays.hashCode(bits);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) return true;
    if (!(obj instanceof BitVector)) return false;
    BitVector other = (BitVector) obj;
    return nbits == other.nbits && Arrays.equals(bits, other.bits);
  }

  @Override
  public String toString() {
    StringBuilder buffer = new StringBuilder();
    buffer.append('{');
    for (int i = nextSetBit(0); i >= 0; i = nextSetBit(i + 1)) {
      if (buffer.length() > 1) {
        buffer.append(", ");
      }
      buffer.append(i);
    }
    buffer.append('}');
    return buffer.toString();
  }
}
