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
package org.cflift.ir;

import java.util.HashMap;

/**
 * An interned, named value type.  The structurer never looks inside a
 * type; it only copies types from block parameters onto the values it
 * synthesizes.
 */
public final class Type {
  private static final HashMap<String, Type> types = new HashMap<String, Type>();

  public static final Type I1 = get("i1");
  public static final Type I32 = get("i32");
  public static final Type I64 = get("i64");
  public static final Type INDEX = get("index");
  public static final Type F64 = get("f64");

  private final String name;

  private Type(String name) {
    this.name = name;
  }

  /**
   * Find or create the type with the given name.
   *
   * @param name the type name, e.g. {@code "i32"}
   * @return the unique type object for that name
   */
  public static synchronized Type get(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("type name must not be empty");
    }
    Type t = types.get(name);
    if (t == null) {
      t = new Type(name);
      types.put(name, t);
    }
    return t;
  }

  public String getName() {
    return name;
  }

  @Override
  public String toString() {
    return name;
  }
}
