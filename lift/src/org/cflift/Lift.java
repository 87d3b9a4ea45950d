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

import java.io.PrintStream;

/**
 * Process-wide services shared by the lifter: assertion checking and
 * trace output.
 * <p>
 * Code your assertion checks as
 * {@code if (Lift.VerifyAssertions) Lift._assert(xxx);}
 */
public final class Lift {

  /** Are internal consistency checks enabled? */
  public static final boolean VerifyAssertions = true;

  private static PrintStream out = System.err;

  private Lift() {}

  //----------------------------------------------------------------------//
  //                         Assertions.                                  //
  //----------------------------------------------------------------------//

  /**
   * Verify an internal assertion (die w/traceback if assertion fails).
   *
   * @param b the assertion to verify
   */
  public static void _assert(boolean b) {
    _assert(b, null, null);
  }

  /**
   * Verify an internal assertion (die w/message if assertion fails).
   *
   * @param b the assertion to verify
   * @param message the message to print if the assertion is false
   */
  public static void _assert(boolean b, String message) {
    _assert(b, message, null);
  }

  public static void _assert(boolean b, String msg1, String msg2) {
    if (!VerifyAssertions) {
      sysWriteln("lift: somebody forgot to conditionalize their call to assert with");
      sysWriteln("lift: if (Lift.VerifyAssertions)");
      _assertionFailure("lift internal error: assert called when !Lift.VerifyAssertions", null);
    }
    if (!b) _assertionFailure(msg1, msg2);
  }

  private static void _assertionFailure(String msg1, String msg2) {
    if (msg1 == null && msg2 == null) {
      msg1 = "lift internal error at:";
    }
    if (msg2 == null) {
      msg2 = msg1;
      msg1 = null;
    }
    throw new AssertionError((msg1 != null ? msg1 + " " : "") + msg2);
  }

  //----------------------------------------------------------------------//
  //                         Trace output.                                //
  //----------------------------------------------------------------------//

  /**
   * Redirect trace output.
   *
   * @param stream the new destination
   * @return the previous destination
   */
  public static synchronized PrintStream setOutput(PrintStream stream) {
    PrintStream old = out;
    out = stream;
    return old;
  }

  public static synchronized void sysWrite(String s) {
    out.print(s);
  }

  public static synchronized void sysWrite(String s, int i) {
    out.print(s);
    out.print(i);
  }

  public static synchronized void sysWriteln() {
    out.println();
    out.flush();
  }

  public static synchronized void sysWriteln(String s) {
    out.println(s);
    out.flush();
  }

  public static synchronized void sysWriteln(String s, int i) {
    out.print(s);
    out.println(i);
    out.flush();
  }

  public static synchronized void sysWriteln(String s, Object o) {
    out.print(s);
    out.println(o);
    out.flush();
  }
}
