package com.cliffc.sym;

/** a symbolic expression kernel
 */

public abstract class Sym {
  // Re-verify canonical form after every Add/Mul construction.  Expensive;
  // on when assertions are on unless overridden.
  public static boolean CHECK_CANONICAL = SymProperties.checkCanonical();

  // assert Sym.once_per() || ...expensive;
  private static int ASSERT_CNT;
  public static boolean once_per() { return once_per(8); }
  public static boolean once_per(int log) {
    return (ASSERT_CNT++ & ((1L<<log)-1))!=0;
  }
}
