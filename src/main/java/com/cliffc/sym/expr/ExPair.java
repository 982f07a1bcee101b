package com.cliffc.sym.expr;

import com.cliffc.sym.util.Util;

// One term of a sum (rest * coeff) or one factor of a product (rest ^ coeff).
public final class ExPair {
  public final Ex _rest, _coeff;
  public ExPair( Ex rest, Ex coeff ) { _rest=rest; _coeff=coeff; }

  // A numeric rest survives in a sequence only when it cannot be folded into
  // the overall coefficient, e.g. 2^(1/2).  Those sort after everything else.
  public boolean is_numeric() { return _rest.is_num(); }

  // Pair order: numeric rests last, then by rest.  Used to sort and merge,
  // so equal rests compare equal regardless of their coefficients.
  public int compare_rest( ExPair p ) {
    boolean n0 = is_numeric(), n1 = p.is_numeric();
    if( n0 != n1 ) return n0 ? 1 : -1;
    return _rest.compare(p._rest);
  }
  // Full order, coefficient breaks ties
  public int compare( ExPair p ) {
    int c = compare_rest(p);
    return c!=0 ? c : _coeff.compare(p._coeff);
  }
  public boolean is_equal( ExPair p ) { return _rest.is_equal(p._rest) && _coeff.is_equal(p._coeff); }
  public int gethash() { return Util.mix_hash(_rest.gethash(),_coeff.gethash()); }

  @Override public String toString() { return "("+_rest+","+_coeff+")"; }
}
