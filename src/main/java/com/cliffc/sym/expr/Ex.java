package com.cliffc.sym.expr;

import java.util.Map;

/**
 * Handle to one shared expression node.
 * <p>
 * Handles are immutable values; many handles (and many parent nodes) may
 * point at the same {@link Basic}.  The default handle is canonical zero.
 * Equality and ordering short-circuit when both handles point at the same
 * node instance, so comparing deeply shared expressions stays cheap.
 * <p>
 * Not thread-safe beyond what immutability gives: the node caches (hash,
 * flags) are benign races.
 */
public final class Ex implements Comparable<Ex> {
  public static final Ex ZERO      = Num.make(0);
  public static final Ex ONE       = Num.make(1);
  public static final Ex TWO       = Num.make(2);
  public static final Ex MINUS_ONE = Num.make(-1);
  public static final Ex HALF      = Num.make(1,2);

  public final Basic _bp;

  public Ex() { this(ZERO._bp); }
  public Ex( Basic bp ) {
    assert bp != null;
    _bp = bp;
  }

  public static Ex of( long l ) { return Num.make(l); }
  public static Ex of( long num, long den ) { return Num.make(num,den); }

  // ----------
  // Arithmetic.  All results are in canonical form.
  public Ex add( Ex e ) { return Add.make(this,e); }
  public Ex sub( Ex e ) { return Add.make(this,e.neg()); }
  public Ex mul( Ex e ) { return Mul.make(this,e); }
  public Ex div( Ex e ) { return Mul.make(this,Power.make(e,MINUS_ONE)); }
  public Ex neg(      ) { return Mul.make(this,MINUS_ONE); }
  public Ex pow( Ex e ) { return Power.make(this,e); }
  public Ex pow( long l ) { return Power.make(this,of(l)); }
  public Ex add( long l ) { return add(of(l)); }
  public Ex mul( long l ) { return mul(of(l)); }

  // ----------
  // Structural equality & order
  public boolean is_equal( Ex e ) { return _bp==e._bp || _bp.is_equal(e._bp); }
  public int compare( Ex e ) { return _bp==e._bp ? 0 : _bp.compare(e._bp); }
  @Override public int compareTo( Ex e ) { return compare(e); }
  @Override public boolean equals( Object o ) { return o instanceof Ex e && is_equal(e); }
  @Override public int hashCode() { return _bp.gethash(); }
  public int gethash() { return _bp.gethash(); }

  // ----------
  // Kind tests
  public boolean is_num   () { return _bp._tag==Basic.TNUM; }
  public boolean is_symbol() { return _bp._tag==Basic.TSYMBOL; }
  public boolean is_add   () { return _bp._tag==Basic.TADD; }
  public boolean is_mul   () { return _bp._tag==Basic.TMUL; }
  public boolean is_power () { return _bp._tag==Basic.TPOWER; }
  public boolean is_zero  () { return _bp instanceof Num n && n.is_zero(); }
  public boolean is_one   () { return _bp instanceof Num n && n.is_one (); }
  public boolean is_integer() { return _bp instanceof Num n && n.is_integer(); }
  public Num num() { return (Num)_bp; }

  // ----------
  // Children
  public int nops() { return _bp.nops(); }
  public Ex op( int i ) { return _bp.op(i); }
  public Ex map( java.util.function.UnaryOperator<Ex> f ) { return _bp.map(this,f); }

  // True if 'e' occurs anywhere in this expression, including at the root
  public boolean has( Ex e ) {
    if( is_equal(e) ) return true;
    for( int i=0; i<nops(); i++ )
      if( op(i).has(e) )
        return true;
    return false;
  }

  // Replace every occurrence of 'from' by 'to', re-canonicalizing as we go
  public Ex subs( Ex from, Ex to ) {
    if( is_equal(from) ) return to;
    return map(e -> e.subs(from,to));
  }
  // Simultaneous replacement; keys are matched structurally
  public Ex subs( Map<Ex,Ex> m ) {
    Ex to = m.get(this);
    if( to!=null ) return to;
    return map(e -> e.subs(m));
  }

  public int degree ( Symbol s ) { return _bp.degree (s); }
  public int ldegree( Symbol s ) { return _bp.ldegree(s); }
  public Ex coeff( Symbol s, int n ) { return _bp.coeff(this,s,n); }
  public Ex coeff( Symbol s ) { return coeff(s,1); }

  @Override public String toString() { return _bp.toString(); }
}
