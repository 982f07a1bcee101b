package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;

// Product: pairs are (base, exponent), overall coefficient is multiplied.
// Exponents may be any expression: x^a*x^b is x^(a+b).
public final class Mul extends ExPairSeq {
  public static final String CLZ = "mul";
  private static final Num ONE = (Num)Ex.ONE._bp;
  static final Mul PROTO = new Mul(new ExPair[0],ONE,true);

  Mul( ExPair[] seq, Num coeff, boolean sorted ) { super(TMUL,seq,coeff,sorted); }

  public static Ex make( Ex a, Ex b ) {
    if( a._bp instanceof Mul x && b._bp instanceof Mul y ) return PROTO.merge(x,y);
    return PROTO.construct(a,b);
  }
  public static Ex make( Ex... es ) { return PROTO.construct(es); }
  public static Ex make( ExPair[] ps, Num coeff ) { return PROTO.construct(ps,coeff); }

  @Override Num neutral() { return ONE; }
  @Override Num combine_overall( Num c0, Num c1 ) { return c0.mul(c1); }

  // b^e becomes (b,e)
  @Override ExPair split( Ex e ) {
    if( e._bp instanceof Power p ) return new ExPair(p._basis,p._exponent);
    return new ExPair(e,Ex.ONE);
  }
  @Override Ex recombine( ExPair p ) { return p._coeff.is_one() ? p._rest : Power.make(p._rest,p._coeff); }
  @Override Ex combine_coeffs( Ex c0, Ex c1 ) { return Add.make(c0,c1); }
  // A numeric base folds in when the exponent is an integer; 2^(1/2) stays a pair
  @Override Num absorb( ExPair p ) {
    if( !(p._rest._bp instanceof Num n) || !(p._coeff._bp instanceof Num e) ) return null;
    Integer i = e.int_value();
    return i==null ? null : n.pow(i);
  }
  // Power.make pushes only integer exponents inside, so (x*y)^(1/2) and
  // (x^2)^(1/2) stay as (x*y,1/2) and (x^2,1/2).
  @Override boolean is_split( ExPair p ) {
    Basic r = p._rest._bp;
    if( !(r instanceof Mul) && !(r instanceof Power) ) return true;
    return !(p._coeff._bp instanceof Num e) || e.int_value()==null;
  }
  @Override ExPairSeq make_raw( ExPair[] seq, Num coeff, boolean sorted ) { return new Mul(seq,coeff,sorted); }

  @Override Ex eval() {
    if( _coeff.is_zero() ) return Ex.ZERO;
    if( _seq.length==0 ) return _coeff.ex();
    if( _seq.length==1 ) {
      ExPair p = _seq[0];
      if( _coeff.is_one() ) return recombine(p);
      // c*(a+b) is c*a+c*b
      if( p._coeff.is_one() && p._rest._bp instanceof Add a ) return a.scale(_coeff);
    }
    return new Ex(set_evaluated());
  }

  // Same factors, unit coefficient
  Ex strip_coeff() { return _coeff.is_one() ? new Ex(this) : new Mul(_seq,ONE,is_sorted()).eval(); }

  // ----------
  @Override public int degree( Symbol s ) {
    int d = 0;
    for( int i=0; i<nops(); i++ ) d += op(i).degree(s);
    return d;
  }
  @Override public int ldegree( Symbol s ) {
    int d = 0;
    for( int i=0; i<nops(); i++ ) d += op(i).ldegree(s);
    return d;
  }
  // n==0: product of every factor's constant part, zero if any factor has s.
  // Otherwise the first factor with a nonzero coefficient is replaced by it.
  @Override public Ex coeff( Ex self, Symbol s, int n ) {
    Ex[] cs = new Ex[nops()];
    if( n==0 ) {
      for( int i=0; i<cs.length; i++ ) cs[i] = op(i).coeff(s,0);
      return make(cs);
    }
    boolean found = false;
    for( int i=0; i<cs.length; i++ ) {
      Ex o = op(i);
      Ex c = found ? Ex.ZERO : o.coeff(s,n);
      if( !c.is_zero() ) { cs[i] = c; found = true; }
      else cs[i] = o;
    }
    return found ? make(cs) : Ex.ZERO;
  }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) {
    for( ExPair p : seq() ) {
      n.add_ex("rest" ,p._rest );
      n.add_ex("coeff",p._coeff);
    }
    n.add_ex("overall_coeff",_coeff.ex());
  }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    return make(unarchive_pairs(n,syms),unarchive_coeff(n,syms));
  }

  @Override SB str( SB sb, int prec ) {
    if( prec > PREC_MUL ) sb.p('(');
    Num c = _coeff;
    if( c.is_negative() ) { sb.p('-'); c = c.neg(); }
    boolean first = true;
    if( !c.is_one() ) { c.str(sb,PREC_MUL); first = false; }
    for( ExPair p : seq() ) {
      if( !first ) sb.p('*');
      if( p._coeff.is_one() ) p._rest._bp.str(sb,PREC_MUL);
      else {
        p._rest ._bp.str(sb,PREC_POW).p('^');
        p._coeff._bp.str(sb,PREC_POW);
      }
      first = false;
    }
    return prec > PREC_MUL ? sb.p(')') : sb;
  }
}
