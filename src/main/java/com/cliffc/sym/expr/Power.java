package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;

import java.util.function.UnaryOperator;

// basis ^ exponent
public final class Power extends Basic {
  public static final String CLZ = "power";

  public final Ex _basis, _exponent;

  private Power( Ex basis, Ex exponent ) {
    super(TPOWER);
    _basis = basis;
    _exponent = exponent;
  }

  // Canonical power.  Folds the trivial exponents, evaluates numeric bases
  // raised to integers, and for integer exponents pushes the power inside
  // nested powers and products.
  public static Ex make( Ex basis, Ex exponent ) {
    if( exponent._bp instanceof Num e ) {
      if( e.is_zero() ) return Ex.ONE;
      if( e.is_one () ) return basis;
      Integer n = e.int_value();
      if( basis._bp instanceof Num b ) {
        if( n != null ) return b.pow(n).ex();
        if( b.is_one() ) return Ex.ONE;
        if( b.is_zero() && !e.is_negative() ) return Ex.ZERO;
      }
      if( n != null ) {
        // (b^x)^n == b^(x*n)
        if( basis._bp instanceof Power p )
          return make(p._basis,Mul.make(p._exponent,exponent));
        // (c*b0^x0*b1^x1)^n == c^n*b0^(x0*n)*b1^(x1*n)
        if( basis._bp instanceof Mul m ) {
          ExPair[] ps = m.seq();
          Ex[] fs = new Ex[ps.length+1];
          for( int i=0; i<ps.length; i++ )
            fs[i] = make(ps[i]._rest,Mul.make(ps[i]._coeff,exponent));
          fs[ps.length] = m._coeff.pow(n).ex();
          return Mul.make(fs);
        }
      }
    }
    if( basis.is_one() ) return Ex.ONE;
    return new Ex(new Power(basis,exponent).set_evaluated());
  }

  @Override public int nops() { return 2; }
  @Override public Ex op( int i ) {
    if( i==0 ) return _basis;
    if( i==1 ) return _exponent;
    return super.op(i);
  }
  @Override public Ex map( Ex self, UnaryOperator<Ex> f ) {
    Ex b = f.apply(_basis), e = f.apply(_exponent);
    return b.is_equal(_basis) && e.is_equal(_exponent) ? self : make(b,e);
  }

  @Override int calchash() { return Util.nonzero(Util.mix_hash(TPOWER,_basis.gethash(),_exponent.gethash())); }
  @Override int compare_same_type( Basic b ) {
    Power p = (Power)b;
    int c = _basis.compare(p._basis);
    return c!=0 ? c : _exponent.compare(p._exponent);
  }
  @Override boolean is_equal_same_type( Basic b ) {
    Power p = (Power)b;
    return _basis.is_equal(p._basis) && _exponent.is_equal(p._exponent);
  }

  // ----------
  @Override public int degree( Symbol s ) {
    Integer n = _exponent._bp instanceof Num e ? e.int_value() : null;
    return n==null ? 0 : _basis.degree(s)*n;
  }
  @Override public int ldegree( Symbol s ) {
    Integer n = _exponent._bp instanceof Num e ? e.int_value() : null;
    return n==null ? 0 : _basis.ldegree(s)*n;
  }
  @Override public Ex coeff( Ex self, Symbol s, int n ) {
    if( _basis._bp==s && _exponent._bp instanceof Num e && e.is_integer() )
      return e.int_value()!=null && e.int_value()==n ? Ex.ONE : Ex.ZERO;
    return n==0 && !_basis.has(s.ex()) ? self : Ex.ZERO;
  }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) {
    n.add_ex("basis"   ,_basis   );
    n.add_ex("exponent",_exponent);
  }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    return make(n.get_ex("basis",syms),n.get_ex("exponent",syms));
  }

  @Override SB str( SB sb, int prec ) {
    if( prec > PREC_POW ) sb.p('(');
    _basis._bp.str(sb,PREC_POW+1).p('^');
    _exponent._bp.str(sb,PREC_POW+1);
    return prec > PREC_POW ? sb.p(')') : sb;
  }
}
