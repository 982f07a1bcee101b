package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveErr;
import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;
import org.jctools.maps.NonBlockingHashMapLong;

import java.math.BigInteger;

// Exact rational literal.  Always reduced, denominator positive, sign on the
// numerator.  Small integers are flyweights shared by every expression.
public final class Num extends Basic {
  public static final String CLZ = "numeric";

  public final BigInteger _num, _den;

  private Num( BigInteger num, BigInteger den ) {
    super(TNUM);
    _num = num;
    _den = den;
    set_evaluated();
  }

  // Flyweight table of small integer literals.  Filled lazily.
  private static final int SMALL = 1024;
  private static final NonBlockingHashMapLong<Ex> SMALLS = new NonBlockingHashMapLong<>();

  public static Ex make( long l ) {
    if( -SMALL <= l && l <= SMALL ) {
      Ex e = SMALLS.get(l);
      if( e != null ) return e;
      Ex e2 = new Ex(new Num(BigInteger.valueOf(l),BigInteger.ONE));
      e = SMALLS.putIfAbsent(l,e2);
      return e==null ? e2 : e;
    }
    return new Ex(new Num(BigInteger.valueOf(l),BigInteger.ONE));
  }
  public static Ex make( long num, long den ) { return make(BigInteger.valueOf(num),BigInteger.valueOf(den)); }
  public static Ex make( BigInteger num, BigInteger den ) {
    if( den.signum()==0 ) throw new ArithmeticException("division by zero: "+num+"/0");
    if( den.signum() < 0 ) { num = num.negate(); den = den.negate(); }
    BigInteger gcd = num.gcd(den);
    if( !gcd.equals(BigInteger.ONE) && gcd.signum()!=0 ) { num = num.divide(gcd); den = den.divide(gcd); }
    if( num.signum()==0 ) den = BigInteger.ONE;
    if( den.equals(BigInteger.ONE) && num.bitLength() < 63 ) return make(num.longValue());
    return new Ex(new Num(num,den));
  }
  public static Ex make( BigInteger i ) { return make(i,BigInteger.ONE); }

  // Parse "p" or "p/q"
  public static Ex valueOf( String s ) {
    int idx = s.indexOf('/');
    if( idx == -1 ) return make(new BigInteger(s.trim()));
    return make(new BigInteger(s.substring(0,idx).trim()),new BigInteger(s.substring(idx+1).trim()));
  }

  // ----------
  // Arithmetic.  Results are (possibly shared) canonical literals.
  public Num add( Num n ) {
    if( n.is_zero() ) return this;
    if( is_zero() ) return n;
    if( _den.equals(n._den) ) return num(_num.add(n._num),_den);
    return num(_num.multiply(n._den).add(n._num.multiply(_den)),_den.multiply(n._den));
  }
  public Num sub( Num n ) { return add(n.neg()); }
  public Num mul( Num n ) {
    if( n.is_one() ) return this;
    if( is_one() ) return n;
    return num(_num.multiply(n._num),_den.multiply(n._den));
  }
  public Num div( Num n ) { return mul(n.inv()); }
  public Num neg() { return num(_num.negate(),_den); }
  public Num inv() { return num(_den,_num); }
  // Exact integer power; 0^-n throws
  public Num pow( int n ) {
    if( n==0 ) return (Num)Ex.ONE._bp;
    if( n==1 ) return this;
    Num b = n < 0 ? inv() : this;
    int m = Math.abs(n);
    return num(b._num.pow(m),b._den.pow(m));
  }
  private static Num num( BigInteger n, BigInteger d ) { return (Num)make(n,d)._bp; }

  public boolean is_zero    () { return _num.signum()==0; }
  public boolean is_one     () { return _num.equals(BigInteger.ONE) && is_integer(); }
  public boolean is_integer () { return _den.equals(BigInteger.ONE); }
  public boolean is_negative() { return _num.signum() < 0; }
  // Integer value that fits in an int, else null
  public Integer int_value() {
    return is_integer() && _num.bitLength() < 32 ? _num.intValue() : null;
  }
  public int compareTo( Num n ) {
    return _num.multiply(n._den).compareTo(n._num.multiply(_den));
  }
  public Ex ex() { return new Ex(this); }

  // ----------
  @Override int calchash() { return Util.nonzero(Util.mix_hash(TNUM,_num.hashCode(),_den.hashCode())); }
  @Override int compare_same_type( Basic b ) { return compareTo((Num)b); }
  @Override boolean is_equal_same_type( Basic b ) {
    Num n = (Num)b;
    return _num.equals(n._num) && _den.equals(n._den);
  }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) { n.add_string("number",toString()); }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    String s = n.get_string("number");
    try { return valueOf(s); }
    catch( NumberFormatException | ArithmeticException e ) {
      throw ArchiveErr.bad_value(n,"number",s,e);
    }
  }

  @Override SB str( SB sb, int prec ) {
    boolean parens = prec > PREC_ADD && (is_negative() || !is_integer());
    if( parens ) sb.p('(');
    sb.p(_num.toString());
    if( !is_integer() ) sb.p('/').p(_den.toString());
    return parens ? sb.p(')') : sb;
  }
}
