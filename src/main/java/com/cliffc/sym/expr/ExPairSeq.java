package com.cliffc.sym.expr;

import com.cliffc.sym.Sym;
import com.cliffc.sym.SymProperties;
import com.cliffc.sym.archive.ArchiveErr;
import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.Ary;
import com.cliffc.sym.util.Util;

import java.util.Arrays;
import java.util.List;
import java.util.function.UnaryOperator;

// Canonical sequence of (rest,coeff) pairs plus one overall numeric
// coefficient; the common representation of sums and products.
//
// After every constructor returns:
// - no two pairs share a rest;
// - no pair has a zero coefficient (zero multiplier, or zero exponent);
// - pairs are in one fixed order, numeric rests last (see ExPair);
// - numeric pairs that evaluate exactly are folded into the overall coefficient.
//
// Small inputs are sorted and merged.  Large inputs are combined through a
// hash table on the rests (see HashCombiner) and left unsorted; the sort
// happens on the first ordered access, in seq().
//
// The per-kind behavior is supplied by Add and Mul through a handful of
// hooks.  Each kind keeps an empty prototype instance, PROTO, through which
// its static make() methods reach the hooks.
public abstract class ExPairSeq extends Basic {
  ExPair[] _seq;                 // Canonical pairs, sorted if _sorted
  public final Num _coeff;       // Overall coefficient
  private volatile boolean _sorted;

  ExPairSeq( byte tag, ExPair[] seq, Num coeff, boolean sorted ) {
    super(tag);
    _seq = seq;
    _coeff = coeff;
    _sorted = sorted || seq.length < 2;
  }

  // ----------
  // Per-kind hooks
  abstract Num neutral();                      // 0 for sums, 1 for products
  abstract Num combine_overall( Num c0, Num c1 ); // + for sums, * for products
  abstract ExPair split( Ex e );               // Child expression to pair
  abstract Ex recombine( ExPair p );           // Pair back to an expression
  abstract Ex combine_coeffs( Ex c0, Ex c1 );  // Merge coefficients of equal rests
  abstract Num absorb( ExPair p );             // Exact value of a numeric pair, or null
  abstract boolean is_split( ExPair p );       // Already in the form split() produces
  abstract ExPairSeq make_raw( ExPair[] seq, Num coeff, boolean sorted );
  abstract Ex eval();                          // Collapse trivial sequences

  // ----------
  // Accessors
  public final ExPair[] seq() {
    if( !_sorted ) {
      ExPair[] s = _seq.clone();
      Arrays.sort(s,ExPair::compare_rest);
      _seq = s;
      _sorted = true;
    }
    return _seq;
  }
  public final boolean is_sorted() { return _sorted; }
  public final int num_pairs() { return _seq.length; }
  public final ExPair pair( int i ) { return seq()[i]; }
  public final Ex overall_coeff() { return _coeff.ex(); }
  final boolean has_coeff() { return !_coeff.is_equal(neutral()); }

  // Terms (or factors), then the overall coefficient if it is not neutral
  @Override public final int nops() { return _seq.length + (has_coeff() ? 1 : 0); }
  @Override public final Ex op( int i ) {
    ExPair[] s = seq();
    if( 0 <= i && i < s.length ) return recombine(s[i]);
    if( i == s.length && has_coeff() ) return _coeff.ex();
    return super.op(i);
  }

  @Override public final Ex map( Ex self, UnaryOperator<Ex> f ) {
    int n = nops();
    Ex[] es = new Ex[n];
    boolean changed = false;
    for( int i=0; i<n; i++ ) {
      Ex o = op(i);
      es[i] = f.apply(o);
      changed |= !es[i].is_equal(o);
    }
    return changed ? construct(es) : self;
  }

  // ----------
  // Accumulates pairs and the overall coefficient during construction
  static final class Acc {
    final Ary<ExPair> _pairs;
    Num _coeff;
    Acc( Num coeff, int len ) { _coeff = coeff; _pairs = new Ary<>(new ExPair[Math.max(len,1)],0); }
  }

  // Move one child into the accumulator: numbers join the coefficient,
  // children of the same kind are inlined, everything else becomes a pair.
  final void flatten( Ex e, Acc acc ) {
    Basic b = e._bp;
    if( b instanceof Num n ) { acc._coeff = combine_overall(acc._coeff,n); return; }
    if( b._tag == _tag ) {
      ExPairSeq s = (ExPairSeq)b;
      for( ExPair p : s._seq ) acc._pairs.push(p);
      acc._coeff = combine_overall(acc._coeff,s._coeff);
      return;
    }
    acc._pairs.push(split(e));
  }

  // Flatten-and-combine from arbitrary children
  final Ex construct( Ex... es ) {
    Acc acc = new Acc(neutral(),es.length);
    for( Ex e : es ) flatten(e,acc);
    return combine(acc);
  }

  // From explicit pairs, e.g. read back from an archive.  Pairs not already
  // in split form go the long way around, through recombine and flatten.
  final Ex construct( ExPair[] ps, Num coeff ) {
    Acc acc = new Acc(coeff,ps.length);
    for( ExPair p : ps ) {
      if( is_split(p) ) acc._pairs.push(p);
      else flatten(recombine(p),acc);
    }
    return combine(acc);
  }

  // Linear merge of two canonical sequences of this kind
  final Ex merge( ExPairSeq a, ExPairSeq b ) {
    assert a._tag==_tag && b._tag==_tag;
    ExPair[] s0 = a.seq(), s1 = b.seq();
    Acc out = new Acc(combine_overall(a._coeff,b._coeff),s0.length+s1.length);
    int i=0, j=0;
    while( i<s0.length && j<s1.length ) {
      int c = s0[i].compare_rest(s1[j]);
      if( c < 0 ) out._pairs.push(s0[i++]);
      else if( c > 0 ) out._pairs.push(s1[j++]);
      else { finish(new ExPair(s0[i]._rest,combine_coeffs(s0[i]._coeff,s1[j]._coeff)),out); i++; j++; }
    }
    while( i<s0.length ) out._pairs.push(s0[i++]);
    while( j<s1.length ) out._pairs.push(s1[j++]);
    return build(out,true);
  }

  // Pick a strategy by size, combine equal rests, build and collapse
  final Ex combine( Acc acc ) {
    if( acc._pairs._len >= SymProperties.hashCombineMin() )
      return build(HashCombiner.combine(this,acc),false);
    return build(sort_combine(acc),true);
  }

  // Sort by rest, then merge runs of equal rests
  final Acc sort_combine( Acc acc ) {
    Ary<ExPair> ps = acc._pairs;
    ps.sort_update(ExPair::compare_rest);
    Acc out = new Acc(acc._coeff,ps._len);
    int i=0;
    while( i < ps._len ) {
      ExPair p = ps._es[i++];
      Ex c = p._coeff;
      boolean merged = false;
      while( i < ps._len && ps._es[i].compare_rest(p)==0 ) {
        c = combine_coeffs(c,ps._es[i++]._coeff);
        merged = true;
      }
      finish(merged ? new ExPair(p._rest,c) : p,out);
    }
    return out;
  }

  // Final disposition of a merged pair: drop if neutral, fold if numeric,
  // else keep.
  final void finish( ExPair p, Acc out ) {
    if( p._coeff.is_zero() ) return;
    Num n = absorb(p);
    if( n != null ) out._coeff = combine_overall(out._coeff,n);
    else out._pairs.push(p);
  }

  private Ex build( Acc out, boolean sorted ) {
    // Merged exponents can make a pair splittable again: (x*y)^(1/2)*(x*y)^(1/2)
    for( int i=0; i<out._pairs._len; i++ )
      if( !is_split(out._pairs._es[i]) )
        return construct(out._pairs.asAry(),out._coeff);
    ExPairSeq s = make_raw(out._pairs.asAry(),out._coeff,sorted);
    if( Sym.CHECK_CANONICAL && !s.is_canonical() )
      throw new AssertionError("not canonical: "+s.seq_str());
    return s.eval();
  }

  // Debug consistency check of the invariants listed up top
  public final boolean is_canonical() {
    ExPair[] s = _seq;
    if( !_sorted ) {            // Check a sorted copy, leave the lazy sort alone
      s = s.clone();
      Arrays.sort(s,ExPair::compare_rest);
    }
    for( int i=0; i<s.length; i++ ) {
      ExPair p = s[i];
      if( p._coeff.is_zero() ) return false;
      if( absorb(p) != null ) return false;
      if( !is_split(p) ) return false;
      if( i > 0 && s[i-1].compare_rest(p) >= 0 ) return false;
    }
    return true;
  }

  // ----------
  // XOR as the pair mixer: order-invariant, so hashing never forces a sort
  @Override final int calchash() {
    int h = 0;
    for( ExPair p : _seq ) h ^= p.gethash();
    return Util.nonzero(Util.mix_hash(_tag,h,_coeff.gethash()));
  }

  @Override final int compare_same_type( Basic b ) {
    ExPairSeq s = (ExPairSeq)b;
    if( _seq.length != s._seq.length ) return _seq.length < s._seq.length ? -1 : 1;
    ExPair[] s0 = seq(), s1 = s.seq();
    for( int i=0; i<s0.length; i++ ) {
      int c = s0[i].compare(s1[i]);
      if( c != 0 ) return c;
    }
    return _coeff.compare(s._coeff);
  }
  @Override final boolean is_equal_same_type( Basic b ) {
    ExPairSeq s = (ExPairSeq)b;
    if( _seq.length != s._seq.length ) return false;
    if( !_coeff.is_equal(s._coeff) ) return false;
    if( gethash() != s.gethash() ) return false;
    ExPair[] s0 = seq(), s1 = s.seq();
    for( int i=0; i<s0.length; i++ )
      if( !s0[i].is_equal(s1[i]) )
        return false;
    return true;
  }

  // Read back the rest/coeff pairs written by archive()
  static ExPair[] unarchive_pairs( ArchiveNode n, Symbol[] syms ) {
    List<Ex> rests = n.find_all_ex("rest",syms), coeffs = n.find_all_ex("coeff",syms);
    if( rests.size() != coeffs.size() )
      throw ArchiveErr.missing(n,rests.size() < coeffs.size() ? "rest" : "coeff");
    ExPair[] ps = new ExPair[rests.size()];
    for( int i=0; i<ps.length; i++ ) ps[i] = new ExPair(rests.get(i),coeffs.get(i));
    return ps;
  }
  static Num unarchive_coeff( ArchiveNode n, Symbol[] syms ) {
    Ex c = n.get_ex("overall_coeff",syms);
    if( !c.is_num() ) throw ArchiveErr.bad_value(n,"overall_coeff",c.toString());
    return c.num();
  }

  // Raw dump of pairs, for assert messages
  final String seq_str() { return class_name()+Arrays.toString(_seq)+"+"+_coeff; }
}
