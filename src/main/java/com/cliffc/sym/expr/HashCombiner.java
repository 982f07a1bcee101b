package com.cliffc.sym.expr;

import com.cliffc.sym.Sym;
import com.cliffc.sym.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Combines equal rests of a large pair list without sorting.
//
// Open-addressed table keyed by the structural hash of each rest, holding
// indices into a dense list of distinct pairs kept in first-seen order.  An
// incoming pair probes from its hash slot; a slot whose rest is_equal gets
// its coefficient merged, an empty slot takes a new pair.  The table doubles
// and rehashes at 3/4 load.
//
// Output is the same multiset of pairs the sort path makes, in insertion
// order; ExPairSeq.seq() sorts it on first ordered use.
final class HashCombiner {
  private static final Logger log = LoggerFactory.getLogger(HashCombiner.class);

  private final ExPairSeq _kind;
  private ExPair[] _pairs;       // Distinct pairs, first-seen order
  private int _len;
  private int[] _tab;            // 1+index into _pairs, 0 is empty
  private int _mask;

  private HashCombiner( ExPairSeq kind, int n ) {
    _kind = kind;
    _pairs = new ExPair[n];
    int cap = 16;
    while( cap*3 < n*4 ) cap <<= 1;
    _tab = new int[cap];
    _mask = cap-1;
  }

  static ExPairSeq.Acc combine( ExPairSeq kind, ExPairSeq.Acc acc ) {
    int n = acc._pairs._len;
    HashCombiner hc = new HashCombiner(kind,n);
    for( int i=0; i<n; i++ ) hc.add(acc._pairs._es[i]);
    if( log.isTraceEnabled() )
      log.trace("{} hash-combined {} pairs into {} in a table of {}",kind.class_name(),n,hc._len,hc._tab.length);
    ExPairSeq.Acc out = new ExPairSeq.Acc(acc._coeff,hc._len);
    for( int i=0; i<hc._len; i++ ) kind.finish(hc._pairs[i],out);
    assert Sym.once_per() || hc.check();
    return out;
  }

  private void add( ExPair p ) {
    int idx = Util.hash_spread(p._rest.gethash()) & _mask;
    while( true ) {
      int x = _tab[idx];
      if( x==0 ) break;         // Miss, insert here
      ExPair q = _pairs[x-1];
      if( q._rest.is_equal(p._rest) ) { // Hit, merge coefficients
        _pairs[x-1] = new ExPair(q._rest,_kind.combine_coeffs(q._coeff,p._coeff));
        return;
      }
      idx = (idx+1) & _mask;    // Linear reprobe
    }
    _pairs[_len++] = p;
    _tab[idx] = _len;
    if( _len*4 >= _tab.length*3 ) grow();
  }

  private void grow() {
    int[] tab = new int[_tab.length<<1];
    int mask = tab.length-1;
    for( int i=0; i<_len; i++ ) {
      int idx = Util.hash_spread(_pairs[i]._rest.gethash()) & mask;
      while( tab[idx]!=0 ) idx = (idx+1) & mask;
      tab[idx] = i+1;
    }
    _tab = tab;
    _mask = mask;
  }

  // No two distinct pairs with equal rests
  private boolean check() {
    for( int i=0; i<_len; i++ )
      for( int j=i+1; j<_len; j++ )
        if( _pairs[i]._rest.is_equal(_pairs[j]._rest) )
          return false;
    return true;
  }
}
