package com.cliffc.sym.util;

public class Util {
  public static int rot(int x, int k) { return (x<<k) | (x>>>(32-k)); }

  // Bob Jenkins' lookup3 final mix, reentrant: no statics, so it nests
  // safely inside recursive hash computations.
  public static int mix( int a, int b, int c ) {
    c ^= b; c -= rot(b,14);
    a ^= c; a -= rot(c,11);
    b ^= a; b -= rot(a,25);
    c ^= b; c -= rot(b,16);
    a ^= c; a -= rot(c, 4);
    b ^= a; b -= rot(a,14);
    c ^= b; c -= rot(b,24);
    return c;
  }

  // Ordered mix of two hashes
  public static int mix_hash( int h0, int h1 ) { return mix(h0,h1,0x9e3779b9); }
  public static int mix_hash( int h0, int h1, int h2 ) { return mix(h0,mix(h1,h2,0x9e3779b9),0xcafebabe); }

  // Return a hash which is never 0; 0 is reserved for "not yet computed".
  public static int nonzero( int hash ) { return hash==0 ? 0xcafebabe : hash; }

  // Single-use hash spreader
  public static int hash_spread( int hash ) { return mix(hash,0xdeadbeef,0x9e3779b9); }
}
