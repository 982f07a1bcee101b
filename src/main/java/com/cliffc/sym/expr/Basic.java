package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;

import java.util.function.UnaryOperator;

// Base of all expression nodes.
//
// Nodes are immutable once they escape their make() method, except for two
// derived caches: the structural hash and the status flags.  Both can be
// recomputed at any time from the node's fields, so they never decide
// behavior; two structurally equal nodes may disagree on what is cached, and
// only pay a different recomputation cost.
//
// Nodes form a DAG built bottom-up: a node only points at nodes that existed
// before it, so there are no cycles and plain GC reclaims everything.
public abstract class Basic {
  // Kind tags, in their fixed canonical order.  Comparing two nodes of
  // different kinds is just comparing tags.
  public static final byte TNUM      = 0;
  public static final byte TSYMBOL   = 1;
  public static final byte TCONSTANT = 2;
  public static final byte TPOWER    = 3;
  public static final byte TADD      = 4;
  public static final byte TMUL      = 5;
  public static final byte TFUNCTION = 6;
  public static final byte TMATRIX   = 7;

  // Status flags
  static final byte EVALUATED       = 1; // Came out of a make(), is in simplest form
  static final byte HASH_CALCULATED = 2;

  // Printing precedence
  static final int PREC_ADD  = 40;
  static final int PREC_MUL  = 50;
  static final int PREC_POW  = 60;

  public final byte _tag;
  private int _hash;            // Structural hash, valid if HASH_CALCULATED
  byte _flags;

  Basic( byte tag ) { _tag = tag; }

  // ----------
  // Children.  Leaves have none.
  public int nops() { return 0; }
  public Ex op( int i ) { throw new IndexOutOfBoundsException("op("+i+") of "+this+" with "+nops()+" operands"); }

  // Rebuild with every child mapped, through the canonicalizing make()
  // methods.  Returns 'self' if no child changed.
  public Ex map( Ex self, UnaryOperator<Ex> f ) { assert self._bp==this; return self; }

  // ----------
  public boolean is_evaluated() { return (_flags & EVALUATED)!=0; }
  Basic set_evaluated() { _flags |= EVALUATED; return this; }

  // The hashcode.  Built recursively from the children's cached hashes, never 0.
  public final int gethash() {
    if( (_flags & HASH_CALCULATED)!=0 ) return _hash;
    _hash = calchash();
    _flags |= HASH_CALCULATED;
    return _hash;
  }
  abstract int calchash();
  @Override public final int hashCode() { return gethash(); }

  // ----------
  // Total order.  Kind tag first, then kind-specific.  Same instance is
  // always equal without looking inside.
  public final int compare( Basic b ) {
    if( this==b ) return 0;
    if( _tag != b._tag ) return _tag < b._tag ? -1 : 1;
    return compare_same_type(b);
  }
  // Already known to be the same kind and not the same instance.
  abstract int compare_same_type( Basic b );

  public final boolean is_equal( Basic b ) {
    if( this==b ) return true;
    if( _tag != b._tag ) return false;
    // Cheap reject when both hashes are already known
    if( (_flags & b._flags & HASH_CALCULATED)!=0 && _hash != b._hash ) return false;
    return is_equal_same_type(b);
  }
  boolean is_equal_same_type( Basic b ) { return compare_same_type(b)==0; }

  @Override public final boolean equals( Object o ) {
    return o instanceof Basic b && is_equal(b);
  }

  // ----------
  // Polynomial-shaped queries on the canonical form, no expansion.
  public int degree ( Symbol s ) { return this==s ? 1 : 0; }
  public int ldegree( Symbol s ) { return this==s ? 1 : 0; }
  public Ex coeff( Ex self, Symbol s, int n ) {
    if( this==s ) return n==1 ? Ex.ONE : Ex.ZERO;
    return n==0 ? self : Ex.ZERO;
  }

  // ----------
  // Archive support.  The class name is the stable wire contract.
  public abstract String class_name();
  // Add this node's properties; the "class" property is already present.
  public abstract void archive( ArchiveNode n );

  // ----------
  // Debug printing.  Precedence of the enclosing operator decides parens.
  abstract SB str( SB sb, int prec );
  @Override public final String toString() { return str(new SB(),0).toString(); }

  // Structural dump, one node per line
  public SB printtree( SB sb ) {
    sb.i().p(class_name()).p(" #").p(Integer.toHexString(gethash()));
    if( nops()==0 ) return sb.p(' ').p(toString()).nl();
    sb.nl().ii(1);
    for( int i=0; i<nops(); i++ ) op(i)._bp.printtree(sb);
    return sb.di(1);
  }
}
