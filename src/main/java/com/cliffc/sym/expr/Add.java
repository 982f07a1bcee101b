package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;

// Sum: pairs are (term, numeric multiplier), overall coefficient is added.
public final class Add extends ExPairSeq {
  public static final String CLZ = "add";
  private static final Num ZERO = (Num)Ex.ZERO._bp;
  static final Add PROTO = new Add(new ExPair[0],ZERO,true);

  Add( ExPair[] seq, Num coeff, boolean sorted ) { super(TADD,seq,coeff,sorted); }

  public static Ex make( Ex a, Ex b ) {
    if( a._bp instanceof Add x && b._bp instanceof Add y ) return PROTO.merge(x,y);
    return PROTO.construct(a,b);
  }
  public static Ex make( Ex... es ) { return PROTO.construct(es); }
  public static Ex make( ExPair[] ps, Num coeff ) { return PROTO.construct(ps,coeff); }

  @Override Num neutral() { return ZERO; }
  @Override Num combine_overall( Num c0, Num c1 ) { return c0.add(c1); }

  // c*rest becomes (rest,c) for a numeric c
  @Override ExPair split( Ex e ) {
    if( e._bp instanceof Mul m && !m._coeff.is_one() )
      return new ExPair(m.strip_coeff(),m._coeff.ex());
    return new ExPair(e,Ex.ONE);
  }
  @Override Ex recombine( ExPair p ) { return p._coeff.is_one() ? p._rest : Mul.make(p._rest,p._coeff); }
  @Override Ex combine_coeffs( Ex c0, Ex c1 ) { return c0.num().add(c1.num()).ex(); }
  @Override Num absorb( ExPair p ) {
    return p._rest._bp instanceof Num n ? n.mul(p._coeff.num()) : null;
  }
  @Override boolean is_split( ExPair p ) {
    Basic r = p._rest._bp;
    return p._coeff.is_num() && !(r instanceof Num) && !(r instanceof Add) &&
      !(r instanceof Mul m && !m._coeff.is_one());
  }
  @Override ExPairSeq make_raw( ExPair[] seq, Num coeff, boolean sorted ) { return new Add(seq,coeff,sorted); }

  // Every term and the overall coefficient multiplied by c
  Ex scale( Num c ) {
    ExPair[] ps = new ExPair[_seq.length];
    for( int i=0; i<ps.length; i++ )
      ps[i] = new ExPair(_seq[i]._rest,_seq[i]._coeff.num().mul(c).ex());
    return make(ps,_coeff.mul(c));
  }

  @Override Ex eval() {
    if( _seq.length==0 ) return _coeff.ex();
    if( _seq.length==1 && _coeff.is_zero() ) return recombine(_seq[0]);
    return new Ex(set_evaluated());
  }

  // ----------
  @Override public int degree( Symbol s ) {
    int d = Integer.MIN_VALUE;
    for( int i=0; i<nops(); i++ ) d = Math.max(d,op(i).degree(s));
    return d;
  }
  @Override public int ldegree( Symbol s ) {
    int d = Integer.MAX_VALUE;
    for( int i=0; i<nops(); i++ ) d = Math.min(d,op(i).ldegree(s));
    return d;
  }
  @Override public Ex coeff( Ex self, Symbol s, int n ) {
    Ex[] cs = new Ex[nops()];
    for( int i=0; i<cs.length; i++ ) cs[i] = op(i).coeff(s,n);
    return make(cs);
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
    if( prec > PREC_ADD ) sb.p('(');
    boolean first = true;
    for( ExPair p : seq() ) {
      Num c = p._coeff.num();
      if( c.is_negative() ) { sb.p('-'); c = c.neg(); }
      else if( !first ) sb.p('+');
      if( !c.is_one() ) c.str(sb,PREC_MUL).p('*');
      p._rest._bp.str(sb,c.is_one() ? PREC_ADD : PREC_MUL);
      first = false;
    }
    if( has_coeff() ) {
      Num c = _coeff;
      if( c.is_negative() ) { sb.p('-'); c = c.neg(); }
      else if( !first ) sb.p('+');
      c.str(sb,PREC_ADD);
    }
    return prec > PREC_ADD ? sb.p(')') : sb;
  }
}
