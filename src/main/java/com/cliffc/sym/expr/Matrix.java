package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveErr;
import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;

import java.util.List;
import java.util.function.UnaryOperator;

// Dense rows x cols matrix of expressions, row-major.  Only a container
// here; matrix arithmetic lives outside the kernel.
public final class Matrix extends Basic {
  public static final String CLZ = "matrix";

  public final int _rows, _cols;
  private final Ex[] _m;

  private Matrix( int rows, int cols, Ex[] m ) {
    super(TMATRIX);
    _rows = rows;
    _cols = cols;
    _m = m;
  }
  public static Ex make( int rows, int cols, Ex... m ) {
    if( rows < 1 || cols < 1 )
      throw new IllegalArgumentException("matrix dimensions must be positive: "+rows+"x"+cols);
    if( (long)rows*cols != m.length )
      throw new IllegalArgumentException(rows+"x"+cols+" matrix needs "+((long)rows*cols)+" elements, got "+m.length);
    return new Ex(new Matrix(rows,cols,m.clone()).set_evaluated());
  }

  public Ex at( int r, int c ) {
    if( r < 0 || r >= _rows || c < 0 || c >= _cols )
      throw new IndexOutOfBoundsException("("+r+","+c+") of "+_rows+"x"+_cols);
    return _m[r*_cols+c];
  }

  @Override public int nops() { return _m.length; }
  @Override public Ex op( int i ) {
    if( 0 <= i && i < _m.length ) return _m[i];
    return super.op(i);
  }
  @Override public Ex map( Ex self, UnaryOperator<Ex> f ) {
    Ex[] m = new Ex[_m.length];
    boolean changed = false;
    for( int i=0; i<m.length; i++ ) {
      m[i] = f.apply(_m[i]);
      changed |= !m[i].is_equal(_m[i]);
    }
    return changed ? new Ex(new Matrix(_rows,_cols,m).set_evaluated()) : self;
  }

  @Override int calchash() {
    int h = Util.mix_hash(TMATRIX,_rows,_cols);
    for( Ex e : _m ) h = Util.mix_hash(h,e.gethash());
    return Util.nonzero(h);
  }
  @Override int compare_same_type( Basic b ) {
    Matrix x = (Matrix)b;
    if( _rows != x._rows ) return _rows < x._rows ? -1 : 1;
    if( _cols != x._cols ) return _cols < x._cols ? -1 : 1;
    for( int i=0; i<_m.length; i++ ) {
      int c = _m[i].compare(x._m[i]);
      if( c != 0 ) return c;
    }
    return 0;
  }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) {
    n.add_unsigned("row",_rows);
    n.add_unsigned("col",_cols);
    for( Ex e : _m ) n.add_ex("m",e);
  }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    long rows = n.get_unsigned("row"), cols = n.get_unsigned("col");
    if( rows < 1 || rows > Integer.MAX_VALUE ) throw ArchiveErr.bad_value(n,"row",Long.toString(rows));
    if( cols < 1 || cols > Integer.MAX_VALUE ) throw ArchiveErr.bad_value(n,"col",Long.toString(cols));
    List<Ex> m = n.find_all_ex("m",syms);
    if( m.size() != rows*cols ) throw ArchiveErr.missing(n,"m");
    return make((int)rows,(int)cols,m.toArray(new Ex[0]));
  }

  @Override SB str( SB sb, int prec ) {
    sb.p('[');
    for( int r=0; r<_rows; r++ ) {
      if( r>0 ) sb.p(',');
      sb.p('[');
      for( int c=0; c<_cols; c++ ) {
        if( c>0 ) sb.p(',');
        _m[r*_cols+c]._bp.str(sb,0);
      }
      sb.p(']');
    }
    return sb.p(']');
  }
}
