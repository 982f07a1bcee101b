package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.function.UnaryOperator;

// Application of a named function to arguments.  The kernel knows nothing
// about what the function means; evaluation rules live elsewhere.
public final class FunctionCall extends Basic {
  public static final String CLZ = "function";

  public final String _name;
  private final Ex[] _args;

  private FunctionCall( String name, Ex[] args ) {
    super(TFUNCTION);
    _name = name;
    _args = args;
  }
  public static Ex make( @NotNull String name, Ex... args ) {
    return new Ex(new FunctionCall(name,args.clone()).set_evaluated());
  }

  @Override public int nops() { return _args.length; }
  @Override public Ex op( int i ) {
    if( 0 <= i && i < _args.length ) return _args[i];
    return super.op(i);
  }
  @Override public Ex map( Ex self, UnaryOperator<Ex> f ) {
    Ex[] as = new Ex[_args.length];
    boolean changed = false;
    for( int i=0; i<as.length; i++ ) {
      as[i] = f.apply(_args[i]);
      changed |= !as[i].is_equal(_args[i]);
    }
    return changed ? new Ex(new FunctionCall(_name,as).set_evaluated()) : self;
  }

  @Override int calchash() {
    int h = Util.mix_hash(TFUNCTION,_name.hashCode());
    for( Ex a : _args ) h = Util.mix_hash(h,a.gethash());
    return Util.nonzero(h);
  }
  // Name, then arity, then arguments left to right
  @Override int compare_same_type( Basic b ) {
    FunctionCall f = (FunctionCall)b;
    int c = _name.compareTo(f._name);
    if( c != 0 ) return c;
    if( _args.length != f._args.length ) return _args.length < f._args.length ? -1 : 1;
    for( int i=0; i<_args.length; i++ )
      if( (c = _args[i].compare(f._args[i])) != 0 )
        return c;
    return 0;
  }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) {
    n.add_string("name",_name);
    for( Ex a : _args ) n.add_ex("arg",a);
  }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    String name = n.get_string("name");
    List<Ex> args = n.find_all_ex("arg",syms);
    return make(name,args.toArray(new Ex[0]));
  }

  @Override SB str( SB sb, int prec ) {
    sb.p(_name).p('(');
    for( int i=0; i<_args.length; i++ ) {
      if( i>0 ) sb.p(',');
      _args[i]._bp.str(sb,0);
    }
    return sb.p(')');
  }
}
