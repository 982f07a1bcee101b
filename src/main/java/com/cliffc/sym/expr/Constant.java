package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveErr;
import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;
import org.jctools.maps.NonBlockingHashMap;

// Named mathematical constant.  Unique per name, process wide, so an
// unarchived Pi is the same node as the Pi in memory.  Numeric evaluation
// lives outside the kernel.
public final class Constant extends Basic {
  public static final String CLZ = "constant";
  private static final NonBlockingHashMap<String,Constant> CONSTANTS = new NonBlockingHashMap<>();

  public final String _name;
  private final Ex _ex;

  private Constant( String name ) {
    super(TCONSTANT);
    _name = name;
    _ex = new Ex(this);
    set_evaluated();
  }

  public static Ex make( String name ) {
    Constant c = CONSTANTS.get(name);
    if( c != null ) return c._ex;
    Constant c2 = new Constant(name);
    c = CONSTANTS.putIfAbsent(name,c2);
    return (c==null ? c2 : c)._ex;
  }
  // Lookup only; null if never made
  public static Ex find( String name ) {
    Constant c = CONSTANTS.get(name);
    return c==null ? null : c._ex;
  }

  public static final Ex PI      = make("Pi");
  public static final Ex EULER   = make("Euler");
  public static final Ex CATALAN = make("Catalan");

  @Override int calchash() { return Util.nonzero(Util.mix_hash(TCONSTANT,_name.hashCode())); }
  @Override int compare_same_type( Basic b ) { return _name.compareTo(((Constant)b)._name); }

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) { n.add_string("name",_name); }
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    String name = n.get_string("name");
    Ex c = find(name);
    if( c==null ) throw ArchiveErr.bad_value(n,"name",name);
    return c;
  }

  @Override SB str( SB sb, int prec ) { return sb.p(_name); }
}
