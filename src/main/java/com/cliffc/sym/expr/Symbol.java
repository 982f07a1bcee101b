package com.cliffc.sym.expr;

import com.cliffc.sym.archive.ArchiveNode;
import com.cliffc.sym.util.SB;
import com.cliffc.sym.util.Util;
import org.jetbrains.annotations.NotNull;

// A free variable.  Every Symbol is distinct from every other Symbol, even
// one with the same name; ordering is by name with the creation serial
// breaking ties, so the order of a sum does not depend on creation order
// unless names collide.
public class Symbol extends Basic {
  public static final String CLZ = "symbol";
  static private int CNT=1;

  public final String _name;
  public final int _serial;
  private final Ex _ex;         // Handle to self, shared by all uses

  public Symbol( @NotNull String name ) {
    super(TSYMBOL);
    _name = name;
    _serial = CNT++;
    _ex = new Ex(this);
    set_evaluated();
  }
  public static Symbol make( String name ) { return new Symbol(name); }

  public Ex ex() { return _ex; }

  @Override int calchash() { return Util.nonzero(Util.mix_hash(TSYMBOL,_name.hashCode(),_serial)); }
  @Override int compare_same_type( Basic b ) {
    Symbol s = (Symbol)b;
    int c = _name.compareTo(s._name);
    return c!=0 ? c : Integer.compare(_serial,s._serial);
  }
  @Override boolean is_equal_same_type( Basic b ) { return false; } // Only equal to self

  @Override public String class_name() { return CLZ; }
  @Override public void archive( ArchiveNode n ) { n.add_string("name",_name); }
  // Resolve against the caller's symbols by name, else make a fresh one
  public static Ex unarchive( ArchiveNode n, Symbol[] syms ) {
    String name = n.get_string("name");
    if( syms != null )
      for( Symbol s : syms )
        if( s._name.equals(name) )
          return s._ex;
    return new Symbol(name)._ex;
  }

  @Override SB str( SB sb, int prec ) { return sb.p(_name); }
}
