package com.cliffc.sym.archive;

import com.cliffc.sym.expr.Ex;
import com.cliffc.sym.expr.Symbol;
import com.cliffc.sym.util.Ary;
import com.cliffc.sym.util.SB;

import java.util.ArrayList;
import java.util.List;

/**
 * One flattened expression node: an ordered list of typed, named properties.
 * Names are atoms of the owning {@link Archive}; node properties hold the id
 * of an earlier node in the same archive.
 * <p>
 * A node is "raw" when it only has properties, and "materialized" once it
 * caches the {@link Ex} it stands for.  Nodes built by
 * {@link Archive#archive_ex} start materialized; nodes read from a stream
 * materialize on their first successful {@link #unarchive}.
 */
public class ArchiveNode {
  public enum PType { BOOL, UNSIGNED, STRING, NODE }
  static final PType[] PTYPES = PType.values();
  static final int TYPE_BITS = 3;

  static final class Prop {
    final PType _type;
    final int _name;            // Atom id
    final long _value;          // 0/1, unsigned, atom id or node id
    Prop( PType type, int name, long value ) { _type=type; _name=name; _value=value; }
    long packed() { return _type.ordinal() | ((long)_name << TYPE_BITS); }
  }

  // Summary of one (type,name) group of properties
  public static final class PropInfo {
    public final PType _type;
    public final String _name;
    public int _count;
    PropInfo( PType type, String name ) { _type=type; _name=name; _count=1; }
    @Override public String toString() { return _type+" "+_name+(_count>1 ? "*"+_count : ""); }
  }

  final Archive _ar;
  int _id;                      // Index in the archive, -1 while being built
  final Ary<Prop> _props = new Ary<>(new Prop[4],0);
  private Ex _e;                // Materialized expression, or null if raw

  // Raw node, filled in by the stream reader
  ArchiveNode( Archive ar, int id ) { _ar = ar; _id = id; }

  // Materialized node from a live expression.  Children archive first, so
  // this node's id is assigned by the caller after the properties are in.
  ArchiveNode( Archive ar, Ex e ) {
    this(ar,-1);
    _e = e;
    add_string("class",e._bp.class_name());
    e._bp.archive(this);
  }

  public int id() { return _id; }

  // ----------
  // Writers, called from Basic.archive
  public void add_bool( String name, boolean b ) { add(PType.BOOL,name,b ? 1 : 0); }
  public void add_unsigned( String name, long val ) {
    if( val < 0 ) throw new IllegalArgumentException("property '"+name+"' must be unsigned: "+val);
    add(PType.UNSIGNED,name,val);
  }
  public void add_string( String name, String val ) { add(PType.STRING,name,_ar.atomize(val)); }
  public void add_ex( String name, Ex e ) { add(PType.NODE,name,_ar.add_node(e)); }
  private void add( PType type, String name, long val ) { add_prop(type,_ar.atomize(name),val); }
  void add_prop( PType type, int name, long val ) { _props.push(new Prop(type,name,val)); }

  // ----------
  // Lookups.  Absent properties are a not-found outcome: null or -1.
  private Prop find( PType type, String name, int index ) {
    int atom = _ar.find_atom(name);
    if( atom == -1 ) return null;
    for( Prop p : _props )
      if( p._type==type && p._name==atom && index-- == 0 )
        return p;
    return null;
  }

  public Boolean find_bool( String name ) {
    Prop p = find(PType.BOOL,name,0);
    return p==null ? null : p._value != 0;
  }
  public long find_unsigned( String name ) {
    Prop p = find(PType.UNSIGNED,name,0);
    return p==null ? -1 : p._value;
  }
  public String find_string( String name ) {
    Prop p = find(PType.STRING,name,0);
    return p==null ? null : _ar.unatomize(p._value);
  }
  // The index'th node property with this name
  public ArchiveNode find_ex_node( String name, int index ) {
    Prop p = find(PType.NODE,name,index);
    return p==null ? null : _ar.get_node(p._value);
  }
  public Ex find_ex( String name, int index, Symbol[] syms ) {
    ArchiveNode n = find_ex_node(name,index);
    return n==null ? null : n.unarchive(syms);
  }
  // All node properties with this name, in order
  public List<Ex> find_all_ex( String name, Symbol[] syms ) {
    ArrayList<Ex> es = new ArrayList<>();
    int atom = _ar.find_atom(name);
    if( atom == -1 ) return es;
    for( Prop p : _props )
      if( p._type==PType.NODE && p._name==atom )
        es.add(_ar.get_node(p._value).unarchive(syms));
    return es;
  }

  // Required lookups
  public String get_string( String name ) {
    String s = find_string(name);
    if( s==null ) throw ArchiveErr.missing(this,name);
    return s;
  }
  public long get_unsigned( String name ) {
    long l = find_unsigned(name);
    if( l == -1 ) throw ArchiveErr.missing(this,name);
    return l;
  }
  public Ex get_ex( String name, Symbol[] syms ) {
    Ex e = find_ex(name,0,syms);
    if( e==null ) throw ArchiveErr.missing(this,name);
    return e;
  }

  public List<PropInfo> get_properties() {
    ArrayList<PropInfo> infos = new ArrayList<>();
    outer:
    for( Prop p : _props ) {
      String name = _ar.unatomize(p._name);
      for( PropInfo pi : infos )
        if( pi._type==p._type && pi._name.equals(name) ) { pi._count++; continue outer; }
      infos.add(new PropInfo(p._type,name));
    }
    return infos;
  }

  // ----------
  public boolean has_ex() { return _e != null; }
  Ex cached() { return _e; }

  // Rebuild the expression, or return the cached one.  A failure leaves
  // this node raw.
  public Ex unarchive( Symbol[] syms ) {
    if( _e != null ) return _e;
    String clz = find_string("class");
    if( clz==null ) throw ArchiveErr.missing(this,"class");
    Registrar.Unarchiver u = Registrar.find(clz);
    if( u==null )
      throw new ArchiveErr(ArchiveErr.Kind.UNKNOWN_CLASS,"archive node "+_id+" has unknown class '"+clz+"'");
    return (_e = u.unarchive(this,syms));
  }

  // Back to raw
  public void forget() { _e = null; }

  public SB printraw( SB sb ) {
    sb.p(_id);
    if( _e != null ) sb.p(" = ").p(_e.toString());
    sb.nl().ii(1);
    for( Prop p : _props ) {
      sb.i().p(p._type.name().toLowerCase()).p(' ').p(_ar.unatomize(p._name)).p(' ');
      switch( p._type ) {
      case BOOL     -> sb.p(p._value != 0);
      case UNSIGNED -> sb.p(p._value);
      case STRING   -> sb.p('"').p(_ar.unatomize(p._value)).p('"');
      case NODE     -> sb.p('#').p(p._value);
      }
      sb.nl();
    }
    return sb.di(1);
  }
}
