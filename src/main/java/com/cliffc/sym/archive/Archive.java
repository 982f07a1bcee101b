package com.cliffc.sym.archive;

import com.cliffc.sym.expr.Ex;
import com.cliffc.sym.expr.Symbol;
import com.cliffc.sym.util.Ary;
import com.cliffc.sym.util.SB;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;

/**
 * A flat, deduplicated encoding of one or more named expressions.
 * <p>
 * Holds an atom table of interned strings, a node list and the named roots.
 * Nodes only reference earlier nodes, since expressions are built bottom-up
 * and children are always archived before their parents.  Deduplication is
 * by node identity: two structurally equal but separately built
 * subexpressions become two archive nodes.
 * <p>
 * Stream layout, all integers as {@link Varint}s:
 * <pre>
 *   "GARC" version
 *   atom_count  (NUL-terminated UTF-8)*
 *   expr_count  (name_atom root_node)*
 *   node_count  (prop_count (type|name&lt;&lt;3 value)*)*
 * </pre>
 * A reader rejects versions outside [OLDEST_VERSION,CURRENT_VERSION] before
 * it reads any atoms.
 */
public class Archive {
  private static final Logger log = LoggerFactory.getLogger(Archive.class);

  public static final int CURRENT_VERSION = 2;
  public static final int OLDEST_VERSION  = 1;
  static final byte[] SIGNATURE = {'G','A','R','C'};

  private final Ary<String> _atoms = new Ary<>(new String[8],0);
  private final HashMap<String,Integer> _atom_ids = new HashMap<>();
  private final Ary<ArchiveNode> _nodes = new Ary<>(new ArchiveNode[8],0);
  // Named roots, as (name atom, root node id)
  private final Ary<int[]> _exprs = new Ary<>(new int[2][],0);

  public Archive() { }
  public Archive( Ex e, @NotNull String name ) { archive_ex(e,name); }

  // ----------
  // Archive a live expression under a name
  public void archive_ex( Ex e, @NotNull String name ) {
    int nodes0 = _nodes.len();
    int root = add_node(e);
    _exprs.push(new int[]{atomize(name),root});
    log.debug("archived '{}' as node {}, {} new nodes", name, root, _nodes.len()-nodes0);
  }

  // Id of the node for this exact expression instance, archiving it (and
  // its children first) if needed.
  int add_node( Ex e ) {
    for( int i=0; i<_nodes.len(); i++ ) {
      ArchiveNode n = _nodes.at(i);
      if( n.cached() != null && n.cached()._bp == e._bp )
        return i;
    }
    ArchiveNode n = new ArchiveNode(this,e);
    n._id = _nodes.len();
    _nodes.push(n);
    log.trace("node {} {}", n._id, e._bp.class_name());
    return n._id;
  }

  public ArchiveNode get_node( long id ) {
    if( id < 0 || id >= _nodes.len() ) throw ArchiveErr.node_range(id,_nodes.len());
    return _nodes.at((int)id);
  }
  public int num_nodes() { return _nodes.len(); }

  // ----------
  // Rebuild a named expression, resolving free symbols by name against syms
  public Ex unarchive_ex( String name, Symbol... syms ) { return find_root(name).unarchive(syms); }
  public Ex unarchive_ex( int index, Symbol... syms ) { return get_top_node(index).unarchive(syms); }

  public ArchiveNode find_root( String name ) {
    int atom = find_atom(name);
    if( atom != -1 )
      for( int[] x : _exprs )
        if( x[0]==atom )
          return get_node(x[1]);
    throw ArchiveErr.not_found("expression '"+name+"'");
  }
  public ArchiveNode get_top_node( int index ) {
    if( index < 0 || index >= _exprs.len() ) throw ArchiveErr.not_found("expression #"+index);
    return get_node(_exprs.at(index)[1]);
  }
  public int num_expressions() { return _exprs.len(); }
  public String name( int index ) {
    if( index < 0 || index >= _exprs.len() ) throw ArchiveErr.not_found("expression #"+index);
    return unatomize(_exprs.at(index)[0]);
  }

  // Reset every node to raw; the next unarchive rebuilds from properties
  public void forget() {
    for( ArchiveNode n : _nodes ) n.forget();
  }
  public void clear() {
    _atoms.clear();
    _atom_ids.clear();
    _nodes.clear();
    _exprs.clear();
  }

  // ----------
  // Atom table
  public int atomize( String s ) {
    Integer id = _atom_ids.get(s);
    if( id != null ) return id;
    if( s.indexOf('\0') != -1 ) throw new IllegalArgumentException("atom contains NUL: "+s);
    int x = _atoms.len();
    _atoms.push(s);
    _atom_ids.put(s,x);
    return x;
  }
  // Atom id, or -1 without interning
  public int find_atom( String s ) {
    Integer id = _atom_ids.get(s);
    return id==null ? -1 : id;
  }
  public String unatomize( long id ) {
    if( id < 0 || id >= _atoms.len() ) throw ArchiveErr.atom_range(id,_atoms.len());
    return _atoms.at((int)id);
  }

  // ----------
  public void write( OutputStream os ) throws IOException {
    os.write(SIGNATURE);
    Varint.write(os,CURRENT_VERSION);
    Varint.write(os,_atoms.len());
    for( String s : _atoms ) {
      os.write(s.getBytes(StandardCharsets.UTF_8));
      os.write(0);
    }
    Varint.write(os,_exprs.len());
    for( int[] x : _exprs ) {
      Varint.write(os,x[0]);
      Varint.write(os,x[1]);
    }
    Varint.write(os,_nodes.len());
    for( ArchiveNode n : _nodes ) {
      Varint.write(os,n._props.len());
      for( ArchiveNode.Prop p : n._props ) {
        Varint.write(os,p.packed());
        Varint.write(os,p._value);
      }
    }
    log.debug("wrote archive: {} atoms, {} expressions, {} nodes", _atoms.len(), _exprs.len(), _nodes.len());
  }

  public static Archive read( InputStream is ) throws IOException {
    byte[] sig = is.readNBytes(SIGNATURE.length);
    if( sig.length < SIGNATURE.length ) throw ArchiveErr.truncated("signature");
    for( int i=0; i<SIGNATURE.length; i++ )
      if( sig[i] != SIGNATURE[i] )
        throw new ArchiveErr(ArchiveErr.Kind.BAD_SIGNATURE,"not an archive, signature "+new String(sig,StandardCharsets.ISO_8859_1));
    long version = Varint.read(is);
    if( version < OLDEST_VERSION || version > CURRENT_VERSION )
      throw new ArchiveErr(ArchiveErr.Kind.BAD_VERSION,"archive version "+version+" not in ["+OLDEST_VERSION+","+CURRENT_VERSION+"]");
    if( version < CURRENT_VERSION )
      log.warn("reading archive version {}, current is {}", version, CURRENT_VERSION);

    Archive ar = new Archive();
    int natoms = Varint.read_int(is,"atom count");
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    for( int i=0; i<natoms; i++ ) {
      buf.reset();
      int b;
      while( (b = is.read()) != 0 ) {
        if( b == -1 ) throw ArchiveErr.truncated("atom "+i);
        buf.write(b);
      }
      String s = buf.toString(StandardCharsets.UTF_8);
      // Duplicate atoms keep their slot; lookups find the first
      ar._atoms.push(s);
      ar._atom_ids.putIfAbsent(s,i);
    }

    int nexprs = Varint.read_int(is,"expression count");
    for( int i=0; i<nexprs; i++ ) {
      long name = Varint.read(is);
      if( name >= natoms ) throw ArchiveErr.atom_range(name,natoms);
      int root = Varint.read_int(is,"root node");
      ar._exprs.push(new int[]{(int)name,root});
    }

    int nnodes = Varint.read_int(is,"node count");
    for( int i=0; i<nnodes; i++ ) {
      ArchiveNode n = new ArchiveNode(ar,i);
      int nprops = Varint.read_int(is,"property count");
      for( int j=0; j<nprops; j++ ) {
        long w = Varint.read(is);
        int type = (int)(w & ((1<<ArchiveNode.TYPE_BITS)-1));
        if( type >= ArchiveNode.PTYPES.length )
          throw new ArchiveErr(ArchiveErr.Kind.BAD_PROPERTY_TYPE,"node "+i+" has property type "+type);
        long name = w >>> ArchiveNode.TYPE_BITS;
        if( name >= natoms ) throw ArchiveErr.atom_range(name,natoms);
        long val = Varint.read(is);
        ArchiveNode.PType pt = ArchiveNode.PTYPES[type];
        if( pt==ArchiveNode.PType.STRING && val >= natoms ) throw ArchiveErr.atom_range(val,natoms);
        if( pt==ArchiveNode.PType.NODE   && val >= i      ) throw ArchiveErr.node_range(val,i);
        n.add_prop(pt,(int)name,val);
      }
      ar._nodes.push(n);
    }
    for( int[] x : ar._exprs )
      if( x[1] >= nnodes ) throw ArchiveErr.node_range(x[1],nnodes);
    log.debug("read archive v{}: {} atoms, {} expressions, {} nodes", version, natoms, nexprs, nnodes);
    return ar;
  }

  public byte[] to_bytes() {
    ByteArrayOutputStream bos = new ByteArrayOutputStream();
    try { write(bos); }
    catch( IOException e ) { throw new UncheckedIOException(e); }
    return bos.toByteArray();
  }
  public static Archive from_bytes( byte[] bs ) {
    try { return read(new ByteArrayInputStream(bs)); }
    catch( IOException e ) { throw new UncheckedIOException(e); }
  }

  // ----------
  public SB printraw( SB sb ) {
    sb.p("Atoms:").nl();
    for( int i=0; i<_atoms.len(); i++ ) sb.p(' ').p(i).p(' ').p(_atoms.at(i)).nl();
    sb.nl().p("Expressions:").nl();
    for( int[] x : _exprs ) sb.p(' ').p(x[1]).p(' ').p(_atoms.at(x[0])).nl();
    sb.nl().p("Nodes:").nl();
    for( ArchiveNode n : _nodes ) n.printraw(sb.p(' '));
    return sb;
  }
  @Override public String toString() { return printraw(new SB()).toString(); }
}
