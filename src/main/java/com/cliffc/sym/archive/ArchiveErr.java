package com.cliffc.sym.archive;

// Recoverable archive failure.  The Kind says what went wrong; NOT_FOUND is a
// lookup miss and everything else is a malformed or unsupported archive.
// The failing call is abandoned, the Archive itself stays usable.
public class ArchiveErr extends RuntimeException {

  public enum Kind {
    NOT_FOUND,                  // Named/indexed expression not in the archive
    BAD_SIGNATURE,              // Not "GARC"
    BAD_VERSION,                // Outside the supported version range
    TRUNCATED,                  // Stream ended early
    VARINT_OVERFLOW,            // Varint too long for its field
    BAD_PROPERTY_TYPE,          // Property type tag not one of PType
    ATOM_RANGE,                 // Atom id past the atom table
    NODE_RANGE,                 // Node id past the node table, or not an earlier node
    MISSING_PROPERTY,           // Required property absent
    UNKNOWN_CLASS,              // No unarchiver registered for the class name
    BAD_VALUE,                  // Property present but unusable
  }

  public final Kind _kind;

  public ArchiveErr( Kind kind, String msg ) {
    super(msg);
    _kind = kind;
  }
  public ArchiveErr( Kind kind, String msg, Throwable cause ) {
    super(msg,cause);
    _kind = kind;
  }

  public boolean is_not_found() { return _kind==Kind.NOT_FOUND; }

  public static ArchiveErr not_found( String what ) {
    return new ArchiveErr(Kind.NOT_FOUND,what+" not found in archive");
  }
  public static ArchiveErr truncated( String what ) {
    return new ArchiveErr(Kind.TRUNCATED,"archive truncated while reading "+what);
  }
  public static ArchiveErr atom_range( long id, int len ) {
    return new ArchiveErr(Kind.ATOM_RANGE,"atom id "+id+" out of range, archive has "+len+" atoms");
  }
  public static ArchiveErr node_range( long id, int len ) {
    return new ArchiveErr(Kind.NODE_RANGE,"node id "+id+" out of range, archive has "+len+" nodes");
  }
  public static ArchiveErr missing( ArchiveNode n, String prop ) {
    return new ArchiveErr(Kind.MISSING_PROPERTY,"archive node "+n._id+" has no property '"+prop+"'");
  }
  public static ArchiveErr bad_value( ArchiveNode n, String prop, String value ) {
    return new ArchiveErr(Kind.BAD_VALUE,"archive node "+n._id+" has a bad '"+prop+"': "+value);
  }
  public static ArchiveErr bad_value( ArchiveNode n, String prop, String value, Throwable cause ) {
    return new ArchiveErr(Kind.BAD_VALUE,"archive node "+n._id+" has a bad '"+prop+"': "+value,cause);
  }
}
