package com.cliffc.sym.archive;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * Unsigned variable-length integers, 7 bits per byte, least significant group
 * first.  Every byte but the last has its top bit set.
 * <pre>
 *   0x00           =      0
 *   0x7f           =    127
 *   0x80 0x01      =    128
 *   0xff 0x7f      =  16383
 *   0x80 0x80 0x01 =  16384
 * </pre>
 */
public abstract class Varint {
  public static void write( OutputStream os, long val ) throws IOException {
    if( val < 0 ) throw new IllegalArgumentException("varint must be unsigned: "+val);
    while( val >= 0x80 ) {
      os.write((int)(val & 0x7f) | 0x80);
      val >>>= 7;
    }
    os.write((int)val);
  }

  // Up to 63 bits; longer encodings are corrupt
  public static long read( InputStream is ) throws IOException {
    long ret = 0;
    int shift = 0;
    int b;
    do {
      b = is.read();
      if( b == -1 ) throw ArchiveErr.truncated("varint");
      if( shift > 63 || (shift > 56 && (b & 0x7f) > (0x7f >> (shift-56))) )
        throw new ArchiveErr(ArchiveErr.Kind.VARINT_OVERFLOW,"varint does not fit in 63 bits");
      ret |= (long)(b & 0x7f) << shift;
      shift += 7;
    } while( (b & 0x80) != 0 );
    return ret;
  }

  // For counts and ids, which must fit an int
  public static int read_int( InputStream is, String what ) throws IOException {
    long l = read(is);
    if( l > Integer.MAX_VALUE )
      throw new ArchiveErr(ArchiveErr.Kind.VARINT_OVERFLOW,what+" "+l+" too large");
    return (int)l;
  }

  public static byte[] encode( long val ) {
    ByteArrayOutputStream bos = new ByteArrayOutputStream(10);
    try { write(bos,val); }
    catch( IOException e ) { throw new UncheckedIOException(e); }
    return bos.toByteArray();
  }
  public static long decode( byte[] bs ) {
    try { return read(new ByteArrayInputStream(bs)); }
    catch( IOException e ) { throw new UncheckedIOException(e); }
  }
}
