package com.cliffc.sym.archive;

import com.cliffc.sym.expr.*;
import org.jctools.maps.NonBlockingHashMap;

// Class name to unarchiver.  The class name written in each archive node is
// the stable wire contract; new expression kinds register their own.
public abstract class Registrar {
  @FunctionalInterface
  public interface Unarchiver {
    Ex unarchive( ArchiveNode n, Symbol[] syms );
  }

  private static final NonBlockingHashMap<String,Unarchiver> UNARCHIVERS = new NonBlockingHashMap<>();
  static {
    register(Num         .CLZ, Num         ::unarchive);
    register(Symbol      .CLZ, Symbol      ::unarchive);
    register(Constant    .CLZ, Constant    ::unarchive);
    register(Power       .CLZ, Power       ::unarchive);
    register(Add         .CLZ, Add         ::unarchive);
    register(Mul         .CLZ, Mul         ::unarchive);
    register(FunctionCall.CLZ, FunctionCall::unarchive);
    register(Matrix      .CLZ, Matrix      ::unarchive);
  }

  // Returns the unarchiver replaced, if any
  public static Unarchiver register( String clz, Unarchiver u ) { return UNARCHIVERS.put(clz,u); }
  public static Unarchiver find( String clz ) { return UNARCHIVERS.get(clz); }
}
