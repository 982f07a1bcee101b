package com.cliffc.sym;

/**
 * Process-wide tunables.  Each is read once from a JVM property, falling back to an
 * environment variable named after the property (upper-cased, dots and dashes become
 * underscores), falling back to a default.
 */
public class SymProperties {
  /* --- --- --- property names --- --- --- */
  public static final String HASH_COMBINE_MIN = "sym.hash-combine.min";
  public static final String CHECK_CANONICAL  = "sym.check-canonical";

  /* --- --- --- default values --- --- --- */
  public static final int DEF_HASH_COMBINE_MIN = 16;

  /* --- --- --- cached values --- --- --- */
  private static int CACHE_HASH_COMBINE_MIN = -1;

  interface Parser<T> { T parse(String source, String value); }

  static <T> T readProperty(String propertyName, T defaultValue, Parser<T> parser) {
    String source = "JVM property "+propertyName;
    String value = System.getProperty(propertyName);
    if( value == null ) {
      String envName = propertyName.toUpperCase().replace('.', '_').replace('-', '_');
      source = "Environment var "+envName;
      value = System.getenv(envName);
    }
    return value == null ? defaultValue : parser.parse(source, value);
  }

  static int readPositiveInt(String propertyName, int defaultValue) {
    return readProperty(propertyName, defaultValue, (src, val) -> {
      int i;
      try { i = Integer.parseInt(val.trim()); }
      catch( NumberFormatException e ) {
        throw new IllegalArgumentException(src+"="+val+" is not an integer", e);
      }
      if( i < 1 )
        throw new IllegalArgumentException(src+"="+val+" is not a positive integer");
      return i;
    });
  }

  static boolean readBoolean(String propertyName, boolean defaultValue) {
    return readProperty(propertyName, defaultValue, (src, val) -> {
      String v = val.trim().toLowerCase();
      if( v.equals("true" ) || v.equals("1") || v.equals("yes") ) return true;
      if( v.equals("false") || v.equals("0") || v.equals("no" ) ) return false;
      throw new IllegalArgumentException(src+"="+val+" is not a boolean");
    });
  }

  /**
   * Pair count at which {@code Add}/{@code Mul} construction switches from
   * sort-then-merge to hash-bucket combining.
   */
  public static int hashCombineMin() {
    int i = CACHE_HASH_COMBINE_MIN;
    if( i < 0 )
      CACHE_HASH_COMBINE_MIN = i = readPositiveInt(HASH_COMBINE_MIN, DEF_HASH_COMBINE_MIN);
    return i;
  }
  /** Override the hash-combine threshold for this process, e.g. from tests. */
  public static void hashCombineMin(int min) {
    if( min < 1 ) throw new IllegalArgumentException("hash-combine.min must be positive: "+min);
    CACHE_HASH_COMBINE_MIN = min;
  }
  /** Forget cached values, so the next read goes back to properties and environment. */
  public static void refresh() { CACHE_HASH_COMBINE_MIN = -1; }

  public static boolean checkCanonical() {
    boolean asserts = false;
    assert (asserts = true);
    return readBoolean(CHECK_CANONICAL, asserts);
  }
}
