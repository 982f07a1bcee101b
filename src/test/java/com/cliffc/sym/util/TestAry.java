package com.cliffc.sym.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestAry {
  @Test public void testPushSort() {
    Ary<String> ary = new Ary<>(new String[0],0);
    ary.push("c").push("a").push("b");
    assertEquals(3,ary.len());
    ary.sort_update(String::compareTo);
    assertArrayEquals(new String[]{"a","b","c"},ary.asAry());
    assertEquals("{a,b,c}",ary.toString());
    StringBuilder sb = new StringBuilder();
    for( String s : ary ) sb.append(s);
    assertEquals("abc",sb.toString());
    assertThrows(ArrayIndexOutOfBoundsException.class, () -> ary.at(3));
    ary.clear();
    assertEquals(0,ary.len());
  }

  @Test public void testHash() {
    // Never zero, and order matters for the two-hash mix
    assertNotEquals(0,Util.nonzero(0));
    assertNotEquals(Util.mix_hash(1,2),Util.mix_hash(2,1));
    assertEquals(Util.mix_hash(3,4,5),Util.mix_hash(3,4,5));
  }
}
