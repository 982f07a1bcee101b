package com.cliffc.sym;

import org.junit.After;
import org.junit.Test;

import static org.junit.Assert.*;

public class TestSymProperties {
  @After public void reset() {
    System.clearProperty(SymProperties.HASH_COMBINE_MIN);
    System.clearProperty(SymProperties.CHECK_CANONICAL);
    SymProperties.refresh();
  }

  @Test public void testHashCombineMin() {
    SymProperties.refresh();
    if( System.getenv("SYM_HASH_COMBINE_MIN")==null )
      assertEquals(SymProperties.DEF_HASH_COMBINE_MIN,SymProperties.hashCombineMin());
    System.setProperty(SymProperties.HASH_COMBINE_MIN," 32 ");
    // Cached until refreshed
    SymProperties.refresh();
    assertEquals(32,SymProperties.hashCombineMin());
    System.setProperty(SymProperties.HASH_COMBINE_MIN,"64");
    assertEquals(32,SymProperties.hashCombineMin());
    SymProperties.refresh();
    assertEquals(64,SymProperties.hashCombineMin());
    // Programmatic override
    SymProperties.hashCombineMin(3);
    assertEquals(3,SymProperties.hashCombineMin());
    assertThrows(IllegalArgumentException.class, () -> SymProperties.hashCombineMin(0));
  }

  @Test public void testBadValues() {
    System.setProperty(SymProperties.HASH_COMBINE_MIN,"lots");
    SymProperties.refresh();
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, SymProperties::hashCombineMin);
    assertTrue(e.getMessage().contains(SymProperties.HASH_COMBINE_MIN));
    System.setProperty(SymProperties.HASH_COMBINE_MIN,"-4");
    assertThrows(IllegalArgumentException.class, SymProperties::hashCombineMin);

    System.setProperty(SymProperties.CHECK_CANONICAL,"maybe");
    assertThrows(IllegalArgumentException.class, SymProperties::checkCanonical);
    System.setProperty(SymProperties.CHECK_CANONICAL,"no");
    assertFalse(SymProperties.checkCanonical());
    System.setProperty(SymProperties.CHECK_CANONICAL,"TRUE");
    assertTrue(SymProperties.checkCanonical());
  }
}
