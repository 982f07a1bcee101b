package com.cliffc.sym.expr;

import org.junit.Test;

import static org.junit.Assert.*;

public class TestPower {
  private static final Ex x = Symbol.make("x").ex(), y = Symbol.make("y").ex();

  @Test public void testTrivialExponents() {
    Ex s = x.add(y);
    assertTrue(s.pow(0).is_one());
    assertSame(s,s.pow(1));
    assertTrue(Ex.ONE.pow(x).is_one());
    assertTrue(Power.make(Ex.ONE,Ex.HALF).is_one());
    assertTrue(Ex.ZERO.pow(3).is_zero());
    assertTrue(Ex.ZERO.pow(Ex.HALF).is_zero());
  }

  @Test public void testNumeric() {
    assertTrue(Ex.TWO.pow(10).is_equal(Ex.of(1024)));
    assertTrue(Ex.HALF.pow(-2).is_equal(Ex.of(4)));
    assertTrue(Ex.of(-3).pow(3).is_equal(Ex.of(-27)));
    assertTrue(Ex.of(2,3).pow(2).is_equal(Ex.of(4,9)));
    // Fractional exponents of numbers stay symbolic
    Ex r = Ex.TWO.pow(Ex.HALF);
    assertTrue(r.is_power());
    assertEquals("2^(1/2)",r.toString());
    assertThrows(ArithmeticException.class, () -> Ex.ZERO.pow(-1));
  }

  @Test public void testNested() {
    // (x^2)^3 == x^6
    assertTrue(x.pow(2).pow(3).is_equal(x.pow(6)));
    // (2*x*y^2)^2 == 4*x^2*y^4
    Ex m = Mul.make(Ex.TWO,x,y.pow(2));
    Ex p = m.pow(2);
    assertTrue(p.is_mul());
    assertTrue(p.is_equal(Mul.make(Ex.of(4),x.pow(2),y.pow(4))));
    // Symbolic exponents do not distribute
    Ex q = m.pow(y);
    assertTrue(q.is_power());
    Power pw = (Power)q._bp;
    assertSame(m,pw._basis);
    assertSame(y,pw._exponent);
  }

  @Test public void testProducts() {
    // Powers of the same base multiply by adding exponents
    assertTrue(x.pow(2).mul(x.pow(3)).is_equal(x.pow(5)));
    assertTrue(x.pow(y).mul(x).is_equal(x.pow(y.add(1))));
    assertTrue(x.pow(y).mul(x.pow(y.neg())).is_one());
    // Division is multiplication by the inverse
    assertTrue(x.pow(3).div(x).is_equal(x.pow(2)));
    assertTrue(x.mul(6).div(Ex.of(4)).is_equal(x.mul(Ex.of(3,2))));
  }

  @Test public void testPrint() {
    assertEquals("(x+y)^5",x.add(y).pow(5).toString());
    assertEquals("x^2",x.pow(2).toString());
    assertEquals("x^(-1)",x.pow(-1).toString());
    assertEquals("2*x+3",x.mul(2).add(3).toString());
    assertEquals("x*y^2",x.mul(y.pow(2)).toString());
  }
}
