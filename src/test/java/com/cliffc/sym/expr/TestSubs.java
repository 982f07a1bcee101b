package com.cliffc.sym.expr;

import org.junit.Test;

import java.util.HashMap;

import static org.junit.Assert.*;

// Substitution, degrees and coefficient extraction
public class TestSubs {
  private static final Symbol X = Symbol.make("x"), Y = Symbol.make("y");
  private static final Ex x = X.ex(), y = Y.ex();

  @Test public void testSubs() {
    Ex e = x.add(y).pow(2);
    assertTrue(e.subs(x,Ex.ONE).is_equal(y.add(1).pow(2)));
    // Substitution re-canonicalizes: x+y with x->y is 2*y
    assertTrue(x.add(y).subs(x,y).is_equal(y.mul(2)));
    // Untouched expressions come back as the same node
    assertSame(e,e.subs(Symbol.make("z").ex(),Ex.ONE));

    HashMap<Ex,Ex> m = new HashMap<>();
    m.put(x,Ex.TWO);
    m.put(y,Ex.of(3));
    assertTrue(x.mul(y).add(1).subs(m).is_equal(Ex.of(7)));
    // Simultaneous, not sequential: x->y, y->x swaps
    m.clear();
    m.put(x,y);
    m.put(y,x);
    Ex f = x.sub(y.mul(2));
    assertTrue(f.subs(m).is_equal(y.sub(x.mul(2))));
  }

  @Test public void testHas() {
    Ex e = FunctionCall.make("f",x.add(y).pow(2),Constant.PI);
    assertTrue(e.has(x));
    assertTrue(e.has(Constant.PI));
    assertTrue(e.has(x.add(y)));
    assertFalse(e.has(Symbol.make("x").ex()));
  }

  @Test public void testDegree() {
    // 3*x^2 + 2*x + 5
    Ex p = Add.make(x.pow(2).mul(3),x.mul(2),Ex.of(5));
    assertEquals(2,p.degree(X));
    assertEquals(0,p.ldegree(X));
    assertEquals(0,p.degree(Y));
    // x^3*y + x*y^2
    Ex q = x.pow(3).mul(y).add(x.mul(y.pow(2)));
    assertEquals(3,q.degree(X));
    assertEquals(1,q.ldegree(X));
    assertEquals(2,q.degree(Y));
    assertEquals(1,q.ldegree(Y));
    assertEquals(-1,x.pow(-1).degree(X));
  }

  @Test public void testCoeff() {
    Ex p = Add.make(x.pow(2).mul(3),x.mul(2),Ex.of(5));
    assertTrue(p.coeff(X,2).is_equal(Ex.of(3)));
    assertTrue(p.coeff(X  ).is_equal(Ex.TWO));
    assertTrue(p.coeff(X,0).is_equal(Ex.of(5)));
    assertTrue(p.coeff(X,3).is_zero());
    // Coefficients may be expressions in other symbols
    Ex q = x.mul(y).add(x);
    assertTrue(q.coeff(X).is_equal(y.add(1)));
    assertTrue(q.coeff(X,0).is_zero());
    assertTrue(q.coeff(Y).is_equal(x));
    // A term free of x is its own constant coefficient
    assertSame(y,y.coeff(X,0));
  }

  @Test public void testContainers() {
    Ex f = FunctionCall.make("f",x,y);
    assertEquals(2,f.nops());
    assertSame(y,f.op(1));
    assertEquals("f(x,y)",f.toString());
    assertTrue(f.subs(x,y).is_equal(FunctionCall.make("f",y,y)));
    assertFalse(f.is_equal(FunctionCall.make("g",x,y)));

    Ex mx = Matrix.make(2,2,x,y,Ex.ONE,Ex.ZERO);
    assertEquals("[[x,y],[1,0]]",mx.toString());
    assertSame(y,((Matrix)mx._bp).at(0,1));
    assertTrue(mx.subs(y,x).is_equal(Matrix.make(2,2,x,x,Ex.ONE,Ex.ZERO)));
    assertThrows(IllegalArgumentException.class, () -> Matrix.make(2,2,x));
    assertThrows(IndexOutOfBoundsException.class, () -> ((Matrix)mx._bp).at(2,0));
  }
}
