package com.cliffc.sym.expr;

import com.cliffc.sym.SymProperties;
import com.cliffc.sym.archive.Archive;
import com.cliffc.sym.util.SB;
import org.junit.After;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Random;

import static org.junit.Assert.*;

// Canonical form of sums and products: however a sum or product is built, the
// result is the one sorted, duplicate-free pair sequence.
public class TestCanonical {
  private static final Symbol X = Symbol.make("x"), Y = Symbol.make("y"), Z = Symbol.make("z");
  private static final Ex x = X.ex(), y = Y.ex(), z = Z.ex();

  @After public void reset() { SymProperties.refresh(); }

  @Test public void testAddSelf() {
    // x+x is 2*x
    Ex e = x.add(x);
    assertTrue(e.is_mul());
    assertTrue(e.is_equal(x.mul(2)));
    assertEquals("2*x",e.toString());

    // Inside a larger sum, the pair is (x,2)
    Ex s = Add.make(x,x,y);
    Add a = (Add)s._bp;
    assertEquals(2,a.num_pairs());
    assertSame(x,a.pair(0)._rest);
    assertTrue(a.pair(0)._coeff.is_equal(Ex.TWO));
    assertSame(y,a.pair(1)._rest);
    assertTrue(a.pair(1)._coeff.is_one());
    assertTrue(a.overall_coeff().is_zero());
  }

  @Test public void testCancel() {
    // x + (-1)*x collapses to the neutral coefficient
    assertTrue(Add.make(x,Mul.make(Ex.MINUS_ONE,x)).is_zero());
    assertTrue(x.sub(x).is_zero());
    // (x+y) - x is just y
    assertSame(y,x.add(y).sub(x));
    // -(x+y) distributes against x+y
    Ex s = x.add(y);
    assertTrue(s.add(s.neg()).is_zero());
    // x * x^-1 is 1
    assertTrue(x.mul(x.pow(-1)).is_one());
  }

  @Test public void testMerge() {
    // Both sides already sums: linear merge
    Ex e = x.add(y).add(y.add(z));
    Add a = (Add)e._bp;
    assertEquals(3,a.num_pairs());
    assertTrue(a.is_sorted());
    assertSame(x,a.pair(0)._rest);
    assertSame(y,a.pair(1)._rest);
    assertTrue(a.pair(1)._coeff.is_equal(Ex.TWO));
    assertSame(z,a.pair(2)._rest);
    assertEquals("x+2*y+z",e.toString());

    // Overall coefficients combine, and vanish when they cancel
    Ex f = x.add(1).add(y.add(-1));
    assertTrue(f.is_add());
    assertTrue(((Add)f._bp).overall_coeff().is_zero());
    assertEquals("x+y",f.toString());

    // Products merge exponents
    Ex p = x.mul(y).mul(x.mul(z));
    assertTrue(p.is_equal(Mul.make(x.pow(2),y,z)));
  }

  @Test public void testNumericFolding() {
    Ex e = Mul.make(Ex.TWO,Ex.of(3),x);
    Mul m = (Mul)e._bp;
    assertTrue(m.overall_coeff().is_equal(Ex.of(6)));
    assertEquals(1,m.num_pairs());
    assertEquals("6*x",e.toString());

    // sqrt(2) stays a numeric pair, sorted after the symbols
    Ex r2 = Power.make(Ex.TWO,Ex.HALF);
    Ex p = Mul.make(r2,x);
    Mul pm = (Mul)p._bp;
    assertEquals(2,pm.num_pairs());
    assertSame(x,pm.pair(0)._rest);
    assertTrue(pm.pair(1).is_numeric());
    // ... until it squares out
    assertTrue(r2.mul(r2).is_equal(Ex.TWO));
    assertTrue(Mul.make(r2,r2,x).is_equal(x.mul(2)));

    // Zero annihilates a product
    assertTrue(x.mul(y).mul(0).is_zero());
  }

  // A number times a bare sum distributes, however the product is reached
  @Test public void testDistribute() {
    Ex s = x.add(y);
    Ex d = s.mul(2);
    assertTrue(d.is_add());
    assertTrue(d.is_equal(x.mul(2).add(y.mul(2))));
    assertEquals("2*x+2*y",d.toString());
    Ex a = s.add(1).mul(3);
    assertEquals("3*x+3*y+3",a.toString());
    assertTrue(a.add(z).sub(z).is_equal(a));
    assertTrue(d.mul(Ex.HALF).is_equal(s));
    assertTrue(Mul.make(Ex.TWO,Ex.of(3),s).is_equal(s.mul(6)));
    // A power of a sum is a factor, not a sum
    assertTrue(s.pow(2).mul(2).is_mul());
  }

  // Non-integer powers of products and powers stay single factors
  @Test public void testFractionalPowerFactors() {
    Ex r = x.mul(y).pow(Ex.HALF);
    Ex q = x.pow(2).pow(Ex.HALF);
    assertTrue(r.is_power());
    assertTrue(q.is_power());
    for( Ex f : new Ex[]{r,q} ) {
      Ex p = f.mul(z);
      Mul m = (Mul)p._bp;
      assertEquals(2,m.num_pairs());
      assertTrue(m.is_canonical());
      Ex p2 = Archive.from_bytes(new Archive(p,"p").to_bytes()).unarchive_ex("p",X,Y,Z);
      assertTrue(p.is_equal(p2));
    }
    // Exponents that add up to an integer split back out
    assertTrue(r.mul(r).is_equal(x.mul(y)));
    assertTrue(q.mul(q).is_equal(x.pow(2)));
    Ex rz = r.mul(z);
    assertTrue(rz.mul(rz).is_equal(Mul.make(x,y,z.pow(2))));
    assertTrue(r.mul(x.mul(y).pow(Ex.of(3,2))).is_equal(x.pow(2).mul(y.pow(2))));
  }

  // Every construction order gives the same expression, down to the archive bytes
  @Test public void testDeterminism() {
    Symbol[] syms = new Symbol[8];
    ArrayList<Ex> terms = new ArrayList<>();
    for( int i=0; i<syms.length; i++ ) {
      syms[i] = Symbol.make("v"+i);
      terms.add(syms[i].ex().mul(i+1));
      terms.add(syms[i].ex().pow(2));
    }
    terms.add(Ex.of(7));
    Ex e0 = Add.make(terms.toArray(new Ex[0]));
    byte[] b0 = new Archive(e0,"e").to_bytes();

    Random rnd = new Random(1234);
    for( int k=0; k<10; k++ ) {
      Collections.shuffle(terms,rnd);
      Ex e1 = Add.make(terms.toArray(new Ex[0]));
      // Also by repeated binary adds
      Ex e2 = Ex.ZERO;
      for( Ex t : terms ) e2 = e2.add(t);
      for( Ex e : new Ex[]{e1,e2} ) {
        assertTrue(e0.is_equal(e));
        assertEquals(0,e0.compare(e));
        assertEquals(e0.gethash(),e.gethash());
        assertEquals(e0.toString(),e.toString());
        assertArrayEquals(b0,new Archive(e,"e").to_bytes());
      }
    }
  }

  @Test public void testIdempotent() {
    Ex e = Add.make(x.mul(3),y.pow(2),Mul.make(x,y,z),Ex.of(5));
    // Rebuilding from its own operands gives the same thing
    Ex[] ops = new Ex[e.nops()];
    for( int i=0; i<ops.length; i++ ) ops[i] = e.op(i);
    Ex e2 = Add.make(ops);
    assertTrue(e.is_equal(e2));
    assertEquals(e.toString(),e2.toString());
    // Identity map changes nothing, not even the node
    assertSame(e,e.map(o -> o));
    // Canonical inputs pass straight through
    Add a = (Add)e._bp;
    assertTrue(a.is_canonical());
    assertTrue(Add.make(a.seq(),a._coeff).is_equal(e));
    assertTrue(a.is_evaluated());
    String tree = a.printtree(new SB()).toString();
    assertTrue(tree.startsWith("add #"));
    assertTrue(tree.contains("symbol #"));
  }

  // The hash-combine path must give exactly what sort-and-merge gives
  @Test public void testHashMatchesSort() {
    Symbol[] syms = new Symbol[40];
    for( int i=0; i<syms.length; i++ ) syms[i] = Symbol.make(String.format("s%02d",i));
    // Descending order, and every symbol twice, so combining has work to do
    Ex[] terms = new Ex[syms.length*2];
    for( int i=0; i<syms.length; i++ ) {
      Ex s = syms[syms.length-1-i].ex();
      terms[i] = s;
      terms[syms.length+i] = s.mul(i);
    }

    SymProperties.hashCombineMin(1000);
    Ex sorted = Add.make(terms);
    assertTrue(((Add)sorted._bp).is_sorted());

    SymProperties.hashCombineMin(2);
    Ex hashed = Add.make(terms);
    Add h = (Add)hashed._bp;
    assertFalse(h.is_sorted());
    // Hash and equality do not need the order
    assertEquals(sorted.gethash(),hashed.gethash());
    assertTrue(h.is_canonical());
    assertFalse(h.is_sorted());
    assertTrue(sorted.is_equal(hashed));
    assertTrue(h.is_sorted());
    assertEquals(sorted.toString(),hashed.toString());
    assertEquals(syms.length,h.num_pairs());
    // s39 appears as s39 + 0*s39, coefficient 1
    assertSame(syms[39].ex(),h.pair(39)._rest);
    assertTrue(h.pair(39)._coeff.is_one());

    // Same for products
    Ex[] facs = new Ex[syms.length];
    for( int i=0; i<syms.length; i++ ) facs[i] = syms[syms.length-1-i].ex().pow(i+1);
    SymProperties.hashCombineMin(1000);
    Ex p0 = Mul.make(facs);
    SymProperties.hashCombineMin(2);
    Ex p1 = Mul.make(facs);
    assertTrue(p0.is_equal(p1));
    assertEquals(p0.toString(),p1.toString());
  }

  @Test public void testIdentityCompare() {
    Ex big = Ex.ZERO;
    for( int i=0; i<50; i++ ) big = big.add(Symbol.make("t"+i).ex().pow(i+1));
    assertEquals(0,big.compare(big));
    assertTrue(big.is_equal(big));
    // Structural equality without shared nodes
    Ex s0 = x.add(y), s1 = y.add(x);
    assertNotSame(s0._bp,s1._bp);
    assertEquals(0,s0.compare(s1));
    assertEquals(s0,s1);
    assertEquals(s0.hashCode(),s1.hashCode());
  }

  @Test public void testOrdering() {
    // Kinds order by tag, numbers first
    assertTrue(Ex.of(100).compare(x) < 0);
    assertTrue(x.compare(Constant.PI) < 0);
    assertTrue(x.pow(2).compare(x.add(y)) < 0);
    // Same-named symbols are still distinct
    Ex x2 = Symbol.make("x").ex();
    assertFalse(x.is_equal(x2));
    assertNotEquals(0,x.compare(x2));
    Ex s = x.add(x2);
    assertEquals(2,((Add)s._bp).num_pairs());
    // Numbers compare by value
    assertTrue(Ex.of(1,3).compare(Ex.HALF) < 0);
    assertTrue(Ex.of(-2).compare(Ex.ZERO) < 0);
  }
}
