package dev.dylanburati.chaintable;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BucketTest {
  private static String render(Bucket<String, Integer> b) {
    StringBuilder bldr = new StringBuilder();
    b.appendTo(bldr, false);
    return bldr.toString();
  }

  private static Bucket<String, Integer> abc() {
    Bucket<String, Integer> b = new Bucket<>();
    b.insert("a", 1);
    b.insert("b", 2);
    b.insert("c", 3);
    return b;
  }

  @Test void testEmpty() {
    Bucket<String, Integer> b = new Bucket<>();
    assertEquals(0, b.len());
    assertNull(b.get("a"));
    assertEquals("", render(b));
    assertFalse(b.appendTo(new StringBuilder(), false));
  }

  @Test void testInsertPrepends() {
    Bucket<String, Integer> b = abc();
    assertEquals(3, b.len());
    assertEquals("c=3, b=2, a=1", render(b));
  }

  @Test void testInsertOverwriteKeepsPosition() {
    Bucket<String, Integer> b = abc();
    b.insert("b", 20);
    assertEquals(3, b.len());
    assertEquals(20, b.get("b"));
    assertEquals("c=3, b=20, a=1", render(b));
  }

  @Test void testRemoveHead() {
    Bucket<String, Integer> b = abc();
    b.remove("c");
    assertEquals(2, b.len());
    assertNull(b.get("c"));
    assertEquals("b=2, a=1", render(b));
  }

  @Test void testRemoveMiddle() {
    Bucket<String, Integer> b = abc();
    b.remove("b");
    assertEquals(2, b.len());
    assertNull(b.get("b"));
    assertEquals("c=3, a=1", render(b));
  }

  @Test void testRemoveTail() {
    Bucket<String, Integer> b = abc();
    b.remove("a");
    assertEquals(2, b.len());
    assertNull(b.get("a"));
    assertEquals("c=3, b=2", render(b));
  }

  @Test void testRemoveAbsent() {
    Bucket<String, Integer> b = abc();
    b.remove("d");
    assertEquals(3, b.len());
    assertEquals("c=3, b=2, a=1", render(b));

    Bucket<String, Integer> empty = new Bucket<>();
    empty.remove("d");
    assertEquals(0, empty.len());
  }

  @Test void testRemoveAllThenReinsert() {
    Bucket<String, Integer> b = abc();
    b.remove("a");
    b.remove("b");
    b.remove("c");
    assertEquals(0, b.len());
    assertEquals("", render(b));
    b.insert("a", 4);
    assertEquals(1, b.len());
    assertEquals(4, b.get("a"));
  }

  @Test void testAppendToSeparator() {
    Bucket<String, Integer> b = new Bucket<>();
    b.insert("a", 1);
    StringBuilder bldr = new StringBuilder("x=0");
    assertTrue(b.appendTo(bldr, true));
    assertEquals("x=0, a=1", bldr.toString());
  }
}
