package com.onthegomap.styleexpr.value;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ValueTest {

  @Test
  void testFromScalars() {
    assertEquals(Value.of("abc"), Value.from("abc"));
    assertEquals(Value.of(1d), Value.from(1));
    assertEquals(Value.of(1d), Value.from(1L));
    assertEquals(Value.of(1.5), Value.from(1.5f));
    assertSame(Value.TRUE, Value.from(true));
    assertEquals(Value.of(Color.WHITE), Value.from(Color.WHITE));
    Value existing = Value.of("x");
    assertSame(existing, Value.from(existing));
  }

  @Test
  void testFromNull() {
    assertThrows(IllegalArgumentException.class, () -> Value.from(null));
  }

  @Test
  void testCollectionsBecomeOpaque() {
    var array = assertInstanceOf(Value.OpaqueVal.class, Value.from(List.of(1, 2)));
    assertEquals(Value.ARRAY_TYPE, array.typeName());
    assertEquals(List.of(1d, 2d), array.payload());
    assertTrue(array.isNumericArray());

    var object = assertInstanceOf(Value.OpaqueVal.class, Value.from(Map.of("a", 1)));
    assertEquals(Value.OBJECT_TYPE, object.typeName());
    assertEquals(Map.of("a", 1d), object.payload());
    assertFalse(object.isNumericArray());
  }

  @Test
  void testOpaqueNormalizesNumbers() {
    assertEquals(Value.from(List.of(1, 2L)), Value.from(List.of(1.0, 2.0)));
    assertNotEquals(Value.from(List.of(1, 2)), Value.from(List.of(1, 3)));
    assertFalse(Value.array(Arrays.asList(1, null)).isNumericArray());
  }

  @Test
  void testOpaqueIsCopied() {
    List<Object> list = new ArrayList<>(List.of(1, 2));
    var value = Value.array(list);
    list.add(3);
    assertEquals(List.of(1d, 2d), value.payload());
    assertThrows(UnsupportedOperationException.class, () -> ((List<?>) value.payload()).clear());
  }

  @Test
  void testOtherObjectsAreTaggedWithTheirClass() {
    record Blob(int id) {}
    var value = assertInstanceOf(Value.OpaqueVal.class, Value.from(new Blob(1)));
    assertEquals("Blob", value.typeName());
    assertEquals(new Blob(1), value.unwrap());
  }

  @Test
  void testTypeNames() {
    assertEquals("string", Value.of("").typeName());
    assertEquals("number", Value.of(1).typeName());
    assertEquals("boolean", Value.of(false).typeName());
    assertEquals("color", Value.of(Color.BLACK).typeName());
  }
}
