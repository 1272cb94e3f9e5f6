package com.onthegomap.styleexpr.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import org.junit.jupiter.api.Test;

class TryTest {

  @Test
  void testSuccess() {
    var result = Try.apply(() -> 1);
    assertEquals(Try.success(1), result);
    assertEquals(1, result.get());
    assertEquals(2, result.map(i -> i + 1).get());
    assertEquals(1, result.orElseGet(e -> 2));
  }

  @Test
  void testFailure() {
    var exception = new IllegalStateException();
    Try<Integer> result = Try.apply(() -> {
      throw exception;
    });
    assertTrue(result.isFailure());
    assertEquals(Try.failure(exception), result);
    assertEquals(2, result.orElseGet(e -> 2));
    assertThrows(IllegalStateException.class, result::get);
    assertTrue(result.map(i -> i + 1).isFailure());
  }

  @Test
  void testCheckedExceptionIsWrapped() {
    Try<Integer> result = Try.apply(() -> {
      throw new IOException("boom");
    });
    assertInstanceOf(IOException.class, result.exception());
    assertThrows(UncheckedIOException.class, result::get);
  }
}
