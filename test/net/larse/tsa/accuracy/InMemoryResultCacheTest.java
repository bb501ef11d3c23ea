package net.larse.tsa.accuracy;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.time.Duration;
import java.time.Instant;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class InMemoryResultCacheTest {
  private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
  private final InMemoryResultCache<String> cache = new InMemoryResultCache<>(clock);

  @Test
  public void testEntryExpires() {
    cache.put("k", "v", Duration.ofMinutes(5));
    clock.advance(Duration.ofMinutes(4));
    assertEquals("v", cache.get("k"));
    clock.advance(Duration.ofMinutes(1));
    assertNull(cache.get("k"));
    assertEquals(0, cache.size());
  }

  @Test
  public void testExpiredEntriesAreEvictedWithoutBeingRead() {
    for (int i = 0; i < 10_000; i++) {
      cache.put("report:m" + i + ":PT720H", "r" + i, Duration.ofMinutes(5));
    }
    clock.advance(Duration.ofDays(1));
    cache.put("report:fresh:PT720H", "fresh", Duration.ofMinutes(5));
    assertEquals(1, cache.size());
    assertEquals("fresh", cache.get("report:fresh:PT720H"));
  }

  @Test
  public void testPutRenewsTtl() {
    cache.put("k", "v1", Duration.ofMinutes(5));
    clock.advance(Duration.ofMinutes(4));
    cache.put("k", "v2", Duration.ofMinutes(5));
    clock.advance(Duration.ofMinutes(4));
    assertEquals("v2", cache.get("k"));
  }

  @Test
  public void testMaximumSizeIsEnforced() {
    InMemoryResultCache<String> small = new InMemoryResultCache<>(clock, 2);
    small.put("a", "1", Duration.ofMinutes(5));
    small.put("b", "2", Duration.ofMinutes(5));
    small.put("c", "3", Duration.ofMinutes(5));
    assertEquals(2, small.size());
  }

  @Test
  public void testInvalidate() {
    cache.put("k", "v", Duration.ofMinutes(5));
    cache.invalidate("k");
    assertNull(cache.get("k"));
  }

  @Test
  public void testMissingKey() {
    assertNull(cache.get("nope"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testZeroTtlRejected() {
    cache.put("k", "v", Duration.ZERO);
  }
}
