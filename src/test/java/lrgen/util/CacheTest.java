package lrgen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class CacheTest {

	@Test
	public void testLeastRecentlyUsedIsEvicted(){
		Cache<String, Integer> cache = new Cache<>(2);
		String a = "a", b = "b", c = "c";
		cache.put(a, 1);
		cache.put(b, 2);
		assertEquals(Integer.valueOf(1), cache.getIfPresent(a));
		cache.put(c, 3);
		assertEquals(2, cache.size());
		assertNull(cache.getIfPresent(b));
		assertEquals(Integer.valueOf(1), cache.getIfPresent(a));
		assertEquals(Integer.valueOf(3), cache.getIfPresent(c));
	}

	@Test
	public void testKeysAreComparedByIdentity(){
		Cache<String, Integer> cache = new Cache<>(2);
		String key = "key";
		cache.put(key, 1);
		assertNull(cache.getIfPresent(new String(key)));
		assertEquals(1, cache.size());
	}

	@Test
	public void testZeroSizeKeepsNothing(){
		Cache<String, Integer> cache = new Cache<>(0);
		cache.put("a", 1);
		assertEquals(0, cache.size());
		assertThrows(IllegalArgumentException.class, () -> new Cache<String, Integer>(-1));
	}
}
