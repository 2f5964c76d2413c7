package works.jsonkeep.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeakIdentityMapTest {
	final WeakIdentityMap<Object, String> map = new WeakIdentityMap<>();

	@Test
	void equalKeys_distinctEntries() {
		List<Integer> first = new ArrayList<>(List.of(1, 2));
		List<Integer> second = new ArrayList<>(List.of(1, 2));
		map.put(first, "first");
		map.put(second, "second");

		assertEquals("first", map.get(first));
		assertEquals("second", map.get(second));
		assertNull(map.get(List.of(1, 2)));
		assertEquals(2, map.size());
	}

	@Test
	void mutatedKey_stillFound() {
		List<Integer> key = new ArrayList<>(List.of(1));
		map.put(key, "value");
		key.add(2);
		key.remove(0);
		assertEquals("value", map.get(key));
	}

	@Test
	void put_overwrites() {
		Object key = new Object();
		assertNull(map.put(key, "old"));
		assertEquals("old", map.put(key, "new"));
		assertEquals("new", map.get(key));
		assertEquals(1, map.size());
	}

	@Test
	void remove_works() {
		Object key = new Object();
		map.put(key, "value");
		assertEquals("value", map.remove(key));
		assertFalse(map.containsKey(key));
		assertNull(map.remove(key));
		assertEquals(0, map.size());
	}

	@Test
	void nullKey_absent() {
		assertNull(map.get(null));
		assertFalse(map.containsKey(null));
		assertNull(map.remove(null));
	}

	@Test
	void nullArguments_rejected() {
		assertThrows(NullPointerException.class, () -> map.put(null, "value"));
		assertThrows(NullPointerException.class, () -> map.put(new Object(), null));
	}

	@Test
	void unreachableKey_collected() throws InterruptedException {
		Object survivor = new Object();
		map.put(survivor, "survivor");
		putGarbage(100);
		assertEquals(101, map.size());

		for (int i = 0; i < 100 && map.size() > 1; i++) {
			System.gc();
			Thread.sleep(50);
		}
		assertThat("Unreachable keys are dropped", map.size(), lessThan(101));
		assertEquals("survivor", map.get(survivor));
	}

	private void putGarbage(int count) {
		for (int i = 0; i < count; i++) {
			map.put(new Object(), "garbage " + i);
		}
	}

	@Test
	void concurrentPuts_allVisible() throws Exception {
		int threads = 8;
		int perThread = 500;
		List<List<Object>> keysByThread = new ArrayList<>();
		for (int t = 0; t < threads; t++) {
			List<Object> keys = new ArrayList<>();
			for (int i = 0; i < perThread; i++) {
				keys.add(new Object());
			}
			keysByThread.add(keys);
		}

		ExecutorService executor = Executors.newFixedThreadPool(threads);
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (int t = 0; t < threads; t++) {
				List<Object> keys = keysByThread.get(t);
				String prefix = "t" + t + "-";
				futures.add(executor.submit(() -> {
					for (int i = 0; i < keys.size(); i++) {
						map.put(keys.get(i), prefix + i);
					}
				}));
			}
			for (Future<?> future : futures) {
				future.get(30, SECONDS);
			}
		} finally {
			executor.shutdown();
			assertTrue(executor.awaitTermination(30, SECONDS));
		}

		assertEquals(threads * perThread, map.size());
		for (int t = 0; t < threads; t++) {
			List<Object> keys = keysByThread.get(t);
			for (int i = 0; i < keys.size(); i++) {
				assertEquals("t" + t + "-" + i, map.get(keys.get(i)));
			}
		}
	}
}
