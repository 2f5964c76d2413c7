package works.jsonkeep.util;

import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A concurrent map that compares keys by identity and holds them weakly.
 * <p>
 * An entry disappears once its key is no longer strongly reachable from elsewhere.
 * For that to work, values must not refer to their keys.
 * <p>
 * Unlike {@link java.util.WeakHashMap}, two keys that are {@link Object#equals equal}
 * but distinct get separate entries, which is what we need for mutable values
 * whose equality changes as they are edited.
 */
public final class WeakIdentityMap<K, V> {
	private final ConcurrentHashMap<Object, V> entries = new ConcurrentHashMap<>();
	private final ReferenceQueue<K> referenceQueue = new ReferenceQueue<>();

	/**
	 * @return the previous value for <code>key</code>, or null if there was none
	 */
	public @Nullable V put(@NotNull K key, @NotNull V value) {
		requireNonNull(key);
		requireNonNull(value);
		expungeStaleEntries();
		return entries.put(new WeakKey<>(key, referenceQueue), value);
	}

	public @Nullable V get(@Nullable Object key) {
		expungeStaleEntries();
		if (key == null) {
			return null;
		}
		return entries.get(new LookupKey(key));
	}

	public boolean containsKey(@Nullable Object key) {
		return get(key) != null;
	}

	public @Nullable V remove(@Nullable Object key) {
		expungeStaleEntries();
		if (key == null) {
			return null;
		}
		return entries.remove(new LookupKey(key));
	}

	/**
	 * @return the number of entries whose keys have not yet been found to be unreachable.
	 * Keys that have been collected but not yet enqueued by the garbage collector
	 * are still counted.
	 */
	public int size() {
		expungeStaleEntries();
		return entries.size();
	}

	private void expungeStaleEntries() {
		Object stale = referenceQueue.poll();
		while (stale != null) {
			entries.remove(stale);
			stale = referenceQueue.poll();
		}
	}

	/**
	 * The stored form of a key.
	 * Once cleared, it is only equal to itself, which is enough to remove it.
	 */
	private static final class WeakKey<K> extends WeakReference<K> {
		private final int hash;

		WeakKey(K referent, ReferenceQueue<K> queue) {
			super(referent, queue);
			this.hash = System.identityHashCode(referent);
		}

		@Override
		public int hashCode() {
			return hash;
		}

		@Override
		public boolean equals(Object obj) {
			if (this == obj) {
				return true;
			}
			Object referent = get();
			if (referent == null) {
				return false;
			}
			if (obj instanceof WeakKey<?> other) {
				return referent == other.get();
			} else if (obj instanceof LookupKey other) {
				return referent == other.referent;
			} else {
				return false;
			}
		}
	}

	/**
	 * A short-lived strong key used only to probe the map.
	 */
	private static final class LookupKey {
		private final Object referent;

		LookupKey(Object referent) {
			this.referent = referent;
		}

		@Override
		public int hashCode() {
			return System.identityHashCode(referent);
		}

		@Override
		public boolean equals(Object obj) {
			if (obj instanceof LookupKey other) {
				return referent == other.referent;
			} else if (obj instanceof WeakKey<?> other) {
				return referent == other.get();
			} else {
				return false;
			}
		}
	}
}
