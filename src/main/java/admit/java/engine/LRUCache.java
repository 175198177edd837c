package admit.java.engine;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Size-bounded, access-ordered map used to hold per-key limiters.
 *
 * Once more than {@code maxSize} keys are present the least recently accessed one is
 * dropped and reported to the eviction callback. All operations are synchronized.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Invoked with each evicted entry (can be null)
     */
    LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;

        // accessOrder=true: get() moves the entry to the tail
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LRUCache.this.maxSize;
                if (evict && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue());
                }
                return evict;
            }
        };
    }

    /**
     * Returns the value for the key, creating and inserting it atomically when absent.
     * Either way the entry becomes the most recently used one.
     */
    synchronized V getOrCreate(K key, Function<? super K, ? extends V> factory) {
        V existing = map.get(key);
        if (existing != null) {
            return existing;
        }
        V created = factory.apply(key);
        map.put(key, created);
        return created;
    }

    synchronized boolean containsKey(K key) {
        return map.containsKey(key);
    }

    synchronized int size() {
        return map.size();
    }

    /**
     * Drops every entry without invoking the eviction callback.
     */
    synchronized void clear() {
        map.clear();
    }

    int maxSize() {
        return maxSize;
    }
}
