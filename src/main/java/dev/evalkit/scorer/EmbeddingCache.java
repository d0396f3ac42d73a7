package dev.evalkit.scorer;

import dev.evalkit.EvalKitUtils;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * LRU cache of embedding vectors keyed by a hash of (model, text).
 *
 * <p>Owned by a single scorer instance. When the cache exceeds its capacity, the least recently
 * used vector is evicted. A disabled cache stores nothing and always computes. Callers get their
 * own copy of a vector.
 */
@ThreadSafe
public final class EmbeddingCache {
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final int maxSize;
    private final boolean enabled;
    private final Map<String, double[]> cache;
    private long hits;
    private long misses;

    public EmbeddingCache(int maxSize, boolean enabled) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.enabled = enabled;
        this.cache =
                new LinkedHashMap<>(Math.min(maxSize, 64), 0.75f, true) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<String, double[]> eldest) {
                        return size() > EmbeddingCache.this.maxSize;
                    }
                };
    }

    public static String key(String model, String text) {
        return EvalKitUtils.sha256Hex(model + "\u0000" + text);
    }

    @Nullable
    public synchronized double[] get(String model, String text) {
        var cached = enabled ? cache.get(key(model, text)) : null;
        return cached == null ? null : cached.clone();
    }

    /**
     * Returns the cached vector or computes and stores it.
     *
     * <p>The supplier runs outside the lock. Two workers missing on the same key may both compute;
     * the later write wins.
     */
    public double[] getOrCompute(String model, String text, Supplier<double[]> supplier) {
        if (!enabled) {
            return supplier.get();
        }
        var key = key(model, text);
        synchronized (this) {
            var cached = cache.get(key);
            if (cached != null) {
                hits++;
                return cached.clone();
            }
            misses++;
        }
        var computed = supplier.get();
        synchronized (this) {
            cache.put(key, computed.clone());
        }
        return computed;
    }

    public boolean enabled() {
        return enabled;
    }

    public synchronized int size() {
        return cache.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized void clear() {
        cache.clear();
    }
}
