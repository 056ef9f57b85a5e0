package me.bechberger.dyntrace.symbolizer;

import java.util.HashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Caches the symbols of a single process (or the kernel), with generational eviction.
 * <p>
 * Every entry remembers the generation in which it was last accessed.
 * {@link #createNewGeneration()} closes the current generation and drops all entries that were not accessed
 * in it or in the previous one, so an entry lives one full generation past its last access.
 * The owning loop calls it once per sampling interval.
 * <p>
 * Not thread safe, calls have to be serialized by the caller.
 */
public class SymbolCache {

    private static final Logger logger = Logger.getLogger(SymbolCache.class.getName());

    public record LookupResult(String symbol, boolean hit) {
    }

    private static final class Entry {
        private final String symbol;
        private long generation;

        private Entry(String symbol, long generation) {
            this.symbol = symbol;
            this.generation = generation;
        }
    }

    private final UPID upid;
    private final SymbolResolver resolver;
    private final Map<Long, Entry> cache = new HashMap<>();
    private long generation = 0;
    /** number of entries accessed in the current generation */
    private int activeEntries = 0;

    public SymbolCache(UPID upid, SymbolResolver resolver) {
        this.upid = upid;
        this.resolver = resolver;
    }

    /**
     * Return the symbol for the address, resolving it on a miss.
     * Unresolved addresses are returned (and cached) as {@code 0x<address>}.
     */
    public LookupResult lookup(long address) {
        var entry = cache.get(address);
        if (entry != null) {
            if (entry.generation != generation) {
                entry.generation = generation;
                activeEntries++;
            }
            return new LookupResult(entry.symbol, true);
        }
        var symbol = SymbolResolver.symbolOrAddress(resolver.resolve(upid, address), address);
        cache.put(address, new Entry(symbol, generation));
        activeEntries++;
        return new LookupResult(symbol, false);
    }

    /**
     * Evict every entry not accessed in the current or the previous generation and start a new generation
     */
    public void createNewGeneration() {
        long previous = generation;
        int before = cache.size();
        cache.values().removeIf(e -> e.generation < previous);
        generation = previous + 1;
        activeEntries = 0;
        if (before != cache.size()) {
            logger.fine(() -> "Evicted " + (before - cache.size()) + " symbols of " + upid + ", " + cache.size() +
                    " left");
        }
    }

    /**
     * Number of cached entries
     */
    public int totalEntries() {
        return cache.size();
    }

    /**
     * Number of entries accessed in the current generation
     */
    public int activeEntries() {
        return activeEntries;
    }

    /**
     * Drop all entries, the generation stays
     */
    public void flush() {
        cache.clear();
        activeEntries = 0;
    }

    public UPID upid() {
        return upid;
    }

    public long generation() {
        return generation;
    }
}
