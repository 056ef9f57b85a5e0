package me.bechberger.dyntrace.symbolizer;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongFunction;
import java.util.logging.Logger;

/**
 * Symbolizes stack trace addresses, using one {@link SymbolCache} per process and one for the kernel.
 * <p>
 * Usage per collected stack trace:
 * <pre>{@code
 * var symbolize = symbolizer.symbolizerFn(upid);
 * for (long addr : addresses) {
 *     frames.add(symbolize.apply(addr));
 * }
 * }</pre>
 * Caches of different processes are independent, so different processes can be symbolized concurrently,
 * but calls for the same process have to be serialized.
 */
public class Symbolizer {

    private static final Logger logger = Logger.getLogger(Symbolizer.class.getName());

    private final SymbolizerConfig config;
    private final SymbolResolver resolver;
    private final Map<UPID, SymbolCache> caches = new ConcurrentHashMap<>();
    private final AtomicLong statAccesses = new AtomicLong();
    private final AtomicLong statHits = new AtomicLong();

    public Symbolizer(SymbolizerConfig config, SymbolResolver resolver) {
        this.config = config;
        this.resolver = resolver;
    }

    public Symbolizer(SymbolResolver resolver) {
        this(SymbolizerConfig.DEFAULT, resolver);
    }

    /**
     * Function that symbolizes addresses of the given process (or {@link UPID#KERNEL}).
     * <p>
     * Obtain a new function for every stack trace, a function obtained before {@link #deleteUPIDs(Collection)}
     * keeps using the deleted cache.
     */
    public LongFunction<String> symbolizerFn(UPID upid) {
        if (!config.enableSymbolCache()) {
            return address -> SymbolResolver.symbolOrAddress(resolver.resolve(upid, address), address);
        }
        var cache = caches.computeIfAbsent(upid, u -> {
            logger.fine(() -> "Creating symbol cache for " + u);
            return new SymbolCache(u, resolver);
        });
        return address -> {
            var result = cache.lookup(address);
            statAccesses.incrementAndGet();
            if (result.hit()) {
                statHits.incrementAndGet();
            }
            return result.symbol();
        };
    }

    /**
     * Drop the cached symbols of the process, e.g. after it loaded new code.
     * The access and hit counters are not affected.
     */
    public void flushCache(UPID upid) {
        var cache = caches.get(upid);
        if (cache != null) {
            cache.flush();
        }
    }

    /**
     * Start a new generation in every cache, called once per sampling interval
     */
    public void createNewGeneration() {
        caches.values().forEach(SymbolCache::createNewGeneration);
    }

    /**
     * Release the caches of processes that exited
     */
    public void deleteUPIDs(Collection<UPID> upids) {
        for (UPID upid : upids) {
            if (caches.remove(upid) != null) {
                logger.fine(() -> "Deleted symbol cache for " + upid);
            }
        }
    }

    /**
     * Number of cached symbols over all processes
     */
    public int totalEntries() {
        return caches.values().stream().mapToInt(SymbolCache::totalEntries).sum();
    }

    /**
     * Number of cached lookups since creation
     */
    public long statAccesses() {
        return statAccesses.get();
    }

    /**
     * Number of cached lookups that did not need the resolver
     */
    public long statHits() {
        return statHits.get();
    }

    public SymbolizerConfig config() {
        return config;
    }
}
