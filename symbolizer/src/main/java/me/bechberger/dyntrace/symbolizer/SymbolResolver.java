package me.bechberger.dyntrace.symbolizer;

import org.jetbrains.annotations.Nullable;

/**
 * Resolves addresses to symbols, e.g. via the symbol tables of the mapped binaries.
 * Implementations may block.
 */
@FunctionalInterface
public interface SymbolResolver {

    /**
     * Resolved symbol (function), its offset from the beginning of the function and the module in which it lies.
     * For example: ("start_thread", 0x202, "/usr/lib/.../libpthread-2.24.so")
     * <p>
     * If the symbol cannot be found, {@code symbol} is null and the offset is 0.
     */
    record ResolveResult(@Nullable String symbol, long offset, @Nullable String module) {

        public static ResolveResult unresolved() {
            return new ResolveResult(null, 0, null);
        }

        public boolean isResolved() {
            return symbol != null;
        }
    }

    ResolveResult resolve(UPID upid, long address);

    /**
     * Use the first resolver for the kernel and the second for every process
     */
    static SymbolResolver byAddressSpace(SymbolResolver kernel, SymbolResolver user) {
        return (upid, address) -> upid.isKernel() ? kernel.resolve(upid, address) : user.resolve(upid, address);
    }

    /**
     * The symbol, or {@code 0x} followed by the 16 digit hex address if the address is unresolved
     */
    static String symbolOrAddress(@Nullable ResolveResult result, long address) {
        if (result == null || result.symbol() == null) {
            return String.format("0x%016x", address);
        }
        return result.symbol();
    }
}
