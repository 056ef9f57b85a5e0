package me.bechberger.dyntrace.symbolizer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Resolves kernel addresses using the symbol list of {@code /proc/kallsyms}.
 * <p>
 * Lines have the format {@code ffffffff81000000 T _stext [module]}, only function symbols are used.
 * An address resolves to the closest symbol at or below it. Addresses of other processes are never resolved.
 */
public class KallsymsResolver implements SymbolResolver {

    private static final Logger logger = Logger.getLogger(KallsymsResolver.class.getName());

    public static final Path KALLSYMS = Path.of("/proc/kallsyms");

    private static final String KERNEL_MODULE = "kernel";

    private record KernelSymbol(String name, String module) {
    }

    /** kernel addresses are above {@link Long#MAX_VALUE}, so compare unsigned */
    private final TreeMap<Long, KernelSymbol> symbols = new TreeMap<>(Long::compareUnsigned);

    public KallsymsResolver(Reader kallsyms) {
        try (var reader = new BufferedReader(kallsyms)) {
            String line;
            while ((line = reader.readLine()) != null) {
                parseLine(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (symbols.isEmpty()) {
            logger.warning("No kernel symbols found, are the addresses hidden by kptr_restrict?");
        }
    }

    public static KallsymsResolver load() {
        try {
            return new KallsymsResolver(Files.newBufferedReader(KALLSYMS));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void parseLine(String line) {
        var parts = line.strip().split("\\s+");
        if (parts.length < 3 || parts[1].length() != 1 || "tTwW".indexOf(parts[1].charAt(0)) == -1) {
            return;
        }
        long address;
        try {
            address = Long.parseUnsignedLong(parts[0], 16);
        } catch (NumberFormatException e) {
            logger.fine("Skipping malformed kallsyms line: " + line);
            return;
        }
        if (address == 0) {
            return;
        }
        var module = parts.length > 3 ? parts[3].replace("[", "").replace("]", "") : KERNEL_MODULE;
        symbols.putIfAbsent(address, new KernelSymbol(parts[2], module));
    }

    @Override
    public ResolveResult resolve(UPID upid, long address) {
        if (!upid.isKernel()) {
            return ResolveResult.unresolved();
        }
        Map.Entry<Long, KernelSymbol> entry = symbols.floorEntry(address);
        if (entry == null) {
            return ResolveResult.unresolved();
        }
        return new ResolveResult(entry.getValue().name(), address - entry.getKey(), entry.getValue().module());
    }

    public int size() {
        return symbols.size();
    }
}
