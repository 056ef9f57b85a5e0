package me.bechberger.dyntrace.symbolizer;

/**
 * @param enableSymbolCache cache resolved symbols per process, if disabled every lookup goes to the resolver
 */
public record SymbolizerConfig(boolean enableSymbolCache) {

    public static final SymbolizerConfig DEFAULT = new SymbolizerConfig(true);
}
