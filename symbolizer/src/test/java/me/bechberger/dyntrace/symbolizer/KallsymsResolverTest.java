package me.bechberger.dyntrace.symbolizer;

import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

public class KallsymsResolverTest {

    private static final String KALLSYMS = """
            0000000000000000 A fixed_percpu_data
            ffffffff81000000 T _stext
            ffffffff81000100 t do_one_initcall
            ffffffff81000200 D some_data
            ffffffff81000300 W weak_function
            not_an_address T broken
            ffffffffc0a00000 t ext4_fill_super\t[ext4]
            """;

    private final KallsymsResolver resolver = new KallsymsResolver(new StringReader(KALLSYMS));

    @Test
    public void testParse() {
        assertEquals(4, resolver.size());
    }

    @Test
    public void testResolveExactAndWithin() {
        assertEquals(new SymbolResolver.ResolveResult("_stext", 0, "kernel"),
                resolver.resolve(UPID.KERNEL, 0xffffffff81000000L));
        assertEquals(new SymbolResolver.ResolveResult("do_one_initcall", 0x150, "kernel"),
                resolver.resolve(UPID.KERNEL, 0xffffffff81000250L));
        assertEquals(new SymbolResolver.ResolveResult("weak_function", 0x10, "kernel"),
                resolver.resolve(UPID.KERNEL, 0xffffffff81000310L));
    }

    @Test
    public void testModuleSymbol() {
        var result = resolver.resolve(UPID.KERNEL, 0xffffffffc0a00004L);
        assertEquals("ext4_fill_super", result.symbol());
        assertEquals("ext4", result.module());
    }

    @Test
    public void testBelowFirstSymbol() {
        assertEquals(new SymbolResolver.ResolveResult(null, 0, null), resolver.resolve(UPID.KERNEL, 0x1000));
    }

    @Test
    public void testUserProcessIsNotResolved() {
        var result = resolver.resolve(new UPID(1, 2), 0xffffffff81000000L);
        assertFalse(result.isResolved());
        assertEquals(0, result.offset());
        assertEquals("0xffffffff81000000", SymbolResolver.symbolOrAddress(result, 0xffffffff81000000L));
    }

    @Test
    public void testHiddenAddresses() {
        var hidden = new KallsymsResolver(new StringReader("""
                0000000000000000 T _stext
                0000000000000000 t do_one_initcall
                """));
        assertEquals(0, hidden.size());
        assertFalse(hidden.resolve(UPID.KERNEL, 0xffffffff81000000L).isResolved());
    }

    @Test
    public void testSymbolizerWithKallsyms() {
        var symbolizer = new Symbolizer(resolver);
        assertEquals("_stext", symbolizer.symbolizerFn(UPID.KERNEL).apply(0xffffffff81000010L));
    }
}
