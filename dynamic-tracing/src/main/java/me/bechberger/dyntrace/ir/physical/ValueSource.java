package me.bechberger.dyntrace.ir.physical;

import me.bechberger.dyntrace.ir.BPFHelper;

import java.util.function.Function;

/**
 * Where the value of a {@link ScalarVariable} comes from.
 * <p>
 * Closed set of kinds, consumers dispatch with {@link #match(Function, Function, Function)}
 * so that a new kind breaks every dispatch site at compile time.
 */
public sealed interface ValueSource {

    <R> R match(Function<RegisterSource, R> onRegister, Function<MemorySource, R> onMemory,
                Function<BuiltinSource, R> onBuiltin);

    record RegisterSource(Register register) implements ValueSource {
        @Override
        public <R> R match(Function<RegisterSource, R> onRegister, Function<MemorySource, R> onMemory,
                           Function<BuiltinSource, R> onBuiltin) {
            return onRegister.apply(this);
        }
    }

    /**
     * Memory at {@code base + offset}, {@code base} being a C expression (e.g. another variable)
     */
    record MemorySource(String base, int offset) implements ValueSource {
        @Override
        public <R> R match(Function<RegisterSource, R> onRegister, Function<MemorySource, R> onMemory,
                           Function<BuiltinSource, R> onBuiltin) {
            return onMemory.apply(this);
        }
    }

    record BuiltinSource(BPFHelper helper) implements ValueSource {
        @Override
        public <R> R match(Function<RegisterSource, R> onRegister, Function<MemorySource, R> onMemory,
                           Function<BuiltinSource, R> onBuiltin) {
            return onBuiltin.apply(this);
        }
    }

    static ValueSource register(Register register) {
        return new RegisterSource(register);
    }

    static ValueSource memory(String base, int offset) {
        return new MemorySource(base, offset);
    }

    static ValueSource builtin(BPFHelper helper) {
        return new BuiltinSource(helper);
    }
}
