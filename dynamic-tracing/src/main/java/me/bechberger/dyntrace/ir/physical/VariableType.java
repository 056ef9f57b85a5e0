package me.bechberger.dyntrace.ir.physical;

/**
 * Type of a variable or struct field: either a scalar or a struct defined in the same probe
 */
public sealed interface VariableType permits ScalarType, VariableType.StructRef {

    record StructRef(String structName) implements VariableType {
    }

    static VariableType struct(String structName) {
        return new StructRef(structName);
    }
}
