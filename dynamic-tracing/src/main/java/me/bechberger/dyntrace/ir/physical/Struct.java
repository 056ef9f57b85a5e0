package me.bechberger.dyntrace.ir.physical;

import java.util.List;

/**
 * Struct type definition, fields are laid out in declaration order
 */
public record Struct(String name, List<Field> fields) {

    public Struct {
        fields = List.copyOf(fields);
    }

    public record Field(String name, VariableType type) {
    }
}
