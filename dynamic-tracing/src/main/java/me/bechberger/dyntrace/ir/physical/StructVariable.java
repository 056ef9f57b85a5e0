package me.bechberger.dyntrace.ir.physical;

import java.util.List;

/**
 * Instance of a struct, the i-th field is assigned from the i-th variable name
 */
public record StructVariable(String name, String structName, List<String> variableNames) {

    public StructVariable {
        variableNames = List.copyOf(variableNames);
    }
}
