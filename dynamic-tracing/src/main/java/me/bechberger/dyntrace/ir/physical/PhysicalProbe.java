package me.bechberger.dyntrace.ir.physical;

import java.util.List;

/**
 * A single attach point with fully resolved variables and actions.
 * All lists are ordered, declarations come before their uses.
 *
 * @param name name of the generated function
 */
public record PhysicalProbe(String name, List<Struct> structs, List<ScalarVariable> vars,
                            List<StructVariable> stVars, List<MapStashAction> mapStashActions,
                            List<OutputAction> outputActions) {

    public PhysicalProbe {
        structs = List.copyOf(structs);
        vars = List.copyOf(vars);
        stVars = List.copyOf(stVars);
        mapStashActions = List.copyOf(mapStashActions);
        outputActions = List.copyOf(outputActions);
    }
}
