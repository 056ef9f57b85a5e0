package me.bechberger.dyntrace.ir.logical;

import java.util.List;

/**
 * A tracing program as the user described it: probes plus the maps and outputs they share
 */
public record Program(List<MapDefinition> maps, List<OutputDefinition> outputs, List<Probe> probes) {

    public Program {
        maps = List.copyOf(maps);
        outputs = List.copyOf(outputs);
        probes = List.copyOf(probes);
    }

    /**
     * Key-value map that probes can stash values into
     */
    public record MapDefinition(String name) {
    }

    /**
     * Output channel, a stream of records with the given fields
     */
    public record OutputDefinition(String name, List<String> fields) {
        public OutputDefinition {
            fields = List.copyOf(fields);
        }
    }
}
