package me.bechberger.dyntrace.ir.physical;

import java.util.List;

/**
 * A compilable unit: shared struct types, maps and perf buffers followed by the probes using them
 */
public record PhysicalProgram(List<Struct> structs, List<MapDeclaration> maps,
                              List<PerfBufferDeclaration> perfBuffers, List<PhysicalProbe> probes) {

    public PhysicalProgram {
        structs = List.copyOf(structs);
        maps = List.copyOf(maps);
        perfBuffers = List.copyOf(perfBuffers);
        probes = List.copyOf(probes);
    }

    /**
     * Hash map declaration, {@code BPF_HASH(name, key, value)}
     */
    public record MapDeclaration(String name, VariableType keyType, VariableType valueType) {
    }

    /**
     * {@code BPF_PERF_OUTPUT(name)}
     */
    public record PerfBufferDeclaration(String name) {
    }
}
