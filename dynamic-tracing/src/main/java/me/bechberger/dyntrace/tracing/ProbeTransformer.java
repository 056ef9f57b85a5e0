package me.bechberger.dyntrace.tracing;

import me.bechberger.dyntrace.ir.BPFHelper;
import me.bechberger.dyntrace.ir.logical.Probe;
import me.bechberger.dyntrace.ir.logical.Probe.Argument;
import me.bechberger.dyntrace.ir.logical.Probe.MapConsumeAction;
import me.bechberger.dyntrace.ir.logical.Probe.MapStashAction;
import me.bechberger.dyntrace.ir.logical.Probe.OutputAction;
import me.bechberger.dyntrace.ir.logical.Probe.TracePoint;
import me.bechberger.dyntrace.ir.logical.Program;
import me.bechberger.dyntrace.ir.logical.Program.MapDefinition;
import me.bechberger.dyntrace.ir.logical.Program.OutputDefinition;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Transforms the logical probes of a program into entry and return probes
 * and adds the maps and outputs they implicitly require.
 * <p>
 * A {@link TracePoint.Type#LOGICAL} probe that needs values from both function entry and return
 * (a latency, or arguments together with return values) is split into
 * <ul>
 *     <li>{@code <name>_entry}: captures the arguments (and the start time) and stashes them into the map
 *     {@code <name>_argstash}, keyed by the thread id</li>
 *     <li>{@code <name>_return}: captures the return values, consumes the stashed entry of the same thread
 *     and emits everything</li>
 * </ul>
 * Every other probe stays a single probe. Output actions without an output are bound to {@code <name>_table}.
 */
public class ProbeTransformer {

    private static final Logger logger = Logger.getLogger(ProbeTransformer.class.getName());

    public static final String ENTRY_PROBE_SUFFIX = "_entry";
    public static final String RETURN_PROBE_SUFFIX = "_return";
    public static final String STASH_MAP_SUFFIX = "_argstash";
    public static final String OUTPUT_SUFFIX = "_table";

    /** id of the implicit start time argument used to compute latencies */
    public static final String START_TIME_ID = "time_";
    public static final String START_TIME_EXPR = "$start_ktime_ns";

    /** key of the stash map, entry and return probe run on the same thread */
    public static final BPFHelper STASH_KEY = BPFHelper.TID;

    private final Program input;
    private final Map<String, MapDefinition> maps = new LinkedHashMap<>();
    private final Map<String, OutputDefinition> outputs = new LinkedHashMap<>();
    private final List<Probe> probes = new ArrayList<>();
    /** names of the user's probes, generated probes must not take them */
    private final Set<String> inputProbeNames = new HashSet<>();
    private final Set<String> emittedProbeNames = new HashSet<>();
    /** outputs of the user, implicit outputs must not take their names */
    private final Set<String> declaredOutputNames = new HashSet<>();

    private ProbeTransformer(Program input) {
        this.input = input;
        input.maps().forEach(m -> maps.put(m.name(), m));
        input.outputs().forEach(o -> outputs.put(o.name(), o));
        input.outputs().forEach(o -> declaredOutputNames.add(o.name()));
    }

    /**
     * Expand the program, see class documentation
     *
     * @return the expanded program, the input is not modified
     * @throws TracingException {@code INVALID_SPEC} if a probe cannot be expanded, nothing is returned then
     */
    public static Program transform(Program program) {
        var transformer = new ProbeTransformer(program);
        transformer.checkProbeNames();
        program.probes().forEach(transformer::transformProbe);
        return new Program(List.copyOf(transformer.maps.values()), List.copyOf(transformer.outputs.values()),
                transformer.probes);
    }

    private void checkProbeNames() {
        for (Probe probe : input.probes()) {
            if (probe.name() == null || probe.name().isBlank()) {
                throw TracingException.invalidSpec("Probe without name");
            }
            if (!inputProbeNames.add(probe.name())) {
                throw TracingException.invalidSpec("Duplicate probe " + probe.name());
            }
        }
    }

    private void emit(Probe probe) {
        if (!emittedProbeNames.add(probe.name())) {
            throw TracingException.invalidSpec("Duplicate probe " + probe.name());
        }
        probes.add(probe);
    }

    private String generatedProbeName(Probe probe, String suffix) {
        var name = probe.name() + suffix;
        if (inputProbeNames.contains(name)) {
            throw TracingException.invalidSpec("Probe name " + name + " is reserved for probe " + probe.name());
        }
        return name;
    }

    private void transformProbe(Probe probe) {
        checkCaptureSpec(probe);
        checkMapActions(probe);
        var type = probe.tracePoint().type();
        if (type == TracePoint.Type.LOGICAL) {
            if (needsSplit(probe)) {
                splitProbe(probe);
                return;
            }
            type = probe.retVals().isEmpty() ? TracePoint.Type.ENTRY : TracePoint.Type.RETURN;
        }
        emit(bindOutputs(probe.name(), probe.withOutputActions(defaultOutputActions(probe))
                .withTracePoint(probe.tracePoint().withType(type))));
    }

    /**
     * Latencies require the entry time, arguments are only readable on entry, return values only on return
     */
    private static boolean needsSplit(Probe probe) {
        return probe.functionLatency() != null || (!probe.args().isEmpty() && !probe.retVals().isEmpty());
    }

    private void checkCaptureSpec(Probe probe) {
        var tracePoint = probe.tracePoint();
        if (tracePoint == null || tracePoint.type() == null) {
            throw TracingException.invalidSpec("Probe " + probe.name() + " has no trace point");
        }
        switch (tracePoint.type()) {
            case ENTRY -> {
                if (!probe.retVals().isEmpty() || probe.functionLatency() != null) {
                    throw TracingException.invalidSpec("Entry probe " + probe.name() +
                            " cannot capture return values or latencies");
                }
            }
            case RETURN -> {
                if (!probe.args().isEmpty() || probe.functionLatency() != null) {
                    throw TracingException.invalidSpec("Return probe " + probe.name() +
                            " cannot capture arguments or latencies");
                }
            }
            case LOGICAL -> {
            }
        }
        Set<String> ids = new HashSet<>();
        for (String id : probe.capturedIds()) {
            if (!ids.add(id)) {
                throw TracingException.invalidSpec("Probe " + probe.name() + " captures " + id + " twice");
            }
        }
        if (needsSplit(probe) && ids.contains(START_TIME_ID)) {
            throw TracingException.invalidSpec("Probe " + probe.name() + " uses the reserved id " + START_TIME_ID);
        }
    }

    private void checkMapActions(Probe probe) {
        for (MapStashAction action : probe.mapStashActions()) {
            checkMapDeclared(probe, action.mapName());
        }
        for (MapConsumeAction action : probe.mapConsumeActions()) {
            checkMapDeclared(probe, action.mapName());
        }
    }

    private void checkMapDeclared(Probe probe, String mapName) {
        if (!maps.containsKey(mapName)) {
            throw TracingException.invalidSpec("Probe " + probe.name() + " uses undeclared map " + mapName);
        }
    }

    private void splitProbe(Probe probe) {
        var stashMap = probe.name() + STASH_MAP_SUFFIX;
        if (maps.containsKey(stashMap)) {
            throw TracingException.invalidSpec("Map " + stashMap + " is reserved for probe " + probe.name());
        }
        maps.put(stashMap, new MapDefinition(stashMap));

        List<Argument> entryArgs = new ArrayList<>(probe.args());
        if (probe.functionLatency() != null) {
            entryArgs.add(new Argument(START_TIME_ID, START_TIME_EXPR));
        }
        var stashedIds = entryArgs.stream().map(Argument::id).toList();

        var entry = Probe.of(generatedProbeName(probe, ENTRY_PROBE_SUFFIX), probe.tracePoint().withType(TracePoint.Type.ENTRY))
                .withArgs(entryArgs)
                .withMapStashActions(List.of(new MapStashAction(stashMap, STASH_KEY, stashedIds)));

        List<MapConsumeAction> consumeActions = new ArrayList<>();
        consumeActions.add(new MapConsumeAction(stashMap, STASH_KEY, stashedIds));
        consumeActions.addAll(probe.mapConsumeActions());
        var ret = Probe.of(generatedProbeName(probe, RETURN_PROBE_SUFFIX), probe.tracePoint().withType(TracePoint.Type.RETURN))
                .withRetVals(probe.retVals())
                .withFunctionLatency(probe.functionLatency())
                .withMapConsumeActions(consumeActions)
                .withMapStashActions(probe.mapStashActions())
                .withOutputActions(defaultOutputActions(probe))
                .withPrintks(probe.printks());

        logger.fine(() -> "Split probe " + probe.name() + " into " + entry.name() + " and " + ret.name() +
                ", stashing " + stashedIds + " in " + stashMap);
        emit(entry);
        emit(bindOutputs(probe.name(), ret));
    }

    /**
     * The user's output actions, or a single action emitting every captured value if there are none
     */
    private static List<OutputAction> defaultOutputActions(Probe probe) {
        if (!probe.outputActions().isEmpty() || probe.capturedIds().isEmpty()) {
            return probe.outputActions();
        }
        return List.of(new OutputAction(null, probe.capturedIds()));
    }

    /**
     * Bind output actions without output to {@code <logicalName>_table}, creating the output if necessary
     */
    private Probe bindOutputs(String logicalName, Probe probe) {
        List<OutputAction> bound = new ArrayList<>();
        for (OutputAction action : probe.outputActions()) {
            var outputName = action.outputName() == null ? logicalName + OUTPUT_SUFFIX : action.outputName();
            if (action.outputName() == null && declaredOutputNames.contains(outputName)) {
                throw TracingException.invalidSpec("Output " + outputName + " is reserved for probe " + logicalName);
            }
            var output = outputs.get(outputName);
            if (output == null) {
                if (action.outputName() != null) {
                    throw TracingException.invalidSpec("Probe " + logicalName + " uses undeclared output " +
                            outputName);
                }
                output = new OutputDefinition(outputName, action.variableNames());
                outputs.put(outputName, output);
                logger.fine("Created implicit output " + outputName + " with fields " + output.fields());
            }
            if (output.fields().size() != action.variableNames().size()) {
                throw TracingException.invalidSpec("Probe " + logicalName + " emits " + action.variableNames().size() +
                        " values to output " + outputName + " which has " + output.fields().size() + " fields");
            }
            bound.add(action.withOutputName(outputName));
        }
        return probe.withOutputActions(bound);
    }
}
