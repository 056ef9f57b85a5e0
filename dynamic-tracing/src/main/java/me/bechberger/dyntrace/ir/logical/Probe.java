package me.bechberger.dyntrace.ir.logical;

import me.bechberger.dyntrace.ir.BPFHelper;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Stream;

/**
 * A user declared probe
 *
 * @param name             unique name, used to derive names of generated probes, maps and outputs
 * @param tracePoint       where to attach
 * @param args             values captured on function entry
 * @param retVals          values captured on function return
 * @param functionLatency  if present, the time between entry and return is captured under this id
 * @param mapStashActions  values to put into maps
 * @param mapConsumeActions stashed values to read back (and remove) from maps
 * @param outputActions    values to emit to outputs
 * @param printks          debug prints
 */
public record Probe(String name, TracePoint tracePoint, List<Argument> args, List<ReturnValue> retVals,
                    @Nullable FunctionLatency functionLatency, List<MapStashAction> mapStashActions,
                    List<MapConsumeAction> mapConsumeActions, List<OutputAction> outputActions,
                    List<Printk> printks) {

    public Probe {
        args = List.copyOf(args);
        retVals = List.copyOf(retVals);
        mapStashActions = List.copyOf(mapStashActions);
        mapConsumeActions = List.copyOf(mapConsumeActions);
        outputActions = List.copyOf(outputActions);
        printks = List.copyOf(printks);
    }

    /**
     * Probe without any captured values or actions
     */
    public static Probe of(String name, TracePoint tracePoint) {
        return new Probe(name, tracePoint, List.of(), List.of(), null, List.of(), List.of(), List.of(), List.of());
    }

    public Probe withTracePoint(TracePoint tracePoint) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withArgs(List<Argument> args) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withRetVals(List<ReturnValue> retVals) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withFunctionLatency(@Nullable FunctionLatency functionLatency) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withMapStashActions(List<MapStashAction> mapStashActions) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withMapConsumeActions(List<MapConsumeAction> mapConsumeActions) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withOutputActions(List<OutputAction> outputActions) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    public Probe withPrintks(List<Printk> printks) {
        return new Probe(name, tracePoint, args, retVals, functionLatency, mapStashActions, mapConsumeActions,
                outputActions, printks);
    }

    /**
     * Ids of all values this probe captures itself, in declaration order
     * (arguments, return values, latency)
     */
    public List<String> capturedIds() {
        return Stream.of(args.stream().map(Argument::id), retVals.stream().map(ReturnValue::id),
                        Stream.ofNullable(functionLatency).map(FunctionLatency::id))
                .flatMap(s -> s).toList();
    }

    /**
     * Attach point of a probe
     */
    public record TracePoint(String binaryPath, String symbol, Type type) {

        public enum Type {
            /** attach on function entry */
            ENTRY,
            /** attach on function return */
            RETURN,
            /** no attach point chosen, derived from what the probe captures */
            LOGICAL
        }

        public TracePoint withType(Type type) {
            return new TracePoint(binaryPath, symbol, type);
        }
    }

    /**
     * Value captured on function entry
     *
     * @param id   variable name
     * @param expr expression describing the argument, e.g. {@code req.method}
     */
    public record Argument(String id, String expr) {
    }

    /**
     * Value captured on function return, {@code expr} is e.g. {@code $0} for the first return value
     */
    public record ReturnValue(String id, String expr) {
    }

    public record FunctionLatency(String id) {
    }

    /**
     * Put the values into the map, keyed by the given helper value
     */
    public record MapStashAction(String mapName, BPFHelper key, List<String> valueVariableNames) {
        public MapStashAction {
            valueVariableNames = List.copyOf(valueVariableNames);
        }
    }

    /**
     * Read values that an earlier probe stashed and remove the entry in the same step,
     * so that every stashed entry is consumed at most once
     */
    public record MapConsumeAction(String mapName, BPFHelper key, List<String> valueVariableNames) {
        public MapConsumeAction {
            valueVariableNames = List.copyOf(valueVariableNames);
        }
    }

    /**
     * Emit the variables into the output
     *
     * @param outputName target output, {@code null} if the probe should get its own implicit output
     */
    public record OutputAction(@Nullable String outputName, List<String> variableNames) {
        public OutputAction {
            variableNames = List.copyOf(variableNames);
        }

        public OutputAction withOutputName(String outputName) {
            return new OutputAction(outputName, variableNames);
        }
    }

    /**
     * Print either a fixed text or the value of a variable to the trace pipe
     */
    public record Printk(@Nullable String text, @Nullable String scalar) {
    }
}
