package me.bechberger.dyntrace.tracing;

import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONArray;
import com.alibaba.fastjson.JSONException;
import com.alibaba.fastjson.JSONObject;
import com.alibaba.fastjson.serializer.SerializerFeature;
import me.bechberger.dyntrace.ir.BPFHelper;
import me.bechberger.dyntrace.ir.logical.Probe;
import me.bechberger.dyntrace.ir.logical.Probe.Argument;
import me.bechberger.dyntrace.ir.logical.Probe.FunctionLatency;
import me.bechberger.dyntrace.ir.logical.Probe.MapConsumeAction;
import me.bechberger.dyntrace.ir.logical.Probe.MapStashAction;
import me.bechberger.dyntrace.ir.logical.Probe.OutputAction;
import me.bechberger.dyntrace.ir.logical.Probe.Printk;
import me.bechberger.dyntrace.ir.logical.Probe.ReturnValue;
import me.bechberger.dyntrace.ir.logical.Probe.TracePoint;
import me.bechberger.dyntrace.ir.logical.Program;
import me.bechberger.dyntrace.ir.logical.Program.MapDefinition;
import me.bechberger.dyntrace.ir.logical.Program.OutputDefinition;
import me.bechberger.dyntrace.ir.physical.PhysicalProbe;
import me.bechberger.dyntrace.ir.physical.PhysicalProgram;
import me.bechberger.dyntrace.ir.physical.PhysicalProgram.MapDeclaration;
import me.bechberger.dyntrace.ir.physical.PhysicalProgram.PerfBufferDeclaration;
import me.bechberger.dyntrace.ir.physical.Register;
import me.bechberger.dyntrace.ir.physical.ScalarType;
import me.bechberger.dyntrace.ir.physical.ScalarVariable;
import me.bechberger.dyntrace.ir.physical.Struct;
import me.bechberger.dyntrace.ir.physical.StructVariable;
import me.bechberger.dyntrace.ir.physical.ValueSource;
import me.bechberger.dyntrace.ir.physical.VariableType;
import me.bechberger.dyntrace.ir.physical.VariableType.StructRef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Reads and writes programs as JSON
 * <p>
 * Logical program:
 * <pre>{@code
 * {
 *   "maps": [{"name": "..."}],
 *   "outputs": [{"name": "...", "fields": ["..."]}],
 *   "probes": [{
 *     "name": "...",
 *     "tracePoint": {"binaryPath": "...", "symbol": "...", "type": "ENTRY|RETURN|LOGICAL"},
 *     "args": [{"id": "...", "expr": "..."}],
 *     "retVals": [{"id": "...", "expr": "$0"}],
 *     "functionLatency": {"id": "..."},
 *     "mapStashActions": [{"mapName": "...", "key": "TID|TGID|TGID_PID", "valueVariableNames": ["..."]}],
 *     "mapConsumeActions": [...same as mapStashActions...],
 *     "outputActions": [{"outputName": "...", "variableNames": ["..."]}],
 *     "printks": [{"text": "..."}, {"scalar": "..."}]
 *   }]
 * }
 * }</pre>
 * Physical program, types are either a {@link ScalarType} name or {@code "struct <name>"}:
 * <pre>{@code
 * {
 *   "structs": [{"name": "...", "fields": [{"name": "...", "type": "INT32"}]}],
 *   "maps": [{"name": "...", "keyType": "UINT32", "valueType": "struct value_t"}],
 *   "perfBuffers": [{"name": "..."}],
 *   "probes": [{
 *     "name": "...",
 *     "structs": [...],
 *     "vars": [{"name": "...", "type": "...", "register": "SP" | "memory": {"base": "sp", "offset": 8}
 *              | "builtin": "TGID"}],
 *     "stVars": [{"name": "...", "structName": "...", "variableNames": ["..."]}],
 *     "mapStashActions": [{"mapName": "...", "keyVariableName": "...", "valueVariableName": "..."}],
 *     "outputActions": [{"perfBufferName": "...", "variableName": "..."}]
 *   }]
 * }
 * }</pre>
 * Missing lists are treated as empty.
 */
public class ProgramJSON {

    private static final String STRUCT_PREFIX = "struct ";

    public static class CannotParseException extends RuntimeException {
        public CannotParseException(String message) {
            super(message);
        }

        public CannotParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public static Program parseLogicalProgram(String json) {
        var obj = parseObject(json);
        return decode(() -> new Program(list(obj, "maps", m -> new MapDefinition(string(m, "name"))),
                list(obj, "outputs", o -> new OutputDefinition(string(o, "name"), strings(o, "fields"))),
                list(obj, "probes", ProgramJSON::parseProbe)));
    }

    private static Probe parseProbe(JSONObject obj) {
        var tp = required(obj, "tracePoint");
        var tracePoint = new TracePoint(tp.getString("binaryPath"), string(tp, "symbol"),
                enumValue(TracePoint.Type.class, string(tp, "type")));
        var latency = optionalObject(obj, "functionLatency");
        return new Probe(string(obj, "name"), tracePoint,
                list(obj, "args", a -> new Argument(string(a, "id"), string(a, "expr"))),
                list(obj, "retVals", r -> new ReturnValue(string(r, "id"), string(r, "expr"))),
                latency == null ? null : new FunctionLatency(string(latency, "id")),
                list(obj, "mapStashActions", a -> new MapStashAction(string(a, "mapName"),
                        enumValue(BPFHelper.class, string(a, "key")), strings(a, "valueVariableNames"))),
                list(obj, "mapConsumeActions", a -> new MapConsumeAction(string(a, "mapName"),
                        enumValue(BPFHelper.class, string(a, "key")), strings(a, "valueVariableNames"))),
                list(obj, "outputActions", a -> new OutputAction(a.getString("outputName"),
                        strings(a, "variableNames"))),
                list(obj, "printks", p -> new Printk(p.getString("text"), p.getString("scalar"))));
    }

    public static String toJSON(Program program) {
        var obj = object();
        obj.put("maps", array(program.maps(), m -> object("name", m.name())));
        obj.put("outputs", array(program.outputs(), o -> {
            var output = object("name", o.name());
            output.put("fields", o.fields());
            return output;
        }));
        obj.put("probes", array(program.probes(), ProgramJSON::toJSONObject));
        return JSON.toJSONString(obj, SerializerFeature.PrettyFormat);
    }

    private static JSONObject toJSONObject(Probe probe) {
        var obj = object("name", probe.name());
        var tp = object();
        tp.put("binaryPath", probe.tracePoint().binaryPath());
        tp.put("symbol", probe.tracePoint().symbol());
        tp.put("type", probe.tracePoint().type().name());
        obj.put("tracePoint", tp);
        obj.put("args", array(probe.args(), a -> {
            var arg = object("id", a.id());
            arg.put("expr", a.expr());
            return arg;
        }));
        obj.put("retVals", array(probe.retVals(), r -> {
            var ret = object("id", r.id());
            ret.put("expr", r.expr());
            return ret;
        }));
        if (probe.functionLatency() != null) {
            obj.put("functionLatency", object("id", probe.functionLatency().id()));
        }
        obj.put("mapStashActions", array(probe.mapStashActions(),
                a -> mapAction(a.mapName(), a.key(), a.valueVariableNames())));
        obj.put("mapConsumeActions", array(probe.mapConsumeActions(),
                a -> mapAction(a.mapName(), a.key(), a.valueVariableNames())));
        obj.put("outputActions", array(probe.outputActions(), a -> {
            var action = object();
            if (a.outputName() != null) {
                action.put("outputName", a.outputName());
            }
            action.put("variableNames", a.variableNames());
            return action;
        }));
        obj.put("printks", array(probe.printks(), p -> {
            var printk = object();
            if (p.text() != null) {
                printk.put("text", p.text());
            }
            if (p.scalar() != null) {
                printk.put("scalar", p.scalar());
            }
            return printk;
        }));
        return obj;
    }

    private static JSONObject mapAction(String mapName, BPFHelper key, List<String> valueVariableNames) {
        var action = object("mapName", mapName);
        action.put("key", key.name());
        action.put("valueVariableNames", valueVariableNames);
        return action;
    }

    public static PhysicalProgram parsePhysicalProgram(String json) {
        var obj = parseObject(json);
        return decode(() -> new PhysicalProgram(list(obj, "structs", ProgramJSON::parseStruct),
                list(obj, "maps", m -> new MapDeclaration(string(m, "name"), type(string(m, "keyType")),
                        type(string(m, "valueType")))),
                list(obj, "perfBuffers", p -> new PerfBufferDeclaration(string(p, "name"))),
                list(obj, "probes", ProgramJSON::parsePhysicalProbe)));
    }

    private static PhysicalProbe parsePhysicalProbe(JSONObject obj) {
        return new PhysicalProbe(string(obj, "name"),
                list(obj, "structs", ProgramJSON::parseStruct),
                list(obj, "vars", ProgramJSON::parseScalarVariable),
                list(obj, "stVars", v -> new StructVariable(string(v, "name"), string(v, "structName"),
                        strings(v, "variableNames"))),
                list(obj, "mapStashActions", a -> new me.bechberger.dyntrace.ir.physical.MapStashAction(
                        string(a, "mapName"), string(a, "keyVariableName"), string(a, "valueVariableName"))),
                list(obj, "outputActions", a -> new me.bechberger.dyntrace.ir.physical.OutputAction(
                        string(a, "perfBufferName"), string(a, "variableName"))));
    }

    private static Struct parseStruct(JSONObject obj) {
        return new Struct(string(obj, "name"),
                list(obj, "fields", f -> new Struct.Field(string(f, "name"), type(string(f, "type")))));
    }

    /**
     * A variable without any source is kept, code generation reports it
     */
    private static ScalarVariable parseScalarVariable(JSONObject obj) {
        var name = string(obj, "name");
        List<ValueSource> sources = new ArrayList<>();
        if (obj.containsKey("register")) {
            sources.add(ValueSource.register(enumValue(Register.class, string(obj, "register"))));
        }
        if (obj.containsKey("memory")) {
            var memory = required(obj, "memory");
            var offset = memory.getInteger("offset");
            sources.add(ValueSource.memory(string(memory, "base"), offset == null ? 0 : offset));
        }
        if (obj.containsKey("builtin")) {
            sources.add(ValueSource.builtin(enumValue(BPFHelper.class, string(obj, "builtin"))));
        }
        if (sources.size() > 1) {
            throw new CannotParseException("Variable " + name + " has more than one source");
        }
        return new ScalarVariable(name, type(string(obj, "type")), sources.isEmpty() ? null : sources.get(0));
    }

    static VariableType type(String type) {
        if (type.startsWith(STRUCT_PREFIX)) {
            return new StructRef(type.substring(STRUCT_PREFIX.length()).strip());
        }
        return enumValue(ScalarType.class, type);
    }

    private static JSONObject parseObject(String json) {
        try {
            var obj = JSON.parseObject(json);
            if (obj == null) {
                throw new CannotParseException("Empty JSON document");
            }
            return obj;
        } catch (JSONException | ClassCastException e) {
            throw new CannotParseException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Run the decoder, turning type mismatches that fastjson reports while accessing nodes into
     * {@link CannotParseException}s
     */
    private static <T> T decode(Supplier<T> decoder) {
        try {
            return decoder.get();
        } catch (JSONException | ClassCastException | NumberFormatException e) {
            throw new CannotParseException("Invalid program: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static @Nullable JSONObject asObject(@Nullable Object value) {
        if (value instanceof JSONObject obj) {
            return obj;
        }
        if (value instanceof Map<?, ?> map) {
            return new JSONObject((Map<String, Object>) map);
        }
        return null;
    }

    private static @Nullable JSONObject optionalObject(JSONObject obj, String key) {
        var value = obj.get(key);
        var result = asObject(value);
        if (value != null && result == null) {
            throw new CannotParseException("Expected an object for key '" + key + "' in " + obj);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static @Nullable JSONArray optionalArray(JSONObject obj, String key) {
        var value = obj.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof JSONArray array) {
            return array;
        }
        if (value instanceof List<?> list) {
            return new JSONArray((List<Object>) list);
        }
        throw new CannotParseException("Expected an array for key '" + key + "' in " + obj);
    }

    private static JSONObject required(JSONObject obj, String key) {
        var value = optionalObject(obj, key);
        if (value == null) {
            throw new CannotParseException("Missing key '" + key + "' in " + obj);
        }
        return value;
    }

    private static String string(JSONObject obj, String key) {
        var value = obj.getString(key);
        if (value == null) {
            throw new CannotParseException("Missing key '" + key + "' in " + obj);
        }
        return value;
    }

    private static List<String> strings(JSONObject obj, String key) {
        var array = optionalArray(obj, key);
        if (array == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            var value = array.get(i);
            if (!(value instanceof String str)) {
                throw new CannotParseException("Expected a string at " + key + "[" + i + "] in " + obj);
            }
            result.add(str);
        }
        return result;
    }

    private static <T> List<T> list(JSONObject obj, String key, Function<JSONObject, T> parser) {
        var array = optionalArray(obj, key);
        if (array == null) {
            return List.of();
        }
        List<T> result = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            var element = asObject(array.get(i));
            if (element == null) {
                throw new CannotParseException("Expected an object at " + key + "[" + i + "] in " + obj);
            }
            result.add(parser.apply(element));
        }
        return result;
    }

    private static <E extends Enum<E>> E enumValue(Class<E> klass, String name) {
        try {
            return Enum.valueOf(klass, name);
        } catch (IllegalArgumentException e) {
            throw new CannotParseException("Unknown " + klass.getSimpleName() + " " + name, e);
        }
    }

    private static JSONObject object() {
        return new JSONObject(new LinkedHashMap<>());
    }

    private static JSONObject object(String key, @Nullable Object value) {
        var obj = object();
        obj.put(key, value);
        return obj;
    }

    private static <T> JSONArray array(List<T> values, Function<T, JSONObject> converter) {
        var array = new JSONArray();
        values.forEach(v -> array.add(converter.apply(v)));
        return array;
    }
}
