package me.bechberger.dyntrace.tracing;

import me.bechberger.dyntrace.cast.CAST.Declarator;
import me.bechberger.dyntrace.cast.CAST.Expression;
import me.bechberger.dyntrace.cast.CAST.Initializer;
import me.bechberger.dyntrace.cast.CAST.Statement;
import me.bechberger.dyntrace.ir.BPFHelper;
import me.bechberger.dyntrace.ir.physical.MapStashAction;
import me.bechberger.dyntrace.ir.physical.OutputAction;
import me.bechberger.dyntrace.ir.physical.PhysicalProbe;
import me.bechberger.dyntrace.ir.physical.PhysicalProgram;
import me.bechberger.dyntrace.ir.physical.PhysicalProgram.MapDeclaration;
import me.bechberger.dyntrace.ir.physical.ScalarType;
import me.bechberger.dyntrace.ir.physical.ScalarVariable;
import me.bechberger.dyntrace.ir.physical.Struct;
import me.bechberger.dyntrace.ir.physical.StructVariable;
import me.bechberger.dyntrace.ir.physical.ValueSource.MemorySource;
import me.bechberger.dyntrace.ir.physical.VariableType;
import me.bechberger.dyntrace.ir.physical.VariableType.StructRef;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

import static me.bechberger.dyntrace.cast.CAST.Declarator.identifier;
import static me.bechberger.dyntrace.cast.CAST.Declarator.structIdentifier;
import static me.bechberger.dyntrace.cast.CAST.Expression.constant;
import static me.bechberger.dyntrace.cast.CAST.Expression.variable;
import static me.bechberger.dyntrace.cast.CAST.Expression.verbatim;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.addressOf;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.assignment;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.binary;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.call;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.cast;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.memberAccess;
import static me.bechberger.dyntrace.cast.CAST.OperatorExpression.sizeof;
import static me.bechberger.dyntrace.cast.CAST.Statement.expression;
import static me.bechberger.dyntrace.cast.CAST.Statement.variableDefinition;

/**
 * Generates BCC flavoured eBPF C code for physical probes.
 * <p>
 * Every method returns the code as lines, joining them with newlines yields a compilable unit.
 * All methods are pure; malformed input results in a {@link TracingException}, never in partial code.
 * <p>
 * Example: the struct {@code S{int32_t i32}} becomes
 * <pre>{@code
 * struct S {
 *   int32_t i32;
 * };
 * }</pre>
 */
public class CodeGen {

    private static final Logger logger = Logger.getLogger(CodeGen.class.getName());

    /** name of the single parameter of every probe function */
    static final String CTX = "ctx";

    private static final String PID_TGID_HELPER = "bpf_get_current_pid_tgid";

    /**
     * @param indentSize number of spaces to indent struct fields with
     */
    public record Options(int indentSize) {
        public static final Options DEFAULT = new Options(2);

        public Options {
            if (indentSize < 0) {
                throw new IllegalArgumentException("Indent size must not be negative: " + indentSize);
            }
        }
    }

    private final Options options;

    public CodeGen() {
        this(Options.DEFAULT);
    }

    public CodeGen(Options options) {
        this.options = options;
    }

    /**
     * C type for the given variable type, e.g. {@code int32_t}, {@code char*} or {@code struct attr_t}
     */
    static Declarator toCType(VariableType type) {
        if (type instanceof StructRef ref) {
            return structIdentifier(ref.structName());
        }
        var scalar = (ScalarType) type;
        switch (scalar) {
            case VOID_POINTER:
                return Declarator.voidPointer();
            case STRING:
                return Declarator.pointer(identifier("char"));
            default:
                return identifier(scalar.cName());
        }
    }

    /**
     * Struct definition: opening line, one line per field (in declaration order), closing line
     */
    public static List<String> genStruct(Struct st, int indentSize) {
        var members = st.fields().stream()
                .map(f -> Declarator.structMember(toCType(f.type()), variable(f.name()))).toList();
        var code = Statement.structDeclarationStatement(Declarator.struct(variable(st.name()), members))
                .toPrettyString("", " ".repeat(indentSize));
        return lines(code);
    }

    /**
     * Declares the variable and initializes it from its source.
     * <p>
     * Memory is always read with {@code bpf_probe_read}, as the verifier forbids dereferencing arbitrary pointers.
     *
     * @throws TracingException {@code INVALID_VARIABLE} if the variable has no source
     */
    public static List<String> genScalarVariable(ScalarVariable var) {
        if (var.source() == null) {
            throw TracingException.invalidVariable("Variable " + var.name() + " has no source");
        }
        var cType = toCType(var.valType());
        var name = variable(var.name());
        return var.source().match(
                reg -> List.of(variableDefinition(cType, name,
                        call(variable(reg.register().accessor()), variable(CTX))).toPrettyString()),
                mem -> List.of(variableDefinition(cType, name).toPrettyString(),
                        expression(call(variable("bpf_probe_read"), addressOf(name),
                                sizeof(Expression.type(cType)), memoryAddress(mem))).toPrettyString()),
                builtin -> List.of(variableDefinition(cType, name, builtinValue(builtin.helper())).toPrettyString()));
    }

    private static Expression memoryAddress(MemorySource mem) {
        if (mem.offset() < 0) {
            return binary("-", verbatim(mem.base()), constant(-(long) mem.offset()));
        }
        return binary("+", verbatim(mem.base()), constant(mem.offset()));
    }

    private static Expression builtinValue(BPFHelper helper) {
        var pidTgid = call(variable(PID_TGID_HELPER));
        return switch (helper) {
            case TID -> cast(identifier("uint32_t"), pidTgid);
            case TGID -> binary(">>", pidTgid, constant(32));
            case TGID_PID -> pidTgid;
        };
    }

    /**
     * Zero initialized struct variable, followed by one assignment per field that has a source variable.
     * <p>
     * Fields without a source variable keep their zero value, surplus source variables are ignored.
     *
     * @throws TracingException {@code INVALID_VARIABLE} if the variable is not of the passed struct type
     */
    public static List<String> genStructVariable(Struct st, StructVariable stVar) {
        if (!st.name().equals(stVar.structName())) {
            throw TracingException.invalidVariable("Struct variable " + stVar.name() + " is of type " +
                    stVar.structName() + ", not " + st.name());
        }
        var fields = st.fields();
        var sources = stVar.variableNames();
        if (sources.size() > fields.size()) {
            logger.warning("Struct variable " + stVar.name() + " has " + sources.size() + " source variables but " +
                    st.name() + " only " + fields.size() + " fields, ignoring " + sources.subList(fields.size(),
                    sources.size()));
        } else if (sources.size() < fields.size()) {
            logger.fine("Struct variable " + stVar.name() + " leaves " + (fields.size() - sources.size()) +
                    " fields zeroed");
        }
        var name = variable(stVar.name());
        List<String> result = new ArrayList<>();
        result.add(variableDefinition(structIdentifier(st.name()), name, Initializer.empty()).toPrettyString());
        for (int i = 0; i < Math.min(fields.size(), sources.size()); i++) {
            result.add(expression(assignment(memberAccess(name, variable(fields.get(i).name())),
                    variable(sources.get(i)))).toPrettyString());
        }
        return result;
    }

    public static List<String> genMapStashAction(MapStashAction action) {
        return List.of(expression(call(memberAccess(variable(action.mapName()), variable("update")),
                addressOf(variable(action.keyVariableName())),
                addressOf(variable(action.valueVariableName())))).toPrettyString());
    }

    public static List<String> genOutputAction(OutputAction action) {
        var value = variable(action.variableName());
        return List.of(expression(call(memberAccess(variable(action.perfBufferName()), variable("perf_submit")),
                variable(CTX), addressOf(value), sizeof(value))).toPrettyString());
    }

    /**
     * Whole probe function, in this order: struct definitions, function header, scalar variables,
     * struct variables, map stash actions, output actions, {@code return 0;} and the closing brace
     *
     * @throws TracingException {@code INVALID_VARIABLE} if a struct variable references a struct not defined in
     *                          the probe, a variable has no source, or an action uses an undeclared variable
     */
    public List<String> genPhysicalProbe(PhysicalProbe probe) {
        return genPhysicalProbe(probe, Map.of());
    }

    /**
     * @param sharedStructs structs defined outside the probe, probe level structs shadow them
     */
    private List<String> genPhysicalProbe(PhysicalProbe probe, Map<String, Struct> sharedStructs) {
        List<String> result = new ArrayList<>();
        for (Struct st : probe.structs()) {
            result.addAll(genStruct(st, options.indentSize()));
        }
        result.add(probeFunction(probe.name()).header(""));
        result.addAll(genProbeBody(probe, sharedStructs));
        result.add(Statement.returnStatement(constant(0)).toPrettyString());
        result.add("}");
        logger.fine(() -> "Generated " + result.size() + " lines for probe " + probe.name());
        return result;
    }

    private static Statement.FunctionDeclarationStatement probeFunction(String name) {
        var header = Declarator.function(variable(name), identifier("int"),
                List.of(Declarator.parameter(variable(CTX), Declarator.pointer(structIdentifier("pt_regs")))));
        return Statement.functionDeclarationStatement(header, List.of());
    }

    private static List<String> genProbeBody(PhysicalProbe probe, Map<String, Struct> sharedStructs) {
        Map<String, Struct> structs = new HashMap<>(sharedStructs);
        probe.structs().forEach(st -> structs.put(st.name(), st));
        Set<String> declared = new HashSet<>();
        List<String> result = new ArrayList<>();
        for (ScalarVariable var : probe.vars()) {
            result.addAll(genScalarVariable(var));
            declare(probe, declared, var.name());
        }
        for (StructVariable stVar : probe.stVars()) {
            var st = structs.get(stVar.structName());
            if (st == null) {
                throw TracingException.invalidVariable("Struct variable " + stVar.name() + " in probe " +
                        probe.name() + " uses undefined struct " + stVar.structName());
            }
            stVar.variableNames().stream().limit(st.fields().size())
                    .forEach(source -> checkDeclared(probe, declared, source));
            result.addAll(genStructVariable(st, stVar));
            declare(probe, declared, stVar.name());
        }
        for (MapStashAction action : probe.mapStashActions()) {
            checkDeclared(probe, declared, action.keyVariableName());
            checkDeclared(probe, declared, action.valueVariableName());
            result.addAll(genMapStashAction(action));
        }
        for (OutputAction action : probe.outputActions()) {
            checkDeclared(probe, declared, action.variableName());
            result.addAll(genOutputAction(action));
        }
        return result;
    }

    private static void declare(PhysicalProbe probe, Set<String> declared, String name) {
        if (!declared.add(name)) {
            throw TracingException.invalidVariable("Variable " + name + " is declared twice in probe " + probe.name());
        }
    }

    private static void checkDeclared(PhysicalProbe probe, Set<String> declared, String name) {
        if (!declared.contains(name)) {
            throw TracingException.invalidVariable("Variable " + name + " is used before its declaration in probe " +
                    probe.name());
        }
    }

    /**
     * Complete source unit: include, shared structs, map and perf buffer declarations and all probes.
     * Struct variables of every probe may use the shared structs.
     *
     * @throws TracingException {@code INVALID_SPEC} for duplicate probe names, {@code INVALID_VARIABLE} if
     *                          a probe uses an undeclared map or perf buffer or for any probe level error
     */
    public List<String> genProgram(PhysicalProgram program) {
        List<String> result = new ArrayList<>();
        result.add(Statement.include("linux/ptrace.h").toPrettyString());
        for (Struct st : program.structs()) {
            result.addAll(genStruct(st, options.indentSize()));
        }
        for (MapDeclaration map : program.maps()) {
            result.add(expression(call(variable("BPF_HASH"), variable(map.name()),
                    Expression.type(toCType(map.keyType())), Expression.type(toCType(map.valueType()))))
                    .toPrettyString());
        }
        for (var perfBuffer : program.perfBuffers()) {
            result.add(expression(call(variable("BPF_PERF_OUTPUT"), variable(perfBuffer.name()))).toPrettyString());
        }
        Map<String, Struct> sharedStructs = new HashMap<>();
        program.structs().forEach(st -> sharedStructs.put(st.name(), st));
        Set<String> maps = new HashSet<>();
        program.maps().forEach(m -> maps.add(m.name()));
        Set<String> perfBuffers = new HashSet<>();
        program.perfBuffers().forEach(p -> perfBuffers.add(p.name()));
        Set<String> probeNames = new HashSet<>();
        for (PhysicalProbe probe : program.probes()) {
            if (!probeNames.add(probe.name())) {
                throw TracingException.invalidSpec("Duplicate probe " + probe.name());
            }
            for (MapStashAction action : probe.mapStashActions()) {
                if (!maps.contains(action.mapName())) {
                    throw TracingException.invalidVariable("Probe " + probe.name() + " uses undeclared map " +
                            action.mapName());
                }
            }
            for (OutputAction action : probe.outputActions()) {
                if (!perfBuffers.contains(action.perfBufferName())) {
                    throw TracingException.invalidVariable("Probe " + probe.name() + " uses undeclared perf buffer " +
                            action.perfBufferName());
                }
            }
            result.addAll(genPhysicalProbe(probe, sharedStructs));
        }
        return result;
    }

    /**
     * Join lines into source code
     */
    public static String toSource(List<String> lines) {
        return String.join("\n", lines) + "\n";
    }

    private static List<String> lines(String code) {
        return List.of(code.split("\n"));
    }
}
