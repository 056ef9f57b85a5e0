package me.bechberger.dyntrace.tracing;

import me.bechberger.dyntrace.ir.BPFHelper;
import me.bechberger.dyntrace.ir.logical.Probe;
import me.bechberger.dyntrace.ir.logical.Probe.Argument;
import me.bechberger.dyntrace.ir.logical.Probe.FunctionLatency;
import me.bechberger.dyntrace.ir.logical.Probe.MapStashAction;
import me.bechberger.dyntrace.ir.logical.Probe.OutputAction;
import me.bechberger.dyntrace.ir.logical.Probe.Printk;
import me.bechberger.dyntrace.ir.logical.Probe.ReturnValue;
import me.bechberger.dyntrace.ir.logical.Probe.TracePoint;
import me.bechberger.dyntrace.ir.logical.Program;
import me.bechberger.dyntrace.ir.logical.Program.MapDefinition;
import me.bechberger.dyntrace.ir.logical.Program.OutputDefinition;
import me.bechberger.dyntrace.ir.physical.Register;
import me.bechberger.dyntrace.ir.physical.ScalarType;
import me.bechberger.dyntrace.ir.physical.ScalarVariable;
import me.bechberger.dyntrace.ir.physical.ValueSource;
import me.bechberger.dyntrace.ir.physical.VariableType;
import me.bechberger.dyntrace.tracing.ProgramJSON.CannotParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProgramJSONTest {

    static String resource(String name) throws IOException {
        try (var stream = ProgramJSONTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(stream, "Missing test resource " + name);
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    public void testParseLogicalProgram() throws IOException {
        var program = ProgramJSON.parseLogicalProgram(resource("latency_program.json"));
        assertEquals(List.of(), program.maps());
        assertEquals(1, program.probes().size());
        var probe = program.probes().get(0);
        assertEquals("probe0", probe.name());
        assertEquals(new TracePoint("/usr/local/bin/server", "main.MyFunc", TracePoint.Type.LOGICAL),
                probe.tracePoint());
        assertEquals(List.of(new Argument("arg0", "a"), new Argument("arg1", "b")), probe.args());
        assertEquals(List.of(new ReturnValue("retval0", "$0")), probe.retVals());
        assertEquals(new FunctionLatency("lat0"), probe.functionLatency());
        assertEquals(List.of(), probe.mapStashActions());
        assertEquals(List.of(), probe.printks());
    }

    @Test
    public void testLogicalProgramSurvivesSerialization() {
        var probe = Probe.of("p", new TracePoint(null, "f", TracePoint.Type.ENTRY))
                .withArgs(List.of(new Argument("a", "x.y")))
                .withMapStashActions(List.of(new MapStashAction("m", BPFHelper.TGID_PID, List.of("a"))))
                .withOutputActions(List.of(new OutputAction(null, List.of("a")), new OutputAction("out", List.of("a"))))
                .withPrintks(List.of(new Printk("entered", null), new Printk(null, "a")));
        var program = new Program(List.of(new MapDefinition("m")),
                List.of(new OutputDefinition("out", List.of("value"))), List.of(probe));
        assertEquals(program, ProgramJSON.parseLogicalProgram(ProgramJSON.toJSON(program)));
    }

    @Test
    public void testToJSONKeepsKeyOrder() {
        var json = ProgramJSON.toJSON(new Program(List.of(new MapDefinition("m")), List.of(), List.of()));
        assertTrue(json.indexOf("\"maps\"") < json.indexOf("\"outputs\""));
        assertTrue(json.indexOf("\"outputs\"") < json.indexOf("\"probes\""));
    }

    @Test
    public void testParsePhysicalProgram() throws IOException {
        var program = ProgramJSON.parsePhysicalProgram(resource("connect_physical.json"));
        assertEquals(1, program.structs().size());
        assertEquals("test", program.maps().get(0).name());
        assertEquals(ScalarType.UINT32, program.maps().get(0).keyType());
        assertEquals("data_events", program.perfBuffers().get(0).name());
        var probe = program.probes().get(0);
        assertEquals(List.of(new ScalarVariable("key", ScalarType.UINT32, ValueSource.builtin(BPFHelper.TGID)),
                new ScalarVariable("var", ScalarType.INT32, ValueSource.register(Register.SP))), probe.vars());
        assertEquals(List.of(), probe.structs());
        assertEquals(List.of("var"), probe.stVars().get(0).variableNames());
    }

    @Test
    public void testParseMemoryVariable() {
        var program = ProgramJSON.parsePhysicalProgram("""
                {"probes": [{"name": "p", "vars": [
                    {"name": "v", "type": "INT64", "memory": {"base": "sp", "offset": -16}},
                    {"name": "w", "type": "VOID_POINTER", "memory": {"base": "v"}}]}]}
                """);
        assertEquals(List.of(new ScalarVariable("v", ScalarType.INT64, ValueSource.memory("sp", -16)),
                        new ScalarVariable("w", ScalarType.VOID_POINTER, ValueSource.memory("v", 0))),
                program.probes().get(0).vars());
    }

    @Test
    public void testVariableWithoutSourceIsKept() {
        var program = ProgramJSON.parsePhysicalProgram("""
                {"probes": [{"name": "p", "vars": [{"name": "v", "type": "INT32"}]}]}
                """);
        assertNull(program.probes().get(0).vars().get(0).source());
    }

    @Test
    public void testVariableWithTwoSources() {
        assertThrows(CannotParseException.class, () -> ProgramJSON.parsePhysicalProgram("""
                {"probes": [{"name": "p", "vars": [{"name": "v", "type": "INT32", "register": "SP", "builtin": "TID"}]}]}
                """));
    }

    @Test
    public void testType() {
        assertEquals(ScalarType.STRING, ProgramJSON.type("STRING"));
        assertEquals(VariableType.struct("attr_t"), ProgramJSON.type("struct attr_t"));
        assertThrows(CannotParseException.class, () -> ProgramJSON.type("int"));
    }

    @Test
    public void testUnknownEnumValue() {
        var e = assertThrows(CannotParseException.class, () -> ProgramJSON.parseLogicalProgram("""
                {"probes": [{"name": "p", "tracePoint": {"symbol": "f", "type": "SOMETIMES"}}]}
                """));
        assertTrue(e.getMessage().contains("SOMETIMES"));
    }

    @Test
    public void testMissingTracePoint() {
        assertThrows(CannotParseException.class,
                () -> ProgramJSON.parseLogicalProgram("{\"probes\": [{\"name\": \"p\"}]}"));
    }

    @Test
    public void testMissingListsAreEmpty() {
        var program = ProgramJSON.parseLogicalProgram("{}");
        assertEquals(new Program(List.of(), List.of(), List.of()), program);
    }

    @Test
    public void testEmptyDocument() {
        assertThrows(CannotParseException.class, () -> ProgramJSON.parseLogicalProgram(""));
    }

    @ParameterizedTest
    @org.junit.jupiter.params.provider.ValueSource(strings = {
            "{\"probes\": [null]}",
            "{\"probes\": 5}",
            "{\"probes\": [5]}",
            "{\"maps\": {\"name\": \"m\"}}",
            "{\"outputs\": [{\"name\": \"o\", \"fields\": [null]}]}",
            "{\"probes\": [{\"name\": \"p\", \"tracePoint\": {\"symbol\": \"f\", \"type\": \"ENTRY\"}, \"args\": [null]}]}",
            "{\"probes\": [{\"name\": \"p\", \"tracePoint\": 1}]}",
            "{\"probes\": [{\"name\": \"p\", \"tracePoint\": {\"symbol\": \"f\", \"type\": \"ENTRY\"}, " +
                    "\"functionLatency\": \"l\"}]}",
            "{\"probes\": [{\"name\": \"p\", \"tracePoint\": {\"symbol\": \"f\", \"type\": \"ENTRY\"}, " +
                    "\"outputActions\": [{\"variableNames\": [null]}]}]}"})
    public void testMalformedLogicalProgram(String json) {
        assertThrows(CannotParseException.class, () -> ProgramJSON.parseLogicalProgram(json));
    }

    @ParameterizedTest
    @org.junit.jupiter.params.provider.ValueSource(strings = {
            "{\"probes\": [null]}",
            "{\"structs\": [{\"name\": \"s\", \"fields\": [null]}]}",
            "{\"probes\": [{\"name\": \"p\", \"stVars\": [{\"name\": \"v\", \"structName\": \"s\", " +
                    "\"variableNames\": [null]}]}]}",
            "{\"probes\": [{\"name\": \"p\", \"vars\": [{\"name\": \"v\", \"type\": \"INT32\", \"memory\": 8}]}]}",
            "{\"probes\": [{\"name\": \"p\", \"vars\": [{\"name\": \"v\", \"type\": \"INT32\", " +
                    "\"memory\": {\"base\": \"sp\", \"offset\": \"far\"}}]}]}"})
    public void testMalformedPhysicalProgram(String json) {
        assertThrows(CannotParseException.class, () -> ProgramJSON.parsePhysicalProgram(json));
    }

    @Test
    public void testInvalidJSON() {
        assertThrows(RuntimeException.class, () -> ProgramJSON.parseLogicalProgram("{\"probes\": ["));
    }
}
