package me.bechberger.dyntrace.tracing.cli;

import me.bechberger.dyntrace.tracing.ProgramJSON;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path tmp;

    private Path copyResource(String name) throws IOException {
        var target = tmp.resolve(name);
        try (InputStream stream = MainTest.class.getResourceAsStream("/" + name)) {
            assertNotNull(stream);
            Files.copy(stream, target);
        }
        return target;
    }

    private static int run(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Test
    public void testTransform() throws IOException {
        var input = copyResource("latency_program.json");
        var output = tmp.resolve("out.json");
        assertEquals(0, run("transform", input.toString(), "-o", output.toString()));
        var program = ProgramJSON.parseLogicalProgram(Files.readString(output));
        assertEquals(2, program.probes().size());
        assertEquals("probe0_entry", program.probes().get(0).name());
        assertEquals("probe0_return", program.probes().get(1).name());
        assertEquals("probe0_argstash", program.maps().get(0).name());
    }

    @Test
    public void testCodegen() throws IOException {
        var input = copyResource("connect_physical.json");
        var output = tmp.resolve("out.c");
        assertEquals(0, run("-v", "codegen", "--indent", "4", input.toString(), "-o", output.toString()));
        var code = Files.readString(output);
        assertTrue(code.startsWith("#include <linux/ptrace.h>\n"));
        assertTrue(code.contains("\n    int32_t i32;\n"));
        assertTrue(code.contains("\nint syscall__probe_connect(struct pt_regs* ctx) {\n"));
        assertTrue(code.contains("\ndata_events.perf_submit(ctx, &st_var, sizeof(st_var));\n"));
        assertTrue(code.endsWith("return 0;\n}\n"));
    }

    @Test
    public void testInvalidProgramFails() throws IOException {
        var input = tmp.resolve("invalid.json");
        Files.writeString(input, """
                {"probes": [{"name": "p", "tracePoint": {"symbol": "f", "type": "RETURN"},
                             "args": [{"id": "a", "expr": "x"}]}]}
                """);
        var output = tmp.resolve("out.json");
        assertNotEquals(0, run("transform", input.toString(), "-o", output.toString()));
        assertFalse(Files.exists(output));
    }

    @Test
    public void testMissingInputFails() {
        assertNotEquals(0, run("codegen", tmp.resolve("missing.json").toString()));
    }
}
