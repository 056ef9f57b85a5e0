package me.bechberger.dyntrace.tracing.cli;

import me.bechberger.dyntrace.tracing.CodeGen;
import me.bechberger.dyntrace.tracing.ProbeTransformer;
import me.bechberger.dyntrace.tracing.ProgramJSON;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Usage: java ... transform|codegen <input.json> [-o output]
 */
@Command(name = "dyntrace", mixinStandardHelpOptions = true,
        description = "Compiles dynamic tracing programs into eBPF C code",
        subcommands = {Main.Transform.class, Main.Codegen.class})
public class Main implements Runnable {

    private static final Logger logger = Logger.getLogger(Main.class.getName());

    @Option(names = {"-v", "--verbose"}, description = "Be verbose")
    private boolean verbose = false;

    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    void configureLogging() {
        if (verbose) {
            var root = Logger.getLogger("");
            root.setLevel(Level.ALL);
            for (var handler : root.getHandlers()) {
                handler.setLevel(Level.ALL);
            }
        }
    }

    static abstract class SubCommand implements Callable<Integer> {

        @CommandLine.ParentCommand
        Main parent;

        @Parameters(index = "0", description = "JSON file containing the program")
        Path input;

        @Option(names = {"-o", "--output"}, description = "File to write the result to, stdout if absent")
        Path output;

        abstract String process(String json);

        @Override
        public Integer call() {
            parent.configureLogging();
            try {
                var result = process(Files.readString(input));
                if (output == null) {
                    System.out.print(result);
                } else {
                    Files.writeString(output, result);
                    logger.info("Wrote " + output);
                }
                return 0;
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }

    @Command(name = "transform", mixinStandardHelpOptions = true,
            description = "Expands a logical program into entry and return probes with implicit maps and outputs")
    static class Transform extends SubCommand {
        @Override
        String process(String json) {
            var program = ProbeTransformer.transform(ProgramJSON.parseLogicalProgram(json));
            logger.fine(() -> "Transformed program has " + program.probes().size() + " probes");
            return ProgramJSON.toJSON(program) + "\n";
        }
    }

    @Command(name = "codegen", mixinStandardHelpOptions = true,
            description = "Generates eBPF C code for a physical program")
    static class Codegen extends SubCommand {

        @Option(names = "--indent", description = "Indentation of struct fields", defaultValue = "2")
        int indent = 2;

        @Override
        String process(String json) {
            var gen = new CodeGen(new CodeGen.Options(indent));
            return CodeGen.toSource(gen.genProgram(ProgramJSON.parsePhysicalProgram(json)));
        }
    }

    public static void main(String[] args) {
        // use picocli + help if no args
        if (args.length == 0) {
            new CommandLine(new Main()).execute("--help");
            return;
        }
        System.exit(new CommandLine(new Main()).execute(args));
    }
}
