package org.littlemanplus.cli.commands;

import org.littlemanplus.cli.CommandLineInterface;
import org.littlemanplus.runtime.InputProvider;
import org.littlemanplus.runtime.ProgramLoadException;
import org.littlemanplus.runtime.ProgramRunner;
import org.littlemanplus.runtime.RunResult;
import org.littlemanplus.runtime.StepResult;
import org.littlemanplus.runtime.VirtualMachine;
import org.littlemanplus.runtime.VmOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.Callable;

@Command(name = "run", description = "Assembles a program and runs it to completion.")
public class RunCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

    static final int EXIT_HALTED = 0;
    static final int EXIT_STOPPED = 1;
    static final int EXIT_COMPILE_FAILED = 2;

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the assembly file.")
    private File file;

    @Option(names = {"-i", "--input"}, split = ",", description = "Input values, consumed in order by INP.")
    private List<Long> inputs = new ArrayList<>();

    @Option(names = {"--interactive"}, description = "Read further input values from stdin once the listed ones are used up.")
    private boolean interactive;

    @Option(names = {"--max-cycles"}, description = "Overrides littleman.runner.max-cycles.")
    private Long maxCycles;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        VmOptions options;
        try {
            options = VmOptions.fromConfig(parent.getConfig());
            if (maxCycles != null) {
                options = options.withMaxCycles(maxCycles);
            }
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                    "Invalid virtual machine settings: " + e.getMessage(), e, null, null);
        }

        VirtualMachine vm = new VirtualMachine(options);
        try {
            vm.compile(Files.readString(file.toPath(), StandardCharsets.UTF_8), file.getName());
        } catch (IOException e) {
            err.println("Could not read " + file + ": " + e.getMessage());
            return EXIT_COMPILE_FAILED;
        } catch (ProgramLoadException e) {
            err.println(e.getMessage());
            return EXIT_COMPILE_FAILED;
        }

        ProgramRunner runner = new ProgramRunner(options.maxCycles(), value -> {
            out.println(value);
            out.flush();
        });
        RunResult result = runner.run(vm, inputProvider(err));

        switch (result.outcome()) {
            case HALTED:
                return EXIT_HALTED;
            case FAULTED:
                StepResult.Fault fault = (StepResult.Fault) result.lastStep();
                err.println("Fault " + fault.reason() + " at address " + fault.address() + ": " + fault.message());
                return EXIT_STOPPED;
            case AWAITING_INPUT:
                err.println("Program is waiting for input at address " + vm.getProgramCounter() + " but none is left.");
                return EXIT_STOPPED;
            case CYCLE_LIMIT:
            default:
                err.println("Program did not halt within " + options.maxCycles() + " cycles.");
                return EXIT_STOPPED;
        }
    }

    private InputProvider inputProvider(PrintWriter err) {
        InputProvider listed = InputProvider.of(inputs);
        if (!interactive) {
            return listed;
        }
        BufferedReader stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        return () -> {
            OptionalLong next = listed.next();
            return next.isPresent() ? next : readLine(stdin, err);
        };
    }

    private OptionalLong readLine(BufferedReader stdin, PrintWriter err) {
        while (true) {
            err.print("Input: ");
            err.flush();
            String line;
            try {
                line = stdin.readLine();
            } catch (IOException e) {
                LOG.error("Failed to read input from stdin", e);
                return OptionalLong.empty();
            }
            if (line == null) {
                return OptionalLong.empty();
            }
            try {
                return OptionalLong.of(Long.parseLong(line.trim()));
            } catch (NumberFormatException e) {
                err.println("Invalid input: expected an integer");
            }
        }
    }
}
