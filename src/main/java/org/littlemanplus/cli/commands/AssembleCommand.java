package org.littlemanplus.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.littlemanplus.compiler.Assembler;
import org.littlemanplus.compiler.api.AssembledProgram;
import org.littlemanplus.compiler.api.CompilationException;
import org.littlemanplus.compiler.api.SourceInfo;
import org.littlemanplus.runtime.isa.InstructionCodec;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "assemble", description = "Assembles a program and prints its memory image as JSON.")
public class AssembleCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the assembly file.")
    private File file;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        AssembledProgram program;
        try {
            List<String> sourceLines = Files.readAllLines(file.toPath());
            program = new Assembler().assemble(sourceLines, file.getName());
        } catch (IOException e) {
            err.println("Could not read " + file + ": " + e.getMessage());
            return RunCommand.EXIT_COMPILE_FAILED;
        } catch (CompilationException e) {
            err.println(e.getMessage());
            return RunCommand.EXIT_COMPILE_FAILED;
        }

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(ImageListing.of(program)));
        return 0;
    }

    /**
     * The JSON shape of an assembled program.
     */
    static final class ImageListing {
        String program;
        Map<String, Integer> labels;
        List<Cell> cells;

        static ImageListing of(AssembledProgram assembled) {
            ImageListing listing = new ImageListing();
            listing.program = assembled.programName();
            listing.labels = assembled.labels();
            listing.cells = new ArrayList<>();
            long[] image = assembled.toMemoryImage();
            for (int address = 0; address < image.length; address++) {
                SourceInfo source = assembled.sourceMap().get(address);
                listing.cells.add(new Cell(address, image[address],
                        InstructionCodec.disassemble(image[address]), source.lineNumber()));
            }
            return listing;
        }
    }

    /**
     * One memory cell in the listing.
     */
    static final class Cell {
        final int address;
        final long value;
        final String disassembly;
        final int line;

        Cell(int address, long value, String disassembly, int line) {
            this.address = address;
            this.value = value;
            this.disassembly = disassembly;
            this.line = line;
        }
    }
}
