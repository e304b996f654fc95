package org.littlemanplus.compiler;

import org.littlemanplus.compiler.api.AssembledProgram;
import org.littlemanplus.compiler.api.CompilationException;
import org.littlemanplus.compiler.api.SourceInfo;
import org.littlemanplus.compiler.backend.link.Linker;
import org.littlemanplus.compiler.diagnostics.DiagnosticsEngine;
import org.littlemanplus.compiler.frontend.lexer.Lexer;
import org.littlemanplus.compiler.frontend.lexer.Token;
import org.littlemanplus.compiler.frontend.parser.Parser;
import org.littlemanplus.compiler.frontend.parser.ast.InstructionNode;
import org.littlemanplus.runtime.Config;
import org.littlemanplus.runtime.isa.Instruction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Orchestrates the assembly pipeline from source text to an {@link AssembledProgram}:
 * lexing, parsing and label resolution.
 * <p>
 * Assembly is a pure function of its input. Each call uses fresh phase objects, so a
 * single instance may be reused freely.
 */
public class Assembler {

    private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);
    private static final String DEFAULT_PROGRAM_NAME = "<memory>";

    /**
     * Assembles source text.
     * @param source The complete program text.
     * @return The assembled program.
     * @throws CompilationException if any syntax or linking error occurs.
     */
    public AssembledProgram assemble(String source) throws CompilationException {
        return assemble(source, DEFAULT_PROGRAM_NAME);
    }

    /**
     * Assembles a list of source lines.
     * @param sourceLines The program lines.
     * @param programName The name of the program, used in diagnostics.
     * @return The assembled program.
     * @throws CompilationException if any syntax or linking error occurs.
     */
    public AssembledProgram assemble(List<String> sourceLines, String programName) throws CompilationException {
        return assemble(String.join("\n", sourceLines), programName);
    }

    /**
     * Assembles source text.
     * @param source The complete program text.
     * @param programName The name of the program, used in diagnostics.
     * @return The assembled program.
     * @throws CompilationException if any syntax or linking error occurs.
     */
    public AssembledProgram assemble(String source, String programName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        Lexer lexer = new Lexer(source, diagnostics, programName);
        List<Token> tokens = lexer.scanTokens();

        // Phase 2: Parsing
        List<String> lines = Arrays.asList(source.split("\\r?\\n", -1));
        Parser parser = new Parser(tokens, lines, diagnostics);
        List<InstructionNode> nodes = parser.parse();
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        // Phase 3: Label resolution
        Linker linker = new Linker(Config.MEMORY_CAPACITY, diagnostics);
        List<Instruction> instructions = linker.link(nodes);
        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }

        List<SourceInfo> sourceMap = nodes.stream()
                .map(InstructionNode::source)
                .collect(Collectors.toList());
        LOG.debug("Assembled '{}': {} cells, {} labels", programName, instructions.size(), linker.getLabels().size());
        return new AssembledProgram(programName, instructions, linker.getLabels(), sourceMap);
    }
}
