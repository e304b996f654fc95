package org.littlemanplus.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.littlemanplus.junit.extensions.logging.AllowLog;
import org.littlemanplus.junit.extensions.logging.LogLevel;
import org.littlemanplus.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives the {@code lmp} command line through picocli with captured output streams.
 */
@ExtendWith(LogWatchExtension.class)
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
    }

    private String program(String name, String... lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, String.join("\n", lines));
        return file.toString();
    }

    private static String[] lines(StringWriter writer) {
        return writer.toString().trim().split("\\R");
    }

    @Test
    @Tag("integration")
    void testRunPrintsOutputsAndExitsZero() throws IOException {
        String file = program("countdown.lmc",
                "     INP",
                "loop OUT",
                "     SUB one",
                "     BRP loop",
                "     HLT",
                "one  DAT 1");

        int exitCode = commandLine.execute("run", "-f", file, "-i", "2");

        assertThat(exitCode).isZero();
        assertThat(lines(out)).containsExactly("2", "1", "0");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testRunConsumesCommaSeparatedInputs() throws IOException {
        String file = program("add.lmc", "INP", "STA a", "INP", "ADD a", "OUT", "HLT", "a DAT");

        int exitCode = commandLine.execute("run", "-f", file, "-i", "40,2");

        assertThat(exitCode).isZero();
        assertThat(lines(out)).containsExactly("42");
    }

    @Test
    @Tag("integration")
    void testCompileErrorExitsWithTwo() throws IOException {
        String file = program("broken.lmc", "BRA nowhere");

        int exitCode = commandLine.execute("run", "-f", file);

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("broken.lmc:1").contains("Unknown label 'nowhere'");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testFaultExitsWithOne() throws IOException {
        String file = program("fault.lmc", "BRA 500");

        int exitCode = commandLine.execute("run", "-f", file);

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("ADDRESS_OUT_OF_RANGE").contains("address 0");
    }

    @Test
    @Tag("integration")
    void testMissingInputExitsWithOne() throws IOException {
        String file = program("echo.lmc", "INP", "OUT", "HLT");

        int exitCode = commandLine.execute("run", "-f", file);

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("waiting for input");
    }

    @Test
    @Tag("integration")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProgramRunner")
    void testMaxCyclesOptionStopsEndlessLoop() throws IOException {
        String file = program("spin.lmc", "loop BRA loop");

        int exitCode = commandLine.execute("run", "-f", file, "--max-cycles", "5");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("did not halt within 5 cycles");
    }

    @Test
    @Tag("integration")
    void testAssemblePrintsJsonImage() throws IOException {
        String file = program("listing.lmc", "start INP", "      OUT", "      BRA @start");

        int exitCode = commandLine.execute("assemble", "-f", file);

        assertThat(exitCode).isZero();
        JsonObject listing = JsonParser.parseString(out.toString()).getAsJsonObject();
        assertThat(listing.get("program").getAsString()).isEqualTo("listing.lmc");
        assertThat(listing.getAsJsonObject("labels").get("start").getAsInt()).isZero();
        JsonArray cells = listing.getAsJsonArray("cells");
        assertThat(cells).hasSize(3);
        JsonObject last = cells.get(2).getAsJsonObject();
        assertThat(last.get("value").getAsLong()).isEqualTo(6100L);
        assertThat(last.get("disassembly").getAsString()).isEqualTo("BRA 100");
        assertThat(last.get("line").getAsInt()).isEqualTo(3);
    }

    @Test
    @Tag("integration")
    void testMissingConfigFileIsUsageError() throws IOException {
        String file = program("halt.lmc", "HLT");

        int exitCode = commandLine.execute("-c", tempDir.resolve("missing.conf").toString(), "run", "-f", file);

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("was not found");
    }

    @Test
    @Tag("integration")
    void testConfigFileSelectsDecodePolicy() throws IOException {
        Path config = tempDir.resolve("strict.conf");
        Files.writeString(config, "littleman.vm.decode-failure-policy = FAULT\n");
        String file = program("data.lmc", "DAT 5");

        int exitCode = commandLine.execute("-c", config.toString(), "run", "-f", file);

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("UNKNOWN_OPCODE");
    }

    @Test
    @Tag("integration")
    void testInvalidSettingIsUsageError() throws IOException {
        Path config = tempDir.resolve("bogus.conf");
        Files.writeString(config, "littleman.vm.decode-failure-policy = BOGUS\n");
        String file = program("halt.lmc", "HLT");

        int exitCode = commandLine.execute("-c", config.toString(), "run", "-f", file);

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("Invalid virtual machine settings").contains("BOGUS");
        assertThat(err.toString()).doesNotContain("at org.littlemanplus");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("integration")
    void testNonPositiveMaxCyclesIsUsageError() throws IOException {
        String file = program("halt.lmc", "HLT");

        int exitCode = commandLine.execute("run", "-f", file, "--max-cycles", "0");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("max-cycles must be positive");
    }
}
