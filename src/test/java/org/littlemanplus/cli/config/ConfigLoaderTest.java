package org.littlemanplus.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.littlemanplus.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests the layering of configuration sources in {@link ConfigLoader}.
 */
@ExtendWith(LogWatchExtension.class)
public class ConfigLoaderTest {

    private static final String MAX_CYCLES = "littleman.runner.max-cycles";

    @AfterEach
    void clearOverrides() {
        System.clearProperty(MAX_CYCLES);
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void testDefaultsComeFromReferenceConf() {
        Config config = ConfigLoader.load(new File("does-not-exist.conf"));

        assertThat(config.getInt("littleman.vm.max-indirection-depth")).isEqualTo(32);
        assertThat(config.getString("littleman.vm.decode-failure-policy")).isEqualTo("SKIP");
        assertThat(config.getLong(MAX_CYCLES)).isEqualTo(1_000_000L);
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    @Tag("unit")
    void testResourceOverridesDefaults() {
        Config config = ConfigLoader.loadFromResource("config/test-config.conf");

        assertThat(config.getInt("littleman.vm.max-indirection-depth")).isEqualTo(4);
        assertThat(config.getString("littleman.vm.decode-failure-policy")).isEqualTo("FAULT");
        assertThat(config.getLong(MAX_CYCLES)).isEqualTo(500L);
        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("logging.default-level")).isEqualTo("INFO");
    }

    @Test
    @Tag("unit")
    void testFileOverridesDefaults(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("littleman.conf");
        Files.writeString(file, "littleman.runner.max-cycles = 7\n");

        Config config = ConfigLoader.load(file.toFile());

        assertThat(config.getLong(MAX_CYCLES)).isEqualTo(7L);
        assertThat(config.getInt("littleman.vm.max-indirection-depth")).isEqualTo(32);
    }

    @Test
    @Tag("unit")
    void testSystemPropertyOverridesFile() {
        System.setProperty(MAX_CYCLES, "42");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromResource("config/test-config.conf");

        assertThat(config.getLong(MAX_CYCLES)).isEqualTo(42L);
        assertThat(config.getInt("littleman.vm.max-indirection-depth")).isEqualTo(4);
    }
}
