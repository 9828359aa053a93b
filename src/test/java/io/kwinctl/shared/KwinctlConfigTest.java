package io.kwinctl.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.kwinctl.api.HostVersion;
import io.kwinctl.api.LogLevel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KwinctlConfigTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileYieldsDefaults() {
        var config = KwinctlConfig.load(tempDir.resolve("absent.toml"));
        assertEquals(KwinctlConfig.defaults(), config);
        assertEquals(Duration.ofSeconds(5), config.replyTimeout());
        assertTrue(config.hostVersion().isEmpty());
    }

    @Test
    void readsHostSection() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, String.join("\n",
            "log-level = \"debug\"",
            "",
            "[host]",
            "version = \"5\"",
            "reply-timeout = \"750ms\"",
            "completion-timeout = \"3s\"",
            ""));

        var config = KwinctlConfig.load(file);

        assertEquals(LogLevel.DEBUG, config.logLevel());
        assertEquals(Optional.of(HostVersion.PLASMA_5), config.hostVersion());
        assertEquals(Duration.ofMillis(750), config.replyTimeout());
        assertEquals(Duration.ofSeconds(3), config.completionTimeout());
    }

    @Test
    void autoVersionDefersToEnvironment() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[host]\nversion = \"auto\"\n");
        assertTrue(KwinctlConfig.load(file).hostVersion().isEmpty());
    }

    @Test
    void malformedFileIsRejected() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "[host\nversion = ");
        assertThrows(IllegalArgumentException.class, () -> KwinctlConfig.load(file));
    }

    @Test
    void unknownLogLevelIsRejected() throws Exception {
        Path file = tempDir.resolve("config.toml");
        Files.writeString(file, "log-level = \"loud\"\n");
        assertThrows(IllegalArgumentException.class, () -> KwinctlConfig.load(file));
    }

    @Test
    void locatesConfigFromEnvironment() {
        Path explicit = tempDir.resolve("explicit.toml");
        assertEquals(explicit.toAbsolutePath().normalize(), KwinctlConfig.locate(explicit, Map.of()));

        Path fromVariable = KwinctlConfig.locate(null, Map.of("KWINCTL_CONFIG", tempDir.resolve("env.toml").toString()));
        assertEquals(tempDir.resolve("env.toml").toAbsolutePath().normalize(), fromVariable);

        Path fromXdg = KwinctlConfig.locate(null, Map.of("XDG_CONFIG_HOME", tempDir.toString()));
        assertEquals(tempDir.resolve("kwinctl").resolve("config.toml").toAbsolutePath().normalize(), fromXdg);
    }
}
