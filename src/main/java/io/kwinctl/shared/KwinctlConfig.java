package io.kwinctl.shared;

import io.kwinctl.api.HostVersion;
import io.kwinctl.api.LogLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;

/**
 * User configuration read from {@code config.toml}.
 *
 * <pre>
 * log-level = "info"
 *
 * [host]
 * version = "auto"
 * reply-timeout = "5s"
 * completion-timeout = "2s"
 * </pre>
 */
public record KwinctlConfig(
    LogLevel logLevel,
    Optional<HostVersion> hostVersion,
    Duration replyTimeout,
    Duration completionTimeout
) {
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_COMPLETION_TIMEOUT = Duration.ofSeconds(2);
    static final String CONFIG_VARIABLE = "KWINCTL_CONFIG";

    public KwinctlConfig {
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(hostVersion, "hostVersion");
        Objects.requireNonNull(replyTimeout, "replyTimeout");
        Objects.requireNonNull(completionTimeout, "completionTimeout");
    }

    public static KwinctlConfig defaults() {
        return new KwinctlConfig(LogLevel.INFO, Optional.empty(), DEFAULT_REPLY_TIMEOUT, DEFAULT_COMPLETION_TIMEOUT);
    }

    /**
     * Loads the configuration file, or returns defaults when it does not exist.
     */
    public static KwinctlConfig load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return defaults();
        }
        TomlParseResult result;
        try {
            result = Toml.parse(Files.readString(path));
        } catch (IOException ex) {
            throw new IllegalStateException("Cannot read config file: " + path, ex);
        }
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid config file " + path + ": " + errors);
        }
        return fromToml(result);
    }

    static KwinctlConfig fromToml(TomlParseResult result) {
        LogLevel logLevel = LogLevel.from(result.getString("log-level"));
        TomlTable host = result.getTable("host");
        if (host == null) {
            return new KwinctlConfig(logLevel, Optional.empty(), DEFAULT_REPLY_TIMEOUT, DEFAULT_COMPLETION_TIMEOUT);
        }
        return new KwinctlConfig(
            logLevel,
            HostVersion.fromSetting(host.getString("version")),
            DurationParser.parseOrDefault(host.getString("reply-timeout"), DEFAULT_REPLY_TIMEOUT),
            DurationParser.parseOrDefault(host.getString("completion-timeout"), DEFAULT_COMPLETION_TIMEOUT)
        );
    }

    /**
     * Resolves the config file location: explicit path, then {@code $KWINCTL_CONFIG}, then the XDG config directory.
     */
    public static Path locate(Path explicit, Map<String, String> environment) {
        if (explicit != null) {
            return explicit.toAbsolutePath().normalize();
        }
        String fromEnv = environment.get(CONFIG_VARIABLE);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return Path.of(fromEnv).toAbsolutePath().normalize();
        }
        String xdg = environment.get("XDG_CONFIG_HOME");
        Path base = xdg != null && !xdg.isBlank()
            ? Path.of(xdg)
            : Path.of(System.getProperty("user.home"), ".config");
        return base.resolve("kwinctl").resolve("config.toml").toAbsolutePath().normalize();
    }
}
