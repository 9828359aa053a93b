package io.kwinctl.api;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of one invocation.
 *
 * @param tokens directive tokens following the global options
 * @param remove script name to unload instead of compiling anything
 */
public record RunConfiguration(
    List<String> tokens,
    boolean debug,
    boolean dryRun,
    Optional<String> shortcut,
    String scriptName,
    Optional<String> remove,
    HostVersion hostVersion,
    Duration replyTimeout,
    Duration completionTimeout,
    LogLevel logLevel,
    String cmdline
) {
    public RunConfiguration {
        tokens = List.copyOf(tokens);
        Objects.requireNonNull(shortcut, "shortcut");
        Objects.requireNonNull(scriptName, "scriptName");
        Objects.requireNonNull(remove, "remove");
        Objects.requireNonNull(hostVersion, "hostVersion");
        Objects.requireNonNull(replyTimeout, "replyTimeout");
        Objects.requireNonNull(completionTimeout, "completionTimeout");
        Objects.requireNonNull(logLevel, "logLevel");
        Objects.requireNonNull(cmdline, "cmdline");
    }

    public boolean persistent() {
        return shortcut.isPresent();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private List<String> tokens = List.of();
        private boolean debug;
        private boolean dryRun;
        private Optional<String> shortcut = Optional.empty();
        private String scriptName = "";
        private Optional<String> remove = Optional.empty();
        private HostVersion hostVersion = HostVersion.PLASMA_6;
        private Duration replyTimeout = Duration.ofSeconds(5);
        private Duration completionTimeout = Duration.ofSeconds(2);
        private LogLevel logLevel = LogLevel.INFO;
        private String cmdline = "";

        public Builder tokens(List<String> tokens) {
            this.tokens = tokens;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder shortcut(Optional<String> shortcut) {
            this.shortcut = shortcut;
            return this;
        }

        public Builder scriptName(String scriptName) {
            this.scriptName = scriptName;
            return this;
        }

        public Builder remove(Optional<String> remove) {
            this.remove = remove;
            return this;
        }

        public Builder hostVersion(HostVersion hostVersion) {
            this.hostVersion = hostVersion;
            return this;
        }

        public Builder replyTimeout(Duration replyTimeout) {
            this.replyTimeout = replyTimeout;
            return this;
        }

        public Builder completionTimeout(Duration completionTimeout) {
            this.completionTimeout = completionTimeout;
            return this;
        }

        public Builder logLevel(LogLevel logLevel) {
            this.logLevel = logLevel;
            return this;
        }

        public Builder cmdline(String cmdline) {
            this.cmdline = cmdline;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(
                tokens,
                debug,
                dryRun,
                shortcut,
                scriptName,
                remove,
                hostVersion,
                replyTimeout,
                completionTimeout,
                logLevel,
                cmdline
            );
        }
    }
}
