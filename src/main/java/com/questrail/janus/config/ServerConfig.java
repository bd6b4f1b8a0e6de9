package com.questrail.janus.config;

import com.questrail.janus.security.ResourceLimits;
import com.questrail.janus.security.SecurityValidator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a Janus server.
 *
 * @param socketPath                filesystem path the server binds
 * @param maxMessageSize            largest datagram accepted or sent, in bytes
 * @param defaultTimeout            handler deadline for requests that declare none
 * @param maxConcurrentHandlers     handlers allowed to run at once; excess requests are rejected
 * @param maxHandlers               handlers that may be registered
 * @param cleanupOnStart            remove a stale socket file before binding
 * @param cleanupOnShutdown         remove the socket file on stop
 * @param replyToMalformedRequests  answer undecodable datagrams with a parse error when a reply address can be recovered
 * @param builtinCommands           register the built-in commands
 * @param validateResponses         check handler results against the manifest (advisory)
 * @param allowedSocketDirectories  directories reply addresses may live in
 */
public record ServerConfig(
    String socketPath,
    int maxMessageSize,
    Duration defaultTimeout,
    int maxConcurrentHandlers,
    int maxHandlers,
    boolean cleanupOnStart,
    boolean cleanupOnShutdown,
    boolean replyToMalformedRequests,
    boolean builtinCommands,
    boolean validateResponses,
    List<String> allowedSocketDirectories
) {
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 65_536;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public ServerConfig {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        if (socketPath.isBlank()) {
            throw new IllegalArgumentException("socketPath must not be empty");
        }
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be > 0");
        }
        if (maxConcurrentHandlers <= 0) {
            throw new IllegalArgumentException("maxConcurrentHandlers must be > 0");
        }
        if (maxHandlers <= 0) {
            throw new IllegalArgumentException("maxHandlers must be > 0");
        }
        allowedSocketDirectories = allowedSocketDirectories == null
                ? SecurityValidator.DEFAULT_ALLOWED_DIRECTORIES
                : List.copyOf(allowedSocketDirectories);
    }

    public static ServerConfig defaults(String socketPath) {
        return builder().withSocketPath(socketPath).build();
    }

    public ResourceLimits resourceLimits() {
        return new ResourceLimits(maxConcurrentHandlers, maxHandlers, ResourceLimits.DEFAULT_MAX_PENDING_REQUESTS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String socketPath;
        private int maxMessageSize = DEFAULT_MAX_MESSAGE_SIZE;
        private Duration defaultTimeout = DEFAULT_TIMEOUT;
        private int maxConcurrentHandlers = ResourceLimits.DEFAULT_MAX_ACTIVE_HANDLERS;
        private int maxHandlers = ResourceLimits.DEFAULT_MAX_HANDLERS;
        private boolean cleanupOnStart = true;
        private boolean cleanupOnShutdown = true;
        private boolean replyToMalformedRequests = false;
        private boolean builtinCommands = true;
        private boolean validateResponses = true;
        private List<String> allowedSocketDirectories = SecurityValidator.DEFAULT_ALLOWED_DIRECTORIES;

        public Builder withSocketPath(String socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder withMaxMessageSize(int maxMessageSize) {
            this.maxMessageSize = maxMessageSize;
            return this;
        }

        public Builder withDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
            return this;
        }

        public Builder withMaxConcurrentHandlers(int maxConcurrentHandlers) {
            this.maxConcurrentHandlers = maxConcurrentHandlers;
            return this;
        }

        public Builder withMaxHandlers(int maxHandlers) {
            this.maxHandlers = maxHandlers;
            return this;
        }

        public Builder withCleanupOnStart(boolean cleanupOnStart) {
            this.cleanupOnStart = cleanupOnStart;
            return this;
        }

        public Builder withCleanupOnShutdown(boolean cleanupOnShutdown) {
            this.cleanupOnShutdown = cleanupOnShutdown;
            return this;
        }

        public Builder withReplyToMalformedRequests(boolean reply) {
            this.replyToMalformedRequests = reply;
            return this;
        }

        public Builder withBuiltinCommands(boolean builtinCommands) {
            this.builtinCommands = builtinCommands;
            return this;
        }

        public Builder withValidateResponses(boolean validateResponses) {
            this.validateResponses = validateResponses;
            return this;
        }

        public Builder withAllowedSocketDirectories(List<String> directories) {
            this.allowedSocketDirectories = directories;
            return this;
        }

        public ServerConfig build() {
            return new ServerConfig(socketPath, maxMessageSize, defaultTimeout, maxConcurrentHandlers,
                    maxHandlers, cleanupOnStart, cleanupOnShutdown, replyToMalformedRequests,
                    builtinCommands, validateResponses, allowedSocketDirectories);
        }
    }
}
