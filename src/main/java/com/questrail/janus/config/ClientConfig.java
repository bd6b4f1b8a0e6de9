package com.questrail.janus.config;

import com.questrail.janus.security.ResourceLimits;
import com.questrail.janus.security.SecurityValidator;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Configuration of a Janus client.
 *
 * @param serverSocketPath         path of the server socket requests are sent to
 * @param maxMessageSize           largest request payload sent, in bytes
 * @param defaultTimeout           request deadline when the caller gives none
 * @param maxPendingRequests       outstanding requests allowed at once
 * @param replySocketDirectory     directory ephemeral reply sockets are created in
 * @param replySocketPrefix        file name prefix of reply sockets
 * @param validateBeforeSend       validate arguments against the manifest before sending
 * @param allowedSocketDirectories directories the server path may live in
 */
public record ClientConfig(
    String serverSocketPath,
    int maxMessageSize,
    Duration defaultTimeout,
    int maxPendingRequests,
    String replySocketDirectory,
    String replySocketPrefix,
    boolean validateBeforeSend,
    List<String> allowedSocketDirectories
) {
    public ClientConfig {
        Objects.requireNonNull(serverSocketPath, "serverSocketPath");
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(replySocketDirectory, "replySocketDirectory");
        Objects.requireNonNull(replySocketPrefix, "replySocketPrefix");
        if (maxMessageSize <= 0) {
            throw new IllegalArgumentException("maxMessageSize must be > 0");
        }
        if (defaultTimeout.isNegative() || defaultTimeout.isZero()) {
            throw new IllegalArgumentException("defaultTimeout must be > 0");
        }
        if (maxPendingRequests <= 0) {
            throw new IllegalArgumentException("maxPendingRequests must be > 0");
        }
        if (replySocketPrefix.isBlank()) {
            throw new IllegalArgumentException("replySocketPrefix must not be empty");
        }
        allowedSocketDirectories = allowedSocketDirectories == null
                ? SecurityValidator.DEFAULT_ALLOWED_DIRECTORIES
                : List.copyOf(allowedSocketDirectories);
    }

    public static ClientConfig defaults(String serverSocketPath) {
        return builder().withServerSocketPath(serverSocketPath).build();
    }

    public ResourceLimits resourceLimits() {
        return new ResourceLimits(ResourceLimits.DEFAULT_MAX_ACTIVE_HANDLERS,
                ResourceLimits.DEFAULT_MAX_HANDLERS, maxPendingRequests);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String serverSocketPath;
        private int maxMessageSize = ServerConfig.DEFAULT_MAX_MESSAGE_SIZE;
        private Duration defaultTimeout = ServerConfig.DEFAULT_TIMEOUT;
        private int maxPendingRequests = ResourceLimits.DEFAULT_MAX_PENDING_REQUESTS;
        private String replySocketDirectory = "/tmp";
        private String replySocketPrefix = "janus";
        private boolean validateBeforeSend = true;
        private List<String> allowedSocketDirectories = SecurityValidator.DEFAULT_ALLOWED_DIRECTORIES;

        public Builder withServerSocketPath(String serverSocketPath) {
            this.serverSocketPath = serverSocketPath;
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

        public Builder withMaxPendingRequests(int maxPendingRequests) {
            this.maxPendingRequests = maxPendingRequests;
            return this;
        }

        public Builder withReplySocketDirectory(String replySocketDirectory) {
            this.replySocketDirectory = replySocketDirectory;
            return this;
        }

        public Builder withReplySocketPrefix(String replySocketPrefix) {
            this.replySocketPrefix = replySocketPrefix;
            return this;
        }

        public Builder withValidateBeforeSend(boolean validateBeforeSend) {
            this.validateBeforeSend = validateBeforeSend;
            return this;
        }

        public Builder withAllowedSocketDirectories(List<String> directories) {
            this.allowedSocketDirectories = directories;
            return this;
        }

        public ClientConfig build() {
            return new ClientConfig(serverSocketPath, maxMessageSize, defaultTimeout, maxPendingRequests,
                    replySocketDirectory, replySocketPrefix, validateBeforeSend, allowedSocketDirectories);
        }
    }
}
