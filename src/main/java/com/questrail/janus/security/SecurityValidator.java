package com.questrail.janus.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;
import com.questrail.janus.api.JanusRequest;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SecurityValidator
 * =============================================================================
 * Screens untrusted input before it reaches the engines.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li><b>socket paths</b>: non-empty, at most {@value #MAX_SOCKET_PATH_LENGTH}
 *       characters, absolute, no {@code ..} segment, no NUL, only
 *       {@code [a-zA-Z0-9._-]} in segments, and inside an allowed directory</li>
 *   <li><b>command names</b>: 1 to 64 of {@code [a-zA-Z0-9_-]}</li>
 *   <li><b>request ids</b>: 1 to 64 of {@code [a-zA-Z0-9-]}</li>
 *   <li><b>arguments</b>: encoded size at most 64 KiB, no prototype-pollution keys</li>
 *   <li><b>timeouts</b>: between 0.1 s and 3600 s</li>
 *   <li><b>payloads</b>: no NUL bytes, valid UTF-8, a JSON object</li>
 * </ul>
 * Violations throw {@link JanusException} with {@link ErrorCode#SECURITY_VIOLATION}.
 *
 * <p>The 104-character limit is the smallest {@code sun_path} among supported
 * platforms, so paths accepted here bind everywhere.</p>
 */
public final class SecurityValidator
{
    public static final int MAX_SOCKET_PATH_LENGTH = 104;
    public static final int MAX_NAME_LENGTH = 64;
    public static final int MAX_ARGS_SIZE = 64 * 1024;
    public static final Duration MIN_TIMEOUT = Duration.ofMillis(100);
    public static final Duration MAX_TIMEOUT = Duration.ofHours(1);

    public static final List<String> DEFAULT_ALLOWED_DIRECTORIES = List.of("/tmp", "/var/tmp", "/dev/shm");

    private static final Pattern SOCKET_PATH = Pattern.compile("^(/[a-zA-Z0-9._-]+)+$");
    private static final Pattern COMMAND_NAME = Pattern.compile("^[a-zA-Z0-9_-]+$");
    private static final Pattern REQUEST_ID = Pattern.compile("^[a-zA-Z0-9-]+$");
    private static final Set<String> FORBIDDEN_ARG_NAMES = Set.of("__proto__", "constructor", "prototype");

    private final List<String> allowedDirectories;
    private final ObjectMapper mapper;

    public SecurityValidator() {
        this(DEFAULT_ALLOWED_DIRECTORIES, new ObjectMapper());
    }

    public SecurityValidator(List<String> allowedDirectories, ObjectMapper mapper) {
        this.allowedDirectories = List.copyOf(Objects.requireNonNull(allowedDirectories, "allowedDirectories"));
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public List<String> allowedDirectories() {
        return allowedDirectories;
    }

    // -------------------------------------------------------------------------
    // Individual checks
    // -------------------------------------------------------------------------

    public void validateSocketPath(String path) {
        if (path == null || path.isEmpty()) {
            throw violation("Socket path cannot be empty");
        }
        if (path.indexOf('\0') >= 0) {
            throw violation("Socket path contains null bytes");
        }
        if (path.length() > MAX_SOCKET_PATH_LENGTH) {
            throw violation("Socket path exceeds maximum length of " + MAX_SOCKET_PATH_LENGTH + " characters");
        }
        if (!path.startsWith("/")) {
            throw violation("Socket path must be absolute");
        }
        for (String segment : path.split("/")) {
            if (segment.equals("..")) {
                throw violation("Path traversal detected in socket path");
            }
        }
        if (!SOCKET_PATH.matcher(path).matches()) {
            throw violation("Socket path contains invalid characters");
        }

        String directory = path.substring(0, path.lastIndexOf('/'));
        boolean allowed = allowedDirectories.stream()
                .anyMatch(d -> directory.equals(d) || directory.startsWith(d + "/"));
        if (!allowed) {
            throw violation("Socket path not in allowed directory");
        }
    }

    public void validateCommandName(String command) {
        if (command == null || command.isEmpty()) {
            throw violation("Command name cannot be empty");
        }
        if (command.length() > MAX_NAME_LENGTH) {
            throw violation("Command name exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }
        if (!COMMAND_NAME.matcher(command).matches()) {
            throw violation("Command name contains invalid characters (only alphanumeric, hyphen, underscore allowed)");
        }
    }

    public void validateRequestId(String id) {
        if (id == null || id.isEmpty()) {
            throw violation("Request ID cannot be empty");
        }
        if (id.length() > MAX_NAME_LENGTH) {
            throw violation("Request ID exceeds maximum length of " + MAX_NAME_LENGTH + " characters");
        }
        if (!REQUEST_ID.matcher(id).matches()) {
            throw violation("Request ID contains invalid characters");
        }
    }

    public void validateArgs(Map<String, JsonNode> args) {
        if (args == null || args.isEmpty()) {
            return;
        }
        for (String name : args.keySet()) {
            if (FORBIDDEN_ARG_NAMES.contains(name.toLowerCase(Locale.ROOT))) {
                throw violation("Dangerous argument name: " + name);
            }
        }
        int size;
        try {
            size = mapper.writeValueAsBytes(args).length;
        } catch (JsonProcessingException e) {
            throw new JanusException(ErrorCode.SECURITY_VIOLATION, "Arguments cannot be encoded: " + e.getOriginalMessage(), e);
        }
        if (size > MAX_ARGS_SIZE) {
            throw violation("Arguments exceed maximum size of " + MAX_ARGS_SIZE + " bytes");
        }
    }

    public void validateTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.compareTo(MIN_TIMEOUT) < 0) {
            throw violation("Timeout " + seconds(timeout) + " is below minimum of 0.1 seconds");
        }
        if (timeout.compareTo(MAX_TIMEOUT) > 0) {
            throw violation("Timeout " + seconds(timeout) + " exceeds maximum of 3600 seconds");
        }
    }

    /**
     * Raw datagram screening: no NUL bytes, valid UTF-8, and the first
     * non-whitespace character opens a JSON object.
     */
    public void validatePayload(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        for (byte b : payload) {
            if (b == 0) {
                throw violation("Message contains null bytes");
            }
        }
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(payload))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new JanusException(ErrorCode.SECURITY_VIOLATION, "Message contains invalid UTF-8 encoding", e);
        }
        String trimmed = text.strip();
        if (!trimmed.startsWith("{")) {
            throw violation("Message must be a JSON object");
        }
    }

    // -------------------------------------------------------------------------
    // Composite
    // -------------------------------------------------------------------------

    /**
     * All request-level checks: id, command name, arguments, reply path (when
     * present) and timeout (when present).
     */
    public void validateRequest(JanusRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequestId(request.id());
        validateCommandName(request.command());
        validateArgs(request.args());
        if (request.replyTo() != null) {
            validateSocketPath(request.replyTo());
        }
        if (request.timeout() != null) {
            validateTimeout(request.timeout());
        }
    }

    private static String seconds(Duration d) {
        return (d.toNanos() / 1_000_000_000d) + "s";
    }

    private static JanusException violation(String details) {
        return new JanusException(ErrorCode.SECURITY_VIOLATION, details);
    }
}
