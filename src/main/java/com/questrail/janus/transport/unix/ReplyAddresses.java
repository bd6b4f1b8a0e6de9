package com.questrail.janus.transport.unix;

import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * ReplyAddresses
 * =============================================================================
 * Generates the ephemeral reply socket paths a client embeds in its requests.
 *
 * <h2>Format</h2>
 * <pre>
 *   &lt;directory&gt;/&lt;prefix&gt;_client_&lt;pid&gt;_&lt;12 hex chars&gt;.sock
 * </pre>
 * The hex suffix is taken from a random UUID, so paths are unique per
 * outstanding request within and across processes. Paths are never reused by
 * one generator.
 */
public final class ReplyAddresses
{
    private static final int UNIQUE_CHARS = 12;

    private final Path directory;
    private final String prefix;
    private final long pid;

    public ReplyAddresses(Path directory, String prefix, long pid) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.pid = pid;
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
    }

    /** Generator for the current process. */
    public static ReplyAddresses forCurrentProcess(Path directory, String prefix) {
        return new ReplyAddresses(directory, prefix, ProcessHandle.current().pid());
    }

    public Path next() {
        String unique = UUID.randomUUID().toString().replace("-", "").substring(0, UNIQUE_CHARS);
        return directory.resolve(prefix + "_client_" + pid + "_" + unique + ".sock");
    }

    public Path directory() {
        return directory;
    }

    // -------------------------------------------------------------------------
    // Address conversions
    // -------------------------------------------------------------------------

    public static UnixDomainSocketAddress address(String path) {
        return UnixDomainSocketAddress.of(Objects.requireNonNull(path, "path"));
    }

    public static UnixDomainSocketAddress address(Path path) {
        return UnixDomainSocketAddress.of(Objects.requireNonNull(path, "path"));
    }

    /**
     * Filesystem path of a Unix domain address.
     *
     * @throws IllegalArgumentException if {@code address} is not a Unix domain address
     */
    public static String pathOf(SocketAddress address) {
        if (address instanceof UnixDomainSocketAddress unix) {
            return unix.getPath().toString();
        }
        throw new IllegalArgumentException("not a Unix domain socket address: " + address);
    }
}
