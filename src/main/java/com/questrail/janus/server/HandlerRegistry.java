package com.questrail.janus.server;

import com.questrail.janus.security.ResourceLimits;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * HandlerRegistry
 * =============================================================================
 * Command name to {@link RequestHandler} table owned by one server.
 *
 * <p>Registration and lookup may happen concurrently with dispatch; every
 * access goes through the registry's lock. Registering a name that is already
 * present replaces the handler and does not count against the handler limit.
 * Built-in commands live outside the registry; a registered handler with a
 * built-in name takes precedence over it.</p>
 */
public final class HandlerRegistry
{
    private final ResourceLimits limits;
    private final Map<String, RequestHandler> handlers = new HashMap<>();

    public HandlerRegistry(ResourceLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
    }

    /**
     * @throws IllegalArgumentException if the name is blank
     * @throws com.questrail.janus.api.JanusException with
     *         {@code RESOURCE_LIMIT_EXCEEDED} when the registry is full
     */
    public synchronized void register(String command, RequestHandler handler) {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(handler, "handler");
        if (command.isBlank()) {
            throw new IllegalArgumentException("command name must not be empty");
        }
        if (!handlers.containsKey(command)) {
            limits.checkHandlers(handlers.size());
        }
        handlers.put(command, handler);
    }

    /**
     * @return {@code true} if a handler was removed
     */
    public synchronized boolean unregister(String command) {
        return handlers.remove(command) != null;
    }

    public synchronized Optional<RequestHandler> lookup(String command) {
        return Optional.ofNullable(handlers.get(command));
    }

    /** Registered command names, sorted. */
    public synchronized Set<String> commands() {
        return new TreeSet<>(handlers.keySet());
    }

    public synchronized int size() {
        return handlers.size();
    }
}
