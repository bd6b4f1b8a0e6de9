package com.questrail.janus.server;

import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;
import com.questrail.janus.security.ResourceLimits;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HandlerRegistryTest {

    private static final RequestHandler OK = request -> HandlerResult.success(TextNode.valueOf("ok"));

    @Test
    void registeredHandlerCanBeLookedUpAndRemoved() {
        HandlerRegistry registry = new HandlerRegistry(ResourceLimits.DEFAULTS);

        registry.register("createWorkspace", OK);

        assertSame(OK, registry.lookup("createWorkspace").orElseThrow());
        assertTrue(registry.lookup("other").isEmpty());
        assertTrue(registry.unregister("createWorkspace"));
        assertFalse(registry.unregister("createWorkspace"));
        assertEquals(0, registry.size());
    }

    @Test
    void reRegisteringReplacesHandler() {
        HandlerRegistry registry = new HandlerRegistry(ResourceLimits.DEFAULTS);
        RequestHandler second = request -> HandlerResult.success(null);

        registry.register("a", OK);
        registry.register("a", second);

        assertSame(second, registry.lookup("a").orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    void handlerLimitAppliesToNewNamesOnly() {
        HandlerRegistry registry = new HandlerRegistry(new ResourceLimits(1, 2, 1));
        registry.register("a", OK);
        registry.register("b", OK);

        JanusException e = assertThrows(JanusException.class, () -> registry.register("c", OK));
        assertEquals(ErrorCode.RESOURCE_LIMIT_EXCEEDED.code(), e.code());

        assertDoesNotThrow(() -> registry.register("a", OK), "replacing an existing name is allowed at the limit");
    }

    @Test
    void blankNamesAreRejected() {
        HandlerRegistry registry = new HandlerRegistry(ResourceLimits.DEFAULTS);

        assertThrows(IllegalArgumentException.class, () -> registry.register(" ", OK));
        assertThrows(NullPointerException.class, () -> registry.register("a", null));
    }

    @Test
    void commandsAreSortedSnapshot() {
        HandlerRegistry registry = new HandlerRegistry(ResourceLimits.DEFAULTS);
        registry.register("zeta", OK);
        registry.register("alpha", OK);

        assertEquals(List.of("alpha", "zeta"), List.copyOf(registry.commands()));

        registry.commands().clear();
        assertEquals(2, registry.size(), "snapshot is detached from the registry");
    }

    @Test
    void concurrentRegistrationsAreAllKept() throws Exception {
        HandlerRegistry registry = new HandlerRegistry(ResourceLimits.DEFAULTS);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (int i = 0; i < 40; i++) {
                String name = "cmd-" + i;
                pool.execute(() -> {
                    try {
                        go.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    registry.register(name, OK);
                });
            }
            go.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(40, registry.size());
    }
}
