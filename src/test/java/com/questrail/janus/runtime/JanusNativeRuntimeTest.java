package com.questrail.janus.runtime;

import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.janus.api.ErrorCode;
import com.questrail.janus.api.JanusException;
import com.questrail.janus.api.JanusResponse;
import com.questrail.janus.config.ClientConfig;
import com.questrail.janus.config.ServerConfig;
import com.questrail.janus.observability.Slf4jJanusObservabilitySink;
import com.questrail.janus.server.HandlerResult;
import com.questrail.janus.transport.unix.netty.NettyUnixDatagramEndpointFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Smoke test over real Unix domain datagram sockets. Skipped where the native
 * epoll transport is unavailable.
 */
class JanusNativeRuntimeTest {

    private String socketPath;
    private JanusServerRuntime serverRuntime;
    private JanusClientRuntime clientRuntime;

    @BeforeEach
    void setUp() {
        assumeTrue(NettyUnixDatagramEndpointFactory.isAvailable(), "native epoll transport unavailable");

        socketPath = "/tmp/janus-native-" + UUID.randomUUID() + ".sock";
        serverRuntime = JanusServerRuntime.builder()
                .withConfig(ServerConfig.defaults(socketPath))
                .withObservabilitySink(new Slf4jJanusObservabilitySink())
                .build();
        serverRuntime.start();

        clientRuntime = JanusClientRuntime.builder()
                .withConfig(ClientConfig.defaults(socketPath))
                .withObservabilitySink(new Slf4jJanusObservabilitySink())
                .build();
    }

    @AfterEach
    void tearDown() {
        if (clientRuntime != null) {
            clientRuntime.close();
        }
        if (serverRuntime != null) {
            serverRuntime.stop();
            assertFalse(Files.exists(Path.of(socketPath)), "socket file removed on shutdown");
        }
    }

    @Test
    void requestAndResponseCrossRealSockets() throws Exception {
        assertTrue(Files.exists(Path.of(socketPath)));
        serverRuntime.registerHandler("greet",
                req -> HandlerResult.success(TextNode.valueOf("hello " + req.arg("name").orElseThrow().asText())));

        JanusResponse response = clientRuntime.client()
                .sendRequest("greet", Map.of("name", TextNode.valueOf("janus")))
                .get(5, TimeUnit.SECONDS);

        assertEquals("hello janus", response.result().asText());
        assertTrue(clientRuntime.client().testConnection().get(5, TimeUnit.SECONDS));
    }

    @Test
    void replySocketFilesAreRemoved() throws Exception {
        Path replyDir = Path.of(clientRuntime.client().config().replySocketDirectory());
        String prefix = clientRuntime.client().config().replySocketPrefix() + "_client_" + ProcessHandle.current().pid();

        clientRuntime.client().ping().get(5, TimeUnit.SECONDS);

        try (Stream<Path> files = Files.list(replyDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().startsWith(prefix)));
        }
    }

    @Test
    void handlerTimeoutCrossesTheWire() throws Exception {
        serverRuntime.registerHandler("stall", req -> {
            Thread.sleep(2_000);
            return HandlerResult.success(null);
        });

        int code;
        try {
            code = clientRuntime.client()
                    .sendRequest("stall", Map.of(), Duration.ofMillis(200))
                    .get(5, TimeUnit.SECONDS)
                    .error()
                    .code();
        } catch (ExecutionException e) {
            code = assertInstanceOf(JanusException.class, e.getCause()).code();
        }
        assertEquals(ErrorCode.HANDLER_TIMEOUT.code(), code);
    }
}
