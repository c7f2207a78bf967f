package com.meetprep.orchestrator.step.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetprep.orchestrator.step.StepCatalog;
import com.meetprep.orchestrator.step.StepExecutionContext;
import com.meetprep.orchestrator.step.StepInputs;
import com.meetprep.orchestrator.step.StepProviderMode;
import com.sun.net.httpserver.HttpServer;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Exercises the research tool client against a throwaway local HTTP server.
 */
class ResearchToolClientTest {

    HttpServer server;
    ObjectMapper json = new ObjectMapper();
    ResearchToolClient client;

    final AtomicReference<String> lastPath = new AtomicReference<>();
    final AtomicReference<String> lastBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/tools/", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));

            String tool = exchange.getRequestURI().getPath().substring("/tools/".length());
            int status;
            String body;
            switch (tool) {
                case "calendar"   -> { status = 200; body = "{\"output\":\"## Calendar\",\"elapsed_ms\":12}"; }
                case "structured" -> { status = 200; body = "{\"output\":{\"items\":[1,2]}}"; }
                case "empty"      -> { status = 200; body = "{}"; }
                case "garbled"    -> { status = 200; body = "not json"; }
                default           -> { status = 500; body = "boom"; }
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        client = new ResearchToolClient(
                "http://127.0.0.1:" + server.getAddress().getPort() + "/",
                Duration.ofSeconds(5), json);
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void invoke_postsJobIdAndInputs_returnsOutput() throws Exception {
        Object out = client.invoke("calendar", "job-1", Map.of("meeting_context", "sync"));

        assertThat(out).isEqualTo("## Calendar");
        assertThat(lastPath.get()).isEqualTo("/tools/calendar");
        Map<?, ?> sent = json.readValue(lastBody.get(), Map.class);
        assertThat(sent.get("job_id")).isEqualTo("job-1");
        assertThat(sent.get("inputs")).isEqualTo(Map.of("meeting_context", "sync"));
    }

    @Test
    void invoke_structuredOutput_isReturnedAsIs() throws Exception {
        Object out = client.invoke("structured", "job-1", Map.of());
        assertThat(out).asInstanceOf(InstanceOfAssertFactories.MAP).containsKey("items");
    }

    @Test
    void invoke_serverError_throws() {
        assertThatThrownBy(() -> client.invoke("failing", "job-1", Map.of()))
                .isInstanceOf(ResearchToolException.class)
                .hasMessageContaining("HTTP 500");
    }

    @Test
    void invoke_missingOutput_throws() {
        assertThatThrownBy(() -> client.invoke("empty", "job-1", Map.of()))
                .isInstanceOf(ResearchToolException.class)
                .hasMessageContaining("returned no output");
    }

    @Test
    void invoke_unparseableBody_throws() {
        assertThatThrownBy(() -> client.invoke("garbled", "job-1", Map.of()))
                .isInstanceOf(ResearchToolException.class)
                .hasMessageContaining("Failed to parse");
    }

    @Test
    void invoke_unreachable_throws() {
        ResearchToolClient offline = new ResearchToolClient("http://127.0.0.1:1", Duration.ofSeconds(2), json);
        assertThatThrownBy(() -> offline.invoke("calendar", "job-1", Map.of()))
                .isInstanceOf(ResearchToolException.class)
                .hasMessageContaining("unreachable");
    }

    @Test
    void remoteProvider_routesEachStepToItsTool() throws Exception {
        RemoteStepProvider provider = new RemoteStepProvider(client);
        assertThat(provider.mode()).isEqualTo(StepProviderMode.REMOTE);
        assertThat(provider.steps()).hasSize(StepCatalog.ALL.size());

        Object out = provider.steps().get(0).execute(
                StepInputs.of(Map.of("meeting_context", "sync")),
                new StepExecutionContext("job-7", StepCatalog.CALENDAR));

        assertThat(out).isEqualTo("## Calendar");
        assertThat(lastBody.get()).contains("\"job_id\":\"job-7\"");
    }
}
