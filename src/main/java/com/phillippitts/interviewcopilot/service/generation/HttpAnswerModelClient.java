package com.phillippitts.interviewcopilot.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.interviewcopilot.config.properties.GenerationProperties;
import com.phillippitts.interviewcopilot.exception.GenerationFailureException;
import com.phillippitts.interviewcopilot.exception.GenerationFailureExceptionBuilder;
import com.phillippitts.interviewcopilot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Answer model client for OpenAI-compatible chat completions endpoints.
 *
 * <p>Request: {@code POST {baseUrl}/chat/completions} with a system and a user message.
 * Response text is read from {@code choices[0].message.content}, or, when streaming, assembled
 * from the {@code choices[0].delta.content} of each server-sent event. Any non-2xx status,
 * transport error or empty content is a {@link GenerationFailureException}; nothing is retried
 * here.
 */
@Component
@ConditionalOnProperty(name = "copilot.generation.provider", havingValue = "http")
public class HttpAnswerModelClient implements AnswerModelClient {

    private static final Logger LOG = LogManager.getLogger(HttpAnswerModelClient.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    private static final String PROVIDER = "http";
    private static final String STREAM_DONE = "[DONE]";

    private final GenerationProperties props;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    @Autowired
    public HttpAnswerModelClient(GenerationProperties props, ObjectMapper mapper) {
        this(props, mapper, HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    // Package-private for tests
    HttpAnswerModelClient(GenerationProperties props, ObjectMapper mapper, HttpClient httpClient) {
        this.props = Objects.requireNonNull(props, "props");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        if (props.apiKey() == null || props.apiKey().isBlank()) {
            LOG.warn("copilot.generation.api-key is not set; requests will likely be rejected");
        }
        LOG.info("HTTP answer model configured: baseUrl={}, model={}, maxTokens={}, temperature={}",
                props.baseUrl(), props.model(), props.maxTokens(), props.temperature());
    }

    @Override
    public String complete(AnswerPrompt prompt) {
        HttpResponse<String> response =
                send(request(requestBody(prompt, false)), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        LOG.debug("Model call status: {} model={}", response.statusCode(), props.model());
        if (response.statusCode() / 100 != 2) {
            throw statusError(response.statusCode(), response.body());
        }
        return extractContent(response.body());
    }

    /**
     * Requests {@code "stream": true} and reads the server-sent event lines as they arrive. Each
     * {@code data:} line carries {@code choices[0].delta.content}; {@code data: [DONE]} ends the
     * answer. The worker's interrupt flag is checked between lines.
     */
    @Override
    public String stream(AnswerPrompt prompt, Consumer<String> onDelta) {
        HttpResponse<Stream<String>> response = send(request(requestBody(prompt, true)), HttpResponse.BodyHandlers.ofLines());
        LOG.debug("Model stream status: {} model={}", response.statusCode(), props.model());
        StringBuilder answer = new StringBuilder();
        try (Stream<String> lines = response.body()) {
            if (response.statusCode() / 100 != 2) {
                throw statusError(response.statusCode(), lines.limit(20).collect(Collectors.joining("\n")));
            }
            Iterator<String> it = lines.iterator();
            while (it.hasNext()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw GenerationFailureExceptionBuilder.create("Model stream interrupted")
                            .provider(PROVIDER).build();
                }
                String data = eventData(it.next());
                if (data == null) {
                    continue;
                }
                if (STREAM_DONE.equals(data)) {
                    break;
                }
                String delta = extractDelta(data);
                if (!delta.isEmpty()) {
                    answer.append(delta);
                    onDelta.accept(delta);
                }
            }
        } catch (UncheckedIOException e) {
            throw GenerationFailureExceptionBuilder.create("Model stream failed")
                    .provider(PROVIDER)
                    .metadata("model", props.model())
                    .metadata("received", answer.length())
                    .cause(e.getCause())
                    .build();
        }
        if (answer.toString().isBlank()) {
            throw GenerationFailureExceptionBuilder.create("Model stream carried no answer content")
                    .provider(PROVIDER)
                    .metadata("model", props.model())
                    .build();
        }
        return answer.toString();
    }

    @Override
    public String name() {
        return PROVIDER;
    }

    String requestBody(AnswerPrompt prompt) {
        return requestBody(prompt, false);
    }

    String requestBody(AnswerPrompt prompt, boolean stream) {
        ObjectNode root = mapper.createObjectNode();
        root.put("model", props.model());
        root.put("max_tokens", props.maxTokens());
        root.put("temperature", props.temperature());
        if (stream) {
            root.put("stream", true);
        }
        ArrayNode messages = root.putArray("messages");
        messages.addObject().put("role", "system").put("content", prompt.systemPrompt());
        messages.addObject().put("role", "user").put("content", prompt.userPrompt());
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new GenerationFailureException("Failed to encode model request", e);
        }
    }

    /** Payload of an SSE {@code data:} line; null for blank, comment and other field lines. */
    static String eventData(String line) {
        if (line == null || !line.startsWith("data:")) {
            return null;
        }
        return line.substring("data:".length()).strip();
    }

    String extractDelta(String data) {
        try {
            JsonNode choices = mapper.readTree(data).path("choices");
            if (!choices.isArray() || choices.isEmpty()) {
                return "";
            }
            return choices.get(0).path("delta").path("content").asText("");
        } catch (JsonProcessingException e) {
            throw GenerationFailureExceptionBuilder.create("Model stream event is not valid JSON")
                    .provider(PROVIDER)
                    .metadata("event", LogSanitizer.truncate(data, 200))
                    .cause(e)
                    .build();
        }
    }

    String extractContent(String body) {
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw GenerationFailureExceptionBuilder.create("Model response is not valid JSON")
                    .provider(PROVIDER).cause(e).build();
        }
        JsonNode choices = root.path("choices");
        String content = null;
        if (choices.isArray() && !choices.isEmpty()) {
            content = choices.get(0).path("message").path("content").asText(null);
        }
        if (content == null || content.isBlank()) {
            throw GenerationFailureExceptionBuilder.create("Model returned no answer content")
                    .provider(PROVIDER)
                    .metadata("body", LogSanitizer.truncate(body, 200))
                    .build();
        }
        return content.strip();
    }

    private HttpRequest request(String body) {
        return HttpRequest.newBuilder(endpoint())
                .timeout(props.timeout())
                .header("Authorization", "Bearer " + (props.apiKey() == null ? "" : props.apiKey()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
    }

    private <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> handler) {
        try {
            return httpClient.send(request, handler);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw GenerationFailureExceptionBuilder.create("Model call interrupted")
                    .provider(PROVIDER).cause(e).build();
        } catch (IOException e) {
            throw GenerationFailureExceptionBuilder.create("Model call failed")
                    .provider(PROVIDER)
                    .metadata("model", props.model())
                    .cause(e)
                    .build();
        }
    }

    private GenerationFailureException statusError(int status, String body) {
        return GenerationFailureExceptionBuilder.create("Model endpoint returned an error")
                .provider(PROVIDER)
                .statusCode(status)
                .metadata("model", props.model())
                .metadata("body", LogSanitizer.truncate(body, 200))
                .build();
    }

    private URI endpoint() {
        String base = props.baseUrl().endsWith("/")
                ? props.baseUrl().substring(0, props.baseUrl().length() - 1)
                : props.baseUrl();
        return URI.create(base + "/chat/completions");
    }
}
