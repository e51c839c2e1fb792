package com.universaltasker.orchestrator.minimax;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around MiniMax {@code chatcompletion_v2}.
 *
 * One call = one system prompt + one user message, optionally carrying a PNG
 * screenshot as a data URL. Endpoints that reject multimodal content with 400
 * get one text-only retry. Everything else (backoff, rate limits) is left to
 * the caller's "no answer" fallback.
 */
@Component
public class MiniMaxClient {

    private static final Logger log = LoggerFactory.getLogger(MiniMaxClient.class);

    private static final String CHAT_PATH = "/v1/text/chatcompletion_v2";

    static final String IMAGE_DROPPED_NOTE =
            "\n\n(A screenshot was captured but could not be attached; use the text above.)";

    // -------------------------------------------------------------------------
    // Response records
    // -------------------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(List<Choice> choices,
                               @JsonProperty("base_resp") BaseResp baseResp) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Message(String role, String content) {}

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record BaseResp(@JsonProperty("status_code") int statusCode,
                               @JsonProperty("status_msg")  String statusMsg) {}

        /** Text of the first choice; empty string when there is none. */
        public String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) return "";
            String content = choices.get(0).message().content();
            return content == null ? "" : content;
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final String       chatUrl;
    private final String       model;
    private final boolean      useStub;

    public MiniMaxClient(@Value("${minimax.api-key:}") String apiKey,
                         @Value("${minimax.base-url:https://api.minimax.io}") String baseUrl,
                         @Value("${minimax.model:MiniMax-M2.1}") String model,
                         @Value("${minimax.use-stub:true}") boolean useStub,
                         ObjectMapper objectMapper) {
        this.apiKey  = apiKey;
        this.chatUrl = baseUrl.replaceAll("/+$", "") + CHAT_PATH;
        this.model   = model;
        this.useStub = useStub;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /** False in stub mode or without a key; callers then skip the engine entirely. */
    public boolean isEnabled() {
        return !useStub && apiKey != null && !apiKey.isBlank();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send one system + user exchange and return the assistant's raw text.
     *
     * @param image     screenshot to attach, or null for a text-only request
     * @param timeout   upper bound for the whole request
     * @param maxTokens reply budget
     * @throws MiniMaxApiException on HTTP or API-level errors
     */
    public String complete(String systemPrompt, String userText, Path image,
                           Duration timeout, int maxTokens) {
        try {
            String b64 = image == null ? null : encode(image);
            Object userContent = b64 == null
                    ? userText
                    : List.of(
                        Map.of("type", "text", "text", userText),
                        Map.of("type", "image_url",
                               "image_url", Map.of("url", "data:image/png;base64," + b64)));

            HttpResponse<String> response = send(systemPrompt, userContent, timeout, maxTokens);

            // Some endpoints accept only string content: retry once without the image.
            if (response.statusCode() == 400 && b64 != null) {
                log.warn("MiniMax rejected multimodal request (400), retrying text-only");
                response = send(systemPrompt, userText + IMAGE_DROPPED_NOTE, timeout, maxTokens);
            }
            if (response.statusCode() != 200) {
                throw new MiniMaxApiException(response.statusCode(), response.body());
            }

            ChatResponse parsed = json.readValue(response.body(), ChatResponse.class);
            if (parsed.baseResp() != null && parsed.baseResp().statusCode() != 0) {
                throw new MiniMaxApiException(parsed.baseResp().statusCode(), parsed.baseResp().statusMsg());
            }
            return parsed.firstText();

        } catch (MiniMaxApiException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("MiniMax API call interrupted", e);
        } catch (Exception e) {
            throw new RuntimeException("MiniMax API call failed", e);
        }
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private HttpResponse<String> send(String systemPrompt, Object userContent,
                                      Duration timeout, int maxTokens)
            throws IOException, InterruptedException {
        String body = json.writeValueAsString(Map.of(
                "model",      model,
                "messages",   List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user",   "content", userContent)),
                "max_tokens", maxTokens));

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(chatUrl))
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Content-Type",  "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    /** Base64 of the image file, or null when it cannot be read. */
    private static String encode(Path image) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(image));
        } catch (IOException e) {
            log.warn("Could not read screenshot {} for upload: {}", image, e.getMessage());
            return null;
        }
    }
}
