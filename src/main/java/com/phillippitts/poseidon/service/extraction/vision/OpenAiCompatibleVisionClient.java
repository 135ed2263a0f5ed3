package com.phillippitts.poseidon.service.extraction.vision;

import com.phillippitts.poseidon.config.backend.VisionModelConfig;
import com.phillippitts.poseidon.domain.FailureKind;
import com.phillippitts.poseidon.exception.ExtractionExceptionBuilder;
import com.phillippitts.poseidon.service.extraction.BackendNames;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.util.Base64;
import java.util.Objects;

/**
 * {@link VisionModelClient} for OpenAI-compatible {@code /chat/completions} endpoints
 * (DeepSeek, OpenAI, local gateways). The image travels inline as a base64 data URL.
 */
public class OpenAiCompatibleVisionClient implements VisionModelClient {

    private static final Logger LOG = LogManager.getLogger(OpenAiCompatibleVisionClient.class);

    private final RestClient restClient;
    private final VisionModelConfig config;

    public OpenAiCompatibleVisionClient(RestClient restClient, VisionModelConfig config) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String describe(byte[] image, String instruction) {
        String body = buildRequest(image, instruction).toString();
        LOG.debug("Invoking vision model '{}' with {} image bytes", config.model(), image.length);

        String response;
        try {
            response = restClient.post()
                    .uri("/chat/completions")
                    .header("Authorization", "Bearer " + config.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw ExtractionExceptionBuilder.create("Vision model call failed")
                    .backend(BackendNames.VISION)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .httpStatus(e.getStatusCode().value())
                    .metadata("body", LogSanitizer.truncate(e.getResponseBodyAsString(), 200))
                    .cause(e)
                    .build();
        } catch (ResourceAccessException e) {
            throw ExtractionExceptionBuilder.create("Vision model unreachable")
                    .backend(BackendNames.VISION)
                    .kind(FailureKind.BACKEND_UNAVAILABLE)
                    .cause(e)
                    .build();
        }
        return extractContent(response);
    }

    JSONObject buildRequest(byte[] image, String instruction) {
        String dataUrl = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(image);
        JSONArray content = new JSONArray()
                .put(new JSONObject().put("type", "text").put("text", instruction))
                .put(new JSONObject().put("type", "image_url")
                        .put("image_url", new JSONObject().put("url", dataUrl)));
        JSONObject message = new JSONObject()
                .put("role", "user")
                .put("content", content);
        return new JSONObject()
                .put("model", config.model())
                .put("max_tokens", config.maxTokens())
                .put("temperature", 0)
                .put("messages", new JSONArray().put(message));
    }

    static String extractContent(String response) {
        if (response == null || response.isBlank()) {
            throw ExtractionExceptionBuilder.create("Vision model returned an empty response")
                    .backend(BackendNames.VISION)
                    .kind(FailureKind.MALFORMED_OUTPUT)
                    .build();
        }
        try {
            JSONObject root = new JSONObject(response);
            JSONArray choices = root.getJSONArray("choices");
            String text = choices.getJSONObject(0).getJSONObject("message").optString("content", "");
            if (text.isBlank()) {
                throw ExtractionExceptionBuilder.create("Vision model returned an empty message")
                        .backend(BackendNames.VISION)
                        .kind(FailureKind.MALFORMED_OUTPUT)
                        .build();
            }
            return text;
        } catch (JSONException e) {
            throw ExtractionExceptionBuilder.create("Vision model response is not a chat completion")
                    .backend(BackendNames.VISION)
                    .kind(FailureKind.MALFORMED_OUTPUT)
                    .cause(e)
                    .build();
        }
    }
}
