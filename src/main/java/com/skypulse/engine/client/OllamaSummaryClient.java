package com.skypulse.engine.client;

import com.skypulse.engine.config.EngineProperties;
import com.skypulse.engine.exception.ExternalServiceException;
import com.skypulse.engine.model.dto.SummaryRequest;
import com.skypulse.engine.port.SummaryClient;
import io.vertx.core.Future;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Language-model adapter for an Ollama server.
 *
 * PROTOCOL:
 * - POST {base-url}/api/generate
 * - Body: {model, prompt, system, stream: false}
 * - Reply: JSON with the generated text in "response"
 *
 * Non-200 replies and empty text fail the Future with
 * ExternalServiceException; retries and fallback belong to SummaryService.
 *
 * =========
 * -@Component: Spring bean implementing the SummaryClient port.
 * =========
 * -@Slf4j: Lombok logger generation.
 */
@Component
@Slf4j
public class OllamaSummaryClient implements SummaryClient {

    @Autowired
    @Qualifier("summaryWebClient")
    private WebClient webClient;

    @Autowired
    private EngineProperties properties;

    @Override
    public Future<String> generate(SummaryRequest request) {
        EngineProperties.Summary summary = properties.getSummary();

        JsonObject body = new JsonObject()
                .put("model", summary.getModel())
                .put("prompt", request.getPrompt())
                .put("system", request.getSystemPrompt())
                .put("stream", false);

        log.debug("Requesting summary for deal {} from {}", request.getDeal().getId(), summary.getBaseUrl());

        return webClient.postAbs(summary.getBaseUrl() + "/api/generate")
                .timeout(summary.getTimeout().toMillis())
                .sendJsonObject(body)
                .recover(error -> Future.failedFuture(
                        new ExternalServiceException("Language model unreachable: " + error.getMessage(), error)))
                .compose(response -> {
                    if (response.statusCode() != 200) {
                        return Future.<String>failedFuture(new ExternalServiceException(
                                "Language model returned HTTP " + response.statusCode()));
                    }
                    JsonObject json = response.bodyAsJsonObject();
                    String text = json == null ? null : json.getString("response");
                    if (text == null || text.trim().isEmpty()) {
                        return Future.<String>failedFuture(new ExternalServiceException("Language model returned no text"));
                    }
                    return Future.succeededFuture(text.trim());
                });
    }
}
