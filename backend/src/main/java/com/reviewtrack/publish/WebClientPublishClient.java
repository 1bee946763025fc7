package com.reviewtrack.publish;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Publish collaborator over HTTP. POSTs the {@link PublishRequest} as JSON and expects
 * {@code {"accepted": true, "reference": "..."}} or {@code {"accepted": false, "reason": "..."}}.
 * 4xx is an explicit rejection, 504 an unknown outcome, any other 5xx or connection error a transport failure.
 */
public class WebClientPublishClient implements PublishClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final String uri;

    public WebClientPublishClient(WebClient.Builder builder, PublishProperties properties) {
        this.webClient = builder.build();
        this.uri = properties.getBaseUrl() + properties.getPath();
    }

    @Override
    public Mono<PublishReceipt> publish(PublishRequest request) {
        return webClient.post()
                .uri(uri)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(WebClientPublishClient::parseReceipt)
                .onErrorMap(WebClientResponseException.class, WebClientPublishClient::mapResponseError)
                .onErrorMap(WebClientRequestException.class,
                        e -> new PublishTransportException("Publish request failed: " + e.getMessage(), e));
    }

    /**
     * Only {@code "accepted": true} confirms the publish. A blank body, unreadable JSON or a missing or non-boolean
     * {@code accepted} leaves the outcome unknown.
     */
    static PublishReceipt parseReceipt(String body) {
        if (body == null || body.isBlank()) {
            throw new PublishOutcomeUnknownException("Empty publish response", null);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (Exception e) {
            throw new PublishOutcomeUnknownException("Unreadable publish response", e);
        }
        JsonNode accepted = root.path("accepted");
        if (!accepted.isBoolean()) {
            throw new PublishOutcomeUnknownException("Publish response carries no acceptance flag", null);
        }
        if (!accepted.booleanValue()) {
            String reason = root.path("reason").asText("");
            throw new PublishRejectedException(reason.isBlank() ? "rejected without reason" : reason);
        }
        JsonNode reference = root.path("reference");
        return new PublishReceipt(reference.isTextual() ? reference.asText() : null);
    }

    static RuntimeException mapResponseError(WebClientResponseException e) {
        if (e.getStatusCode().is4xxClientError()) {
            String body = e.getResponseBodyAsString();
            return new PublishRejectedException(e.getStatusCode().value() + (body.isBlank() ? "" : " " + body));
        }
        if (e.getStatusCode().value() == HttpStatus.GATEWAY_TIMEOUT.value()) {
            return new PublishOutcomeUnknownException("Gateway timeout from publish collaborator", e);
        }
        return new PublishTransportException("Publish collaborator returned " + e.getStatusCode().value(), e);
    }
}
