package io.twingraph.events.sink.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.auth.ClientCredentialsTokenProvider;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.CloudEventJson;
import io.twingraph.events.sink.EventSink;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Posts each event to an HTTP endpoint as a structured CloudEvent.
 */
public class WebhookEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(WebhookEventSink.class);

    static final MediaType CLOUD_EVENT_JSON = MediaType.parseMediaType(CloudEventJson.STRUCTURED_CONTENT_TYPE);

    private final String name;
    private final String url;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;
    private final ClientCredentialsTokenProvider tokenProvider;
    private volatile boolean healthy = true;

    /**
     * Builds the sink on a copy of {@code builder} configured with the sink's timeouts.
     */
    public static WebhookEventSink create(
        WebhookSinkProperties properties,
        RestClient.Builder builder,
        ObjectMapper objectMapper
    ) {
        if (properties.getConnectTimeoutMs() <= 0 || properties.getReadTimeoutMs() <= 0) {
            throw new IllegalArgumentException("Webhook sink " + properties.getName() + " requires positive timeouts");
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getReadTimeoutMs());
        return new WebhookEventSink(properties, builder.clone().requestFactory(requestFactory), objectMapper);
    }

    WebhookEventSink(WebhookSinkProperties properties, RestClient.Builder builder, ObjectMapper objectMapper) {
        if (isBlank(properties.getUrl())) {
            throw new IllegalArgumentException("Webhook sink " + properties.getName() + " requires a url");
        }
        this.name = properties.getName();
        this.url = properties.getUrl();
        this.objectMapper = objectMapper;

        WebhookAuthType authType = properties.getAuthenticationType() == null
            ? WebhookAuthType.NONE
            : properties.getAuthenticationType();
        this.tokenProvider = authType == WebhookAuthType.OAUTH
            ? new ClientCredentialsTokenProvider(
                builder.clone().build(),
                properties.getTokenEndpoint(),
                properties.getClientId(),
                properties.getClientSecret(),
                properties.getScope()
            )
            : null;
        this.restClient = builder.clone()
            .defaultHeaders(headers -> applyStaticAuth(authType, properties, headers))
            .build();
    }

    private static void applyStaticAuth(WebhookAuthType authType, WebhookSinkProperties properties, HttpHeaders headers) {
        switch (authType) {
            case BASIC -> {
                if (isBlank(properties.getUsername())) {
                    throw new IllegalArgumentException("Webhook sink " + properties.getName() + " with Basic auth requires a username");
                }
                headers.setBasicAuth(properties.getUsername(), properties.getPassword() == null ? "" : properties.getPassword());
            }
            case BEARER -> {
                if (isBlank(properties.getToken())) {
                    throw new IllegalArgumentException("Webhook sink " + properties.getName() + " with Bearer auth requires a token");
                }
                headers.setBearerAuth(properties.getToken());
            }
            case API_KEY -> {
                if (isBlank(properties.getHeaderName()) || properties.getHeaderValue() == null) {
                    throw new IllegalArgumentException(
                        "Webhook sink " + properties.getName() + " with ApiKey auth requires header-name and header-value"
                    );
                }
                headers.set(properties.getHeaderName(), properties.getHeaderValue());
            }
            case NONE, OAUTH -> {
                // OAuth tokens are attached per request
            }
        }
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void send(List<DomainEvent> events) throws Exception {
        for (DomainEvent event : events) {
            byte[] body = CloudEventJson.toStructuredBytes(objectMapper, event);
            try {
                RestClient.RequestBodySpec request = restClient.post()
                    .uri(url)
                    .contentType(CLOUD_EVENT_JSON);
                if (tokenProvider != null) {
                    request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + tokenProvider.getToken());
                }
                ResponseEntity<Void> response = request.body(body).retrieve().toBodilessEntity();
                if (!response.getStatusCode().is2xxSuccessful()) {
                    healthy = false;
                    throw new IllegalStateException(
                        "Webhook sink " + name + " got status " + response.getStatusCode().value() + " for event " + event.id()
                    );
                }
            } catch (RestClientResponseException e) {
                healthy = false;
                log.error(
                    "Webhook sink '{}' rejected event {} (status={}, body={})",
                    name,
                    event.id(),
                    e.getStatusCode().value(),
                    e.getResponseBodyAsString()
                );
                throw e;
            } catch (RestClientException | IllegalStateException e) {
                healthy = false;
                log.error("Webhook sink '{}' failed to deliver event {}: {}", name, event.id(), e.getMessage());
                throw e;
            }
        }
        healthy = true;
        if (!events.isEmpty()) {
            log.info("Sent {} events to webhook sink '{}'", events.size(), name);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
