package io.twingraph.events.auth;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * OAuth 2.0 client credentials grant with an in-memory token cache.
 * A cached token is reused until one minute before it expires.
 */
public class ClientCredentialsTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(ClientCredentialsTokenProvider.class);

    static final Duration REFRESH_SKEW = Duration.ofMinutes(1);
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    private final RestClient restClient;
    private final String tokenEndpoint;
    private final String clientId;
    private final String clientSecret;
    private final String scope;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile String accessToken;
    private volatile Instant expiresAt = Instant.EPOCH;

    public ClientCredentialsTokenProvider(
        RestClient restClient,
        String tokenEndpoint,
        String clientId,
        String clientSecret,
        String scope
    ) {
        this(restClient, tokenEndpoint, clientId, clientSecret, scope, Clock.systemUTC());
    }

    ClientCredentialsTokenProvider(
        RestClient restClient,
        String tokenEndpoint,
        String clientId,
        String clientSecret,
        String scope,
        Clock clock
    ) {
        if (isBlank(tokenEndpoint) || isBlank(clientId) || isBlank(clientSecret)) {
            throw new IllegalArgumentException("Client credentials require token endpoint, client id and client secret");
        }
        this.restClient = restClient;
        this.tokenEndpoint = tokenEndpoint;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.scope = scope;
        this.clock = clock;
    }

    public String getToken() {
        if (isFresh()) {
            return accessToken;
        }
        lock.lock();
        try {
            if (isFresh()) {
                return accessToken;
            }
            requestToken();
            return accessToken;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh() {
        return accessToken != null && clock.instant().isBefore(expiresAt.minus(REFRESH_SKEW));
    }

    private void requestToken() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
        if (!isBlank(scope)) {
            form.add("scope", scope);
        }

        JsonNode response;
        try {
            response = restClient.post()
                .uri(tokenEndpoint)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new IllegalStateException("Token request to " + tokenEndpoint + " failed", e);
        }

        String token = response == null ? null : response.path("access_token").asText(null);
        if (isBlank(token)) {
            throw new IllegalStateException("Token response from " + tokenEndpoint + " has no access_token");
        }
        long expiresIn = response.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        if (expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }

        accessToken = token;
        expiresAt = clock.instant().plusSeconds(expiresIn);
        log.debug("Acquired access token for client {} (expiresIn={}s)", clientId, expiresIn);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
