package io.twingraph.events.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class ClientCredentialsTokenProviderTest {

    private static final String ENDPOINT = "https://login.example/oauth2/token";

    private RestClient.Builder builder;
    private MockRestServiceServer server;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void cachedTokenIsReusedUntilShortlyBeforeExpiry() {
        ClientCredentialsTokenProvider provider = provider("api://events/.default");
        server.expect(once(), requestTo(ENDPOINT))
            .andExpect(content().string(containsString("grant_type=client_credentials")))
            .andExpect(content().string(containsString("scope=")))
            .andRespond(withSuccess("{\"access_token\":\"t1\",\"expires_in\":600}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(ENDPOINT))
            .andRespond(withSuccess("{\"access_token\":\"t2\",\"expires_in\":600}", MediaType.APPLICATION_JSON));

        assertThat(provider.getToken()).isEqualTo("t1");
        clock.advance(Duration.ofMinutes(8));
        assertThat(provider.getToken()).isEqualTo("t1");
        clock.advance(Duration.ofSeconds(61));
        assertThat(provider.getToken()).isEqualTo("t2");

        server.verify();
    }

    @Test
    void responseWithoutAccessTokenFails() {
        ClientCredentialsTokenProvider provider = provider(null);
        server.expect(requestTo(ENDPOINT))
            .andRespond(withSuccess("{\"token_type\":\"Bearer\"}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(provider::getToken)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("access_token");
    }

    @Test
    void missingCredentialsAreRejected() {
        assertThatThrownBy(() -> new ClientCredentialsTokenProvider(builder.build(), ENDPOINT, "id", " ", null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ClientCredentialsTokenProvider provider(String scope) {
        return new ClientCredentialsTokenProvider(builder.build(), ENDPOINT, "client", "secret", scope, clock);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
