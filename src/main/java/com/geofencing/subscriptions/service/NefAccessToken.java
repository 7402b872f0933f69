package com.geofencing.subscriptions.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.geofencing.subscriptions.config.GeofencingProperties;
import com.geofencing.subscriptions.exception.PositionUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * Bearer token for the NEF emulator, owned by the position provider.
 *
 * Lifecycle:
 * 1. Obtained lazily on first use (OAuth2 password form login)
 * 2. Reused for every position lookup
 * 3. Invalidated when NEF answers 401, then re-obtained on the next {@link #get()}
 */
@Component
@Slf4j
public class NefAccessToken {

    static final String LOGIN_PATH = "/api/v1/login/access-token";

    private final RestClient nefRestClient;
    private final GeofencingProperties.Nef nef;

    private String token;

    public NefAccessToken(@Qualifier("nefRestClient") RestClient nefRestClient, GeofencingProperties properties) {
        this.nefRestClient = nefRestClient;
        this.nef = properties.getNef();
    }

    /**
     * Current token, logging in first if none is held.
     *
     * @throws PositionUnavailableException if the login fails
     */
    public synchronized String get() {
        if (token == null) {
            token = login();
        }
        return token;
    }

    /**
     * Drops {@code rejected} if it is still the current token.
     */
    public synchronized void invalidate(String rejected) {
        if (Objects.equals(token, rejected)) {
            token = null;
        }
    }

    private String login() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "");
        form.add("username", nef.getUsername());
        form.add("password", nef.getPassword());
        form.add("scope", "");
        form.add("client_id", "");
        form.add("client_secret", "");

        try {
            TokenResponse response = nefRestClient.post()
                .uri(LOGIN_PATH)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(form)
                .retrieve()
                .body(TokenResponse.class);

            if (response == null || response.accessToken() == null || response.accessToken().isBlank()) {
                throw new PositionUnavailableException("NEF login returned no access token");
            }

            log.info("Obtained NEF access token for {}", nef.getUsername());
            return response.accessToken();
        } catch (RestClientException e) {
            throw new PositionUnavailableException("NEF login failed: " + e.getMessage(), e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenResponse(
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType
    ) {
    }
}
