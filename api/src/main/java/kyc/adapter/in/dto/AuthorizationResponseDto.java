package kyc.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import kyc.core.model.AuthorizationRequest;

/**
 * Authorization URL handed to the UI, which redirects the browser to it.
 *
 * @param authorizationUrl provider authorization URL
 * @param state            correlation value echoed on the callback
 * @param expiresAt        when the pending session expires
 */
public record AuthorizationResponseDto(
        @JsonProperty("authorization_url") String authorizationUrl,
        @JsonProperty("state") String state,
        @JsonProperty("expires_at") Instant expiresAt) {

    public static AuthorizationResponseDto from(AuthorizationRequest request) {
        return new AuthorizationResponseDto(request.authorizationUrl(), request.state(), request.expiresAt());
    }
}
