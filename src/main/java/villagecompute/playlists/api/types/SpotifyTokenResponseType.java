package villagecompute.playlists.api.types;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body of the accounts service refresh-token grant.
 *
 * <p>
 * {@code refreshToken} is only present when the accounts service rotated the refresh token.
 */
@JsonIgnoreProperties(
        ignoreUnknown = true)
public record SpotifyTokenResponseType(@JsonProperty("access_token") String accessToken,
        @JsonProperty("token_type") String tokenType, @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("refresh_token") String refreshToken, String scope) {
}
