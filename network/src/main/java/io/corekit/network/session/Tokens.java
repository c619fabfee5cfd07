package io.corekit.network.session;

import io.corekit.util.Assert;

/**
 * An access token together with the refresh token that renews it. Both are always present;
 * a session without credentials has no {@code Tokens} at all.
 *
 * @param accessToken the bearer token sent with requests
 * @param refreshToken the token exchanged for a new access token
 */
public record Tokens(String accessToken, String refreshToken) {

    public Tokens {
        Assert.checkNotNullParam("accessToken", accessToken);
        Assert.checkNotNullParam("refreshToken", refreshToken);
    }

    @Override
    public String toString() {
        return "Tokens[accessToken=***, refreshToken=***]";
    }
}
