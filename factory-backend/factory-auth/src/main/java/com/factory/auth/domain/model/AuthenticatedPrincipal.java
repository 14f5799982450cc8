package com.factory.auth.domain.model;

import lombok.Value;

/**
 * Caller identity established by a validated access token, handed by the transport to later calls.
 * Carries the profile the validation loaded, so handlers need not read the directory again.
 */
@Value
public class AuthenticatedPrincipal {
    UserProfile profile;

    public static AuthenticatedPrincipal of(UserProfile profile) {
        return new AuthenticatedPrincipal(profile);
    }

    public String getUserId() {
        return profile.getId();
    }

    public String getEmail() {
        return profile.getEmail();
    }
}
