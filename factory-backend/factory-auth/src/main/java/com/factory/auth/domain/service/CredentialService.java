package com.factory.auth.domain.service;

import com.factory.auth.domain.model.LoginResult;
import com.factory.auth.domain.model.TokenPair;
import com.factory.auth.domain.model.UserProfile;

/**
 * The five credential operations. HTTP and gRPC adapters both call through this interface.
 */
public interface CredentialService {

    UserProfile register(String email, String password, String firstName, String lastName);

    LoginResult login(String email, String password);

    UserProfile validateAccessToken(String accessToken);

    TokenPair refreshAccessToken(String refreshToken);

    UserProfile getProfile(String userId);
}
