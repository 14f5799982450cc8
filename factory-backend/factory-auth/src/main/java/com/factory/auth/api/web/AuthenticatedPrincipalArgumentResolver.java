package com.factory.auth.api.web;

import com.factory.auth.domain.exception.MissingCredentialsException;
import com.factory.auth.domain.model.AuthenticatedPrincipal;
import com.factory.auth.domain.service.CredentialService;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies an {@link AuthenticatedPrincipal} parameter from the request's bearer token. Declaring the
 * parameter is what makes an endpoint protected.
 */
@Component
public class AuthenticatedPrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    private final CredentialService credentialService;

    public AuthenticatedPrincipalArgumentResolver(CredentialService credentialService) {
        this.credentialService = credentialService;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public AuthenticatedPrincipal resolveArgument(MethodParameter parameter,
                                                  ModelAndViewContainer mavContainer,
                                                  NativeWebRequest webRequest,
                                                  WebDataBinderFactory binderFactory) {
        String token = BearerTokenExtractor.extract(webRequest.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(MissingCredentialsException::new);
        return AuthenticatedPrincipal.of(credentialService.validateAccessToken(token));
    }
}
