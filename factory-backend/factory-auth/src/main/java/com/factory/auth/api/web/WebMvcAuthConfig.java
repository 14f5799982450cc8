package com.factory.auth.api.web;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@Configuration
public class WebMvcAuthConfig implements WebMvcConfigurer {

    private final AuthenticatedPrincipalArgumentResolver principalResolver;

    public WebMvcAuthConfig(AuthenticatedPrincipalArgumentResolver principalResolver) {
        this.principalResolver = principalResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(principalResolver);
    }
}
