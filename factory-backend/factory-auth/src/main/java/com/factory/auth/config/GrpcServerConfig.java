package com.factory.auth.config;

import com.factory.auth.api.grpc.AuthGrpcService;
import com.factory.auth.api.grpc.GrpcExceptionInterceptor;
import com.factory.auth.api.grpc.GrpcServerLifecycle;
import com.factory.auth.domain.service.CredentialService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "factory.auth.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
public class GrpcServerConfig {

    @Bean
    public AuthGrpcService authGrpcService(CredentialService credentialService) {
        return new AuthGrpcService(credentialService);
    }

    @Bean
    public GrpcExceptionInterceptor grpcExceptionInterceptor() {
        return new GrpcExceptionInterceptor();
    }

    @Bean
    public GrpcServerLifecycle grpcServerLifecycle(AuthProperties properties,
                                                   AuthGrpcService authGrpcService,
                                                   GrpcExceptionInterceptor grpcExceptionInterceptor) {
        AuthProperties.Grpc grpc = properties.getGrpc();
        return new GrpcServerLifecycle(grpc.getPort(), grpc.getShutdownGracePeriod(),
                authGrpcService, grpcExceptionInterceptor);
    }
}
