package com.factory.auth.api.grpc;

import io.grpc.BindableService;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.ServerInterceptors;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.protobuf.services.HealthStatusManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs the gRPC server alongside the Spring context: started after the context is refreshed and
 * drained gracefully on shutdown.
 */
@Slf4j
public class GrpcServerLifecycle implements SmartLifecycle {

    private final int port;
    private final Duration shutdownGracePeriod;
    private final BindableService service;
    private final GrpcExceptionInterceptor exceptionInterceptor;
    private final HealthStatusManager health = new HealthStatusManager();

    private volatile Server server;

    public GrpcServerLifecycle(int port,
                               Duration shutdownGracePeriod,
                               BindableService service,
                               GrpcExceptionInterceptor exceptionInterceptor) {
        this.port = port;
        this.shutdownGracePeriod = shutdownGracePeriod;
        this.service = service;
        this.exceptionInterceptor = exceptionInterceptor;
    }

    @Override
    public void start() {
        try {
            server = ServerBuilder.forPort(port)
                    .addService(ServerInterceptors.intercept(service, exceptionInterceptor))
                    .addService(health.getHealthService())
                    .build()
                    .start();
        } catch (IOException e) {
            log.error("[GRPC_SERVER_ERROR] Failed to start gRPC server | port={}", port, e);
            throw new UncheckedIOException("Failed to start gRPC server on port " + port, e);
        }
        health.setStatus("", ServingStatus.SERVING);
        log.info("[GRPC_SERVER_STARTED] gRPC server listening | port={}", server.getPort());
    }

    @Override
    public void stop() {
        Server running = server;
        if (running == null) {
            return;
        }
        log.info("[GRPC_SERVER_STOPPING] Draining gRPC server | grace={}s", shutdownGracePeriod.toSeconds());
        health.enterTerminalState();
        running.shutdown();
        try {
            if (!running.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("[GRPC_SERVER_FORCED] Grace period elapsed, cancelling in-flight calls");
                running.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running.shutdownNow();
        }
        server = null;
        log.info("[GRPC_SERVER_STOPPED] gRPC server stopped");
    }

    @Override
    public boolean isRunning() {
        return server != null;
    }

    int getPort() {
        return server == null ? -1 : server.getPort();
    }
}
