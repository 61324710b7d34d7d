package com.simpla.reconciliation;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.protobuf.services.ProtoReflectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

public class ReconciliationServer {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationServer.class);

    private Server server;

    private void start() throws IOException {
        int port = Integer.parseInt(getEnvOrDefault("RECONCILIATION_GRPC_PORT", "50053"));

        server = ServerBuilder.forPort(port)
                .addService(new ReconciliationServiceImpl())
                .addService(ProtoReflectionService.newInstance()) // Enable reflection for testing
                .build()
                .start();

        log.info("gRPC server started, listening on {}", port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server since JVM is shutting down");
            try {
                ReconciliationServer.this.stop();
            } catch (InterruptedException e) {
                log.error("Interrupted while shutting down gRPC server", e);
                Thread.currentThread().interrupt();
            }
            log.info("Server shut down");
        }));
    }

    private void stop() throws InterruptedException {
        if (server != null) {
            server.shutdown().awaitTermination(30, TimeUnit.SECONDS);
        }
    }

    private void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    private static String getEnvOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        final ReconciliationServer server = new ReconciliationServer();
        server.start();
        server.blockUntilShutdown();
    }
}
