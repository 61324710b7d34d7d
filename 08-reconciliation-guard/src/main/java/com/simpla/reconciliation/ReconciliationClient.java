package com.simpla.reconciliation;

import com.simpla.reconciliation.proto.ReconcileRequest;
import com.simpla.reconciliation.proto.ReconcileResponse;
import com.simpla.reconciliation.proto.ReconciliationServiceGrpc;
import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Command-line client: {@code ReconciliationClient <request.json> [host:port]}.
 */
public class ReconciliationClient {
    private final ReconciliationServiceGrpc.ReconciliationServiceBlockingStub blockingStub;

    public ReconciliationClient(Channel channel) {
        blockingStub = ReconciliationServiceGrpc.newBlockingStub(channel);
    }

    public void reconcile(String requestJson) {
        System.out.println("Calling reconcile() with request length: " + requestJson.length());

        ReconcileRequest request = ReconcileRequest.newBuilder()
                .setRequestJson(requestJson)
                .build();

        ReconcileResponse response;
        try {
            response = blockingStub.reconcile(request);
        } catch (StatusRuntimeException e) {
            System.err.println("RPC failed: " + e.getStatus());
            return;
        }

        System.out.println("\n=== RECONCILE RESPONSE ===");
        System.out.println("Success: " + response.getSuccess());
        System.out.println("Message: " + response.getMessage());

        if (response.getSuccess()) {
            System.out.println("\nResult JSON:");
            String resultJson = response.getResultJson();
            if (resultJson.length() > 500) {
                System.out.println(resultJson.substring(0, 500) + "...");
                System.out.println("(Total length: " + resultJson.length() + " chars)");
            } else {
                System.out.println(resultJson);
            }
        }
        System.out.println("==========================\n");
    }

    public static void main(String[] args) throws Exception {
        if (args.length == 0) {
            System.err.println("Usage: ReconciliationClient <request.json> [host:port]");
            System.exit(1);
        }

        String requestJson = new String(Files.readAllBytes(Paths.get(args[0])), StandardCharsets.UTF_8);
        String target = args.length > 1 ? args[1] : "localhost:50053";

        System.out.println("Connecting to reconciliation-guard at: " + target);

        ManagedChannel channel = ManagedChannelBuilder.forTarget(target)
                .usePlaintext()
                .build();

        try {
            new ReconciliationClient(channel).reconcile(requestJson);
        } finally {
            channel.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
