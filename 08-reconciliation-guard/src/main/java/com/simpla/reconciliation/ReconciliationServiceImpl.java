package com.simpla.reconciliation;

import com.simpla.reconciliation.dto.ReconcileResponseDTO;
import com.simpla.reconciliation.processor.ReconciliationProcessor;
import com.simpla.reconciliation.proto.ReconcileRequest;
import com.simpla.reconciliation.proto.ReconcileResponse;
import com.simpla.reconciliation.proto.ReconciliationServiceGrpc;
import io.grpc.stub.StreamObserver;

/**
 * gRPC service implementation for reconciliation guard.
 * Delegates all business logic to ReconciliationProcessor.
 */
public class ReconciliationServiceImpl extends ReconciliationServiceGrpc.ReconciliationServiceImplBase {

    private final ReconciliationProcessor processor;

    public ReconciliationServiceImpl() {
        this(new ReconciliationProcessor());
    }

    public ReconciliationServiceImpl(ReconciliationProcessor processor) {
        this.processor = processor;
    }

    @Override
    public void reconcile(ReconcileRequest request, StreamObserver<ReconcileResponse> responseObserver) {
        ReconcileResponseDTO result = processor.processReconcile(request.getRequestJson());

        ReconcileResponse response = buildReconcileResponse(
            result.isSuccess(),
            result.getMessage(),
            result.getResultJson()
        );

        sendResponse(responseObserver, response);
    }

    private ReconcileResponse buildReconcileResponse(boolean success, String message, String resultJson) {
        ReconcileResponse.Builder builder = ReconcileResponse.newBuilder()
                .setSuccess(success)
                .setMessage(message);

        // proto3 strings reject null
        if (resultJson != null) {
            builder.setResultJson(resultJson);
        }

        return builder.build();
    }

    private <T> void sendResponse(StreamObserver<T> responseObserver, T response) {
        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }
}
