package com.simpla.reconciliation;

import com.simpla.reconciliation.engine.ReconciliationEngine;
import com.simpla.reconciliation.processor.ReconciliationProcessor;
import com.simpla.reconciliation.proto.ReconcileRequest;
import com.simpla.reconciliation.proto.ReconcileResponse;
import io.grpc.stub.StreamObserver;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationServiceImplTest {

    private final ReconciliationServiceImpl service =
            new ReconciliationServiceImpl(new ReconciliationProcessor(new ReconciliationEngine()));

    private static final class RecordingObserver implements StreamObserver<ReconcileResponse> {
        private final List<ReconcileResponse> responses = new ArrayList<>();
        private Throwable error;
        private boolean completed;

        @Override
        public void onNext(ReconcileResponse value) {
            responses.add(value);
        }

        @Override
        public void onError(Throwable t) {
            error = t;
        }

        @Override
        public void onCompleted() {
            completed = true;
        }
    }

    @Test
    void reconcileReturnsResultJson() {
        RecordingObserver observer = new RecordingObserver();
        String request = "{\"ley\":{\"numero\":\"20744\",\"titulos\":[{\"numero\":\"I\",\"articulos\":["
                + "{\"numero\":\"1\",\"texto\":\"Texto original.\"}]}]},"
                + "\"dictamen\":[{\"dictamen_articulo\":\"ARTÍCULO 1\",\"accion\":\"derógase\",\"destino_articulo\":\"1\"}]}";

        service.reconcile(ReconcileRequest.newBuilder().setRequestJson(request).build(), observer);

        assertTrue(observer.completed);
        assertNull(observer.error);
        assertEquals(1, observer.responses.size());
        ReconcileResponse response = observer.responses.get(0);
        assertTrue(response.getSuccess(), response.getMessage());
        assertTrue(response.getResultJson().contains("\"estado\":\"derogado\""));
    }

    @Test
    void malformedRequestCompletesWithFailure() {
        RecordingObserver observer = new RecordingObserver();

        service.reconcile(ReconcileRequest.newBuilder().setRequestJson("not json").build(), observer);

        assertTrue(observer.completed);
        ReconcileResponse response = observer.responses.get(0);
        assertFalse(response.getSuccess());
        assertEquals("", response.getResultJson());
        assertTrue(response.getMessage().startsWith("Invalid data format"));
    }
}
