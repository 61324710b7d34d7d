package com.simpla.reconciliation.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.simpla.reconciliation.model.DictamenOperation;
import com.simpla.reconciliation.model.ReconciledLey;

import java.util.Collections;
import java.util.List;

/**
 * Reconciled view plus everything the run could not apply.
 */
public final class ReconciliationResult {
    private final ReconciledLey ley;
    private final ReconciliationMetadata metadatos;
    private final List<Diagnostic> diagnosticos;
    private final List<DictamenOperation> operacionesOmitidas;

    public ReconciliationResult(ReconciledLey ley, ReconciliationMetadata metadatos,
                                List<Diagnostic> diagnosticos, List<DictamenOperation> operacionesOmitidas) {
        this.ley = ley;
        this.metadatos = metadatos;
        this.diagnosticos = Collections.unmodifiableList(diagnosticos);
        this.operacionesOmitidas = Collections.unmodifiableList(operacionesOmitidas);
    }

    @JsonProperty("ley")
    public ReconciledLey getLey() {
        return ley;
    }

    @JsonProperty("metadatos")
    public ReconciliationMetadata getMetadatos() {
        return metadatos;
    }

    @JsonProperty("diagnosticos")
    public List<Diagnostic> getDiagnosticos() {
        return diagnosticos;
    }

    /**
     * Operations left out of the merge, for manual review.
     */
    @JsonProperty("operaciones_omitidas")
    public List<DictamenOperation> getOperacionesOmitidas() {
        return operacionesOmitidas;
    }

    @JsonIgnore
    public long countDiagnostics(DiagnosticType type) {
        return diagnosticos.stream().filter(d -> d.getTipo() == type).count();
    }
}
