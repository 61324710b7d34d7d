package com.simpla.reconciliation.engine;

import com.simpla.reconciliation.model.AmendmentAction;
import com.simpla.reconciliation.model.DictamenOperation;

/**
 * Operation whose action and target have been resolved, with its position in the dictamen.
 */
public final class TargetedOperation {
    private final int index;
    private final DictamenOperation operation;
    private final AmendmentAction action;
    private final ResolvedTarget target;

    public TargetedOperation(int index, DictamenOperation operation, AmendmentAction action, ResolvedTarget target) {
        this.index = index;
        this.operation = operation;
        this.action = action;
        this.target = target;
    }

    public int getIndex() {
        return index;
    }

    public DictamenOperation getOperation() {
        return operation;
    }

    public AmendmentAction getAction() {
        return action;
    }

    public ResolvedTarget getTarget() {
        return target;
    }

    public boolean targetsInciso() {
        return target.getInciso() != null;
    }
}
