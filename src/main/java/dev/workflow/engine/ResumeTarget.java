package dev.workflow.engine;

import dev.workflow.model.Step;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * An approval step plus the containers enclosing it, compared by identity.
 */
record ResumeTarget(Step.Approval approval, Set<Step> enclosing) {

    static ResumeTarget of(Step.Approval approval, List<Step> enclosing) {
        Set<Step> path = Collections.newSetFromMap(new IdentityHashMap<>());
        path.addAll(enclosing);
        return new ResumeTarget(approval, path);
    }

    boolean isCheckpoint(Step step) {
        return step == approval;
    }

    boolean encloses(Step step) {
        return enclosing.contains(step);
    }
}
