package dev.workflow.engine;

import dev.workflow.model.CompileResult;
import dev.workflow.model.Step;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Finds approval steps, in document order, together with the containers that enclose them.
 * Referenced subworkflows are searched too, up to the configured depth.
 */
final class CheckpointLocator {

    private final SubworkflowResolver resolver;
    private final int maxDepth;

    CheckpointLocator(SubworkflowResolver resolver, int maxDepth) {
        this.resolver = resolver;
        this.maxDepth = maxDepth;
    }

    List<ResumeTarget> approvals(List<Step> steps) {
        var found = new ArrayList<ResumeTarget>();
        walk(steps, new ArrayDeque<>(), 0, found);
        return found;
    }

    Optional<ResumeTarget> find(List<Step> steps, String stepId) {
        return approvals(steps).stream()
            .filter(target -> target.approval().id().equals(stepId))
            .findFirst();
    }

    private void walk(List<Step> steps, Deque<Step> path, int depth, List<ResumeTarget> found) {
        for (Step step : steps) {
            if (step instanceof Step.Approval approval) {
                found.add(ResumeTarget.of(approval, List.copyOf(path)));
                continue;
            }
            path.addLast(step);
            walk(step.children(), path, depth, found);
            if (step instanceof Step.Subworkflow sub && !sub.isInline() && depth < maxDepth) {
                resolver.resolve(sub.workflowId())
                    .filter(CompileResult::ok)
                    .ifPresent(result -> walk(result.workflow().steps(), path, depth + 1, found));
            }
            path.removeLast();
        }
    }
}
