package dev.workflow.compiler;

import dev.workflow.model.Step;

import java.util.ArrayList;
import java.util.List;

/**
 * Pre-order, document-order walk over a step tree. A conditional contributes its own id,
 * then its {@code then} body, then its {@code else} body.
 */
public final class StepOrder {

    private StepOrder() {}

    public static List<String> of(List<Step> steps) {
        var order = new ArrayList<String>();
        collect(steps, order);
        return List.copyOf(order);
    }

    private static void collect(List<Step> steps, List<String> order) {
        for (Step step : steps) {
            order.add(step.id());
            collect(step.children(), order);
        }
    }
}
