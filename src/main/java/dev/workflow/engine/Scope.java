package dev.workflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.workflow.model.StepResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output bindings and result list that a block of steps writes into.
 * Reads fall through to the parent scope; writes stay local.
 * A scope is only ever touched by one thread.
 */
final class Scope {

    private final Scope parent;
    private final List<StepResult> results;
    private final Map<String, JsonNode> outputs;
    private final int depth;

    Scope(Scope parent, List<StepResult> results, Map<String, JsonNode> initialOutputs, int depth) {
        this.parent = parent;
        this.results = results;
        this.outputs = new LinkedHashMap<>(initialOutputs);
        this.depth = depth;
    }

    static Scope root(List<StepResult> results, Map<String, JsonNode> initialOutputs) {
        return new Scope(null, results, initialOutputs, 0);
    }

    /** Child sharing this scope's result list, for subworkflow bodies. */
    Scope nested(Map<String, JsonNode> initialOutputs, int childDepth) {
        return new Scope(this, results, initialOutputs, childDepth);
    }

    /** Child with its own result list, for one branch of a parallel group. */
    Scope branch(List<StepResult> branchResults) {
        return new Scope(this, branchResults, Map.of(), depth);
    }

    int depth() {
        return depth;
    }

    List<StepResult> results() {
        return results;
    }

    void bind(String name, JsonNode value) {
        outputs.put(name, value);
    }

    void bindAll(Map<String, JsonNode> values) {
        outputs.putAll(values);
    }

    Map<String, JsonNode> ownOutputs() {
        return outputs;
    }

    /** Everything visible from here; local bindings shadow inherited ones. */
    Map<String, JsonNode> visibleOutputs() {
        var visible = new LinkedHashMap<String, JsonNode>();
        if (parent != null) {
            visible.putAll(parent.visibleOutputs());
        }
        visible.putAll(outputs);
        return visible;
    }

    int record(StepResult result) {
        results.add(result);
        return results.size() - 1;
    }

    void update(int slot, StepResult result) {
        results.set(slot, result);
    }

    StepResult at(int slot) {
        return results.get(slot);
    }
}
