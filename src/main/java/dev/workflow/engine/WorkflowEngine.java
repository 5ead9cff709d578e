package dev.workflow.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.workflow.backend.ConditionScope;
import dev.workflow.backend.StepBackend;
import dev.workflow.backend.StepContext;
import dev.workflow.compiler.StepOrder;
import dev.workflow.event.EventSink;
import dev.workflow.event.WorkflowEvent;
import dev.workflow.model.ApprovalRequest;
import dev.workflow.model.CompileResult;
import dev.workflow.model.CompiledWorkflow;
import dev.workflow.model.EnginePolicy;
import dev.workflow.model.ExecutionCheckpoint;
import dev.workflow.model.ExecutionRun;
import dev.workflow.model.RunStatus;
import dev.workflow.model.Step;
import dev.workflow.model.StepOutcome;
import dev.workflow.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Interprets a compiled workflow as a resumable state machine.
 * One engine call covers one process invocation; anything that must survive
 * between {@code run} and {@code resume} travels in the returned checkpoint.
 */
public final class WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEngine.class);
    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    public static final String APPROVAL_DENIED = "approval_denied";
    public static final String RESUME_TOKEN_MISMATCH = "resume_token_mismatch:";
    public static final String STEP_EXECUTION_ERROR = "step_execution_error:";

    private final StepBackend backend;
    private final EventSink events;
    private final Clock clock;
    private final EnginePolicy policy;

    /**
     * @param policy limits applied as given; callers fold {@code runtime.policy} and flag overrides in first
     */
    public WorkflowEngine(StepBackend backend, EventSink events, Clock clock, EnginePolicy policy) {
        this.backend = backend;
        this.events = events;
        this.clock = clock;
        this.policy = policy;
    }

    /**
     * Execute a workflow from its first step.
     */
    public ExecutionRun run(String executionId, CompiledWorkflow workflow, RunPayload payload, Path workspace) {
        emit(event("execution.started", executionId)
            .with("workflowHash", workflow.workflowHash())
            .with("attempt", payload.runtime().attempt())
            .with("idempotencyKey", payload.runtime().idempotencyKey())
            .with("backend", backend.getName()));

        var invocation = new Invocation(executionId, workflow, payload, workspace,
            new SubworkflowResolver(payload.workflows()), null);
        Scope root = Scope.root(new ArrayList<>(), Map.of());
        BlockOutcome outcome = invocation.executeSteps(workflow.steps(), root, null);
        return invocation.finish(root, outcome);
    }

    /**
     * Continue a run paused at an approval after the decision was {@code approve}.
     * Work finished before the checkpoint is not repeated.
     */
    public ExecutionRun resume(String executionId, CompiledWorkflow workflow, RunPayload payload,
                               Path workspace, String resumeToken) {
        // The invocation must reuse these compiled subworkflows: resume targets match steps by identity
        var resolver = new SubworkflowResolver(payload.workflows());
        var locator = new CheckpointLocator(resolver, policy.maxSubworkflowDepth());
        ExecutionCheckpoint checkpoint = payload.runtime().checkpoint();
        String hash = workflow.workflowHash();

        String claimedStep;
        Optional<ResumeTarget> target;
        if (checkpoint != null) {
            claimedStep = checkpoint.stepId();
            target = locator.find(workflow.steps(), claimedStep)
                .filter(t -> ResumeTokens.matches(resumeToken, executionId, hash, claimedStep));
        } else {
            List<ResumeTarget> approvals = locator.approvals(workflow.steps());
            claimedStep = approvals.size() == 1 ? approvals.get(0).approval().id() : "unknown";
            target = approvals.stream()
                .filter(t -> ResumeTokens.matches(resumeToken, executionId, hash, t.approval().id()))
                .findFirst();
        }

        emit(event("execution.resumed", executionId)
            .with("decision", "approve")
            .with("stepId", target.map(t -> t.approval().id()).orElse(claimedStep)));

        if (target.isEmpty()) {
            String error = RESUME_TOKEN_MISMATCH + claimedStep;
            logger.debug("Execution {}: {}", executionId, error);
            emit(event("execution.finished", executionId)
                .with("status", RunStatus.FAILED.value())
                .with("error", error));
            return ExecutionRun.failed(executionId, hash, Map.of(), List.of(), error);
        }

        var invocation = new Invocation(executionId, workflow, payload, workspace, resolver, target.get());
        Scope root = Scope.root(new ArrayList<>(),
            checkpoint != null ? checkpoint.outputs() : Map.of());
        BlockOutcome outcome = invocation.executeSteps(workflow.steps(), root, null);
        return invocation.finish(root, outcome);
    }

    /**
     * The approval was denied: the run ends as cancelled without touching the workflow.
     */
    public ExecutionRun deny(String executionId) {
        emit(event("execution.resumed", executionId).with("decision", "deny"));
        emit(event("execution.finished", executionId)
            .with("status", RunStatus.CANCELLED.value())
            .with("error", APPROVAL_DENIED));
        return ExecutionRun.cancelled(executionId, null, Map.of(), List.of(), APPROVAL_DENIED);
    }

    private String now() {
        return Instant.now(clock).toString();
    }

    private WorkflowEvent event(String type, String executionId) {
        return WorkflowEvent.forExecution(type, executionId, now());
    }

    private void emit(WorkflowEvent event) {
        events.emit(event);
    }

    /**
     * State and step interpretation for a single invocation.
     */
    private final class Invocation {

        private final ExecutionState state;
        private final CompiledWorkflow workflow;
        private final RunPayload payload;
        private final Path workspace;
        private final SubworkflowResolver resolver;
        private final ExecutionCheckpoint checkpoint;

        Invocation(String executionId, CompiledWorkflow workflow, RunPayload payload, Path workspace,
                   SubworkflowResolver resolver, ResumeTarget resumeTarget) {
            this.state = new ExecutionState(executionId, workflow.workflowHash(), resumeTarget);
            this.workflow = workflow;
            this.payload = payload;
            this.workspace = workspace;
            this.resolver = resolver;
            this.checkpoint = payload.runtime().checkpoint();
        }

        BlockOutcome executeSteps(List<Step> steps, Scope scope, Integer iteration) {
            for (Step step : steps) {
                BlockOutcome outcome;
                if (state.fastForwarding()) {
                    ResumeTarget target = state.fastForwardTarget();
                    if (target.isCheckpoint(step)) {
                        outcome = approveCheckpoint(target.approval(), scope, iteration);
                    } else if (!target.encloses(step)) {
                        continue;
                    } else {
                        outcome = resumeInto(step, scope, iteration);
                    }
                } else {
                    outcome = executeStep(step, scope, iteration);
                }
                if (!(outcome instanceof BlockOutcome.Completed)) {
                    return outcome;
                }
            }
            return BlockOutcome.COMPLETED;
        }

        private BlockOutcome executeStep(Step step, Scope scope, Integer iteration) {
            if (state.visitStep() > policy.maxSteps()) {
                return new BlockOutcome.Failed("max_steps_exceeded:" + policy.maxSteps());
            }
            int attempt = state.nextAttempt(step.id());

            if (step instanceof Step.Approval approval) {
                return approval(approval, scope, attempt, iteration);
            }
            if (step instanceof Step.Conditional conditional) {
                return conditional(conditional, scope, attempt, iteration, null);
            }
            if (step instanceof Step.Loop loop) {
                return loop(loop, scope, attempt, iteration, 1, false);
            }
            if (step instanceof Step.Parallel parallel) {
                return parallel(parallel, scope, attempt, iteration);
            }
            if (step instanceof Step.Subworkflow subworkflow) {
                return subworkflow(subworkflow, scope, attempt, iteration, Map.of());
            }
            return action(step, scope, attempt, iteration);
        }

        /** Re-enter a container that holds the checkpoint, without re-running what came before it. */
        private BlockOutcome resumeInto(Step step, Scope scope, Integer iteration) {
            if (state.visitStep() > policy.maxSteps()) {
                return new BlockOutcome.Failed("max_steps_exceeded:" + policy.maxSteps());
            }
            int attempt = state.nextAttempt(step.id());
            ResumeTarget target = state.fastForwardTarget();

            if (step instanceof Step.Conditional conditional) {
                boolean inThen = conditional.thenSteps().stream()
                    .anyMatch(s -> target.isCheckpoint(s) || target.encloses(s));
                return conditional(conditional, scope, attempt, iteration, inThen);
            }
            if (step instanceof Step.Loop loop) {
                int first = checkpoint != null ? checkpoint.loopIterations().getOrDefault(loop.id(), 1) : 1;
                return loop(loop, scope, attempt, iteration, first, true);
            }
            if (step instanceof Step.Subworkflow subworkflow) {
                Map<String, JsonNode> restored = checkpoint != null
                    ? checkpoint.scopes().getOrDefault(subworkflow.id(), Map.of()) : Map.of();
                return subworkflow(subworkflow, scope, attempt, iteration, restored);
            }
            return executeStep(step, scope, iteration);
        }

        /** Settle the paused approval; a decision arriving after {@code timeoutAt} gets the default action. */
        private BlockOutcome approveCheckpoint(Step.Approval approval, Scope scope, Integer iteration) {
            state.visitStep();
            int attempt = state.nextAttempt(approval.id());
            state.reachedCheckpoint();
            String at = now();
            if (approval.timeoutAt() != null && !Instant.now(clock).isBefore(approval.timeoutAt())) {
                logger.debug("Execution {} resumed after approval {} expired", state.executionId(), approval.id());
                int slot = scope.record(StepResult.running(approval.id(), attempt, iteration, at));
                return approvalTimedOut(approval, scope, slot, attempt);
            }
            ObjectNode output = JSON.objectNode();
            output.put("approved", true);
            output.put("decision", "approve");

            scope.record(StepResult.running(approval.id(), attempt, iteration, at).complete(at, output));
            bindOutput(approval, scope, output);
            logger.debug("Execution {} resumed past checkpoint {}", state.executionId(), approval.id());
            emit(stepEvent("step.completed", approval.id(), attempt).with("decision", "approve"));
            return BlockOutcome.COMPLETED;
        }

        // Leaf steps

        private BlockOutcome action(Step step, Scope scope, int firstAttempt, Integer iteration) {
            int attempt = firstAttempt;
            int tries = 1;
            while (true) {
                int slot = start(step, scope, attempt, iteration);
                StepOutcome outcome = invoke(step, new StepContext(
                    state.executionId(), workspace, attempt, iteration, conditionScope(scope, iteration)));

                if (outcome instanceof StepOutcome.Success success) {
                    JsonNode output = success.output() != null ? success.output() : JSON.nullNode();
                    scope.update(slot, scope.at(slot).complete(now(), output));
                    bindOutput(step, scope, output);
                    emit(stepEvent("step.completed", step.id(), attempt));
                    return BlockOutcome.COMPLETED;
                }

                var failure = (StepOutcome.Failure) outcome;
                scope.update(slot, scope.at(slot).fail(now(), failure.output(), failure.error()));
                emit(stepEvent("step.failed", step.id(), attempt).with("error", failure.error()));
                logger.debug("Step {} attempt {} failed: {}", step.id(), attempt, failure.error());

                if (!step.retry().allowsAnotherAttempt(tries)) {
                    if (step.common().continueOnError()) {
                        return BlockOutcome.COMPLETED;
                    }
                    return new BlockOutcome.Failed(STEP_EXECUTION_ERROR + step.id() + ": " + failure.error());
                }

                tries++;
                attempt = state.nextAttempt(step.id());
                emit(stepEvent("step.retrying", step.id(), attempt)
                    .with("maxAttempts", step.retry().maxAttempts()));
                if (!backoff(step.retry().backoffMs())) {
                    return new BlockOutcome.Failed(STEP_EXECUTION_ERROR + step.id() + ": interrupted during retry backoff");
                }
            }
        }

        private StepOutcome invoke(Step step, StepContext context) {
            try {
                if (step instanceof Step.Bash bash) {
                    return backend.runBash(bash, context);
                }
                if (step instanceof Step.Tool tool) {
                    return backend.runTool(tool, context);
                }
                if (step instanceof Step.AgentMessage message) {
                    return deliver(message, context);
                }
                return backend.dispatchAgent(step, context);
            } catch (RuntimeException e) {
                logger.debug("Backend {} threw for step {}", backend.getName(), step.id(), e);
                return StepOutcome.failure(describe(e));
            }
        }

        private StepOutcome deliver(Step.AgentMessage message, StepContext context) {
            StepOutcome delivered = backend.dispatchAgent(message, context);
            if (!message.awaitResponse() || delivered instanceof StepOutcome.Failure) {
                return delivered;
            }

            long timeoutMs = message.awaitTimeoutMs() != null
                ? message.awaitTimeoutMs() : policy.agentResponseTimeoutMs();
            CompletableFuture<StepOutcome> reply = backend.awaitAgentResponse(message, context);
            try {
                return reply.get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                reply.cancel(true);
                return StepOutcome.failure("agent_response_timeout:" + message.id());
            } catch (ExecutionException e) {
                return StepOutcome.failure(describe(e.getCause()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StepOutcome.failure("Interrupted while awaiting agent response");
            }
        }

        private BlockOutcome approval(Step.Approval approval, Scope scope, int attempt, Integer iteration) {
            int slot = start(approval, scope, attempt, iteration);
            String prompt = approval.message() != null
                ? approval.message() : "Approval required for step " + approval.id();

            if (approval.timeoutAt() != null && !Instant.now(clock).isBefore(approval.timeoutAt())) {
                return approvalTimedOut(approval, scope, slot, attempt);
            }

            String resumeToken = ResumeTokens.mint(state.executionId(), state.workflowHash(), approval.id());
            ObjectNode output = JSON.objectNode();
            output.put("prompt", prompt);
            scope.update(slot, scope.at(slot).waitForApproval(now(), output));

            emit(stepEvent("approval.required", approval.id(), attempt).with("resumeToken", resumeToken));
            logger.debug("Execution {} waiting for approval at {}", state.executionId(), approval.id());

            return BlockOutcome.Suspended.at(new ApprovalRequest(
                approval.id(),
                prompt,
                approval.items(),
                resumeToken,
                approval.timeoutAt() != null ? approval.timeoutAt().toString() : null,
                approval.defaultAction() != null ? approval.defaultAction().value() : null));
        }

        private BlockOutcome approvalTimedOut(Step.Approval approval, Scope scope, int slot, int attempt) {
            String at = now();
            ObjectNode output = JSON.objectNode();
            output.put("reason", "timeout_default");
            String action = approval.defaultAction() != null ? approval.defaultAction().value() : "fail";
            output.put("decision", action);

            switch (action) {
                case "approve" -> {
                    output.put("approved", true);
                    scope.update(slot, scope.at(slot).complete(at, output));
                    bindOutput(approval, scope, output);
                    emit(stepEvent("step.completed", approval.id(), attempt).with("decision", action));
                    return BlockOutcome.COMPLETED;
                }
                case "deny" -> {
                    output.put("approved", false);
                    scope.update(slot, scope.at(slot).complete(at, output));
                    emit(stepEvent("step.completed", approval.id(), attempt).with("decision", action));
                    return new BlockOutcome.Cancelled(APPROVAL_DENIED);
                }
                default -> {
                    String error = "approval_timeout:" + approval.id();
                    scope.update(slot, scope.at(slot).fail(at, output, error));
                    emit(stepEvent("step.failed", approval.id(), attempt).with("error", error));
                    return new BlockOutcome.Failed(error);
                }
            }
        }

        // Containers

        private BlockOutcome conditional(Step.Conditional conditional, Scope scope, int attempt,
                                         Integer iteration, Boolean resumedBranch) {
            int slot = start(conditional, scope, attempt, iteration);
            boolean taken = resumedBranch != null
                ? resumedBranch
                : backend.evaluate(conditional.condition(), conditionScope(scope, iteration));
            logger.debug("Conditional {} took the {} branch", conditional.id(), taken ? "then" : "else");

            // The untaken then-branch was already accounted for before a resume into else
            if (!taken && resumedBranch == null) {
                recordSkipped(conditional.thenSteps(), scope);
            }
            BlockOutcome outcome = executeSteps(taken ? conditional.thenSteps() : conditional.elseSteps(),
                scope, iteration);
            if (taken && !(outcome instanceof BlockOutcome.Suspended)) {
                recordSkipped(conditional.elseSteps(), scope);
            }

            ObjectNode output = JSON.objectNode();
            output.put("condition", taken);
            output.put("branch", taken ? "then" : "else");
            finishContainer(conditional, scope, slot, attempt, outcome, output, output);
            return outcome;
        }

        private BlockOutcome loop(Step.Loop loop, Scope scope, int attempt, Integer outerIteration,
                                  int firstIteration, boolean resuming) {
            int slot = start(loop, scope, attempt, outerIteration);
            int max = loop.maxIterations() != null ? loop.maxIterations() : policy.maxLoopIterations();
            int completed = firstIteration - 1;
            boolean boundReached = true;

            for (int iteration = firstIteration; iteration <= max; iteration++) {
                boolean alreadyChecked = resuming && iteration == firstIteration;
                if (!alreadyChecked && loop.condition() != null
                    && !backend.evaluate(loop.condition(), conditionScope(scope, iteration))) {
                    boundReached = false;
                    break;
                }

                BlockOutcome body = executeSteps(loop.steps(), scope, iteration);
                if (body instanceof BlockOutcome.Suspended suspended) {
                    suspended.loopIterations().put(loop.id(), iteration);
                    return body;
                }
                if (!(body instanceof BlockOutcome.Completed)) {
                    ObjectNode output = loopOutput(iteration - 1, false);
                    finishContainer(loop, scope, slot, attempt, body, output, output);
                    return body;
                }
                completed = iteration;
            }

            ObjectNode output = loopOutput(completed, boundReached);
            finishContainer(loop, scope, slot, attempt, BlockOutcome.COMPLETED, output, output);
            return BlockOutcome.COMPLETED;
        }

        private BlockOutcome parallel(Step.Parallel parallel, Scope scope, int attempt, Integer iteration) {
            int slot = start(parallel, scope, attempt, iteration);
            List<Step> children = parallel.steps();
            var branches = new ArrayList<Scope>();
            var tasks = new ArrayList<Callable<BlockOutcome>>();
            for (Step child : children) {
                Scope branch = scope.branch(new ArrayList<>());
                branches.add(branch);
                tasks.add(() -> executeSteps(List.of(child), branch, iteration));
            }

            List<BlockOutcome> outcomes = new ArrayList<>();
            ExecutorService pool = Executors.newFixedThreadPool(Math.min(children.size(), policy.maxParallelism()));
            try {
                for (Future<BlockOutcome> future : pool.invokeAll(tasks)) {
                    outcomes.add(join(future));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                outcomes.clear();
                children.forEach(child -> outcomes.add(new BlockOutcome.Failed("interrupted:" + child.id())));
            } finally {
                pool.shutdownNow();
            }

            // Merge in document order so results do not depend on scheduling
            ArrayNode failedSteps = JSON.arrayNode();
            String firstError = null;
            for (int i = 0; i < children.size(); i++) {
                Scope branch = branches.get(i);
                branch.results().forEach(scope::record);
                scope.bindAll(branch.ownOutputs());

                String error = branchError(outcomes.get(i));
                if (error != null) {
                    failedSteps.add(children.get(i).id());
                    firstError = firstError != null ? firstError : error;
                }
            }

            ObjectNode output = JSON.objectNode();
            output.put("branchCount", children.size());
            output.set("failedSteps", failedSteps);

            BlockOutcome outcome = firstError != null && !parallel.common().continueOnError()
                ? new BlockOutcome.Failed(firstError)
                : BlockOutcome.COMPLETED;
            finishContainer(parallel, scope, slot, attempt, outcome, output, output);
            return outcome;
        }

        private BlockOutcome join(Future<BlockOutcome> future) throws InterruptedException {
            try {
                return future.get();
            } catch (ExecutionException e) {
                logger.error("Parallel branch crashed in execution {}", state.executionId(), e.getCause());
                return new BlockOutcome.Failed(describe(e.getCause()));
            }
        }

        private String branchError(BlockOutcome outcome) {
            if (outcome instanceof BlockOutcome.Failed failed) {
                return failed.error();
            }
            if (outcome instanceof BlockOutcome.Cancelled cancelled) {
                return cancelled.error();
            }
            if (outcome instanceof BlockOutcome.Suspended suspended) {
                return "approval_not_supported_in_parallel:" + suspended.approval().stepId();
            }
            return null;
        }

        private BlockOutcome subworkflow(Step.Subworkflow subworkflow, Scope scope, int attempt,
                                         Integer iteration, Map<String, JsonNode> restoredOutputs) {
            int slot = start(subworkflow, scope, attempt, iteration);
            ObjectNode output = JSON.objectNode();
            List<Step> body = subworkflow.steps();
            int childDepth = scope.depth();

            if (!subworkflow.isInline()) {
                output.put("workflowId", subworkflow.workflowId());
                String error = null;
                if (scope.depth() >= policy.maxSubworkflowDepth()) {
                    error = "subworkflow_depth_exceeded:" + policy.maxSubworkflowDepth();
                } else {
                    Optional<CompileResult> resolved = resolver.resolve(subworkflow.workflowId());
                    if (resolved.isEmpty()) {
                        error = "subworkflow_not_found:" + subworkflow.workflowId();
                    } else if (!resolved.get().ok()) {
                        error = "subworkflow_compile_error:%s: %s"
                            .formatted(subworkflow.workflowId(), resolved.get().firstErrorMessage());
                    } else {
                        body = resolved.get().workflow().steps();
                        output.put("workflowHash", resolved.get().workflow().workflowHash());
                        childDepth++;
                    }
                }
                if (error != null) {
                    BlockOutcome failed = new BlockOutcome.Failed(error);
                    finishContainer(subworkflow, scope, slot, attempt, failed, output, output);
                    return failed;
                }
            }

            Scope child = scope.nested(restoredOutputs, childDepth);
            BlockOutcome outcome = executeSteps(body, child, iteration);
            if (outcome instanceof BlockOutcome.Suspended suspended) {
                suspended.scopes().put(subworkflow.id(), new LinkedHashMap<>(child.ownOutputs()));
                return outcome;
            }

            ObjectNode childOutputs = JSON.objectNode();
            child.ownOutputs().forEach(childOutputs::set);
            output.put("status", outcome instanceof BlockOutcome.Completed ? "ok" : "failed");
            output.set("outputs", childOutputs);
            finishContainer(subworkflow, scope, slot, attempt, outcome, output, childOutputs);
            return outcome;
        }

        // Bookkeeping

        private int start(Step step, Scope scope, int attempt, Integer iteration) {
            String at = now();
            int slot = scope.record(StepResult.running(step.id(), attempt, iteration, at));
            emit(stepEvent("step.started", step.id(), attempt).with("iteration", iteration));
            return slot;
        }

        /**
         * Settle a container's own result. Suspended and cancelled containers stay {@code running}.
         */
        private void finishContainer(Step step, Scope scope, int slot, int attempt, BlockOutcome outcome,
                                     ObjectNode output, JsonNode bound) {
            String at = now();
            if (outcome instanceof BlockOutcome.Completed) {
                scope.update(slot, scope.at(slot).complete(at, output));
                bindOutput(step, scope, bound);
                emit(stepEvent("step.completed", step.id(), attempt));
            } else if (outcome instanceof BlockOutcome.Failed failed) {
                scope.update(slot, scope.at(slot).fail(at, output, failed.error()));
                emit(stepEvent("step.failed", step.id(), attempt).with("error", failed.error()));
            }
        }

        private void recordSkipped(List<Step> steps, Scope scope) {
            for (String stepId : StepOrder.of(steps)) {
                scope.record(StepResult.skipped(stepId, now()));
                emit(event("step.skipped", state.executionId()).with("stepId", stepId));
            }
        }

        private void bindOutput(Step step, Scope scope, JsonNode value) {
            if (step.outputVariable() != null) {
                scope.bind(step.outputVariable(), value);
            }
        }

        private ConditionScope conditionScope(Scope scope, Integer iteration) {
            Map<String, JsonNode> variables = new LinkedHashMap<>(payload.variables());
            if (iteration != null) {
                ObjectNode loop = JSON.objectNode();
                loop.put("iteration", iteration);
                variables.put("loop", loop);
            }
            return new ConditionScope(scope.visibleOutputs(), variables, payload.trigger());
        }

        private WorkflowEvent stepEvent(String type, String stepId, int attempt) {
            return event(type, state.executionId()).with("stepId", stepId).with("attempt", attempt);
        }

        ExecutionRun finish(Scope root, BlockOutcome outcome) {
            String executionId = state.executionId();
            String hash = workflow.workflowHash();
            Map<String, JsonNode> output = new LinkedHashMap<>(root.ownOutputs());
            List<StepResult> steps = List.copyOf(root.results());

            if (outcome instanceof BlockOutcome.Completed && state.fastForwarding()) {
                outcome = new BlockOutcome.Failed(
                    RESUME_TOKEN_MISMATCH + state.fastForwardTarget().approval().id());
            }

            ExecutionRun run;
            if (outcome instanceof BlockOutcome.Suspended suspended) {
                var paused = new ExecutionCheckpoint(suspended.approval().stepId(),
                    suspended.loopIterations(), output, suspended.scopes());
                run = ExecutionRun.awaitingApproval(executionId, hash, output, steps, suspended.approval(), paused);
            } else if (outcome instanceof BlockOutcome.Failed failed) {
                run = ExecutionRun.failed(executionId, hash, output, steps, failed.error());
            } else if (outcome instanceof BlockOutcome.Cancelled cancelled) {
                run = ExecutionRun.cancelled(executionId, hash, output, steps, cancelled.error());
            } else {
                run = ExecutionRun.completed(executionId, hash, output, steps);
            }

            logger.debug("Execution {} finished with status {} after {} steps",
                executionId, run.status().value(), state.stepCount());
            emit(event("execution.finished", executionId)
                .with("status", run.status().value())
                .with("error", run.error()));
            return run;
        }
    }

    private static ObjectNode loopOutput(int iterations, boolean boundReached) {
        ObjectNode output = JSON.objectNode();
        output.put("iterations", iterations);
        output.put("boundReached", boundReached);
        return output;
    }

    private static boolean backoff(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String describe(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }
}
