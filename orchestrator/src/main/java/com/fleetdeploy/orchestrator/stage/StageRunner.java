package com.fleetdeploy.orchestrator.stage;

import com.fleetdeploy.orchestrator.executor.CommandHandle;
import com.fleetdeploy.orchestrator.executor.CommandOutcome;
import com.fleetdeploy.orchestrator.executor.DispatchException;
import com.fleetdeploy.orchestrator.executor.ExecutionCredential;
import com.fleetdeploy.orchestrator.executor.ExecutorException;
import com.fleetdeploy.orchestrator.executor.RemoteExecutionClient;
import com.fleetdeploy.orchestrator.target.Target;
import com.fleetdeploy.orchestrator.template.CommandTemplateEngine;
import com.fleetdeploy.orchestrator.template.RenderedCommand;
import com.fleetdeploy.orchestrator.template.TemplateCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Runs one stage against one target: render, dispatch, poll, classify.
 *
 * No retries here. Unreachable targets come back as a TARGET_UNREACHABLE
 * outcome and the orchestrator decides what happens next.
 */
@Component
public class StageRunner {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final TemplateCatalog       templates;
    private final CommandTemplateEngine engine;
    private final RemoteExecutionClient client;

    public StageRunner(TemplateCatalog templates,
                       CommandTemplateEngine engine,
                       RemoteExecutionClient client) {
        this.templates = templates;
        this.engine    = engine;
        this.client    = client;
    }

    /**
     * Render the stage template for this run without sending anything.
     *
     * @throws com.fleetdeploy.orchestrator.template.RenderException on a missing binding or template
     */
    public RenderedCommand render(StageDefinition stage, Map<String, String> bindings) {
        return engine.render(templates.get(stage.templateName()), bindings);
    }

    /**
     * @throws com.fleetdeploy.orchestrator.template.RenderException before any dispatch
     *         if the stage template cannot be rendered
     */
    public StageResult run(Target target, StageDefinition stage, Map<String, String> bindings,
                           ExecutionCredential credential) {
        RenderedCommand command = render(stage, bindings);

        CommandHandle handle;
        try {
            handle = client.dispatch(target, command, credential);
        } catch (DispatchException e) {
            log.warn("Stage {} not dispatched to {}: {}", stage.name(), target.id(), e.getMessage());
            CommandOutcome outcome = e.getKind() == DispatchException.Kind.TARGET_UNREACHABLE
                    ? CommandOutcome.targetUnreachable(e.getMessage())
                    : CommandOutcome.failure(e.getMessage(), null);
            return new StageResult(outcome, false);
        } catch (ExecutorException e) {
            // The agent may have queued the command; without an id it cannot be polled.
            log.error("Stage {} dispatch to {} gave an unusable reply: {}",
                    stage.name(), target.id(), e.getMessage());
            return new StageResult(CommandOutcome.failure(e.getMessage(), null), false);
        }

        CommandOutcome outcome = client.poll(handle, stage.timeout());
        boolean passed = stage.successPredicate().passes(outcome);
        if (passed) {
            log.info("Stage {} PASS on {} (exit={})", stage.name(), target.id(), outcome.exitCode());
        } else {
            log.warn("Stage {} FAIL on {}: status={} exit={}",
                    stage.name(), target.id(), outcome.status(), outcome.exitCode());
        }
        return new StageResult(outcome, passed);
    }
}
