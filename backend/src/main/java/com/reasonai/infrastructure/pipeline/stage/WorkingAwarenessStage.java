package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.Perspective;
import com.reasonai.domain.reasoning.model.PerspectivesOutput;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.infrastructure.ai.AiReasoningException;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.PipelineCancelledException;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import com.reasonai.infrastructure.pipeline.StageTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Reasons about the task from several independent framings.
 * <p>
 * The perspectives do not depend on each other: with parallel execution they fan out on the
 * stage executor and are joined before the stage completes. Either way the output is ordered
 * by perspective index, never by completion order. Single perspective failures are tolerated;
 * the stage fails only when none succeeds, and a partial set is never cached.
 * </p>
 */
@Slf4j
public class WorkingAwarenessStage extends AbstractStage {

    static final int MAX_TOKENS = 1000;
    static final double TEMPERATURE = 0.7;

    private final ReasoningAgent agent;
    private final StagePromptBuilder promptBuilder;
    private final int numPerspectives;
    private final boolean parallel;

    public WorkingAwarenessStage(ReasoningAgent agent, StagePromptBuilder promptBuilder,
                                 int numPerspectives, boolean parallel,
                                 boolean enabled, StageRuntime runtime) {
        super(StageType.WORKING_AWARENESS, enabled, runtime);
        this.agent = agent;
        this.promptBuilder = promptBuilder;
        this.numPerspectives = numPerspectives;
        this.parallel = parallel;
    }

    @Override
    protected StageOutput process(StageContext context, Deadline deadline) {
        String input = reasoningInput(context);
        List<PerspectiveFraming> framings = PerspectiveFraming.first(numPerspectives);

        log.info("Generating {} reasoning perspectives ({})", framings.size(), parallel ? "parallel" : "sequential");

        List<Perspective> perspectives = parallel
                ? fanOut(context, deadline, framings, input)
                : runSequentially(context, deadline, framings, input);

        if (perspectives.isEmpty()) {
            throw new AiReasoningException("All " + framings.size() + " reasoning perspectives failed");
        }
        if (perspectives.size() < framings.size()) {
            log.warn("Some perspectives failed: {} of {} succeeded", perspectives.size(), framings.size());
        }
        return new PerspectivesOutput(perspectives);
    }

    @Override
    protected List<String> cacheInputs(StageContext context) {
        return List.of(reasoningInput(context));
    }

    @Override
    protected boolean shouldCache(StageOutput output) {
        return output instanceof PerspectivesOutput perspectives
                && perspectives.perspectives().size() == numPerspectives;
    }

    @Override
    protected String cacheVariant() {
        return "perspectives=" + numPerspectives;
    }

    private List<Perspective> fanOut(StageContext context, Deadline deadline,
                                     List<PerspectiveFraming> framings, String input) {
        List<CompletableFuture<String>> futures = new ArrayList<>(framings.size());
        for (PerspectiveFraming framing : framings) {
            futures.add(CompletableFuture.supplyAsync(() -> reason(framing, input), runtime.executor()));
        }

        // allOf settles only after every perspective is done; handle() keeps one failure from masking the rest.
        CompletableFuture<Void> joined = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, error) -> null);
        try {
            await(context, deadline, joined);
        } catch (PipelineCancelledException | StageTimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        List<Perspective> perspectives = new ArrayList<>(framings.size());
        for (int i = 0; i < framings.size(); i++) {
            PerspectiveFraming framing = framings.get(i);
            try {
                perspectives.add(new Perspective(i, framing.label(), futures.get(i).join()));
            } catch (CompletionException e) {
                log.warn("Perspective {} ({}) failed: {}", i, framing.label(), e.getCause().getMessage());
            }
        }
        return perspectives;
    }

    private List<Perspective> runSequentially(StageContext context, Deadline deadline,
                                              List<PerspectiveFraming> framings, String input) {
        List<Perspective> perspectives = new ArrayList<>(framings.size());
        for (int i = 0; i < framings.size(); i++) {
            PerspectiveFraming framing = framings.get(i);
            try {
                perspectives.add(new Perspective(i, framing.label(), call(context, deadline, () -> reason(framing, input))));
            } catch (AiReasoningException e) {
                log.warn("Perspective {} ({}) failed: {}", i, framing.label(), e.getMessage());
            }
        }
        return perspectives;
    }

    private String reason(PerspectiveFraming framing, String input) {
        String prompt = promptBuilder.buildPerspectivePrompt(framing, input);
        String text = agent.execute(new AgentPayload(prompt, null, MAX_TOKENS, TEMPERATURE)).text();
        log.debug("Perspective {} complete: {} chars", framing.label(), text != null ? text.length() : 0);
        return text != null ? text : "";
    }

    private static String reasoningInput(StageContext context) {
        return context.output(StageType.PREPROCESSING)
                .map(StageOutput::asText)
                .orElse(context.getRequest().prompt());
    }
}
