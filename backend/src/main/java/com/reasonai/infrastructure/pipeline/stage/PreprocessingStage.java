package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.AgentResponse;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.model.TextOutput;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Normalizes the raw request into a task statement the later stages reason over.
 */
@Slf4j
public class PreprocessingStage extends AbstractStage {

    static final int MAX_TOKENS = 500;
    static final double TEMPERATURE = 0.3;

    private final ReasoningAgent agent;
    private final StagePromptBuilder promptBuilder;

    public PreprocessingStage(ReasoningAgent agent, StagePromptBuilder promptBuilder,
                              boolean enabled, StageRuntime runtime) {
        super(StageType.PREPROCESSING, enabled, runtime);
        this.agent = agent;
        this.promptBuilder = promptBuilder;
    }

    @Override
    protected StageOutput process(StageContext context, Deadline deadline) {
        String prompt = promptBuilder.buildPreprocessingPrompt(context.getRequest());
        log.debug("Sending preprocessing request: {} chars", prompt.length());

        AgentResponse response = call(context, deadline,
                () -> agent.execute(new AgentPayload(prompt, null, MAX_TOKENS, TEMPERATURE)));

        TextOutput output = new TextOutput(response.text());
        log.info("Preprocessing complete, result length: {}", output.text().length());
        return output;
    }

    @Override
    protected List<String> cacheInputs(StageContext context) {
        return List.of();
    }
}
