package com.reasonai.infrastructure.pipeline.stage;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.AgentResponse;
import com.reasonai.domain.reasoning.model.PipelineRequest;
import com.reasonai.domain.reasoning.model.StageOutput;
import com.reasonai.domain.reasoning.model.StageType;
import com.reasonai.domain.reasoning.model.TextOutput;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import com.reasonai.infrastructure.pipeline.Deadline;
import com.reasonai.infrastructure.pipeline.StageContext;
import com.reasonai.infrastructure.pipeline.StagePromptBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthesizes the answer from the request and everything earlier stages produced.
 */
@Slf4j
public class FinalResponseStage extends AbstractStage {

    static final int DEFAULT_MAX_TOKENS = 1500;
    static final double DEFAULT_TEMPERATURE = 0.5;

    private final ReasoningAgent agent;
    private final StagePromptBuilder promptBuilder;

    public FinalResponseStage(ReasoningAgent agent, StagePromptBuilder promptBuilder,
                              boolean enabled, StageRuntime runtime) {
        super(StageType.FINAL_RESPONSE, enabled, runtime);
        this.agent = agent;
        this.promptBuilder = promptBuilder;
    }

    @Override
    protected StageOutput process(StageContext context, Deadline deadline) {
        PipelineRequest request = context.getRequest();
        String prompt = promptBuilder.buildSynthesisPrompt(request, context.getSharedData());
        log.debug("Created synthesis prompt: {} chars", prompt.length());

        AgentPayload payload = new AgentPayload(prompt, null,
                request.maxTokens() != null ? request.maxTokens() : DEFAULT_MAX_TOKENS,
                request.temperature() != null ? request.temperature() : DEFAULT_TEMPERATURE);
        AgentResponse response = call(context, deadline, () -> agent.execute(payload));

        TextOutput output = new TextOutput(response.text());
        log.info("Final response generated: {} chars", output.text().length());
        return output;
    }

    @Override
    protected List<String> cacheInputs(StageContext context) {
        PipelineRequest request = context.getRequest();
        List<String> inputs = new ArrayList<>();
        context.getSharedData().values().forEach(o -> inputs.add(o.asText()));
        inputs.add("maxTokens=" + request.maxTokens() + ",temperature=" + request.temperature());
        return inputs;
    }
}
