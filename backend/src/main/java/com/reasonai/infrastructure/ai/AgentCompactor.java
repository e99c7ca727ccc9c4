package com.reasonai.infrastructure.ai;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.service.Compactor;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import lombok.extern.slf4j.Slf4j;

/**
 * Compactor that asks the reasoning agent to merge numbered outputs into one message.
 * The template must contain the {@value #OUTPUTS_PLACEHOLDER} placeholder.
 */
@Slf4j
public class AgentCompactor implements Compactor {

    public static final String OUTPUTS_PLACEHOLDER = "{outputs}";

    static final String DEFAULT_TEMPLATE = """
            You are an intelligent consolidation agent. Your task is to merge multiple reasoning outputs \
            into a single, coherent, and easy-to-parse message.

            INSTRUCTIONS:
            1. Read all provided reasoning outputs carefully
            2. Identify common themes, insights, and conclusions across all outputs
            3. Resolve any contradictions by considering context and confidence levels
            4. Produce a single consolidated output that captures the essential information
            5. Preserve important details from all sources
            6. If outputs are in different languages, consolidate into the most common language

            REASONING OUTPUTS TO CONSOLIDATE:
            {outputs}

            CONSOLIDATED OUTPUT:""";

    private static final int MAX_TOKENS = 1500;
    private static final double TEMPERATURE = 0.3;

    private final ReasoningAgent agent;
    private final String template;

    public AgentCompactor(ReasoningAgent agent) {
        this(agent, null);
    }

    public AgentCompactor(ReasoningAgent agent, String template) {
        if (agent == null) {
            throw new IllegalArgumentException("agent is required");
        }
        if (template != null && !template.isBlank() && !template.contains(OUTPUTS_PLACEHOLDER)) {
            throw new IllegalArgumentException("Compaction template must contain " + OUTPUTS_PLACEHOLDER);
        }
        this.agent = agent;
        this.template = template == null || template.isBlank() ? DEFAULT_TEMPLATE : template;
    }

    @Override
    public String compact(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String prompt = template.replace(OUTPUTS_PLACEHOLDER, input);
        String result = agent.execute(new AgentPayload(prompt, null, MAX_TOKENS, TEMPERATURE)).text();
        log.debug("Compaction complete, {} chars in, {} chars out", input.length(), result.length());
        return result;
    }
}
