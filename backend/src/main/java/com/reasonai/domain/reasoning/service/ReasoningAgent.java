package com.reasonai.domain.reasoning.service;

import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.AgentResponse;

/**
 * Generates a response for a prompt. Implementations must be safe to call from
 * several threads at once; retries, if any, are their own business.
 */
public interface ReasoningAgent {

    /**
     * Run one model call.
     *
     * @param payload prompt, optional context and sampling settings
     * @return generated text with token usage
     */
    AgentResponse execute(AgentPayload payload);
}
