package com.reasonai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.reasonai.domain.reasoning.model.AgentPayload;
import com.reasonai.domain.reasoning.model.AgentResponse;
import com.reasonai.domain.reasoning.service.ReasoningAgent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Reasoning agent over the OpenAI chat completions API.
 * One payload is one completion; the pipeline decides prompts, limits and retries.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiReasoningAgent implements ReasoningAgent {

    static final String SYSTEM_PROMPT = "You are a careful reasoning assistant. "
            + "Follow the instruction in the user message exactly and answer in the language of the request.";

    private final OpenAIClient openAIClient;

    private final AtomicLong totalPromptTokens = new AtomicLong();
    private final AtomicLong totalCompletionTokens = new AtomicLong();

    @Value("${openai.model}")
    private String model;

    @Override
    public AgentResponse execute(AgentPayload payload) {
        try {
            var builder = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(payload.temperature())
                    .maxCompletionTokens(payload.maxTokens())
                    .addSystemMessage(SYSTEM_PROMPT);

            if (payload.context() != null && !payload.context().isBlank()) {
                builder.addSystemMessage("Background context:\n" + payload.context());
            }
            builder.addUserMessage(payload.prompt());

            ChatCompletion completion = openAIClient.chat().completions().create(builder.build());

            long[] tokens = new long[2];
            completion.usage().ifPresent(usage -> {
                tokens[0] = usage.promptTokens();
                tokens[1] = usage.completionTokens();
                log.info("Token usage - prompt: {}, completion: {}, total: {} (cumulative prompt: {}, completion: {})",
                        usage.promptTokens(), usage.completionTokens(), usage.totalTokens(),
                        totalPromptTokens.addAndGet(usage.promptTokens()),
                        totalCompletionTokens.addAndGet(usage.completionTokens()));
            });

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiReasoningException("OpenAI response has no content"));

            return new AgentResponse(content.trim(), tokens[0], tokens[1]);
        } catch (AiReasoningException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API call failed", e);
            throw new AiReasoningException("Reasoning agent call failed: " + e.getMessage(), e);
        }
    }
}
