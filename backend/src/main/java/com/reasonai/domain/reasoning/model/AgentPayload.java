package com.reasonai.domain.reasoning.model;

/**
 * One call to the reasoning agent.
 *
 * @param prompt      the instruction text
 * @param context     optional background passed alongside the prompt (nullable)
 * @param maxTokens   generation limit
 * @param temperature sampling temperature
 */
public record AgentPayload(String prompt, String context, int maxTokens, double temperature) {}
