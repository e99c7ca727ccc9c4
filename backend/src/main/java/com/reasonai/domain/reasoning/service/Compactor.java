package com.reasonai.domain.reasoning.service;

/**
 * Compresses accumulated reasoning text into a shorter representation.
 */
public interface Compactor {

    String compact(String input);
}
