package com.reasonai.domain.reasoning.model;

/**
 * Why a stage ended in FAILED.
 *
 * @param kind    failure category
 * @param message human-readable description, prefixed with the stage name
 */
public record StageError(Kind kind, String message) {

    public enum Kind {
        /** A reasoning, compaction or reranking call failed. */
        COLLABORATOR,
        /** The stage did not finish before its deadline. */
        TIMEOUT,
        /** The caller cancelled the run. */
        CANCELLED,
        /** Any other fault raised inside the stage. */
        INTERNAL
    }
}
