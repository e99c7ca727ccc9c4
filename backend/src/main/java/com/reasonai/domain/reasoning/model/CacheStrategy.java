package com.reasonai.domain.reasoning.model;

public enum CacheStrategy {
    /** Always recompute. */
    NONE,
    /** In-process cache, lost on restart. */
    MEMORY
}
