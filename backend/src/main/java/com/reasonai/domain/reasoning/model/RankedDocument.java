package com.reasonai.domain.reasoning.model;

public record RankedDocument(String document, double score) {}
