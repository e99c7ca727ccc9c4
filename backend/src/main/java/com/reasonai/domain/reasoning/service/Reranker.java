package com.reasonai.domain.reasoning.service;

import com.reasonai.domain.reasoning.model.RankedDocument;

import java.util.List;

/**
 * Orders candidate answers by relevance to the query, best first.
 */
public interface Reranker {

    List<RankedDocument> rerank(String query, List<String> candidates);
}
