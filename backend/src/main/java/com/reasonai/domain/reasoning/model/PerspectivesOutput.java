package com.reasonai.domain.reasoning.model;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Perspectives ordered by index, regardless of the order in which they finished.
 */
public record PerspectivesOutput(List<Perspective> perspectives) implements StageOutput {

    public PerspectivesOutput {
        perspectives = perspectives.stream()
                .sorted(Comparator.comparingInt(Perspective::index))
                .toList();
    }

    public List<String> texts() {
        return perspectives.stream().map(Perspective::text).toList();
    }

    @Override
    public String asText() {
        return "Multiple reasoning perspectives:\n" + perspectives.stream()
                .map(p -> "\nPerspective " + (p.index() + 1) + " (" + p.framing() + "):\n" + p.text())
                .collect(Collectors.joining("\n"));
    }
}
