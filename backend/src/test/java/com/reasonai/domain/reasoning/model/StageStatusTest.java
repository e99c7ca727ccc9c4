package com.reasonai.domain.reasoning.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StageStatusTest {

    @Test
    @DisplayName("a pending stage either runs or is skipped")
    void pendingTransitions() {
        assertThat(StageStatus.PENDING.canTransitionTo(StageStatus.RUNNING)).isTrue();
        assertThat(StageStatus.PENDING.canTransitionTo(StageStatus.SKIPPED)).isTrue();
        assertThat(StageStatus.PENDING.canTransitionTo(StageStatus.COMPLETED)).isFalse();
        assertThat(StageStatus.PENDING.canTransitionTo(StageStatus.FAILED)).isFalse();
    }

    @Test
    @DisplayName("a running stage ends completed or failed, never skipped")
    void runningTransitions() {
        assertThat(StageStatus.RUNNING.canTransitionTo(StageStatus.COMPLETED)).isTrue();
        assertThat(StageStatus.RUNNING.canTransitionTo(StageStatus.FAILED)).isTrue();
        assertThat(StageStatus.RUNNING.canTransitionTo(StageStatus.SKIPPED)).isFalse();
        assertThat(StageStatus.RUNNING.canTransitionTo(StageStatus.PENDING)).isFalse();
    }

    @Test
    @DisplayName("terminal states have no outgoing transitions")
    void terminalStates() {
        for (StageStatus terminal : List.of(StageStatus.COMPLETED, StageStatus.SKIPPED, StageStatus.FAILED)) {
            assertThat(terminal.isTerminal()).isTrue();
            for (StageStatus next : StageStatus.values()) {
                assertThat(terminal.canTransitionTo(next)).as("%s -> %s", terminal, next).isFalse();
            }
        }
    }

    @Test
    @DisplayName("pending and running are not terminal")
    void nonTerminalStates() {
        assertThat(StageStatus.PENDING.isTerminal()).isFalse();
        assertThat(StageStatus.RUNNING.isTerminal()).isFalse();
    }
}
