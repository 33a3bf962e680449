package com.substitution.solver.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Per-stage counters collected after a run.
 */
@Value
@Builder
public class StageStatistics {
    int position;
    String word;
    String signature;
    int candidates;
    long received;
    long forwarded;

    static StageStatistics of(int position, WordStage stage) {
        return StageStatistics.builder()
                .position(position)
                .word(stage.getWord().getText())
                .signature(stage.getWord().getSignature().toString())
                .candidates(stage.getWord().candidateCount())
                .received(stage.getReceived())
                .forwarded(stage.getForwarded())
                .build();
    }
}
