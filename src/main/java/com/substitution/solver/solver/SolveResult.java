package com.substitution.solver.solver;

import java.util.List;

import com.substitution.solver.model.ResolutionTable;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of one solver run.
 */
@Data
@Builder
public class SolveResult {
    private boolean success;
    private String errorMessage;

    private String ciphertext;
    private String plaintext;
    private ResolutionTable resolutions;

    private int cipherWordCount;
    private int stageCount;
    @Singular("stage")
    private List<StageStatistics> stages;
    @Singular("unmatchedWord")
    private List<String> unmatchedWords;

    private long mappingsProduced;
    private long mappingsObserved;
    private boolean truncated;

    /** Counted over the distinct letters that occur in the ciphertext. */
    private long certainCount;
    private long ambiguousCount;
    private long unknownCount;

    public static SolveResult failure(String ciphertext, String errorMessage) {
        return SolveResult.builder()
                .success(false)
                .ciphertext(ciphertext)
                .errorMessage(errorMessage)
                .build();
    }
}
