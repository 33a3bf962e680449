package com.substitution.solver.model;

import java.util.List;

import com.substitution.solver.pattern.PatternSignature;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One normalized ciphertext word with its signature and the dictionary words
 * sharing that signature.
 */
@Value
@Builder(toBuilder = true)
public class CipherWord {

    @NonNull
    String text;

    @NonNull
    PatternSignature signature;

    @NonNull
    @Singular("candidate")
    List<String> candidates;

    public int candidateCount() {
        return candidates.size();
    }

    public boolean hasCandidates() {
        return !candidates.isEmpty();
    }
}
