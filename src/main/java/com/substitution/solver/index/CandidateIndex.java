package com.substitution.solver.index;

import java.util.List;
import java.util.Map;

import com.substitution.solver.pattern.PatternSignature;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Read-only lookup of dictionary words by repetition signature. Only the
 * signatures the ciphertext needs are present.
 */
@Value
@Builder(toBuilder = true)
public class CandidateIndex {

    /**
     * Candidate words per signature, in dictionary order, without duplicates.
     */
    @NonNull
    @Singular("bucket")
    Map<PatternSignature, List<String>> buckets;

    /**
     * Candidates for the signature; empty when the dictionary has none.
     */
    public List<String> candidatesFor(PatternSignature signature) {
        if (signature == null) {
            return List.of();
        }
        return buckets.getOrDefault(signature, List.of());
    }

    public int signatureCount() {
        return buckets.size();
    }

    public int totalCandidates() {
        return buckets.values().stream().mapToInt(List::size).sum();
    }
}
