package com.substitution.solver.solver;

import com.substitution.solver.model.CipherWord;
import com.substitution.solver.model.LetterMapping;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Pipeline unit bound to one cipher word. For every inbound mapping it forwards
 * one extended mapping per admissible candidate to the downstream receiver,
 * depth first: each forwarded mapping is fully processed downstream before the
 * next candidate is tried.
 */
@RequiredArgsConstructor
public class WordStage implements MappingReceiver {

    @Getter
    @NonNull
    private final CipherWord word;

    @NonNull
    private final WordMatcher matcher;

    @Getter
    @NonNull
    private final MappingReceiver downstream;

    @NonNull
    private final SearchBudget budget;

    @Getter
    private long received;

    @Getter
    private long forwarded;

    @Override
    public void receive(LetterMapping mapping) {
        received++;
        String cipherText = word.getText();
        for (String candidate : word.getCandidates()) {
            if (budget.isExhausted()) {
                return;
            }
            if (!matcher.isAdmissible(cipherText, mapping, candidate)) {
                continue;
            }
            if (!budget.tryConsume()) {
                return;
            }
            forwarded++;
            downstream.receive(mapping.extend(cipherText, candidate));
        }
    }
}
