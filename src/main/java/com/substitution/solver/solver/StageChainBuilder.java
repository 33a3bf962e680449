package com.substitution.solver.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.config.ChainOrdering;
import com.substitution.solver.model.CipherWord;

/**
 * Wires one {@link WordStage} per distinct cipher word in front of a fresh
 * {@link GuessAggregator}.
 *
 * Words without any dictionary candidate get no stage: they place no constraint
 * on the key, and a stage for them would cut off every branch passing through it.
 * Their letters stay unknown unless other words pin them down.
 */
public class StageChainBuilder {

    private static final Logger log = LoggerFactory.getLogger(StageChainBuilder.class);

    private final WordMatcher matcher;

    public StageChainBuilder(WordMatcher matcher) {
        this.matcher = matcher;
    }

    public StageChain build(List<CipherWord> words, ChainOrdering ordering, SearchBudget budget) {
        List<CipherWord> matched = new ArrayList<>();
        for (CipherWord word : distinct(words)) {
            if (word.hasCandidates()) {
                matched.add(word);
            } else {
                log.debug("Skipping '{}': no candidates for signature {}", word.getText(), word.getSignature());
            }
        }
        List<CipherWord> evaluationOrder = orderForEvaluation(matched, ordering);

        GuessAggregator aggregator = new GuessAggregator();
        MappingReceiver target = aggregator;
        List<WordStage> stages = new ArrayList<>();

        // Built from the aggregator backwards, so the last word evaluated is wired first.
        for (int i = evaluationOrder.size() - 1; i >= 0; i--) {
            WordStage stage = new WordStage(evaluationOrder.get(i), matcher, target, budget);
            stages.add(stage);
            target = stage;
        }
        Collections.reverse(stages);

        for (int i = 0; i < stages.size(); i++) {
            CipherWord word = stages.get(i).getWord();
            log.debug("Stage {}: '{}' signature {} with {} candidates",
                    i + 1, word.getText(), word.getSignature(), word.candidateCount());
        }
        return new StageChain(target, stages, aggregator, budget);
    }

    /**
     * Repeated cipher words collapse to their first occurrence. A second stage for
     * the same word could only ever forward the mapping it received unchanged.
     */
    static List<CipherWord> distinct(List<CipherWord> words) {
        Map<String, CipherWord> byText = new LinkedHashMap<>();
        for (CipherWord word : words) {
            byText.putIfAbsent(word.getText(), word);
        }
        return new ArrayList<>(byText.values());
    }

    /**
     * Entry stage first. For {@link ChainOrdering#FEWEST_CANDIDATES_FIRST} this is
     * ascending candidate count, ties kept in input order.
     */
    static List<CipherWord> orderForEvaluation(List<CipherWord> words, ChainOrdering ordering) {
        List<CipherWord> ordered = new ArrayList<>(words);
        if (ordering == ChainOrdering.FEWEST_CANDIDATES_FIRST) {
            ordered.sort(Comparator.comparingInt(CipherWord::candidateCount));
        }
        return ordered;
    }
}
