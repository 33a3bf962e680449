package com.substitution.solver.solver;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.config.SolverConfig;
import com.substitution.solver.index.CandidateIndex;
import com.substitution.solver.index.DictionaryLoadException;
import com.substitution.solver.index.DictionaryLoadingService;
import com.substitution.solver.index.DictionarySource;
import com.substitution.solver.index.FileDictionarySource;
import com.substitution.solver.model.CipherWord;
import com.substitution.solver.model.Resolution;
import com.substitution.solver.model.ResolutionTable;
import com.substitution.solver.pattern.PatternSignature;
import com.substitution.solver.pattern.PatternSignatureCalculator;
import com.substitution.solver.render.SubstitutionRenderer;
import com.substitution.solver.text.TextNormalizer;

/**
 * Runs the full pipeline for one ciphertext: tokenize, index the dictionary,
 * assemble and drive the stage chain, then render the resolved key.
 */
public class SolverService {
    private static final Logger log = LoggerFactory.getLogger(SolverService.class);

    private final SolverConfig config;
    private final DictionaryLoadingService dictionaryLoader;
    private final StageChainBuilder chainBuilder;

    public SolverService(SolverConfig config) {
        this(config, new DictionaryLoadingService(), new StageChainBuilder(new WordMatcher()));
    }

    public SolverService(SolverConfig config, DictionaryLoadingService dictionaryLoader, StageChainBuilder chainBuilder) {
        this.config = config;
        this.dictionaryLoader = dictionaryLoader;
        this.chainBuilder = chainBuilder;
    }

    /**
     * Solve against the dictionary file named in the configuration.
     */
    public SolveResult solve(String ciphertext) {
        return solve(ciphertext, new FileDictionarySource(config.getDictionaryPath()));
    }

    public SolveResult solve(String ciphertext, DictionarySource dictionary) {
        try {
            // Step 1: tokenize
            List<String> tokens = TextNormalizer.tokenize(ciphertext);
            log.info("Step 1: {} cipher words in input", tokens.size());

            Set<PatternSignature> needed = new LinkedHashSet<>();
            for (String token : tokens) {
                needed.add(PatternSignatureCalculator.calculateSignature(token));
            }

            // Step 2: index the dictionary by the signatures we need
            log.info("Step 2: Indexing dictionary {}", dictionary.describe());
            CandidateIndex index = dictionaryLoader.loadIndex(dictionary, needed);

            List<CipherWord> words = new ArrayList<>();
            for (String token : tokens) {
                PatternSignature signature = PatternSignatureCalculator.calculateSignature(token);
                words.add(CipherWord.builder()
                        .text(token)
                        .signature(signature)
                        .candidates(index.candidatesFor(signature))
                        .build());
            }

            // Step 3: assemble and drive the chain
            SearchBudget budget = config.isBudgeted() ? SearchBudget.of(config.getMaxMappings()) : SearchBudget.unlimited();
            StageChain chain = chainBuilder.build(words, config.getOrdering(), budget);
            log.info("Step 3: Searching across {} stages ({} ordering)", chain.getStages().size(), config.getOrdering());
            ResolutionTable table = chain.run();

            if (budget.isExhausted()) {
                log.warn("Search budget of {} mappings exhausted; result is partial", budget.getLimit());
            }

            // Step 4: render
            String plaintext = SubstitutionRenderer.render(ciphertext, table.toSubstitutions(config.getPlaceholder()));
            return buildResult(ciphertext, words, chain, table, plaintext);

        } catch (DictionaryLoadException e) {
            log.debug("Dictionary load failed", e);
            return SolveResult.failure(ciphertext, e.getMessage());
        }
    }

    private SolveResult buildResult(String ciphertext, List<CipherWord> words, StageChain chain,
            ResolutionTable table, String plaintext) {
        String letters = TextNormalizer.normalize(ciphertext);

        SolveResult.SolveResultBuilder result = SolveResult.builder()
                .success(true)
                .ciphertext(ciphertext)
                .plaintext(plaintext)
                .resolutions(table)
                .cipherWordCount(words.size())
                .stageCount(chain.getStages().size())
                .mappingsProduced(chain.getBudget().getProduced())
                .mappingsObserved(chain.getAggregator().getObserved())
                .truncated(chain.getBudget().isExhausted())
                .certainCount(table.count(Resolution.Kind.CERTAIN, letters))
                .ambiguousCount(table.count(Resolution.Kind.AMBIGUOUS, letters))
                .unknownCount(table.count(Resolution.Kind.UNKNOWN, letters));

        List<WordStage> stages = chain.getStages();
        for (int i = 0; i < stages.size(); i++) {
            result.stage(StageStatistics.of(i + 1, stages.get(i)));
        }
        for (CipherWord word : StageChainBuilder.distinct(words)) {
            if (!word.hasCandidates()) {
                log.warn("No dictionary word matches the pattern of '{}' {}", word.getText(), word.getSignature());
                result.unmatchedWord(word.getText());
            }
        }
        return result.build();
    }
}
