package com.substitution.solver.index;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.substitution.solver.pattern.PatternSignature;
import com.substitution.solver.pattern.PatternSignatureCalculator;
import com.substitution.solver.text.TextNormalizer;

/**
 * Builds a {@link CandidateIndex} from a dictionary source, keeping only the
 * buckets for the requested signatures.
 */
public class DictionaryLoadingService {

    private static final Logger log = LoggerFactory.getLogger(DictionaryLoadingService.class);

    public CandidateIndex loadIndex(DictionarySource source, Set<PatternSignature> neededSignatures) {
        Map<PatternSignature, Set<String>> buckets = new LinkedHashMap<>();
        for (PatternSignature signature : neededSignatures) {
            buckets.put(signature, new LinkedHashSet<>());
        }

        int linesRead = 0;
        try (Stream<String> lines = source.lines()) {
            for (String line : (Iterable<String>) lines::iterator) {
                linesRead++;
                String word = TextNormalizer.normalize(line);
                if (word.isEmpty()) {
                    continue;
                }
                Set<String> bucket = buckets.get(PatternSignatureCalculator.calculateSignature(word));
                if (bucket != null) {
                    bucket.add(word);
                }
            }
        } catch (IOException e) {
            throw new DictionaryLoadException("Failed to read dictionary " + source.describe(), e);
        } catch (UncheckedIOException e) {
            throw new DictionaryLoadException("Failed to read dictionary " + source.describe(), e.getCause());
        }

        CandidateIndex.CandidateIndexBuilder builder = CandidateIndex.builder();
        buckets.forEach((signature, words) -> builder.bucket(signature, List.copyOf(words)));
        CandidateIndex index = builder.build();

        log.debug("Read {} dictionary lines from {}; kept {} candidates across {} signatures",
                linesRead, source.describe(), index.totalCandidates(), index.signatureCount());
        return index;
    }
}
