package com.substitution.solver.index;

import java.io.IOException;
import java.util.stream.Stream;

/**
 * Line-oriented supply of candidate plaintext words. Each call to
 * {@link #lines()} starts over from the beginning; callers close the stream.
 */
public interface DictionarySource {

    Stream<String> lines() throws IOException;

    /**
     * Human-readable origin, used in log messages.
     */
    String describe();
}
