package com.substitution.solver.index;

import java.util.List;
import java.util.stream.Stream;

/**
 * Dictionary backed by a fixed list of lines.
 */
public class InMemoryDictionarySource implements DictionarySource {

    private final List<String> lines;

    public InMemoryDictionarySource(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public static InMemoryDictionarySource of(String... lines) {
        return new InMemoryDictionarySource(List.of(lines));
    }

    @Override
    public Stream<String> lines() {
        return lines.stream();
    }

    @Override
    public String describe() {
        return "in-memory (" + lines.size() + " lines)";
    }
}
