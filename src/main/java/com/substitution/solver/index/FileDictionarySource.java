package com.substitution.solver.index;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Reads a word list such as /usr/share/dict/words, one word per line.
 * Undecodable bytes are replaced rather than failing the whole load, since
 * system word lists are not always clean UTF-8.
 */
@RequiredArgsConstructor
public class FileDictionarySource implements DictionarySource {

    @NonNull
    private final Path path;

    @Override
    public Stream<String> lines() throws IOException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder));
        return reader.lines().onClose(() -> {
            try {
                reader.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Override
    public String describe() {
        return path.toAbsolutePath().toString();
    }
}
