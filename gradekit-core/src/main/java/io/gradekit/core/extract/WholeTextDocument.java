package io.gradekit.core.extract;

import java.util.Objects;

/// Hands the entire response to every field. Used by `text` and `number` graders.
final class WholeTextDocument implements ResponseDocument {

    private final String text;

    WholeTextDocument(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String read(String key) {
        return text;
    }
}
