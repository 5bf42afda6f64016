package io.gradekit.core.extract;

import java.util.Objects;

/// Reads fields as `<key>...</key>` tag pairs in free text.
///
/// The first opening tag is paired with the nearest closing tag after it. Nested tags of the
/// same name are not balanced, and attributes on the opening tag are not recognised.
final class XmlTagDocument implements ResponseDocument {

    private final String text;

    XmlTagDocument(String text) {
        this.text = Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public String read(String key) {
        String open = "<" + key + ">";
        String close = "</" + key + ">";
        int start = text.indexOf(open);
        if (start < 0) {
            return null;
        }
        int contentStart = start + open.length();
        int end = text.indexOf(close, contentStart);
        if (end < 0) {
            return null;
        }
        return text.substring(contentStart, end);
    }
}
