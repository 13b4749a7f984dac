package io.github.healprint.chat.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field-level modification applied by {@link ConversationDocumentStore#updateOne}. Mirrors the
 * MongoDB {@code $set}, {@code $push} and {@code $max} operators.
 */
public final class DocumentPatch {

    private final Map<String, Object> sets = new LinkedHashMap<>();
    private final Map<String, Object> pushes = new LinkedHashMap<>();
    private final Map<String, Object> maxes = new LinkedHashMap<>();

    private DocumentPatch() {}

    public static DocumentPatch create() {
        return new DocumentPatch();
    }

    public DocumentPatch set(String field, Object value) {
        sets.put(field, value);
        return this;
    }

    /** Appends {@code value} to the array stored in {@code field}. */
    public DocumentPatch push(String field, Object value) {
        pushes.put(field, value);
        return this;
    }

    /** Sets {@code field} to {@code value} only when it is greater than the stored value. */
    public DocumentPatch max(String field, Comparable<?> value) {
        maxes.put(field, value);
        return this;
    }

    public Map<String, Object> sets() {
        return Collections.unmodifiableMap(sets);
    }

    public Map<String, Object> pushes() {
        return Collections.unmodifiableMap(pushes);
    }

    public Map<String, Object> maxes() {
        return Collections.unmodifiableMap(maxes);
    }

    public boolean isEmpty() {
        return sets.isEmpty() && pushes.isEmpty() && maxes.isEmpty();
    }
}
