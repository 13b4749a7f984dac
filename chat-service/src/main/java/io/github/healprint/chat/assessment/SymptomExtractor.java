package io.github.healprint.chat.assessment;

import io.github.healprint.chat.api.dto.SymptomEvidence;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Cheap substring scan of user text against the symptom taxonomy. A key such as {@code hair_loss}
 * matches when "hair loss" occurs anywhere in the lower-cased message, so overlapping keys may
 * match together.
 */
@ApplicationScoped
public class SymptomExtractor {

    private final DiagnosticCatalog catalog;

    @Inject
    public SymptomExtractor(DiagnosticCatalog catalog) {
        this.catalog = catalog;
    }

    public Map<String, SymptomEvidence> extract(String message) {
        Map<String, SymptomEvidence> found = new LinkedHashMap<>();
        if (message == null || message.isBlank()) {
            return found;
        }
        String text = message.toLowerCase(Locale.ROOT);
        catalog.symptomCategories()
                .forEach(
                        (categoryId, category) -> {
                            for (String symptom : category.symptoms()) {
                                if (text.contains(symptom.replace('_', ' '))) {
                                    found.put(symptom, SymptomEvidence.mentionedIn(categoryId));
                                }
                            }
                        });
        return found;
    }

    /** Returns {@code existing} plus {@code found}. Evidence already collected is never dropped. */
    public Map<String, SymptomEvidence> merge(
            Map<String, SymptomEvidence> existing, Map<String, SymptomEvidence> found) {
        Map<String, SymptomEvidence> merged = new LinkedHashMap<>();
        if (existing != null) {
            merged.putAll(existing);
        }
        found.forEach(merged::putIfAbsent);
        return merged;
    }
}
