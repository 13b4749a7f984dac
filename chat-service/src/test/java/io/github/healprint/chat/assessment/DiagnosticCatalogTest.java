package io.github.healprint.chat.assessment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DiagnosticCatalogTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void loadsTaxonomyFromResource() {
        DiagnosticCatalog catalog =
                DiagnosticCatalog.fromClasspath(objectMapper, "diagnostic-data.json");

        assertEquals(
                List.of("skin_conditions", "hair_conditions", "internal_health"),
                List.copyOf(catalog.symptomCategories().keySet()));
        assertTrue(catalog.symptomCategories().get("hair_conditions").symptoms().contains("frizz"));
        assertEquals(3, catalog.recommendedTests().size());
    }

    @Test
    void fallsBackToBuiltInTaxonomyWhenResourceIsMissing() {
        DiagnosticCatalog catalog = DiagnosticCatalog.fromClasspath(objectMapper, "missing.json");

        assertEquals(3, catalog.symptomCategories().size());
        assertTrue(catalog.symptomCategories().get("skin_conditions").symptoms().contains("acne"));
        assertTrue(catalog.healthFactorsFor(List.of("acne")).isEmpty());
    }

    @Test
    void selectsHealthFactorsRelatedToAnySymptom() {
        DiagnosticCatalog catalog =
                DiagnosticCatalog.fromClasspath(objectMapper, "diagnostic-data.json");

        Set<String> factors =
                catalog.healthFactorsFor(List.of("acne")).stream()
                        .map(HealthFactor::factor)
                        .collect(Collectors.toSet());

        assertEquals(
                Set.of("Hormonal Imbalances", "Chronic Stress", "Gut Health Issues"), factors);
        assertTrue(catalog.healthFactorsFor(List.of("frizz")).isEmpty());
    }

    @Test
    void describesCatalogForPrompt() {
        String text =
                DiagnosticCatalog.fromClasspath(objectMapper, "diagnostic-data.json")
                        .describeForPrompt();

        assertTrue(text.startsWith("Available Diagnostic Tools and Data:"));
        assertTrue(text.contains("Key Health Factors to Consider:"));
        assertTrue(text.contains("\"impact_level\" : \"high\""));
        assertTrue(text.contains("Thyroid function (TSH, T3, T4, reverse T3)"));
    }
}
