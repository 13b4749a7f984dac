package io.github.healprint.chat.assessment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Static symptom taxonomy and health-factor table. Loaded once from a classpath resource; the
 * built-in skin, hair and internal-health taxonomy is used when the resource is missing.
 */
@ApplicationScoped
public class DiagnosticCatalog {

    private static final Logger LOG = Logger.getLogger(DiagnosticCatalog.class);

    private final DiagnosticData data;
    private final ObjectMapper objectMapper;

    @Inject
    public DiagnosticCatalog(
            ObjectMapper objectMapper,
            @ConfigProperty(name = "healprint.diagnostic-data", defaultValue = "diagnostic-data.json")
                    String resource) {
        this(objectMapper, loadData(objectMapper, resource));
    }

    DiagnosticCatalog(ObjectMapper objectMapper, DiagnosticData data) {
        this.objectMapper = objectMapper;
        this.data = data;
    }

    public static DiagnosticCatalog fromClasspath(ObjectMapper objectMapper, String resource) {
        return new DiagnosticCatalog(objectMapper, loadData(objectMapper, resource));
    }

    /** Category id to category definition, in declaration order. */
    public Map<String, SymptomCategory> symptomCategories() {
        return Collections.unmodifiableMap(data.getSymptomCategories());
    }

    public List<HealthFactor> healthFactorsFor(Collection<String> symptoms) {
        return data.getHealthFactors().values().stream()
                .filter(factor -> factor.relatesToAny(symptoms))
                .toList();
    }

    public Map<String, List<String>> recommendedTests() {
        return Collections.unmodifiableMap(data.getRecommendedTests());
    }

    /** Renders the catalog as the diagnostic-tools block of the completion instructions. */
    public String describeForPrompt() {
        StringBuilder text = new StringBuilder("Available Diagnostic Tools and Data:\n\n");
        appendSection(text, "Symptom Categories", data.getSymptomCategories());
        appendSection(text, "Key Health Factors to Consider", data.getHealthFactors());
        appendSection(text, "Common Diagnostic Patterns", data.getDiagnosticPatterns());
        appendSection(text, "Recommended Tests", data.getRecommendedTests());
        text.append(
                "Use this information to guide your questions and provide comprehensive health"
                        + " insights.\n");
        return text.toString();
    }

    private void appendSection(StringBuilder text, String heading, Object value) {
        text.append(heading).append(":\n");
        try {
            text.append(
                    objectMapper
                            .writer()
                            .with(SerializationFeature.INDENT_OUTPUT)
                            .writeValueAsString(value));
        } catch (JsonProcessingException e) {
            LOG.warnf(e, "Failed to render %s for the completion prompt", heading);
            text.append("{}");
        }
        text.append("\n\n");
    }

    private static DiagnosticData loadData(ObjectMapper objectMapper, String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = DiagnosticCatalog.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                LOG.warnf("Diagnostic data %s not found, using built-in taxonomy", resource);
                return builtIn();
            }
            DiagnosticData data = objectMapper.readValue(in, DiagnosticData.class);
            LOG.infof(
                    "Loaded diagnostic data from %s: %d symptom categories, %d health factors",
                    resource,
                    data.getSymptomCategories().size(),
                    data.getHealthFactors().size());
            return data;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read diagnostic data " + resource, e);
        }
    }

    static DiagnosticData builtIn() {
        Map<String, SymptomCategory> categories = new LinkedHashMap<>();
        categories.put(
                "skin_conditions",
                new SymptomCategory(
                        "Skin Conditions",
                        List.of(
                                "acne", "blackheads", "whiteheads", "cysts", "nodules",
                                "dry_skin", "oily_skin", "sensitive_skin", "redness",
                                "inflammation", "rashes", "eczema", "psoriasis", "dermatitis",
                                "rosacea", "hyperpigmentation", "dark_spots", "melasma",
                                "age_spots", "wrinkles", "fine_lines", "sagging", "dull_skin",
                                "uneven_texture")));
        categories.put(
                "hair_conditions",
                new SymptomCategory(
                        "Hair Conditions",
                        List.of(
                                "hair_loss", "thinning", "bald_patches", "receding_hairline",
                                "dry_hair", "oily_hair", "brittle_hair", "split_ends", "dandruff",
                                "scalp_irritation", "scalp_psoriasis", "scalp_eczema",
                                "slow_growth", "excessive_shedding", "breakage", "frizz")));
        categories.put(
                "internal_health",
                new SymptomCategory(
                        "Internal Health Indicators",
                        List.of(
                                "digestive_issues", "bloating", "constipation", "diarrhea",
                                "acid_reflux", "fatigue", "low_energy", "sleep_issues",
                                "insomnia", "poor_sleep_quality", "mood_swings", "anxiety",
                                "depression", "irritability", "brain_fog", "weight_changes",
                                "unexplained_weight_gain", "unexplained_weight_loss",
                                "hormonal_imbalances", "irregular_cycles", "pms_symptoms",
                                "menopause_symptoms")));
        DiagnosticData data = new DiagnosticData();
        data.setSymptomCategories(categories);
        return data;
    }
}
