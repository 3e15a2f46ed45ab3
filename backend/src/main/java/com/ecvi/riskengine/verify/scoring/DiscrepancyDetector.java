package com.ecvi.riskengine.verify.scoring;

import com.ecvi.riskengine.verify.adapter.ReportedFields;
import com.ecvi.riskengine.verify.model.Discrepancy;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cross-checks fields reported by more than one source. The first reporting category
 * (in {@link SourceCategory} order) is the reference; every later one that disagrees gets
 * the discrepancy attached to its own result.
 */
@Component
public class DiscrepancyDetector {
    private static final Map<String, FieldKind> COMPARED_FIELDS = new LinkedHashMap<>();

    static {
        COMPARED_FIELDS.put(ReportedFields.LEGAL_NAME, FieldKind.NAME);
        COMPARED_FIELDS.put(ReportedFields.REGISTRATION_NUMBER, FieldKind.IDENTIFIER);
        COMPARED_FIELDS.put(ReportedFields.JURISDICTION, FieldKind.JURISDICTION);
        COMPARED_FIELDS.put(ReportedFields.COUNTRY, FieldKind.JURISDICTION);
        COMPARED_FIELDS.put(ReportedFields.DOMAIN, FieldKind.DOMAIN);
    }

    public Map<SourceCategory, SourceResult> detect(Map<SourceCategory, SourceResult> results) {
        Map<SourceCategory, List<Discrepancy>> found = new EnumMap<>(SourceCategory.class);
        for (Map.Entry<String, FieldKind> compared : COMPARED_FIELDS.entrySet()) {
            String field = compared.getKey();
            SourceResult reference = null;
            for (SourceCategory category : SourceCategory.values()) {
                SourceResult result = results.get(category);
                if (result == null || !result.hasEvidence() || result.field(field) == null) {
                    continue;
                }
                if (reference == null) {
                    reference = result;
                    continue;
                }
                FieldComparator.compare(
                    field,
                    compared.getValue(),
                    reference.field(field),
                    result.field(field),
                    category.name().toLowerCase(Locale.ROOT)
                ).ifPresent(discrepancy -> found.computeIfAbsent(category, ignored -> new ArrayList<>()).add(discrepancy));
            }
        }

        Map<SourceCategory, SourceResult> updated = new EnumMap<>(SourceCategory.class);
        for (Map.Entry<SourceCategory, SourceResult> entry : results.entrySet()) {
            updated.put(entry.getKey(), entry.getValue().withAddedDiscrepancies(found.get(entry.getKey())));
        }
        return updated;
    }
}
