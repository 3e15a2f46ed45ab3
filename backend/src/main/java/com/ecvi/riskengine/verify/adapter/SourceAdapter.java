package com.ecvi.riskengine.verify.adapter;

import com.ecvi.riskengine.verify.model.CompanyField;
import com.ecvi.riskengine.verify.model.CompanySnapshot;
import com.ecvi.riskengine.verify.model.SourceCategory;
import com.ecvi.riskengine.verify.model.SourceResult;

import java.time.Instant;
import java.util.Set;

/**
 * One evidence source. Implementations are stateless and safe to call concurrently.
 */
public interface SourceAdapter {

    SourceCategory category();

    /** Fields that can drive this adapter; it runs when at least one is present. */
    Set<CompanyField> inputFields();

    default boolean isApplicable(CompanySnapshot snapshot) {
        for (CompanyField field : inputFields()) {
            if (snapshot.hasValue(field)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Evaluates the snapshot. External failures are absorbed into an {@code UNAVAILABLE} or
     * degraded {@code EVALUATED} result; this method does not throw for them.
     *
     * @param deadline instant after which outbound work should stop being attempted
     */
    SourceResult evaluate(CompanySnapshot snapshot, Instant deadline);
}
