package com.finclinic.backend.services.insights;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.finclinic.backend.enums.CategoryStatus;
import com.finclinic.backend.enums.FinancialCategory;
import com.finclinic.backend.exceptions.CatalogInvariantException;
import com.finclinic.backend.services.catalog.LocalizedText;

/**
 * Advisory text keyed by category, status level and condition tag.
 *
 * Buckets are sparse: a (category, status) pair may be absent, and a populated bucket only
 * carries the tags that were written for it. Every populated bucket has a
 * {@link ConditionTag#DEFAULT} variant; {@link Builder#build()} refuses content without one.
 * Variants inside a bucket are kept in {@link ConditionTag} order.
 */
public final class InsightMatrix {

    private final String version;
    private final Map<FinancialCategory, Map<CategoryStatus, List<InsightVariant>>> buckets;

    private InsightMatrix(String version, Map<FinancialCategory, Map<CategoryStatus, List<InsightVariant>>> buckets) {
        this.version = version;
        this.buckets = buckets;
    }

    public static Builder builder(String version) {
        return new Builder(version);
    }

    public String version() {
        return version;
    }

    /**
     * Variants for a bucket in resolution order; empty when the bucket was never populated.
     */
    public List<InsightVariant> bucket(FinancialCategory category, CategoryStatus status) {
        Map<CategoryStatus, List<InsightVariant>> byStatus = buckets.get(category);
        if (byStatus == null) {
            return List.of();
        }
        return byStatus.getOrDefault(status, List.of());
    }

    public int populatedBuckets() {
        return buckets.values().stream().mapToInt(Map::size).sum();
    }

    public static final class Builder {

        private final String version;
        private final Map<FinancialCategory, Map<CategoryStatus, List<InsightVariant>>> buckets =
                new EnumMap<>(FinancialCategory.class);

        private Builder(String version) {
            this.version = version;
        }

        public Builder add(FinancialCategory category, CategoryStatus status, ConditionTag tag, String en, String ar) {
            buckets.computeIfAbsent(category, c -> new EnumMap<>(CategoryStatus.class))
                    .computeIfAbsent(status, s -> new ArrayList<>())
                    .add(new InsightVariant(tag, LocalizedText.of(en, ar)));
            return this;
        }

        /**
         * @throws CatalogInvariantException if a populated bucket lacks a default variant or
         *         repeats a tag
         */
        public InsightMatrix build() throws CatalogInvariantException {
            if (version == null || version.isBlank()) {
                throw new CatalogInvariantException("Insight matrix version is required");
            }

            Map<FinancialCategory, Map<CategoryStatus, List<InsightVariant>>> frozen = new EnumMap<>(FinancialCategory.class);
            for (Map.Entry<FinancialCategory, Map<CategoryStatus, List<InsightVariant>>> byCategory : buckets.entrySet()) {
                Map<CategoryStatus, List<InsightVariant>> frozenStatuses = new EnumMap<>(CategoryStatus.class);
                for (Map.Entry<CategoryStatus, List<InsightVariant>> bucket : byCategory.getValue().entrySet()) {
                    String where = byCategory.getKey().getDisplayName() + "/" + bucket.getKey().getCode();

                    Set<ConditionTag> tags = EnumSet.noneOf(ConditionTag.class);
                    for (InsightVariant variant : bucket.getValue()) {
                        if (!tags.add(variant.tag())) {
                            throw new CatalogInvariantException(
                                    "Insight bucket " + where + " defines tag " + variant.tag().getCode() + " twice");
                        }
                    }
                    if (!tags.contains(ConditionTag.DEFAULT)) {
                        throw new CatalogInvariantException("Insight bucket " + where + " has no default text");
                    }

                    List<InsightVariant> ordered = new ArrayList<>(bucket.getValue());
                    ordered.sort(Comparator.comparing(InsightVariant::tag));
                    frozenStatuses.put(bucket.getKey(), List.copyOf(ordered));
                }
                frozen.put(byCategory.getKey(), Collections.unmodifiableMap(frozenStatuses));
            }
            return new InsightMatrix(version, Collections.unmodifiableMap(frozen));
        }
    }
}
