package com.e2eq.conformance.taxonomy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * An externally produced description of a suspected conflict: keyword hits and structural
 * facts (including yes/no judgments from an ontology reasoner or cycle detector). Keywords and
 * fact values are normalized to trimmed lower case.
 */
public final class ConflictSignal {
    private final Set<String> keywords;
    private final Map<String, String> facts;
    private final String description;

    private ConflictSignal(Set<String> keywords, Map<String, String> facts, String description) {
        this.keywords = Collections.unmodifiableSet(keywords);
        this.facts = Collections.unmodifiableMap(facts);
        this.description = description;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ConflictSignal ofKeywords(String... keywords) {
        Builder b = builder();
        for (String k : keywords) b.keyword(k);
        return b.build();
    }

    public Set<String> keywords() {
        return keywords;
    }

    public Map<String, String> facts() {
        return facts;
    }

    public String description() {
        return description;
    }

    public boolean isEmpty() {
        return keywords.isEmpty() && facts.isEmpty();
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "{keywords=" + keywords + ", facts=" + facts + "}";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConflictSignal)) return false;
        ConflictSignal that = (ConflictSignal) o;
        return keywords.equals(that.keywords) && facts.equals(that.facts);
    }

    @Override
    public int hashCode() {
        return 31 * keywords.hashCode() + facts.hashCode();
    }

    public static final class Builder {
        private final Set<String> keywords = new LinkedHashSet<>();
        private final Map<String, String> facts = new LinkedHashMap<>();
        private String description;

        private Builder() {}

        public Builder keyword(String keyword) {
            String k = normalize(keyword);
            if (!k.isEmpty()) keywords.add(k);
            return this;
        }

        public Builder fact(String key, String value) {
            facts.put(normalize(key), normalize(value));
            return this;
        }

        public Builder fact(String key, boolean value) {
            return fact(key, Boolean.toString(value));
        }

        public Builder facts(Map<String, ?> values) {
            if (values != null) values.forEach((k, v) -> fact(k, String.valueOf(v)));
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public ConflictSignal build() {
            return new ConflictSignal(new LinkedHashSet<>(keywords), new LinkedHashMap<>(facts), description);
        }
    }
}
