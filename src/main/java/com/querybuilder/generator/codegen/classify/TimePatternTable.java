package com.querybuilder.generator.codegen.classify;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered, immutable table of time type patterns.
 *
 * Built once per generation run (built-ins plus caller additions) and passed
 * explicitly to every classification. Lookups are exact string matches and the
 * first entry for a name wins; duplicate additions are dropped with a warning.
 */
public final class TimePatternTable {
    private static final Logger log = LoggerFactory.getLogger(TimePatternTable.class);

    public static final List<TimePattern> BUILT_INS = List.of(
            new TimePattern("time.Time", true),
            new TimePattern("datatypes.Date", true),
            new TimePattern("datatypes.Time", true),
            new TimePattern("datatypes.DateTime", true),
            new TimePattern("sql.NullTime", true),
            new TimePattern("pq.NullTime", true)
    );

    private final Map<String, TimePattern> patterns;

    private TimePatternTable(Map<String, TimePattern> patterns) {
        this.patterns = patterns;
    }

    public static TimePatternTable defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<TimePattern> match(String typeName) {
        if (typeName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(patterns.get(typeName));
    }

    public List<TimePattern> getPatterns() {
        return List.copyOf(patterns.values());
    }

    public int size() {
        return patterns.size();
    }

    public static final class Builder {
        private final List<TimePattern> additions = new ArrayList<>();
        private boolean includeBuiltIns = true;

        private Builder() {
        }

        public Builder withoutBuiltIns() {
            this.includeBuiltIns = false;
            return this;
        }

        public Builder add(String exactTypeName, boolean orderable) {
            return add(new TimePattern(exactTypeName, orderable));
        }

        public Builder add(TimePattern pattern) {
            additions.add(pattern);
            return this;
        }

        public Builder addAll(List<TimePattern> patterns) {
            additions.addAll(patterns);
            return this;
        }

        public TimePatternTable build() {
            Map<String, TimePattern> table = new LinkedHashMap<>();
            if (includeBuiltIns) {
                BUILT_INS.forEach(p -> table.put(p.getExactTypeName(), p));
            }
            for (TimePattern pattern : additions) {
                TimePattern existing = table.putIfAbsent(pattern.getExactTypeName(), pattern);
                if (existing != null && existing.isOrderable() != pattern.isOrderable()) {
                    log.warn("Ignoring time type {} (orderable={}): already registered with orderable={}",
                            pattern.getExactTypeName(), pattern.isOrderable(), existing.isOrderable());
                }
            }
            return new TimePatternTable(Collections.unmodifiableMap(table));
        }
    }
}
