package ch.so.arp.courserag.index;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exact-match predicate over the metadata of content records. Filters are
 * values: two filters built from the same inputs are equal.
 */
public sealed interface MetadataFilter permits MetadataFilter.None, MetadataFilter.Equals, MetadataFilter.And {

    static MetadataFilter none() {
        return None.INSTANCE;
    }

    static MetadataFilter eq(String field, Object value) {
        return new Equals(field, value);
    }

    static MetadataFilter and(MetadataFilter... operands) {
        return new And(List.of(operands));
    }

    boolean matches(Map<String, Object> metadata);

    /**
     * Matches every record.
     */
    record None() implements MetadataFilter {

        private static final None INSTANCE = new None();

        @Override
        public boolean matches(Map<String, Object> metadata) {
            return true;
        }
    }

    record Equals(String field, Object value) implements MetadataFilter {

        public Equals {
            Objects.requireNonNull(field, "field");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(Map<String, Object> metadata) {
            Object actual = metadata.get(field);
            if (actual instanceof Number number && value instanceof Number expected) {
                return number.longValue() == expected.longValue();
            }
            return value.equals(actual);
        }
    }

    record And(List<MetadataFilter> operands) implements MetadataFilter {

        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean matches(Map<String, Object> metadata) {
            return operands.stream().allMatch(operand -> operand.matches(metadata));
        }
    }
}
