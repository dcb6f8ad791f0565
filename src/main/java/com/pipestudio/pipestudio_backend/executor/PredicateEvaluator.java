package com.pipestudio.pipestudio_backend.executor;

import com.pipestudio.pipestudio_backend.model.config.PredicateClause;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Evaluates one {field, operator, value} clause against a record.
 *
 * A field the record does not have is "undefined": every operator is false for it except ne.
 * Relational operators compare numerically when both sides are numbers (or numeric strings),
 * lexicographically when both are strings, and are false otherwise.
 * Dotted fields ("user.age") walk nested maps when no key with the literal name exists.
 */
@Component
public class PredicateEvaluator {

    private static final Object UNDEFINED = new Object();

    public boolean test(Object record, PredicateClause clause) {
        if (clause == null || clause.getField() == null || clause.getField().isBlank()) {
            throw new NodeExecutionException("Predicate clause has no field");
        }
        String operator = clause.getOperator() != null ? clause.getOperator().trim().toLowerCase() : "eq";
        Object actual = fieldValue(record, clause.getField());
        Object expected = clause.getValue();

        if (actual == UNDEFINED) {
            return switch (operator) {
                case "ne" -> true;
                case "eq", "gt", "lt", "gte", "lte", "contains" -> false;
                default -> throw unknownOperator(operator);
            };
        }

        return switch (operator) {
            case "eq"       -> valuesEqual(actual, expected);
            case "ne"       -> !valuesEqual(actual, expected);
            case "gt"       -> compare(actual, expected, c -> c > 0);
            case "lt"       -> compare(actual, expected, c -> c < 0);
            case "gte"      -> compare(actual, expected, c -> c >= 0);
            case "lte"      -> compare(actual, expected, c -> c <= 0);
            case "contains" -> contains(actual, expected);
            default         -> throw unknownOperator(operator);
        };
    }

    @SuppressWarnings("unchecked")
    private Object fieldValue(Object record, String field) {
        if (!(record instanceof Map<?, ?> map)) return UNDEFINED;
        if (map.containsKey(field)) return map.get(field);

        Object current = record;
        for (String part : field.split("\\.")) {
            if (!(current instanceof Map<?, ?> level) || !level.containsKey(part)) {
                return UNDEFINED;
            }
            current = ((Map<String, Object>) level).get(part);
        }
        return current;
    }

    private boolean valuesEqual(Object actual, Object expected) {
        if (actual == null || expected == null) return actual == expected;
        if (actual instanceof Number a && expected instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue()) == 0;
        }
        return actual.equals(expected);
    }

    private boolean compare(Object actual, Object expected, IntPredicate accept) {
        Double a = toDouble(actual);
        Double b = toDouble(expected);
        if (a != null && b != null) {
            return accept.test(Double.compare(a, b));
        }
        if (actual instanceof String s && expected instanceof String t) {
            return accept.test(s.compareTo(t));
        }
        return false;
    }

    private boolean contains(Object actual, Object expected) {
        if (actual == null) return false;
        if (actual instanceof Collection<?> collection) {
            return collection.stream().anyMatch(item -> valuesEqual(item, expected));
        }
        return String.valueOf(actual).contains(String.valueOf(expected));
    }

    private Double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private NodeExecutionException unknownOperator(String operator) {
        return new NodeExecutionException("Unknown predicate operator: " + operator);
    }
}
