package com.example.campaign.shared.repository.criteria;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A composable SQL predicate over the {@code contacts} table, aliased as {@code c}.
 * Each specification carries its WHERE fragments and the named parameters they bind.
 * Parameter names must be unique across the specifications combined with {@link #and}.
 */
public final class ContactSpecification {

    private static final ContactSpecification ALL = new ContactSpecification(List.of(), Map.of());

    private final List<String> clauses;
    private final Map<String, Object> parameters;

    private ContactSpecification(List<String> clauses, Map<String, Object> parameters) {
        this.clauses = clauses;
        this.parameters = parameters;
    }

    public static ContactSpecification all() {
        return ALL;
    }

    public static ContactSpecification where(String clause, Map<String, Object> parameters) {
        return new ContactSpecification(List.of(clause), Map.copyOf(parameters));
    }

    public ContactSpecification and(ContactSpecification other) {
        List<String> combinedClauses = new ArrayList<>(clauses);
        combinedClauses.addAll(other.clauses);
        Map<String, Object> combinedParameters = new LinkedHashMap<>(parameters);
        other.parameters.forEach((name, value) -> {
            if (combinedParameters.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate contact specification parameter: " + name);
            }
            combinedParameters.put(name, value);
        });
        return new ContactSpecification(Collections.unmodifiableList(combinedClauses), Collections.unmodifiableMap(combinedParameters));
    }

    /**
     * The WHERE body, or {@code 1 = 1} when nothing is constrained.
     */
    public String toSql() {
        return clauses.isEmpty() ? "1 = 1" : String.join(" AND ", clauses);
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return toSql() + " " + parameters;
    }
}
