package com.covidintel.etl.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Ordered set of check definitions. Adding or removing a rule is a registry
 * operation; the validator itself never changes.
 */
public class CheckRegistry {

    private final List<CheckDefinition> definitions = new ArrayList<>();

    public CheckRegistry register(CheckDefinition definition) {
        boolean clash = definitions.stream().anyMatch(d -> d.name().equals(definition.name())
                && d.thresholds().keySet().stream().anyMatch(definition.thresholds()::containsKey));
        if (clash) {
            throw new IllegalArgumentException("Check " + definition.name() + " is already registered for one of its tables");
        }
        definitions.add(definition);
        return this;
    }

    /** Remove every definition with the given name. */
    public CheckRegistry remove(String name) {
        definitions.removeIf(d -> d.name().equals(name));
        return this;
    }

    public CheckRegistry removeAll(Collection<String> names) {
        names.forEach(this::remove);
        return this;
    }

    public List<CheckDefinition> definitions() {
        return List.copyOf(definitions);
    }
}
