package com.aisignal.model;

import lombok.Value;

/**
 * A rival product named by the classifier, with how the classified product differs from it.
 */
@Value
public class Competitor {
    String name;
    String description;
    String comparison;

    public Competitor(String name, String description, String comparison) {
        this.name = name == null ? "" : name.trim();
        this.description = description == null ? "" : description.trim();
        this.comparison = comparison == null ? "" : comparison.trim();
    }
}
