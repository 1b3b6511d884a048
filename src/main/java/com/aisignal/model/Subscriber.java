package com.aisignal.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Locale;

/**
 * Digest recipient with delivery preferences.
 */
@Value
public class Subscriber {
    long id;
    String email;
    String name;
    boolean active;
    List<String> categories;
    int minRelevance;

    @Builder(toBuilder = true)
    public Subscriber(long id, String email, String name, boolean active, List<String> categories, int minRelevance) {
        this.id = id;
        this.email = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        this.name = name == null ? "" : name.trim();
        this.active = active;
        this.categories = categories == null ? List.of() : List.copyOf(categories);
        this.minRelevance = Math.max(0, Math.min(10, minRelevance));
    }

    /**
     * An empty category list accepts every category.
     */
    public boolean accepts(ClassifiedRecord record) {
        if (record == null || record.getRelevanceScore() < minRelevance) {
            return false;
        }
        if (categories.isEmpty()) {
            return true;
        }
        String label = record.getCategory().label();
        for (String wanted : categories) {
            if (wanted != null && wanted.trim().equalsIgnoreCase(label)) {
                return true;
            }
        }
        return false;
    }
}
