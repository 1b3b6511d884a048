package com.aisignal.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of classification labels accepted from the text-generation service.
 */
public enum Category {
    PRODUCT_TOOL("Product/Tool"),
    AI_MODEL("AI Model"),
    RESEARCH_PAPER("Research Paper"),
    INDUSTRY_NEWS("Industry News"),
    TUTORIAL_GUIDE("Tutorial/Guide"),
    PLATFORM_INFRASTRUCTURE("Platform/Infrastructure");

    public static final Category DEFAULT = INDUSTRY_NEWS;

    private final String label;

    Category(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Exact label match, ignoring case and surrounding whitespace.
     */
    public static Optional<Category> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String wanted = raw.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.label.toLowerCase(Locale.ROOT).equals(wanted)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    public static List<String> labels() {
        List<String> out = new ArrayList<>();
        for (Category category : values()) {
            out.add(category.label);
        }
        return out;
    }
}
