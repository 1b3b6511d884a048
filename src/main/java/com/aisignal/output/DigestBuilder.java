package com.aisignal.output;

import com.aisignal.model.Category;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.Competitor;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a subscriber's records into the digest view model, the HTML body and a plain-text body.
 */
public final class DigestBuilder {
    private static final DateTimeFormatter HEADER_DATE = DateTimeFormatter.ofPattern("EEEE, MMMM dd, yyyy", Locale.US);
    private static final DateTimeFormatter SUBJECT_DATE = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.US);
    private static final int MAX_TAGS = 3;
    private static final int MAX_COMPETITORS = 3;

    private static final Map<Category, String> CATEGORY_ICONS = buildIcons();
    private static final Map<String, String> SOURCE_COLORS = buildSourceColors();
    private static final String DEFAULT_SOURCE_COLOR = "#2563eb";

    private final DigestRenderer renderer;
    private final String appUrl;

    public DigestBuilder(DigestRenderer renderer, String appUrl) {
        this.renderer = renderer;
        String url = appUrl == null ? "" : appUrl.trim();
        this.appUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    /**
     * For example {@code [AI Signal] AI News Digest – Mar 01, 2025 (5 stories)}; a blank prefix
     * is left out.
     */
    public static String subject(String prefix, LocalDate date, int storyCount) {
        String head = prefix == null || prefix.isBlank() ? "" : prefix.trim() + " ";
        return head + "AI News Digest – " + SUBJECT_DATE.format(date) + " (" + storyCount + " stories)";
    }

    /** HTML body rendered from {@link #buildView}. */
    public String buildHtml(String recipientName, List<ClassifiedRecord> records, LocalDate date) {
        return renderer.renderDigest(buildView(recipientName, records, date));
    }

    /** Plain-text alternative with the same stories, grouped the same way. */
    public String buildText(String recipientName, List<ClassifiedRecord> records, LocalDate date) {
        StringBuilder sb = new StringBuilder();
        sb.append("AI News Tracker - Daily Digest - ").append(HEADER_DATE.format(date)).append("\n");
        sb.append("Hi ").append(greetingName(recipientName)).append(", ")
                .append(records.size()).append(" top articles curated for you.\n");
        for (Map.Entry<Category, List<ClassifiedRecord>> group : groupByCategory(records).entrySet()) {
            sb.append("\n== ").append(group.getKey().label()).append(" (").append(group.getValue().size()).append(") ==\n");
            for (ClassifiedRecord record : group.getValue()) {
                sb.append("\n* ").append(record.getTitle()).append("\n");
                sb.append("  ").append(record.getSourceName())
                        .append(" | Relevance: ").append(record.getRelevanceScore()).append("/10\n");
                if (!record.getSummary().isBlank()) {
                    sb.append("  ").append(record.getSummary()).append("\n");
                }
                if (record.isProductOrTool() && !record.getCompetitiveAdvantage().isBlank()) {
                    sb.append("  Key Advantage: ").append(record.getCompetitiveAdvantage()).append("\n");
                }
                sb.append("  ").append(record.getLocator()).append("\n");
            }
        }
        sb.append("\nDashboard: ").append(appUrl).append("\n");
        sb.append("Unsubscribe: ").append(appUrl).append("/unsubscribe\n");
        return sb.toString();
    }

    Map<String, Object> buildView(String recipientName, List<ClassifiedRecord> records, LocalDate date) {
        Map<String, Object> view = new HashMap<>();
        view.put("pageTitle", "AI News Tracker Daily Digest");
        view.put("dateLabel", HEADER_DATE.format(date));
        view.put("recipientName", greetingName(recipientName));
        view.put("articleCount", records.size());
        view.put("dashboardUrl", appUrl);
        view.put("unsubscribeUrl", appUrl + "/unsubscribe");

        List<Map<String, Object>> sections = new ArrayList<>();
        for (Map.Entry<Category, List<ClassifiedRecord>> group : groupByCategory(records).entrySet()) {
            List<Map<String, Object>> cards = new ArrayList<>();
            for (ClassifiedRecord record : group.getValue()) {
                cards.add(card(record));
            }
            sections.add(kv(
                    "icon", CATEGORY_ICONS.getOrDefault(group.getKey(), "📌"),
                    "label", group.getKey().label(),
                    "count", cards.size(),
                    "cards", cards
            ));
        }
        view.put("sections", sections);
        return view;
    }

    private Map<String, Object> card(ClassifiedRecord record) {
        List<Map<String, Object>> competitors = new ArrayList<>();
        if (record.isProductOrTool()) {
            for (Competitor competitor : record.getCompetitors()) {
                if (competitors.size() >= MAX_COMPETITORS) {
                    break;
                }
                competitors.add(kv(
                        "name", competitor.getName(),
                        "description", competitor.getDescription(),
                        "comparison", competitor.getComparison()
                ));
            }
        }
        List<String> tags = record.getTags();
        return kv(
                "title", record.getTitle(),
                "url", record.getLocator().isBlank() ? "#" : record.getLocator(),
                "source", record.getSourceName(),
                "sourceColor", sourceColor(record.getSourceName()),
                "relevance", record.getRelevanceScore(),
                "relevanceColor", relevanceColor(record.getRelevanceScore()),
                "productOrTool", record.isProductOrTool(),
                "category", record.getCategory().label(),
                "summary", record.getSummary().isBlank() ? "No summary available." : record.getSummary(),
                "tags", tags.size() > MAX_TAGS ? tags.subList(0, MAX_TAGS) : tags,
                "competitors", competitors,
                "advantage", record.isProductOrTool() ? record.getCompetitiveAdvantage() : ""
        );
    }

    static Map<Category, List<ClassifiedRecord>> groupByCategory(List<ClassifiedRecord> records) {
        Map<Category, List<ClassifiedRecord>> out = new LinkedHashMap<>();
        for (ClassifiedRecord record : records) {
            out.computeIfAbsent(record.getCategory(), ignored -> new ArrayList<>()).add(record);
        }
        return out;
    }

    static String relevanceColor(int score) {
        if (score >= 7) {
            return "#22c55e";
        }
        if (score >= 5) {
            return "#f59e0b";
        }
        return "#9ca3af";
    }

    static String sourceColor(String sourceName) {
        String source = sourceName == null ? "" : sourceName;
        for (Map.Entry<String, String> entry : SOURCE_COLORS.entrySet()) {
            if (source.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return DEFAULT_SOURCE_COLOR;
    }

    private static String greetingName(String name) {
        return name == null || name.isBlank() ? "there" : name.trim();
    }

    private static Map<Category, String> buildIcons() {
        Map<Category, String> icons = new EnumMap<>(Category.class);
        icons.put(Category.PRODUCT_TOOL, "🔧");
        icons.put(Category.AI_MODEL, "🤖");
        icons.put(Category.RESEARCH_PAPER, "📄");
        icons.put(Category.INDUSTRY_NEWS, "📰");
        icons.put(Category.TUTORIAL_GUIDE, "📚");
        icons.put(Category.PLATFORM_INFRASTRUCTURE, "🏗️");
        return icons;
    }

    private static Map<String, String> buildSourceColors() {
        Map<String, String> colors = new LinkedHashMap<>();
        colors.put("Hacker News", "#ff6600");
        colors.put("arXiv", "#b31b1b");
        colors.put("Medium", "#000000");
        colors.put("NewsAPI", "#2563eb");
        return colors;
    }

    private Map<String, Object> kv(Object... values) {
        Map<String, Object> out = new HashMap<>();
        for (int i = 0; i + 1 < values.length; i += 2) out.put(String.valueOf(values[i]), values[i + 1]);
        return out;
    }
}
