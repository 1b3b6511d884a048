package com.aisignal.news;

import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import com.aisignal.model.Category;
import com.aisignal.model.Competitor;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the model's free text into a {@link Classification}, rejecting anything that does not
 * match the eight-key answer shape exactly.
 */
public final class ClassificationParser {
    static final String OWNER = "classifier";
    static final int MAX_COMPETITORS = 3;
    static final List<String> REQUIRED_KEYS = List.of(
            "summary",
            "category",
            "tags",
            "relevance_score",
            "is_product_or_tool",
            "product_name",
            "competitors",
            "competitive_advantage"
    );
    private static final Pattern FENCE = Pattern.compile("```[a-zA-Z0-9_-]*");

    private ClassificationParser() {
    }

    public static Outcome<Classification> parse(String raw) {
        String json = extractJsonObject(raw);
        if (json.isEmpty()) {
            return invalid("no JSON object in response");
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            return invalid("unparseable JSON: " + e.getMessage());
        }
        for (String key : REQUIRED_KEYS) {
            if (!obj.has(key) || obj.isNull(key)) {
                return invalid("missing key " + key);
            }
        }

        Object summary = obj.get("summary");
        if (!(summary instanceof String) || ((String) summary).isBlank()) {
            return invalid("summary must be a non-blank string");
        }
        Object categoryRaw = obj.get("category");
        if (!(categoryRaw instanceof String)) {
            return invalid("category must be a string");
        }
        Category category = Category.fromLabel((String) categoryRaw).orElse(null);
        if (category == null) {
            return invalid("unknown category " + categoryRaw);
        }
        List<String> tags = stringArray(obj.get("tags"));
        if (tags == null) {
            return invalid("tags must be an array of strings");
        }
        Integer relevance = integerValue(obj.get("relevance_score"));
        if (relevance == null || relevance < 1 || relevance > 10) {
            return invalid("relevance_score out of range: " + obj.get("relevance_score"));
        }
        Object flag = obj.get("is_product_or_tool");
        if (!(flag instanceof Boolean)) {
            return invalid("is_product_or_tool must be a boolean");
        }
        Object productName = obj.get("product_name");
        if (!(productName instanceof String)) {
            return invalid("product_name must be a string");
        }
        List<Competitor> competitors = competitors(obj.get("competitors"));
        if (competitors == null) {
            return invalid("competitors must be an array of {name, description, comparison}");
        }
        Object advantage = obj.get("competitive_advantage");
        if (!(advantage instanceof String)) {
            return invalid("competitive_advantage must be a string");
        }

        boolean product = (Boolean) flag;
        return Outcome.success(new Classification(
                ((String) summary).trim(),
                category,
                tags,
                relevance,
                product,
                product ? ((String) productName).trim() : "",
                product ? competitors.subList(0, Math.min(MAX_COMPETITORS, competitors.size())) : List.of(),
                product ? ((String) advantage).trim() : ""
        ), OWNER);
    }

    /**
     * Drops code fences and any prose around the outermost {@code {...}}; empty when no object is
     * present.
     */
    static String extractJsonObject(String raw) {
        if (raw == null) {
            return "";
        }
        Matcher fence = FENCE.matcher(raw);
        String text = fence.replaceAll("").trim();
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return "";
        }
        return text.substring(start, end + 1);
    }

    private static List<String> stringArray(Object value) {
        if (!(value instanceof JSONArray)) {
            return null;
        }
        JSONArray array = (JSONArray) value;
        List<String> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object element = array.get(i);
            if (!(element instanceof String)) {
                return null;
            }
            String tag = ((String) element).trim();
            if (!tag.isEmpty()) {
                out.add(tag);
            }
        }
        return out;
    }

    private static List<Competitor> competitors(Object value) {
        if (!(value instanceof JSONArray)) {
            return null;
        }
        JSONArray array = (JSONArray) value;
        List<Competitor> out = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            Object element = array.get(i);
            if (!(element instanceof JSONObject)) {
                return null;
            }
            JSONObject competitor = (JSONObject) element;
            Object name = competitor.opt("name");
            Object description = competitor.opt("description");
            Object comparison = competitor.opt("comparison");
            if (!(name instanceof String) || !(description instanceof String) || !(comparison instanceof String)) {
                return null;
            }
            out.add(new Competitor((String) name, (String) description, (String) comparison));
        }
        return out;
    }

    private static Integer integerValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof BigInteger) {
            long v = ((Number) value).longValue();
            return v < Integer.MIN_VALUE || v > Integer.MAX_VALUE ? null : (int) v;
        }
        if (value instanceof BigDecimal || value instanceof Double || value instanceof Float) {
            BigDecimal decimal = new BigDecimal(value.toString());
            if (decimal.stripTrailingZeros().scale() > 0) {
                return null;
            }
            try {
                return decimal.intValueExact();
            } catch (ArithmeticException e) {
                return null;
            }
        }
        return null;
    }

    private static Outcome<Classification> invalid(String reason) {
        return Outcome.failure(CauseCode.CLASSIFY_SCHEMA_INVALID, OWNER, reason);
    }
}
