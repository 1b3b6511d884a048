package com.aisignal.news;

import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import com.aisignal.model.Category;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ClassificationParserTest {

    static final String PRODUCT_JSON = "{"
            + "\"summary\": \"A faster vector database for RAG pipelines.\","
            + "\"category\": \"Product/Tool\","
            + "\"tags\": [\"rag\", \"vector-db\"],"
            + "\"relevance_score\": 8,"
            + "\"is_product_or_tool\": true,"
            + "\"product_name\": \"VecStore\","
            + "\"competitors\": ["
            + "  {\"name\": \"Pinecone\", \"description\": \"managed vector db\", \"comparison\": \"self-hosted\"},"
            + "  {\"name\": \"Weaviate\", \"description\": \"open source\", \"comparison\": \"lower latency\"},"
            + "  {\"name\": \"Qdrant\", \"description\": \"rust engine\", \"comparison\": \"simpler ops\"},"
            + "  {\"name\": \"Milvus\", \"description\": \"distributed\", \"comparison\": \"smaller footprint\"}"
            + "],"
            + "\"competitive_advantage\": \"Single binary with built-in hybrid search.\""
            + "}";

    @Test
    void parse_shouldAcceptFencedJson() {
        Outcome<Classification> outcome = ClassificationParser.parse("```json\n" + PRODUCT_JSON + "\n```");

        assertTrue(outcome.success);
        Classification c = outcome.value;
        assertEquals(Category.PRODUCT_TOOL, c.getCategory());
        assertEquals(8, c.getRelevanceScore());
        assertEquals(List.of("rag", "vector-db"), c.getTags());
        assertEquals("VecStore", c.getProductName());
    }

    @Test
    void parse_shouldCapCompetitorsAtThree() {
        Outcome<Classification> outcome = ClassificationParser.parse(PRODUCT_JSON);

        assertTrue(outcome.success);
        assertEquals(3, outcome.value.getCompetitors().size());
        assertEquals("Pinecone", outcome.value.getCompetitors().get(0).getName());
    }

    @Test
    void parse_shouldRejectRelevanceOutOfRange() {
        Outcome<Classification> outcome = ClassificationParser.parse(PRODUCT_JSON.replace("\"relevance_score\": 8", "\"relevance_score\": 15"));

        assertFalse(outcome.success);
        assertEquals(CauseCode.CLASSIFY_SCHEMA_INVALID, outcome.causeCode);
    }

    @Test
    void parse_shouldRejectRelevanceGivenAsString() {
        Outcome<Classification> outcome = ClassificationParser.parse(PRODUCT_JSON.replace("\"relevance_score\": 8", "\"relevance_score\": \"8\""));

        assertFalse(outcome.success);
    }

    @Test
    void parse_shouldRejectMissingKey() {
        Outcome<Classification> outcome = ClassificationParser.parse(
                "{\"summary\": \"s\", \"category\": \"AI Model\", \"tags\": [], \"relevance_score\": 6}"
        );

        assertFalse(outcome.success);
        assertEquals(CauseCode.CLASSIFY_SCHEMA_INVALID, outcome.causeCode);
        assertTrue(outcome.error().contains("is_product_or_tool"));
    }

    @Test
    void parse_shouldRejectUnknownCategoryAndNonJson() {
        assertFalse(ClassificationParser.parse(PRODUCT_JSON.replace("Product/Tool", "Gossip")).success);
        assertFalse(ClassificationParser.parse("I am not sure what this article is about.").success);
        assertFalse(ClassificationParser.parse(null).success);
    }

    @Test
    void parse_shouldClearProductFieldsWhenNotAProduct() {
        String json = PRODUCT_JSON
                .replace("\"is_product_or_tool\": true", "\"is_product_or_tool\": false")
                .replace("\"category\": \"Product/Tool\"", "\"category\": \"Research Paper\"");

        Outcome<Classification> outcome = ClassificationParser.parse(json);

        assertTrue(outcome.success);
        assertFalse(outcome.value.isProductOrTool());
        assertEquals("", outcome.value.getProductName());
        assertTrue(outcome.value.getCompetitors().isEmpty());
        assertEquals("", outcome.value.getCompetitiveAdvantage());
    }

    @Test
    void extractJsonObject_shouldDropSurroundingProse() {
        assertEquals("{\"a\": 1}", ClassificationParser.extractJsonObject("Here you go:\n```\n{\"a\": 1}\n```\nThanks"));
        assertEquals("", ClassificationParser.extractJsonObject("no braces here"));
    }
}
