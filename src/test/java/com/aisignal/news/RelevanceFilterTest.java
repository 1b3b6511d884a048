package com.aisignal.news;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelevanceFilterTest {

    @Test
    void matches_shouldSearchTitleAndBodyIgnoringCase() {
        RelevanceFilter filter = new RelevanceFilter(List.of("LLM", "platform engineering"));

        assertTrue(filter.matches("New llm benchmark", ""));
        assertTrue(filter.matches("Team topologies", "Notes on Platform Engineering at scale"));
        assertFalse(filter.matches("Cooking with cast iron", "Seasoning tips"));
    }

    @Test
    void matches_shouldAcceptEverythingWithEmptyVocabulary() {
        RelevanceFilter filter = new RelevanceFilter(Arrays.asList(" ", null));

        assertTrue(filter.keywords().isEmpty());
        assertTrue(filter.matches("anything", null));
        assertEquals(0, new RelevanceFilter(null).keywords().size());
    }
}
