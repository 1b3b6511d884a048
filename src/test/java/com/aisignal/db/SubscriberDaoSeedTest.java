package com.aisignal.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubscriberDaoSeedTest {

    @Test
    void parseSeed_shouldReadNamedAndBareEntriesAndSkipMalformed() {
        List<SubscriberDao.SeedEntry> entries = SubscriberDao.parseSeed(" Alice:alice@example.com , bob@example.com,,Carol:nope ");

        assertEquals(2, entries.size());
        assertEquals("Alice", entries.get(0).name);
        assertEquals("alice@example.com", entries.get(0).email);
        assertEquals("bob", entries.get(1).name);
        assertEquals("bob@example.com", entries.get(1).email);
    }

    @Test
    void parseSeed_shouldReturnNothingForBlankList() {
        assertTrue(SubscriberDao.parseSeed("  ").isEmpty());
        assertTrue(SubscriberDao.parseSeed(null).isEmpty());
    }

    @Test
    void readCategories_shouldTolerateBrokenJson() {
        assertEquals(List.of("AI Model", "Research Paper"), SubscriberDao.readCategories("[\"AI Model\",\"Research Paper\"]"));
        assertTrue(SubscriberDao.readCategories("{oops").isEmpty());
    }
}
