package com.aisignal.news.source;

import com.aisignal.config.Config;
import com.aisignal.model.IntermediateItem;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArxivSourceTest {
    static final String ATOM = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
            + "<feed xmlns=\"http://www.w3.org/2005/Atom\">"
            + "<title>ArXiv Query</title>"
            + "<entry>"
            + "<id>http://arxiv.org/abs/2503.00001v1</id>"
            + "<published>2025-03-01T00:00:00Z</published>"
            + "<title>Agentic Planning\n   with Large Language Models</title>"
            + "<summary>  We study planning\n agents.  </summary>"
            + "<author><name>A. One</name></author>"
            + "<author><name>B. Two</name></author>"
            + "<author><name>C. Three</name></author>"
            + "<author><name>D. Four</name></author>"
            + "<link href=\"http://arxiv.org/abs/2503.00001v1\" rel=\"alternate\" type=\"text/html\"/>"
            + "</entry>"
            + "</feed>";

    @Test
    void parse_shouldNormalizeEntryAndCapAuthors() throws Exception {
        ArxivSource source = new ArxivSource(Config.fromConfigurationProperties(Path.of("."), Map.of()), null);

        List<IntermediateItem> items = source.parse(ATOM);

        assertEquals(1, items.size());
        IntermediateItem paper = items.get(0);
        assertEquals("Agentic Planning with Large Language Models", paper.getTitle());
        assertEquals("We study planning agents.", paper.getBodyText());
        assertEquals("A. One, B. Two, C. Three", paper.getAuthor());
        assertEquals("http://arxiv.org/abs/2503.00001v1", paper.getLocator());
        assertEquals("arXiv", paper.getSourceName());
        assertEquals(List.of("research", "arxiv"), paper.getTags());
        assertEquals(0L, paper.getRankScore());
    }
}
