package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.model.Category;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.IntermediateItem;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArticleClassifierTest {

    @Test
    void classifyAll_shouldDefaultEveryItemWithoutCredential() {
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of("ai.provider", "anthropic", "ai.api_key", "")));
        List<IntermediateItem> items = items(5);

        ClassificationBatch batch = classifier.classifyAll(items, CancellationSignal.none());

        assertFalse(classifier.isModelAvailable());
        assertEquals("ai.api_key not set", classifier.unavailableReason());
        assertEquals(5, batch.getRecords().size());
        assertEquals(0, batch.getModelCalls());
        assertEquals(5, batch.getDegraded().get(CauseCode.CLASSIFY_NO_CREDENTIAL));
        for (ClassifiedRecord record : batch.getRecords()) {
            assertEquals(Category.INDUSTRY_NEWS, record.getCategory());
            assertEquals(5, record.getRelevanceScore());
            assertFalse(record.isProductOrTool());
            assertTrue(record.getCompetitors().isEmpty());
        }
    }

    @Test
    void classifyAll_shouldNeverExceedConcurrencyCap() {
        CountingModel model = new CountingModel(ClassificationParserTest.PRODUCT_JSON, 15);
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of("classify.concurrent", "5")), model, "");

        ClassificationBatch batch = classifier.classifyAll(items(50), CancellationSignal.none());

        assertEquals(50, batch.getRecords().size());
        assertEquals(50, batch.getModelCalls());
        assertTrue(model.maxInFlight.get() <= 5, "max in flight was " + model.maxInFlight.get());
        assertEquals(0, batch.degradedTotal());
    }

    @Test
    void classifyAll_shouldKeepInputOrderAndApplyModelAnswer() {
        CountingModel model = new CountingModel(ClassificationParserTest.PRODUCT_JSON, 0);
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of()), model, "");
        List<IntermediateItem> items = items(3);

        ClassificationBatch batch = classifier.classifyAll(items, CancellationSignal.none());

        for (int i = 0; i < 3; i++) {
            ClassifiedRecord record = batch.getRecords().get(i);
            assertEquals(items.get(i).getIdentity(), record.getIdentity());
            assertEquals(Category.PRODUCT_TOOL, record.getCategory());
            assertEquals(List.of("rag", "vector-db"), record.getTags());
            assertEquals(3, record.getCompetitors().size());
        }
    }

    @Test
    void classify_shouldDegradeTransportFailureToDefaultRecord() {
        ChatLanguageModel broken = new ChatLanguageModel() {
            @Override
            public Response<AiMessage> generate(List<ChatMessage> messages) {
                throw new RuntimeException("connect timed out");
            }
        };
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of()), broken, "");
        IntermediateItem item = items(1).get(0);

        ClassificationBatch batch = classifier.classifyAll(List.of(item), CancellationSignal.none());

        assertEquals(1, batch.getDegraded().get(CauseCode.CLASSIFY_TRANSPORT_FAILED));
        ClassifiedRecord record = batch.getRecords().get(0);
        assertEquals(ArticleClassifier.defaultRecord(item).getSummary(), record.getSummary());
        assertEquals(List.of("test"), record.getTags());
    }

    @Test
    void classify_shouldDegradeSchemaFailureToDefaultRecord() {
        CountingModel model = new CountingModel(ClassificationParserTest.PRODUCT_JSON.replace("\"relevance_score\": 8", "\"relevance_score\": 15"), 0);
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of()), model, "");

        ClassificationBatch batch = classifier.classifyAll(items(2), CancellationSignal.none());

        assertEquals(2, batch.getDegraded().get(CauseCode.CLASSIFY_SCHEMA_INVALID));
        assertEquals(5, batch.getRecords().get(0).getRelevanceScore());
        assertEquals(Category.INDUSTRY_NEWS, batch.getRecords().get(0).getCategory());
    }

    @Test
    void toRecord_shouldKeepItemTagsWhenModelReturnsNone() {
        CountingModel model = new CountingModel(ClassificationParserTest.PRODUCT_JSON.replace("[\"rag\", \"vector-db\"]", "[]"), 0);
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of()), model, "");

        ClassificationBatch batch = classifier.classifyAll(items(1), CancellationSignal.none());

        assertEquals(List.of("test"), batch.getRecords().get(0).getTags());
    }

    @Test
    void defaultSummary_shouldEchoBodyOrPointToSource() {
        IntermediateItem withBody = IntermediateItem.builder()
                .title("t").sourceName("arXiv").bodyText("b".repeat(400)).build();
        IntermediateItem bare = IntermediateItem.builder()
                .title("t").sourceName("Hacker News").bodyText("short").build();

        assertEquals(300, ArticleClassifier.defaultSummary(withBody).length());
        assertEquals("From Hacker News. Click the headline to read the full article.", ArticleClassifier.defaultSummary(bare));
    }

    @Test
    void buildPrompt_shouldTruncateBodyAndListCategories() {
        ArticleClassifier classifier = new ArticleClassifier(config(Map.of()), null, "");
        IntermediateItem item = IntermediateItem.builder()
                .title("Title").sourceName("Medium").bodyText("a".repeat(700) + "TAIL").build();

        String prompt = classifier.buildPrompt(item);

        assertFalse(prompt.contains("TAIL"));
        assertTrue(prompt.contains("Product/Tool | AI Model | Research Paper | Industry News | Tutorial/Guide | Platform/Infrastructure"));
    }

    private static List<IntermediateItem> items(int count) {
        List<IntermediateItem> out = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String locator = "https://example.com/story/" + i;
            out.add(IntermediateItem.builder()
                    .identity(IdentityAssigner.identity(locator))
                    .title("Story " + i)
                    .locator(locator)
                    .sourceName("Test")
                    .bodyText("Body of story " + i)
                    .tags(List.of("test"))
                    .build());
        }
        return out;
    }

    private static Config config(Map<String, ?> overrides) {
        return Config.fromConfigurationProperties(Path.of("."), overrides);
    }

    private static final class CountingModel implements ChatLanguageModel {
        private final String reply;
        private final long delayMillis;
        private final AtomicInteger calls = new AtomicInteger();
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();

        private CountingModel(String reply, long delayMillis) {
            this.reply = reply;
            this.delayMillis = delayMillis;
        }

        @Override
        public Response<AiMessage> generate(List<ChatMessage> messages) {
            calls.incrementAndGet();
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if (delayMillis > 0) {
                    Thread.sleep(delayMillis);
                }
                return Response.from(AiMessage.from(reply));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            } finally {
                inFlight.decrementAndGet();
            }
        }
    }
}
