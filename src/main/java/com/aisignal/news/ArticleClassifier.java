package com.aisignal.news;

import com.aisignal.config.Config;
import com.aisignal.core.CancellationSignal;
import com.aisignal.core.diagnostics.CauseCode;
import com.aisignal.core.diagnostics.Outcome;
import com.aisignal.model.Category;
import com.aisignal.model.ClassifiedRecord;
import com.aisignal.model.IntermediateItem;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Summarizes and categorizes items with one structured-extraction call each.
 *
 * <p>Without a usable chat model the whole batch gets default records and no call is made.
 * Otherwise calls run on a fixed pool behind a counting gate of {@code classify.concurrent}
 * permits, and any failure of a single call yields that item's default record.</p>
 */
public final class ArticleClassifier {
    private static final Logger log = LogManager.getLogger(ArticleClassifier.class);

    static final String SYSTEM_PROMPT = "You are an expert AI/ML analyst specializing in software development and platform engineering.\n"
            + "You analyze AI news articles and provide structured analysis. Always respond with valid JSON only, no markdown.";
    static final int DEFAULT_SUMMARY_ECHO_CHARS = 300;
    static final int DEFAULT_SUMMARY_MIN_BODY_CHARS = 30;

    private final ChatLanguageModel chatModel;
    private final String unavailableReason;
    private final int concurrency;
    private final int maxPromptBodyChars;
    private final Semaphore gate;
    private final AtomicInteger modelCalls = new AtomicInteger();

    public ArticleClassifier(Config config) {
        this(config, ChatModelFactory.create(config));
    }

    private ArticleClassifier(Config config, Outcome<ChatLanguageModel> model) {
        this(config, model.valueOr(null), model.success ? "" : model.error());
        if (!model.success) {
            log.warn("no chat model available ({}), summaries will use defaults", model.error());
        }
    }

    ArticleClassifier(Config config, ChatLanguageModel chatModel, String unavailableReason) {
        this.chatModel = chatModel;
        this.unavailableReason = unavailableReason == null ? "" : unavailableReason;
        this.concurrency = Math.max(1, config.getInt("classify.concurrent", 5));
        this.maxPromptBodyChars = Math.max(0, config.getInt("classify.prompt.max_body_chars", 600));
        this.gate = new Semaphore(concurrency);
    }

    public boolean isModelAvailable() {
        return chatModel != null;
    }

    public String unavailableReason() {
        return chatModel != null ? "" : unavailableReason;
    }

    public ClassificationBatch classifyAll(List<IntermediateItem> items, CancellationSignal signal) {
        CancellationSignal cancel = signal == null ? CancellationSignal.none() : signal;
        if (items == null || items.isEmpty()) {
            return new ClassificationBatch(List.of(), Map.of(), 0);
        }
        int callsBefore = modelCalls.get();
        Map<CauseCode, Integer> degraded = new EnumMap<>(CauseCode.class);
        List<ClassifiedRecord> records = new ArrayList<>(items.size());

        if (chatModel == null) {
            for (IntermediateItem item : items) {
                records.add(defaultRecord(item));
            }
            degraded.put(CauseCode.CLASSIFY_NO_CREDENTIAL, items.size());
            log.warn("classification skipped for {} items: {}", items.size(), unavailableReason());
            return new ClassificationBatch(records, degraded, 0);
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, items.size()));
        try {
            List<Future<Outcome<Classification>>> futures = new ArrayList<>(items.size());
            for (IntermediateItem item : items) {
                futures.add(pool.submit(() -> classify(item, cancel)));
            }
            for (int i = 0; i < items.size(); i++) {
                IntermediateItem item = items.get(i);
                Outcome<Classification> outcome = await(futures.get(i), item);
                if (!outcome.success) {
                    degraded.merge(outcome.causeCode, 1, Integer::sum);
                    log.warn("classify degraded item={} cause={} err={}", item.getIdentity(), outcome.causeCode, outcome.error());
                }
                records.add(toRecord(item, outcome));
            }
        } finally {
            pool.shutdownNow();
        }

        int calls = modelCalls.get() - callsBefore;
        log.info("classified items={} model_calls={} degraded={}", records.size(), calls, degraded);
        return new ClassificationBatch(records, degraded, calls);
    }

    /**
     * One gated model call, decoded and validated. Never throws.
     */
    Outcome<Classification> classify(IntermediateItem item, CancellationSignal cancel) {
        String owner = item.getIdentity();
        if (chatModel == null) {
            return Outcome.failure(CauseCode.CLASSIFY_NO_CREDENTIAL, owner, unavailableReason());
        }
        if (cancel.isCancelled()) {
            return Outcome.failure(CauseCode.CANCELLED, owner, "cancelled before call");
        }
        Outcome<String> reply = Outcome.attempt(owner, CauseCode.CLASSIFY_TRANSPORT_FAILED, () -> {
            gate.acquire();
            try {
                modelCalls.incrementAndGet();
                return callModel(item);
            } finally {
                gate.release();
            }
        });
        return reply.flatMap(ClassificationParser::parse);
    }

    private String callModel(IntermediateItem item) {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(SYSTEM_PROMPT),
                UserMessage.from(buildPrompt(item))
        );
        Response<AiMessage> response = chatModel.generate(messages);
        if (response == null || response.content() == null || response.content().text() == null) {
            throw new IllegalStateException("empty model response");
        }
        return response.content().text();
    }

    String buildPrompt(IntermediateItem item) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("Analyze this AI/tech article and return JSON:\n\n");
        sb.append("Title: ").append(item.getTitle()).append('\n');
        sb.append("Source: ").append(item.getSourceName()).append('\n');
        sb.append("Content: ").append(TextSupport.truncate(item.getBodyText(), maxPromptBodyChars)).append("\n\n");
        sb.append("Return this exact JSON structure:\n");
        sb.append("{\n");
        sb.append("  \"summary\": \"2-3 sentence summary focused on what matters for software engineers and platform engineers\",\n");
        sb.append("  \"category\": \"one of: ").append(String.join(" | ", Category.labels())).append("\",\n");
        sb.append("  \"tags\": [\"tag1\", \"tag2\", \"tag3\"],\n");
        sb.append("  \"relevance_score\": <1-10 score for software dev / platform engineering relevance>,\n");
        sb.append("  \"is_product_or_tool\": <true if this is about a product, tool, model, framework, or platform>,\n");
        sb.append("  \"product_name\": \"<name if is_product_or_tool, else empty string>\",\n");
        sb.append("  \"competitors\": [\n");
        sb.append("    {\n");
        sb.append("      \"name\": \"Competitor Name\",\n");
        sb.append("      \"description\": \"brief description\",\n");
        sb.append("      \"comparison\": \"how this new thing differs or improves on this competitor\"\n");
        sb.append("    }\n");
        sb.append("  ],\n");
        sb.append("  \"competitive_advantage\": \"<if is_product_or_tool: what makes it stand out vs competitors, else empty string>\"\n");
        sb.append("}\n\n");
        sb.append("For competitors: only include if is_product_or_tool is true. List 2-3 most relevant competitors max.");
        return sb.toString();
    }

    static ClassifiedRecord toRecord(IntermediateItem item, Outcome<Classification> outcome) {
        if (outcome == null || !outcome.success || outcome.value == null) {
            return defaultRecord(item);
        }
        Classification c = outcome.value;
        return ClassifiedRecord.from(item)
                .tags(c.getTags().isEmpty() ? item.getTags() : c.getTags())
                .summary(c.getSummary())
                .category(c.getCategory())
                .relevanceScore(c.getRelevanceScore())
                .productOrTool(c.isProductOrTool())
                .productName(c.getProductName())
                .competitors(c.getCompetitors())
                .competitiveAdvantage(c.getCompetitiveAdvantage())
                .build();
    }

    /**
     * Record with every AI-derived field at its deterministic default.
     */
    public static ClassifiedRecord defaultRecord(IntermediateItem item) {
        return ClassifiedRecord.from(item)
                .summary(defaultSummary(item))
                .category(Category.DEFAULT)
                .relevanceScore(ClassifiedRecord.DEFAULT_RELEVANCE)
                .productOrTool(false)
                .build();
    }

    static String defaultSummary(IntermediateItem item) {
        String body = item.getBodyText();
        if (body.length() > DEFAULT_SUMMARY_MIN_BODY_CHARS) {
            return TextSupport.truncate(body, DEFAULT_SUMMARY_ECHO_CHARS).trim();
        }
        return "From " + item.getSourceName() + ". Click the headline to read the full article.";
    }

    private Outcome<Classification> await(Future<Outcome<Classification>> future, IntermediateItem item) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(CauseCode.CANCELLED, item.getIdentity(), "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            return Outcome.failure(CauseCode.RUNTIME_ERROR, item.getIdentity(), cause.toString());
        }
    }
}
