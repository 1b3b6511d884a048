package com.aisignal.data.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared outbound GET transport: custom user agent, redirects followed, and one deadline covering
 * connect, headers and body.
 *
 * <p>Non-final so tests can serve canned responses without a network.</p>
 */
public class HttpClientEx {
    public static final String DEFAULT_USER_AGENT = "AISignal/1.0";
    /** Bodies past this size are cut off; feeds and article heads fit well inside it. */
    public static final int DEFAULT_MAX_BODY_BYTES = 4 * 1024 * 1024;

    private static final Pattern CHARSET = Pattern.compile("charset=\"?([\\w.:-]+)", Pattern.CASE_INSENSITIVE);
    private static final List<String> TEXTUAL = List.of("text/", "html", "xml", "json", "rss", "atom");

    private final HttpClient client;
    private final String userAgent;
    private final int maxBodyBytes;

    public HttpClientEx() {
        this(DEFAULT_USER_AGENT);
    }

    public HttpClientEx(String userAgent) {
        this(userAgent, DEFAULT_MAX_BODY_BYTES);
    }

    public HttpClientEx(String userAgent, int maxBodyBytes) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent.trim();
        this.maxBodyBytes = Math.max(1024, maxBodyBytes);
    }

    /**
     * Returns the body of a 2xx response and throws for anything else.
     *
     * @throws HttpTimeoutException when the whole exchange takes longer than {@code timeoutSeconds}
     */
    public String getText(String url, int timeoutSeconds) throws IOException, InterruptedException {
        PageResponse resp = fetch(url, timeoutSeconds, userAgent);
        if (resp.isSuccess()) {
            return resp.getBody();
        }
        throw new IOException("HTTP " + resp.getStatus() + " for " + url);
    }

    /**
     * Raw GET used by page enrichment, where status and content type decide what to keep.
     *
     * <p>The body is read only for 2xx responses with a textual content type, and at most
     * {@code maxBodyBytes} of it. Anything else comes back with an empty body and the real status.</p>
     *
     * @throws HttpTimeoutException when the whole exchange takes longer than {@code timeoutSeconds}
     */
    public PageResponse fetch(String url, int timeoutSeconds, String agent) throws IOException, InterruptedException {
        int seconds = Math.max(1, timeoutSeconds);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(seconds))
                .GET()
                .header("User-Agent", agent == null || agent.isBlank() ? userAgent : agent)
                .build();

        CompletableFuture<HttpResponse<String>> pending = client.sendAsync(req, this::bodyFor);
        HttpResponse<String> resp;
        try {
            resp = pending.get(seconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new HttpTimeoutException("no complete response within " + seconds + "s from " + url);
        } catch (InterruptedException e) {
            pending.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("GET " + url + " failed: " + cause, cause);
        }
        return new PageResponse(resp.statusCode(), contentTypeOf(resp.headers()), resp.body());
    }

    private HttpResponse.BodySubscriber<String> bodyFor(HttpResponse.ResponseInfo info) {
        boolean success = info.statusCode() >= 200 && info.statusCode() < 300;
        String contentType = contentTypeOf(info.headers());
        if (!success || !isTextual(contentType)) {
            return HttpResponse.BodySubscribers.replacing("");
        }
        return new CappedTextSubscriber(maxBodyBytes, charsetOf(contentType));
    }

    static boolean isTextual(String contentType) {
        if (contentType.isEmpty()) {
            return true;
        }
        for (String marker : TEXTUAL) {
            if (contentType.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    static Charset charsetOf(String contentType) {
        Matcher m = CHARSET.matcher(contentType);
        if (m.find()) {
            try {
                return Charset.forName(m.group(1));
            } catch (IllegalArgumentException e) {
                return StandardCharsets.UTF_8;
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static String contentTypeOf(HttpHeaders headers) {
        return headers.firstValue("content-type").orElse("").toLowerCase(Locale.ROOT);
    }

    /**
     * Collects up to {@code limit} bytes, then cancels the upstream subscription and completes with
     * what it has.
     */
    static final class CappedTextSubscriber implements HttpResponse.BodySubscriber<String> {
        private final int limit;
        private final Charset charset;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private final CompletableFuture<String> result = new CompletableFuture<>();
        private Flow.Subscription subscription;

        CappedTextSubscriber(int limit, Charset charset) {
            this.limit = limit;
            this.charset = charset;
        }

        @Override
        public CompletionStage<String> getBody() {
            return result;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) {
                return;
            }
            for (ByteBuffer item : items) {
                int room = limit - buffer.size();
                int take = Math.min(room, item.remaining());
                byte[] chunk = new byte[take];
                item.get(chunk);
                buffer.write(chunk, 0, take);
                if (buffer.size() >= limit) {
                    subscription.cancel();
                    complete();
                    return;
                }
            }
        }

        @Override
        public void onError(Throwable throwable) {
            result.completeExceptionally(throwable);
        }

        @Override
        public void onComplete() {
            complete();
        }

        private void complete() {
            result.complete(new String(buffer.toByteArray(), charset));
        }
    }
}
