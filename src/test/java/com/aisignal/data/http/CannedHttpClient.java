package com.aisignal.data.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves canned responses by URL; unknown URLs fail like an unreachable host.
 */
public class CannedHttpClient extends HttpClientEx {
    private final Map<String, PageResponse> responses = new HashMap<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMillis;

    public CannedHttpClient html(String url, String body) {
        responses.put(url, new PageResponse(200, "text/html; charset=utf-8", body));
        return this;
    }

    public CannedHttpClient respond(String url, int status, String contentType, String body) {
        responses.put(url, new PageResponse(status, contentType, body));
        return this;
    }

    public CannedHttpClient json(String url, String body) {
        return respond(url, 200, "application/json", body);
    }

    public CannedHttpClient delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    public List<String> requested() {
        return requested;
    }

    public int maxInFlight() {
        return maxInFlight.get();
    }

    @Override
    public PageResponse fetch(String url, int timeoutSeconds, String agent) throws IOException, InterruptedException {
        requested.add(url);
        int now = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(now, Math::max);
        try {
            if (delayMillis > 0) {
                Thread.sleep(delayMillis);
            }
            PageResponse response = responses.get(url);
            if (response == null) {
                throw new IOException("connection refused: " + url);
            }
            return response;
        } finally {
            inFlight.decrementAndGet();
        }
    }
}
