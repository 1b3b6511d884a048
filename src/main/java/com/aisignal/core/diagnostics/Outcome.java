package com.aisignal.core.diagnostics;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * Success value or failure reason of one outbound step.
 *
 * <p>{@link #attempt(String, CauseCode, Callable)} is the single place where exceptions thrown by
 * a network call turn into a failure; callers pick their own default through {@link #valueOr(Object)}.</p>
 */
public final class Outcome<T> {
    public final boolean success;
    public final T value;
    public final CauseCode causeCode;
    public final String owner;
    public final Map<String, Object> details;

    private Outcome(boolean success, T value, CauseCode causeCode, String owner, Map<String, Object> details) {
        this.success = success;
        this.value = value;
        this.causeCode = causeCode == null ? CauseCode.NONE : causeCode;
        this.owner = owner == null ? "" : owner;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static <T> Outcome<T> success(T value, String owner) {
        return new Outcome<>(true, value, CauseCode.NONE, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner) {
        return new Outcome<>(false, null, causeCode, owner, Map.of());
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, Map<String, Object> details) {
        return new Outcome<>(false, null, causeCode, owner, copy(details));
    }

    public static <T> Outcome<T> failure(CauseCode causeCode, String owner, String error) {
        return new Outcome<>(false, null, causeCode, owner, Map.of("error", error == null ? "" : error));
    }

    /**
     * Runs {@code call}; a thrown exception becomes a failure tagged with {@code causeOnError}.
     */
    public static <T> Outcome<T> attempt(String owner, CauseCode causeOnError, Callable<T> call) {
        try {
            return success(call.call(), owner);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(CauseCode.CANCELLED, owner, "interrupted");
        } catch (Exception e) {
            return failure(causeOnError, owner, describe(e));
        }
    }

    /**
     * Chains a step that itself may fail; failures pass through untouched.
     */
    public <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> next) {
        if (!success) {
            return new Outcome<>(false, null, causeCode, owner, details);
        }
        Outcome<R> out = next.apply(value);
        return out == null ? failure(CauseCode.RUNTIME_ERROR, owner, "null outcome") : out;
    }

    public T valueOr(T fallback) {
        return success && value != null ? value : fallback;
    }

    public String error() {
        Object error = details.get("error");
        return error == null ? "" : error.toString();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return e.getClass().getSimpleName() + ": " + message;
    }

    private static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) {
            return Map.of();
        }
        return new LinkedHashMap<>(in);
    }
}
