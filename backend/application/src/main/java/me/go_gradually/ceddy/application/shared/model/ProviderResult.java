package me.go_gradually.ceddy.application.shared.model;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a call to an external provider. Failures are values here, never exceptions,
 * so the caller decides how to degrade.
 */
public final class ProviderResult<T> {
    private final T value;
    private final ProviderFailure failure;
    private final String message;

    private ProviderResult(T value, ProviderFailure failure, String message) {
        this.value = value;
        this.failure = failure;
        this.message = message;
    }

    public static <T> ProviderResult<T> success(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Successful provider result requires a value");
        }
        return new ProviderResult<>(value, null, null);
    }

    public static <T> ProviderResult<T> failure(ProviderFailure failure, String message) {
        if (failure == null) {
            throw new IllegalArgumentException("failure kind is required");
        }
        return new ProviderResult<>(null, failure, message == null ? "" : message);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<T> value() {
        return Optional.ofNullable(value);
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public T orElseGet(Supplier<? extends T> fallback) {
        return isSuccess() ? value : fallback.get();
    }

    public ProviderFailure failure() {
        return failure;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProviderResult[success]" : "ProviderResult[" + failure + ": " + message + "]";
    }
}
