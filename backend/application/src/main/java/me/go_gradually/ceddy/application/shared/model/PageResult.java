package me.go_gradually.ceddy.application.shared.model;

import java.util.List;
import java.util.function.Function;

public record PageResult<T>(List<T> items, long total) {
    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative");
        }
    }

    public static <T> PageResult<T> of(List<T> items, long total) {
        return new PageResult<>(items, total);
    }

    public <R> PageResult<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = items.stream().<R>map(mapper).toList();
        return new PageResult<>(mapped, total);
    }
}
