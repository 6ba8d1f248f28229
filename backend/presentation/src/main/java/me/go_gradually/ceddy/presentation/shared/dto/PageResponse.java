package me.go_gradually.ceddy.presentation.shared.dto;

import me.go_gradually.ceddy.application.shared.model.PageResult;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

public class PageResponse<T> {
    private long total;
    private List<T> items;

    public static <S, T> PageResponse<T> from(PageResult<S> page, Function<S, T> mapper) {
        PageResponse<T> response = new PageResponse<>();
        response.setTotal(page.total());
        response.setItems(page.items().stream().map(mapper).collect(Collectors.toList()));
        return response;
    }

    public long getTotal() {
        return total;
    }

    public void setTotal(long total) {
        this.total = total;
    }

    public List<T> getItems() {
        return items;
    }

    public void setItems(List<T> items) {
        this.items = items;
    }
}
