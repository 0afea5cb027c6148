package com.eventstorming.core.query;

import com.eventstorming.core.model.WorkshopValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class PageTest {

    private static final List<Integer> ITEMS = IntStream.rangeClosed(1, 7).boxed().toList();

    @Test
    @DisplayName("pages 1..totalPages concatenate to the full listing")
    void pagesConcatenate() {
        List<Integer> all = new ArrayList<>();
        Page<Integer> first = Page.of(ITEMS, new PageRequest(1, 3));
        for (int p = 1; p <= first.pagination().totalPages(); p++) {
            all.addAll(Page.of(ITEMS, new PageRequest(p, 3)).items());
        }
        assertEquals(3, first.pagination().totalPages());
        assertEquals(ITEMS, all);
    }

    @Test
    @DisplayName("middle page has both neighbours")
    void middlePage() {
        var info = Page.of(ITEMS, new PageRequest(2, 3)).pagination();
        assertEquals(2, info.page());
        assertEquals(7, info.totalItems());
        assertTrue(info.hasNext());
        assertTrue(info.hasPrev());
    }

    @Test
    @DisplayName("a page past the end is clamped to the last page")
    void clampsPastEnd() {
        Page<Integer> page = Page.of(ITEMS, new PageRequest(99, 3));
        assertEquals(3, page.pagination().page());
        assertEquals(List.of(7), page.items());
        assertFalse(page.pagination().hasNext());
    }

    @Test
    @DisplayName("empty listing yields an empty first page")
    void emptyListing() {
        Page<Integer> page = Page.of(List.of(), new PageRequest(4, 10));
        assertEquals(1, page.pagination().page());
        assertEquals(0, page.pagination().totalPages());
        assertTrue(page.items().isEmpty());
        assertFalse(page.pagination().hasNext());
        assertFalse(page.pagination().hasPrev());
    }

    @Test
    @DisplayName("page request bounds are validated")
    void requestBounds() {
        assertThrows(WorkshopValidationException.class, () -> new PageRequest(0, 10));
        assertThrows(WorkshopValidationException.class, () -> new PageRequest(1, 0));
        assertThrows(WorkshopValidationException.class, () -> new PageRequest(1, 201));
        assertEquals(50, PageRequest.firstPage().pageSize());
    }
}
