package com.medicaledu.backend.global.web;

/**
 * Clamps client supplied paging parameters.
 */
public final class PageRequests {

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private PageRequests() {
    }

    public static int page(Integer page) {
        return page == null ? 0 : Math.max(0, page);
    }

    public static int size(Integer size) {
        return size(size, DEFAULT_PAGE_SIZE);
    }

    public static int size(Integer size, int defaultSize) {
        if (size == null) {
            return defaultSize;
        }
        return Math.max(1, Math.min(MAX_PAGE_SIZE, size));
    }
}
