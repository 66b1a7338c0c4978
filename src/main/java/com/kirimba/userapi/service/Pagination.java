package com.kirimba.userapi.service;

/**
 * Нормализованные параметры страницы.
 * Ноль или отсутствие значения означает значение по умолчанию; границы проверяются раньше, на валидации.
 *
 * @param page     номер страницы, начиная с 1
 * @param pageSize размер страницы
 */
public record Pagination(int page, int pageSize) {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public static Pagination normalize(Integer page, Integer pageSize) {
        int normalizedPage = page == null || page == 0 ? DEFAULT_PAGE : page;
        int normalizedPageSize = pageSize == null || pageSize == 0 ? DEFAULT_PAGE_SIZE : pageSize;
        return new Pagination(normalizedPage, normalizedPageSize);
    }

    public long offset() {
        return (long) (page - 1) * pageSize;
    }

    public int limit() {
        return pageSize;
    }

    public int totalPages(long totalRows) {
        return totalPages(totalRows, pageSize);
    }

    public static int totalPages(long totalRows, int pageSize) {
        return (int) Math.ceil((double) totalRows / pageSize);
    }
}
