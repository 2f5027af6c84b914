package com.sc360.reportrefresh.model;

/**
 * Selects which work-list rows belong to a pipeline by matching file_datasource
 * against a substring pattern.
 */
public record DataSourceFilter(String pattern, Mode mode) {

    public enum Mode {
        /** file_datasource LIKE %pattern% */
        INCLUDE,
        /** file_datasource NOT LIKE %pattern% */
        EXCLUDE
    }

    public String likePattern() {
        return "%" + pattern + "%";
    }
}
