package com.scholarintel.crawler.model;

public enum RelationType {
    REFERENCES("references"),
    CITED_BY("cited_by");

    private final String column;

    RelationType(String column) {
        this.column = column;
    }

    public String column() {
        return column;
    }

    public static RelationType fromColumn(String value) {
        for (RelationType type : values()) {
            if (type.column.equals(value)) return type;
        }
        throw new IllegalArgumentException("Unknown relation type: " + value);
    }
}
