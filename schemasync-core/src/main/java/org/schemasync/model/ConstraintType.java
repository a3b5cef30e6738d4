package org.schemasync.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

public enum ConstraintType {
    @JsonProperty("FOREIGN_KEY")
    FOREIGN_KEY("FOREIGN KEY"),
    @JsonProperty("UNIQUE")
    UNIQUE("UNIQUE"),
    @JsonProperty("CHECK")
    CHECK("CHECK");

    private final String keyword;

    ConstraintType(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    /**
     * Lower-case label used in plan descriptions, e.g. "foreign key".
     */
    public String label() {
        return keyword.toLowerCase(Locale.ROOT);
    }
}
