package org.schemasync.migration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of DDL statement. {@link #executionOrder()} is a total order over kinds; a plan never runs a
 * higher-ordered kind before a lower-ordered one.
 */
public enum StatementType {
    DROP_CONSTRAINT(1, true),
    DROP_INDEX(2, true),
    DROP_COLUMN(3, true),
    DROP_TABLE(4, true),
    CREATE_TABLE(5, false),
    ADD_COLUMN(6, false),
    MODIFY_COLUMN(7, false),
    CREATE_INDEX(8, false),
    ADD_CONSTRAINT(9, false);

    private final int executionOrder;
    private final boolean destructive;

    StatementType(int executionOrder, boolean destructive) {
        this.executionOrder = executionOrder;
        this.destructive = destructive;
    }

    public int executionOrder() {
        return executionOrder;
    }

    public boolean isDestructive() {
        return destructive;
    }

    @JsonValue
    public String tag() {
        return name();
    }

    /**
     * @throws IllegalArgumentException for an empty or unrecognized tag
     */
    @JsonCreator
    public static StatementType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("migration statement type cannot be empty");
        }
        for (StatementType type : values()) {
            if (type.name().equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException("invalid migration statement type: " + tag);
    }
}
