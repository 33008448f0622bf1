package com.star.pglogstats.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum QueryType {
    SELECT("SELECT"),
    INSERT("INSERT"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    DDL("DDL"),
    OTHER("OTHER");

    private final String label;

    QueryType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
