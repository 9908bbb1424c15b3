package org.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

// Request body carrying the candidate query
public class SubmitQueryRequest {
    @JsonProperty
    private String sql;

    public SubmitQueryRequest() {}

    public SubmitQueryRequest(String sql) {
        this.sql = sql;
    }

    public String getSql() {
        return sql;
    }
}
