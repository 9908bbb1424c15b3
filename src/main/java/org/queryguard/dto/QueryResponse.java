package org.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.queryguard.model.RejectionReason;

import java.util.List;

// Returned to the agent for every submitted query; which fields are set depends on status
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QueryResponse {
    public QueryStatus status;
    public String sql;
    public RejectionReason reason;
    public String error;
    public List<String> columns;
    public List<List<Object>> rows;
}
