package org.queryguard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.queryguard.model.RejectionReason;

// Dry-run verdict, nothing executed
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionResponse {
    public boolean accepted;
    public String sql;
    public RejectionReason reason;
    public String error;
}
