package org.queryguard.dto;

public enum QueryStatus {
    SUCCEEDED,
    REJECTED,
    FAILED
}
