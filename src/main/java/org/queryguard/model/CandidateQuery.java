package org.queryguard.model;

import java.util.Objects;

// Raw query text submitted by the agent, before admission
public final class CandidateQuery {
    private final String sql;

    private CandidateQuery(String sql) {
        this.sql = sql;
    }

    public static CandidateQuery of(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            throw new IllegalArgumentException("sql required");
        }
        return new CandidateQuery(sql);
    }

    public String sql() {
        return sql;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CandidateQuery)) return false;
        return sql.equals(((CandidateQuery) o).sql);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql);
    }

    @Override
    public String toString() {
        return "CandidateQuery{" + sql + "}";
    }
}
