package org.queryguard.service;

import org.queryguard.model.QueryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.Ref;
import java.sql.SQLException;
import java.sql.SQLXML;
import java.sql.Statement;
import java.sql.Struct;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Runs admitted queries against the shared pool and materializes the whole result set.
// Callers must only pass text that AdmissionFilter accepted; nothing is re-checked here.
public class QueryExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(QueryExecutor.class);

    private static final int MAX_NESTED_DEPTH = 3;
    private static final String UNSUPPORTED = "[unsupported]";

    private final DataSource dataSource;
    private final int statementTimeoutMs;
    private final int fetchSize;

    public QueryExecutor(DataSource dataSource, int statementTimeoutMs, int fetchSize) {
        this.dataSource = dataSource;
        this.statementTimeoutMs = statementTimeoutMs;
        this.fetchSize = fetchSize;
    }

    public QueryResult execute(String finalText) {
        long start = System.nanoTime();
        // Connection goes back to the pool on every path
        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement(ResultSet.TYPE_FORWARD_ONLY, ResultSet.CONCUR_READ_ONLY)) {
            if (statementTimeoutMs > 0) {
                st.setQueryTimeout(timeoutSeconds(statementTimeoutMs));
            }
            if (fetchSize > 0) {
                st.setFetchSize(fetchSize);
            }

            if (!st.execute(finalText)) {
                return QueryResult.rows(Collections.emptyList(), Collections.emptyList());
            }

            try (ResultSet rs = st.getResultSet()) {
                ResultSetMetaData md = rs.getMetaData();
                int cols = md.getColumnCount();

                List<String> columns = new ArrayList<>(cols);
                for (int i = 1; i <= cols; i++) {
                    columns.add(md.getColumnLabel(i));
                }

                List<List<Object>> rows = new ArrayList<>();
                while (rs.next()) {
                    List<Object> row = new ArrayList<>(cols);
                    for (int i = 1; i <= cols; i++) {
                        row.add(toScalar(rs.getObject(i)));
                    }
                    rows.add(row);
                }

                LOG.debug("Executed query rows={} tookMs={}", rows.size(), (System.nanoTime() - start) / 1_000_000);
                return QueryResult.rows(columns, rows);
            }
        } catch (Exception e) {
            String message = diagnostic(e);
            LOG.warn("Query execution failed: {}", message);
            return QueryResult.error(message);
        }
    }

    // JDBC timeouts are whole seconds; round up so a small timeout never becomes "none"
    static int timeoutSeconds(int ms) {
        return (int) Math.max(1, (ms + 999L) / 1000L);
    }

    // Converts driver-specific values into plain scalars the JSON layer can write.
    // Anything not recognised is written as its string form.
    static Object toScalar(Object v) throws SQLException {
        return toScalar(v, 0);
    }

    private static Object toScalar(Object v, int depth) throws SQLException {
        if (v == null) return null;
        if (depth > MAX_NESTED_DEPTH) return UNSUPPORTED;
        if (v instanceof Number || v instanceof Boolean || v instanceof String || v instanceof byte[]) {
            return v;
        }
        if (v instanceof java.sql.Date || v instanceof java.sql.Time || v instanceof java.sql.Timestamp
                || v instanceof TemporalAccessor) {
            return v.toString();
        }
        if (v instanceof Clob) {
            Clob clob = (Clob) v;
            return clob.getSubString(1, (int) clob.length());
        }
        if (v instanceof Blob) {
            Blob blob = (Blob) v;
            return blob.getBytes(1, (int) blob.length());
        }
        if (v instanceof SQLXML) {
            return ((SQLXML) v).getString();
        }
        if (v instanceof Struct) {
            Object[] attrs = ((Struct) v).getAttributes();
            return toList(attrs == null ? new Object[0] : attrs, depth);
        }
        if (v instanceof Array) {
            Object arr = ((Array) v).getArray();
            return (arr instanceof Object[]) ? toList((Object[]) arr, depth) : arr;
        }
        if (v instanceof ResultSet) {
            // nested result sets (ROW values on some drivers) become a list of rows
            try (ResultSet nested = (ResultSet) v) {
                int cols = nested.getMetaData().getColumnCount();
                List<Object> rows = new ArrayList<>();
                while (nested.next()) {
                    List<Object> row = new ArrayList<>(cols);
                    for (int i = 1; i <= cols; i++) {
                        row.add(toScalar(nested.getObject(i), depth + 1));
                    }
                    rows.add(row);
                }
                return rows;
            }
        }
        if (v instanceof Ref) {
            return ((Ref) v).getBaseTypeName();
        }
        if (v instanceof Object[]) {
            return toList((Object[]) v, depth);
        }
        if (v instanceof List) {
            return toList(((List<?>) v).toArray(), depth);
        }
        return String.valueOf(v);
    }

    private static List<Object> toList(Object[] items, int depth) throws SQLException {
        List<Object> out = new ArrayList<>(items.length);
        for (Object item : items) {
            out.add(toScalar(item, depth + 1));
        }
        return out;
    }

    static String diagnostic(Exception e) {
        String m = e.getMessage();
        if (m == null || m.trim().isEmpty()) return e.getClass().getSimpleName();
        return m.trim();
    }
}
