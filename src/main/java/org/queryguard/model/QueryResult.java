package org.queryguard.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

// Outcome of executing an admitted query: the full result set or the driver's diagnostic, never partial
public abstract class QueryResult {

    private QueryResult() {
    }

    public static QueryResult rows(List<String> columns, List<List<Object>> rows) {
        return new Rows(columns, rows);
    }

    public static QueryResult error(String message) {
        return new ExecutionError(message);
    }

    public abstract boolean isSuccess();

    public static final class Rows extends QueryResult {
        private final List<String> columns;
        private final List<List<Object>> rows;

        private Rows(List<String> columns, List<List<Object>> rows) {
            this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
            List<List<Object>> copy = new ArrayList<>(rows.size());
            for (List<Object> row : rows) {
                if (row.size() != this.columns.size()) {
                    throw new IllegalArgumentException(
                            "row has " + row.size() + " values, expected " + this.columns.size());
                }
                // values may be null, so no List.copyOf
                copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
            }
            this.rows = Collections.unmodifiableList(copy);
        }

        public List<String> columns() {
            return columns;
        }

        public List<List<Object>> rows() {
            return rows;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toString() {
            return "Rows{columns=" + columns + ", rows=" + rows.size() + "}";
        }
    }

    public static final class ExecutionError extends QueryResult {
        private final String message;

        private ExecutionError(String message) {
            this.message = Objects.requireNonNull(message, "message");
        }

        public String message() {
            return message;
        }

        // What the agent sees
        public String render() {
            return "ERROR: " + message;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return "ExecutionError{" + message + "}";
        }
    }
}
