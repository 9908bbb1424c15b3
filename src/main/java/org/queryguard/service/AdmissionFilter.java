package org.queryguard.service;

import org.queryguard.model.AdmissionVerdict;
import org.queryguard.model.RejectionReason;

import java.util.regex.Pattern;

// Decides whether a candidate query may run and bounds unbounded SELECTs; first matching rule wins.
// Keywords inside quotes are not exempt, so WHERE name = 'update' is rejected as a write.
public class AdmissionFilter {
    public static final int DEFAULT_ROW_LIMIT = 200;

    private static final Pattern WRITE_KEYWORD = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|DROP|TRUNCATE|ALTER|CREATE|REPLACE)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SELECT_PREFIX = Pattern.compile(
            "^\\s*select\\b",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern LIMIT_CLAUSE = Pattern.compile(
            "\\blimit\\s+\\d+\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern AGGREGATE = Pattern.compile(
            "\\bcount\\(|\\bgroup\\s+by\\b|\\bsum\\(|\\bavg\\(|\\bmax\\(|\\bmin\\(",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    private final int defaultRowLimit;

    public AdmissionFilter() {
        this(DEFAULT_ROW_LIMIT);
    }

    public AdmissionFilter(int defaultRowLimit) {
        if (defaultRowLimit <= 0) {
            throw new IllegalArgumentException("defaultRowLimit must be positive");
        }
        this.defaultRowLimit = defaultRowLimit;
    }

    public AdmissionVerdict admit(String sql) {
        String s = normalize(sql);

        if (WRITE_KEYWORD.matcher(s).find()) {
            return AdmissionVerdict.rejected(RejectionReason.WRITE_OPERATION_FORBIDDEN);
        }
        if (s.indexOf(';') >= 0) {
            return AdmissionVerdict.rejected(RejectionReason.MULTIPLE_STATEMENTS_FORBIDDEN);
        }
        if (!SELECT_PREFIX.matcher(s).find()) {
            return AdmissionVerdict.rejected(RejectionReason.ONLY_SELECT_ALLOWED);
        }
        if (!LIMIT_CLAUSE.matcher(s).find() && !AGGREGATE.matcher(s).find()) {
            s = s + " LIMIT " + defaultRowLimit;
        }
        return AdmissionVerdict.accepted(s);
    }

    public int defaultRowLimit() {
        return defaultRowLimit;
    }

    // Strip whitespace, drop a single trailing terminator, strip again
    static String normalize(String sql) {
        String s = (sql == null) ? "" : sql.strip();
        if (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).strip();
        }
        return s;
    }
}
