package org.queryguard.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

// Read-only introspection of the allowlisted tables, used to prime the agent; never consulted by admission
public class SchemaRepo {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaRepo.class);
    private static final String[] TABLE_TYPES = {"TABLE", "VIEW"};

    private final DataSource dataSource;
    private final List<String> includeTables;
    private final int sampleRows;

    public SchemaRepo(DataSource dataSource, List<String> includeTables, int sampleRows) {
        this.dataSource = dataSource;
        this.includeTables = (includeTables == null)
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(includeTables));
        this.sampleRows = sampleRows;
    }

    public Connection conn() throws SQLException {
        return dataSource.getConnection();
    }

    // Fails when the pool cannot hand out a working connection
    public String verifyConnection() throws SQLException {
        try (Connection c = conn()) {
            if (!c.isValid(5)) {
                throw new SQLException("connection is not valid");
            }
            DatabaseMetaData md = c.getMetaData();
            return md.getDatabaseProductName() + " " + md.getDatabaseProductVersion();
        }
    }

    // One block per allowlisted table found in the database, separated by blank lines
    public String describe() throws SQLException {
        List<String> blocks = new ArrayList<>();
        try (Connection c = conn()) {
            DatabaseMetaData md = c.getMetaData();
            for (String name : includeTables) {
                TableRef ref = find(c, md, name);
                if (ref == null) {
                    LOG.warn("Table not found, skipped from schema description: {}", name);
                    continue;
                }
                StringBuilder sb = new StringBuilder();
                sb.append(createTable(md, ref));
                if (sampleRows > 0) {
                    sb.append("\n\n").append(sample(c, md, ref));
                }
                blocks.add(sb.toString());
            }
        }
        return String.join("\n\n", blocks);
    }

    // Current schema first, then any schema. Names are matched literally, not as LIKE patterns.
    private static TableRef find(Connection c, DatabaseMetaData md, String name) throws SQLException {
        List<String> schemas = new ArrayList<>();
        String current = c.getSchema();
        if (current != null) schemas.add(current);
        schemas.add(null);

        for (String schema : schemas) {
            // Drivers fold unquoted identifiers differently
            for (String candidate : new String[]{name, name.toUpperCase(Locale.ROOT), name.toLowerCase(Locale.ROOT)}) {
                try (ResultSet rs = md.getTables(null, escape(md, schema), escape(md, candidate), TABLE_TYPES)) {
                    while (rs.next()) {
                        if (candidate.equals(rs.getString("TABLE_NAME"))) {
                            return new TableRef(rs.getString("TABLE_CAT"), rs.getString("TABLE_SCHEM"),
                                    rs.getString("TABLE_NAME"), name);
                        }
                    }
                }
            }
        }
        return null;
    }

    static String escape(DatabaseMetaData md, String pattern) throws SQLException {
        if (pattern == null) return null;
        String esc = md.getSearchStringEscape();
        if (esc == null || esc.isEmpty()) return pattern;
        return pattern.replace(esc, esc + esc).replace("_", esc + "_").replace("%", esc + "%");
    }

    private static String createTable(DatabaseMetaData md, TableRef ref) throws SQLException {
        List<String> lines = new ArrayList<>();
        try (ResultSet rs = md.getColumns(ref.catalog, escape(md, ref.schema), escape(md, ref.table), null)) {
            while (rs.next()) {
                String line = "\t" + rs.getString("COLUMN_NAME") + " " + rs.getString("TYPE_NAME");
                if (rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls) {
                    line += " NOT NULL";
                }
                lines.add(line);
            }
        }

        // KEY_SEQ order, not result order
        Map<Short, String> keys = new TreeMap<>();
        try (ResultSet rs = md.getPrimaryKeys(ref.catalog, ref.schema, ref.table)) {
            while (rs.next()) {
                keys.put(rs.getShort("KEY_SEQ"), rs.getString("COLUMN_NAME"));
            }
        }
        if (!keys.isEmpty()) {
            lines.add("\tPRIMARY KEY (" + String.join(", ", keys.values()) + ")");
        }

        return "CREATE TABLE " + ref.display + " (\n" + String.join(",\n", lines) + "\n)";
    }

    private String sample(Connection c, DatabaseMetaData md, TableRef ref) throws SQLException {
        String sql = "SELECT * FROM " + qualified(md, ref);
        StringBuilder sb = new StringBuilder();
        try (Statement st = c.createStatement()) {
            st.setMaxRows(sampleRows);
            try (ResultSet rs = st.executeQuery(sql)) {
                ResultSetMetaData rmd = rs.getMetaData();
                int cols = rmd.getColumnCount();

                List<String> header = new ArrayList<>(cols);
                for (int i = 1; i <= cols; i++) header.add(rmd.getColumnLabel(i));

                List<String> rows = new ArrayList<>();
                while (rs.next() && rows.size() < sampleRows) {
                    List<String> values = new ArrayList<>(cols);
                    for (int i = 1; i <= cols; i++) values.add(String.valueOf(rs.getObject(i)));
                    rows.add(String.join("\t", values));
                }

                sb.append("/*\n")
                        .append(sampleRows).append(" rows from ").append(ref.display).append(" table:\n")
                        .append(String.join("\t", header));
                for (String row : rows) sb.append("\n").append(row);
                sb.append("\n*/");
            }
        }
        return sb.toString();
    }

    private static String qualified(DatabaseMetaData md, TableRef ref) throws SQLException {
        String q = md.getIdentifierQuoteString();
        q = (q == null) ? "" : q.trim();
        String table = quote(ref.table, q);
        if (ref.schema == null || ref.schema.isEmpty()) return table;
        return quote(ref.schema, q) + "." + table;
    }

    private static String quote(String identifier, String q) {
        if (q.isEmpty()) return identifier;
        return q + identifier.replace(q, q + q) + q;
    }

    private static class TableRef {
        final String catalog;
        final String schema;
        final String table;
        final String display;

        TableRef(String catalog, String schema, String table, String display) {
            this.catalog = catalog;
            this.schema = schema;
            this.table = table;
            this.display = display;
        }
    }
}
