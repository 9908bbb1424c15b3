package org.queryguard.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// Describes the query tool to an agent framework: name, purpose and arguments keyed by name
public class ToolDescriptor {
    public static final String NAME = "execute_sql";
    public static final String DESCRIPTION = "Execute exactly one SELECT statement; DML/DDL is forbidden.";
    public static final String SQL_ARGUMENT =
            "A single read-only SELECT statement, bounded with LIMIT when returning many rows.";

    public String name;
    public String description;
    public Map<String, Argument> arguments;

    public static ToolDescriptor executeSql() {
        ToolDescriptor d = new ToolDescriptor();
        d.name = NAME;
        d.description = DESCRIPTION;
        Map<String, Argument> args = new LinkedHashMap<>();
        args.put("sql", new Argument("string", SQL_ARGUMENT, true));
        d.arguments = Collections.unmodifiableMap(args);
        return d;
    }

    public static class Argument {
        public String type;
        public String description;
        public boolean required;

        public Argument() {}

        public Argument(String type, String description, boolean required) {
            this.type = type;
            this.description = description;
            this.required = required;
        }
    }
}
