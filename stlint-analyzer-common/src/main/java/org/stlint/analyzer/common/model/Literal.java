package org.stlint.analyzer.common.model;

/*
A constant. typeName is the explicit type prefix (UINT#5, LREAL#1.0), or null.
 */
public record Literal(Kind kind, String value, String typeName, SourceMeta meta) implements Expression {

    public enum Kind {
        INTEGER("INT"),
        REAL("LREAL"),
        BOOLEAN("BOOL"),
        STRING("STRING"),
        WSTRING("WSTRING"),
        BIT_STRING(null),
        TIME("TIME"),
        LTIME("LTIME"),
        TIME_OF_DAY("TIME_OF_DAY"),
        LTIME_OF_DAY("LTIME_OF_DAY"),
        DATE("DATE"),
        LDATE("LDATE"),
        DATE_AND_TIME("DATE_AND_TIME"),
        LDATE_AND_TIME("LDATE_AND_TIME");

        private final String defaultType;

        Kind(String defaultType) {
            this.defaultType = defaultType;
        }

        // null for bit strings without prefix (16#FF): there is no agreed default
        public String defaultType() {
            return defaultType;
        }
    }

    @Override
    public String text() {
        return typeName == null ? value : typeName + "#" + value;
    }

    @Override
    public Shape<?> shape() {
        return Shape.LITERAL;
    }
}
