package org.stlint.analyzer.common.model;

import java.util.List;
import java.util.Map;

/*
User-defined data type. Structures and unions have fields (declarations), structures may extend
another structure; enumerations have values; aliases have a base type.
 */
public record DataType(String name, Kind kind, String extendsName, Map<String, Declaration> declarations,
                       List<String> enumValues, String aliasType) {

    public enum Kind {STRUCT, UNION, ENUM, ALIAS}

    public DataType {
        declarations = Declarations.frozen(declarations);
        enumValues = List.copyOf(enumValues);
    }

    public static DataType struct(String name, String extendsName, List<Declaration> fields) {
        return new DataType(name, Kind.STRUCT, extendsName, Declarations.byName(fields), List.of(), null);
    }

    public static DataType enumeration(String name, List<String> values) {
        return new DataType(name, Kind.ENUM, null, Map.of(), values, null);
    }

    public static DataType alias(String name, String aliasType) {
        return new DataType(name, Kind.ALIAS, null, Map.of(), List.of(), aliasType);
    }

    public boolean isEnum() {
        return kind == Kind.ENUM;
    }
}
