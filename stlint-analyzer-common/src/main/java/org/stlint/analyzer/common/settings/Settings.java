package org.stlint.analyzer.common.settings;

import org.stlint.analyzer.common.ConfigurationException;
import org.stlint.analyzer.common.model.Names;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
Configuration of a lint run.

level: minimum severity of the findings that are returned (default WARNING).
checks: per rule code, enabled flag and severity.
builtinSymbols: name -> type of symbols that exist without declaration; a type written as <TYPE>
marks a symbol that is itself a type.
builtinFunctions: names of vendor library functions (MEMCPY, ...).
maxNamelessArgs, namelessArgFunctions, namelessArgMethods: limits on unnamed call arguments;
a method entry is either a method name or TYPE.METHOD.
blockPrefixes: declaration block (VAR_INPUT, ...) -> accepted variable name prefixes.
typePrefixes: type name -> variable name prefix.
kindPrefixes: kind of declared type (see PREFIX_KINDS) -> type name prefix; absent when not configured.
 */
public record Settings(Severity level,
                       Map<String, CheckSettings> checks,
                       Map<String, String> builtinSymbols,
                       Set<String> builtinFunctions,
                       int maxNamelessArgs,
                       Set<String> namelessArgFunctions,
                       Set<String> namelessArgMethods,
                       Map<String, Set<String>> blockPrefixes,
                       Map<String, String> typePrefixes,
                       Map<String, String> kindPrefixes) {

    public static final Settings DEFAULT = new Builder().build();

    public static final List<String> KEYS = List.of("level", "checks", "builtin_symbols", "builtin_functions",
            "max_nameless_args", "nameless_arg_functions", "nameless_arg_methods", "block_prefixes",
            "type_prefixes", "function_block_prefix", "interface_prefix", "enum_prefix", "struct_prefix",
            "reference_prefix", "array_prefix");

    public static final List<String> PREFIX_KINDS = List.of("function_block", "interface", "enum", "struct",
            "reference", "array");

    public Settings {
        checks = Collections.unmodifiableMap(new LinkedHashMap<>(checks));
        builtinSymbols = Collections.unmodifiableMap(new LinkedHashMap<>(builtinSymbols));
        builtinFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(builtinFunctions));
        namelessArgFunctions = Collections.unmodifiableSet(new LinkedHashSet<>(namelessArgFunctions));
        namelessArgMethods = Collections.unmodifiableSet(new LinkedHashSet<>(namelessArgMethods));
        Map<String, Set<String>> bp = new LinkedHashMap<>();
        blockPrefixes.forEach((block, prefixes) ->
                bp.put(block, Collections.unmodifiableSet(new LinkedHashSet<>(prefixes))));
        blockPrefixes = Collections.unmodifiableMap(bp);
        typePrefixes = Collections.unmodifiableMap(new LinkedHashMap<>(typePrefixes));
        kindPrefixes = Collections.unmodifiableMap(new LinkedHashMap<>(kindPrefixes));
    }

    public CheckSettings checkSettings(String code) {
        return checks.getOrDefault(code, CheckSettings.DEFAULT);
    }

    public Set<String> blockPrefixes(String block) {
        Set<String> prefixes = Names.get(blockPrefixes, block);
        return prefixes == null ? Set.of() : prefixes;
    }

    public String typePrefix(String type) {
        return Names.get(typePrefixes, type);
    }

    /*
    null when no prefix is configured for the kind
     */
    public String kindPrefix(String kind) {
        return kindPrefixes.get(kind);
    }

    public boolean allowsNamelessArgs(String functionName) {
        return Names.contains(namelessArgFunctions, functionName);
    }

    public boolean allowsNamelessArgs(String typeName, String methodName) {
        return Names.contains(namelessArgMethods, methodName)
               || typeName != null && Names.contains(namelessArgMethods, typeName + "." + methodName);
    }

    public static class Builder {
        private Severity level = Severity.WARNING;
        private final Map<String, CheckSettings> checks = new LinkedHashMap<>();
        private final Map<String, String> builtinSymbols = new LinkedHashMap<>();
        private final Set<String> builtinFunctions = new LinkedHashSet<>();
        private int maxNamelessArgs = 3;
        private final Set<String> namelessArgFunctions = new LinkedHashSet<>();
        private final Set<String> namelessArgMethods = new LinkedHashSet<>();
        private final Map<String, Set<String>> blockPrefixes = new LinkedHashMap<>();
        private final Map<String, String> typePrefixes = new LinkedHashMap<>();
        private final Map<String, String> kindPrefixes = new LinkedHashMap<>();

        public Builder setLevel(Severity level) {
            this.level = level;
            return this;
        }

        public Builder setCheck(String code, CheckSettings checkSettings) {
            checks.put(code, checkSettings);
            return this;
        }

        public Builder addBuiltinSymbol(String name, String type) {
            builtinSymbols.put(name, type);
            return this;
        }

        public Builder addBuiltinFunctions(Collection<String> names) {
            builtinFunctions.addAll(names);
            return this;
        }

        public Builder setMaxNamelessArgs(int maxNamelessArgs) {
            this.maxNamelessArgs = maxNamelessArgs;
            return this;
        }

        public Builder addNamelessArgFunctions(Collection<String> names) {
            namelessArgFunctions.addAll(names);
            return this;
        }

        public Builder addNamelessArgMethods(Collection<String> names) {
            namelessArgMethods.addAll(names);
            return this;
        }

        public Builder addBlockPrefixes(String block, Collection<String> prefixes) {
            blockPrefixes.computeIfAbsent(block, b -> new LinkedHashSet<>()).addAll(prefixes);
            return this;
        }

        public Builder setTypePrefix(String type, String prefix) {
            typePrefixes.put(type, prefix);
            return this;
        }

        public Builder setKindPrefix(String kind, String prefix) {
            if (!PREFIX_KINDS.contains(kind)) {
                throw new IllegalArgumentException("Unknown prefix kind '" + kind + "', expected one of " + PREFIX_KINDS);
            }
            if (prefix == null) kindPrefixes.remove(kind);
            else kindPrefixes.put(kind, prefix);
            return this;
        }

        public Settings build() {
            return new Settings(level, checks, builtinSymbols, builtinFunctions, maxNamelessArgs,
                    namelessArgFunctions, namelessArgMethods, blockPrefixes, typePrefixes, kindPrefixes);
        }
    }

    /*
    The shape produced by a YAML or JSON reader: nested maps, lists and scalars.
     */
    public static Settings fromMap(Map<String, ?> map) {
        Builder b = new Builder();
        for (Map.Entry<String, ?> entry : map.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            try {
                switch (key) {
                    case "level" -> b.setLevel(Severity.parse(value));
                    case "checks" -> asMap(key, value).forEach((code, cs) -> b.setCheck(code, checkSettings(code, cs)));
                    case "builtin_symbols" -> asMap(key, value).forEach((name, type) ->
                            b.addBuiltinSymbol(name, String.valueOf(type)));
                    case "builtin_functions" -> b.addBuiltinFunctions(asStrings(key, value));
                    case "max_nameless_args" -> b.setMaxNamelessArgs(asInt(key, value));
                    case "nameless_arg_functions" -> b.addNamelessArgFunctions(asStrings(key, value));
                    case "nameless_arg_methods" -> b.addNamelessArgMethods(asStrings(key, value));
                    case "block_prefixes" -> asMap(key, value).forEach((block, prefixes) ->
                            b.addBlockPrefixes(block, asStrings(key + "." + block, prefixes)));
                    case "type_prefixes" -> asMap(key, value).forEach((type, prefix) ->
                            b.setTypePrefix(type, asString(key + "." + type, prefix)));
                    case "function_block_prefix", "interface_prefix", "enum_prefix", "struct_prefix",
                            "reference_prefix", "array_prefix" -> b.setKindPrefix(
                            key.substring(0, key.length() - "_prefix".length()),
                            value == null ? null : asString(key, value));
                    default -> throw new ConfigurationException("Unknown settings key '" + key
                                                                + "', expected one of " + KEYS);
                }
            } catch (IllegalArgumentException iae) {
                throw new ConfigurationException("Bad value for settings key '" + key + "': " + value, iae);
            }
        }
        return b.build();
    }

    private static CheckSettings checkSettings(String code, Object value) {
        boolean enabled = true;
        Severity level = Severity.ERROR;
        for (Map.Entry<String, Object> e : asMap("checks." + code, value).entrySet()) {
            switch (e.getKey()) {
                case "enabled" -> {
                    if (!(e.getValue() instanceof Boolean bool)) {
                        throw new ConfigurationException("checks." + code + ".enabled must be a boolean");
                    }
                    enabled = bool;
                }
                case "level" -> level = Severity.parse(e.getValue());
                default -> throw new ConfigurationException("Unknown key checks." + code + "." + e.getKey());
            }
        }
        return new CheckSettings(enabled, level);
    }

    private static Map<String, Object> asMap(String key, Object value) {
        if (value instanceof Map<?, ?> m) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : m.entrySet()) {
                if (!(e.getKey() instanceof String k)) {
                    throw new ConfigurationException("Non-string key in " + key + ": " + e.getKey());
                }
                copy.put(k, e.getValue());
            }
            return copy;
        }
        throw new ConfigurationException(key + " must be a mapping");
    }

    private static List<String> asStrings(String key, Object value) {
        if (value instanceof String s) return List.of(s);
        if (value instanceof Collection<?> c) return c.stream().map(v -> asString(key, v)).toList();
        throw new ConfigurationException(key + " must be a list of names");
    }

    private static String asString(String key, Object value) {
        if (value instanceof String s) return s;
        throw new ConfigurationException(key + " must be a string");
    }

    private static int asInt(String key, Object value) {
        if (value instanceof Number n) return n.intValue();
        if (value instanceof String s) return Integer.parseInt(s.trim());
        throw new ConfigurationException(key + " must be an integer");
    }
}
