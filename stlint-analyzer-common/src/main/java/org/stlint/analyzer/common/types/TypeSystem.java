package org.stlint.analyzer.common.types;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/*
Builtin types, conversions and functions of the language. The family tables are ordered by width,
which is what the common arithmetic type computation relies on.
 */
public class TypeSystem {
    private static final Logger LOGGER = LoggerFactory.getLogger(TypeSystem.class);

    public static final String BOOL = "BOOL";
    public static final String INT = "INT";

    public static final List<String> BIT_STRINGS = List.of("BOOL", "BYTE", "WORD", "DWORD", "LWORD");
    public static final List<String> UNSIGNED_INTEGERS = List.of("USINT", "UINT", "UDINT", "ULINT");
    public static final List<String> SIGNED_INTEGERS = List.of("SINT", "INT", "DINT", "LINT");
    public static final List<String> FLOATING_POINT = List.of("REAL", "LREAL");
    public static final List<String> TIME_RELATED = List.of("TIME", "LTIME", "DATE", "LDATE", "TIME_OF_DAY", "TOD",
            "LTIME_OF_DAY", "LTOD", "DATE_AND_TIME", "DT", "LDATE_AND_TIME", "LDT");

    // strings are not elementary types
    public static final List<String> ELEMENTARY_TYPES = Stream.of(BIT_STRINGS, UNSIGNED_INTEGERS, SIGNED_INTEGERS,
            FLOATING_POINT, TIME_RELATED).flatMap(List::stream).toList();

    // most dominant family first
    private static final List<List<String>> DOMINANCE = List.of(TIME_RELATED, FLOATING_POINT, UNSIGNED_INTEGERS,
            SIGNED_INTEGERS);

    public static final Map<String, String> BUILTIN_TYPE_CONVERSIONS = makeConversions();

    public static final Map<String, String> BUILTIN_FUNCTIONS = Map.of(
            "LEN", "INT",
            "FIND", "INT",
            "TRUNC", "DINT",
            "TRUNC_INT", "INT",
            // may return UINT, UDINT or ULINT depending on the value
            "SIZEOF", "USINT");

    private static final Pattern ARRAY_TYPE = Pattern.compile("^ARRAY\\s*\\[([^\\]]*)\\]\\s*OF\\s+(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REFERENCE_TYPE = Pattern.compile("^REFERENCE\\s+TO\\s+(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern POINTER_TYPE = Pattern.compile("^POINTER\\s+TO\\s+(.*?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    public record ArrayType(int dimensions, String elementType) {
    }

    private TypeSystem() {
    }

    private static Map<String, String> makeConversions() {
        Map<String, String> map = new HashMap<>();
        for (String to : ELEMENTARY_TYPES) {
            map.put("TO_" + to, to);
            for (String from : ELEMENTARY_TYPES) {
                if (!from.equals(to)) map.put(from + "_TO_" + to, to);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    private static String normalize(String type) {
        return type.trim().toUpperCase(Locale.ROOT);
    }

    /*
    Either type may be unknown (null), in which case the other one is returned. Between families,
    time-related dominates floating point, which dominates unsigned, which dominates signed. Within
    a family, the wider type wins. Equal types, ignoring case, give the upper-case name.
     */
    public static String commonArithmeticType(String type1, String type2) {
        if (type1 == null) return type2;
        if (type2 == null) return type1;
        String t1 = normalize(type1);
        String t2 = normalize(type2);
        if (t1.equals(t2)) return t1;

        for (List<String> family : DOMINANCE) {
            int i1 = family.indexOf(t1);
            int i2 = family.indexOf(t2);
            if (i1 >= 0 && i2 < 0) return type1;
            if (i2 >= 0 && i1 < 0) return type2;
            if (i1 >= 0) return i1 >= i2 ? type1 : type2;
        }
        LOGGER.warn("Ambiguous common arithmetic type of {} and {}", type1, type2);
        // best effort, but independent of the order of the arguments
        int b1 = BIT_STRINGS.indexOf(t1);
        int b2 = BIT_STRINGS.indexOf(t2);
        if (b1 >= 0 && b2 >= 0) return b1 >= b2 ? type1 : type2;
        return t1.compareTo(t2) <= 0 ? type1 : type2;
    }

    public static boolean isUnsignedInteger(String type) {
        return type != null && UNSIGNED_INTEGERS.contains(normalize(type));
    }

    // X_TO_Y and TO_Y; null when the name is not a builtin conversion
    public static String conversionTarget(String functionName) {
        return functionName == null ? null : BUILTIN_TYPE_CONVERSIONS.get(normalize(functionName));
    }

    public static String builtinFunctionReturnType(String functionName) {
        return functionName == null ? null : BUILTIN_FUNCTIONS.get(normalize(functionName));
    }

    // ARRAY [0..9, 1..3] OF INT -> (2, INT); null when the type is not an array
    public static ArrayType arrayType(String type) {
        if (type == null) return null;
        Matcher m = ARRAY_TYPE.matcher(type.trim());
        if (!m.matches()) return null;
        String ranges = m.group(1);
        int dimensions = (int) ranges.chars().filter(c -> c == ',').count() + 1;
        return new ArrayType(dimensions, m.group(2));
    }

    public static boolean isReference(String type) {
        return type != null && REFERENCE_TYPE.matcher(type.trim()).matches();
    }

    public static String referenceBaseType(String type) {
        Matcher m = REFERENCE_TYPE.matcher(type.trim());
        return m.matches() ? m.group(1) : null;
    }

    public static boolean isPointer(String type) {
        return type != null && POINTER_TYPE.matcher(type.trim()).matches();
    }

    public static String pointerBaseType(String type) {
        Matcher m = POINTER_TYPE.matcher(type.trim());
        return m.matches() ? m.group(1) : null;
    }
}
