package org.contractquard.analyzer.transform.solidity;

import org.contractquard.analyzer.ir.type.IRType;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Parses solc {@code typeString} values into structural types.
 * <pre>
 *     uint256                                primitive
 *     uint256[] storage ref                  array of uint256, dynamic
 *     mapping(address => mapping(address => uint256))
 *     struct Vault.Deposit memory            struct-like, named Vault.Deposit
 * </pre>
 */
public class SolidityTypeParser {
    private static final Pattern INTEGER = Pattern.compile("u?int\\d*");
    private static final Pattern FIXED_BYTES = Pattern.compile("bytes\\d+");
    private static final Pattern FIXED_POINT = Pattern.compile("u?fixed(\\d+x\\d+)?");
    private static final List<String> LOCATION_SUFFIXES = List.of(" storage", " memory", " calldata", " ref",
            " pointer", " slice");
    private static final List<String> STRUCT_LIKE_PREFIXES = List.of("struct ", "contract ", "enum ");

    public IRType parse(String typeString) {
        if (typeString == null) return IRType.UNKNOWN;
        String s = stripLocation(typeString.trim());
        if (s.isEmpty()) return IRType.UNKNOWN;

        if (s.startsWith("mapping(") && s.endsWith(")")) {
            IRType mapping = parseMapping(s.substring("mapping(".length(), s.length() - 1));
            if (mapping != null) return mapping;
        }
        if (s.endsWith("]")) {
            int open = matchingOpenBracket(s);
            if (open > 0) {
                IRType elementType = parse(s.substring(0, open));
                String size = s.substring(open + 1, s.length() - 1).trim();
                return IRType.arrayOf(elementType, parseSize(size));
            }
        }
        if (isPrimitive(s)) return IRType.primitive(s);
        if (s.startsWith("int_const") || s.startsWith("rational_const")) return IRType.primitive("int_const");
        if (s.startsWith("literal_string") || s.startsWith("literal_unicode")) return IRType.primitive("string");
        for (String prefix : STRUCT_LIKE_PREFIXES) {
            if (s.startsWith(prefix)) {
                return IRType.struct(s.substring(prefix.length()).trim(), null);
            }
        }
        return IRType.named(s);
    }

    static boolean isPrimitive(String s) {
        return "bool".equals(s) || "address".equals(s) || "address payable".equals(s) || "string".equals(s)
               || "bytes".equals(s) || "byte".equals(s)
               || INTEGER.matcher(s).matches() || FIXED_BYTES.matcher(s).matches()
               || FIXED_POINT.matcher(s).matches();
    }

    private static String stripLocation(String s) {
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String suffix : LOCATION_SUFFIXES) {
                if (s.endsWith(suffix)) {
                    s = s.substring(0, s.length() - suffix.length()).trim();
                    changed = true;
                }
            }
        }
        return s;
    }

    // the "=>" at nesting depth 0 separates key and value
    private IRType parseMapping(String inner) {
        int depth = 0;
        for (int i = 0; i < inner.length() - 1; i++) {
            char c = inner.charAt(i);
            if (c == '(' || c == '[') depth++;
            else if (c == ')' || c == ']') depth--;
            else if (depth == 0 && c == '=' && inner.charAt(i + 1) == '>') {
                IRType key = parse(inner.substring(0, i));
                IRType value = parse(inner.substring(i + 2));
                return IRType.mappingOf(key, value);
            }
        }
        return null;
    }

    private static int matchingOpenBracket(String s) {
        int depth = 0;
        for (int i = s.length() - 1; i >= 0; i--) {
            char c = s.charAt(i);
            if (c == ']' || c == ')') depth++;
            else if (c == '[' || c == '(') {
                depth--;
                if (depth == 0) return c == '[' ? i : -1;
            }
        }
        return -1;
    }

    private static Integer parseSize(String size) {
        if (size.isEmpty()) return null;
        try {
            return Integer.parseInt(size);
        } catch (NumberFormatException nfe) {
            // constant expressions such as N or 2**8 are not evaluated
            return null;
        }
    }
}
