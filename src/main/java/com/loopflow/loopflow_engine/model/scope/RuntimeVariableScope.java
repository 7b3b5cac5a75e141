package com.loopflow.loopflow_engine.model.scope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Variables of a single automation run.
 *
 * Created fresh for every execution and passed by reference through the graph executor,
 * the conditional evaluator and every step handler. Never shared between runs, so it needs
 * no synchronisation.
 *
 * Lookup paths:
 *   name            → top-level variable
 *   name.prop       → map property
 *   name[0]         → list element
 *   a.b[0].c        → any chain of the above
 *
 * A lookup that walks off the data (missing key, index out of range, indexing a scalar)
 * yields "" instead of failing, so templated steps never break on a missing upstream value.
 */
public class RuntimeVariableScope {

    /** Matches {{ path }} tokens; whitespace around the path is tolerated. */
    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\{\\{\\s*([a-zA-Z0-9_\\[\\].]+)\\s*\\}\\}");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern HEX = Pattern.compile("0[xX][0-9a-fA-F]+");

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private final Map<String, Object> variables;

    public RuntimeVariableScope(Map<String, ?> seed) {
        this.variables = seed != null ? new LinkedHashMap<>(seed) : new LinkedHashMap<>();
    }

    public static RuntimeVariableScope empty() {
        return new RuntimeVariableScope(null);
    }

    // ── Read / write ──────────────────────────────────────────────────────────

    public Object get(String path) {
        if (path == null) return "";
        List<Object> tokens = tokenize(path.trim());
        if (tokens.isEmpty()) return "";

        String root = String.valueOf(tokens.get(0));
        if (!variables.containsKey(root)) return "";
        Object value = variables.get(root);

        for (int i = 1; i < tokens.size(); i++) {
            if (value == null) return "";
            value = step(value, tokens.get(i));
            if (value == MISSING) return "";
        }
        return value;
    }

    public void set(String key, Object value) {
        variables.put(key, value);
    }

    public boolean contains(String key) {
        return variables.containsKey(key);
    }

    /** Read-only view of the current variables. */
    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(variables);
    }

    /** Detached copy, safe to hand to a log writer after the run. */
    public Map<String, Object> snapshot() {
        return new LinkedHashMap<>(variables);
    }

    // ── Interpolation ─────────────────────────────────────────────────────────

    /**
     * Replaces every {{path}} in the template with the stringified value at that path.
     * Null input gives "".
     */
    public String substitute(String template) {
        if (template == null || template.isEmpty()) return "";
        Matcher matcher = TOKEN_PATTERN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String replacement = stringify(get(matcher.group(1)));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Text form of a variable value: "" for null, JSON for maps and lists,
     * integral doubles without a trailing ".0".
     */
    public static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof String s) return s;
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (value instanceof BigDecimal bd) return bd.stripTrailingZeros().toPlainString();
        if (value instanceof Map || value instanceof Iterable || value.getClass().isArray()) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    // ── Auto-typing ───────────────────────────────────────────────────────────

    /**
     * Types a raw string the way a user would expect:
     * JSON text first (objects, arrays, numbers, booleans, null, quoted strings),
     * then the literals "true"/"false", then numeric strings, else the string itself.
     */
    public static Object parseValue(String input) {
        if (input == null) return null;
        try {
            return MAPPER.readValue(input, Object.class);
        } catch (JsonProcessingException notJson) {
            return parseLiteral(input);
        }
    }

    private static Object parseLiteral(String input) {
        if ("true".equals(input)) return Boolean.TRUE;
        if ("false".equals(input)) return Boolean.FALSE;

        Number number = parseNumber(input);
        return number != null ? number : input;
    }

    /**
     * Numeric reading of a string as a browser's Number() would do it, restricted to
     * decimal and hexadecimal literals. Returns null when the string is not numeric.
     */
    static Number parseNumber(String input) {
        String t = input.trim();
        if (t.isEmpty()) return null;
        double d;
        if (DECIMAL.matcher(t).matches()) {
            d = Double.parseDouble(t);
        } else if (HEX.matcher(t).matches()) {
            d = new BigInteger(t.substring(2), 16).doubleValue();
        } else {
            return null;
        }
        if (d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) return (int) d;
        if (d == Math.rint(d) && Math.abs(d) < 9.0e15) return (long) d;
        return d;
    }

    // ── Path walking ──────────────────────────────────────────────────────────

    private static final Object MISSING = new Object();

    private static Object step(Object value, Object token) {
        if (token instanceof Integer index) {
            if (value instanceof List<?> list) {
                return index >= 0 && index < list.size() ? list.get(index) : MISSING;
            }
            return MISSING;
        }
        String key = (String) token;
        if (value instanceof Map<?, ?> map) {
            return map.containsKey(key) ? map.get(key) : MISSING;
        }
        if (value instanceof List<?> list && key.chars().allMatch(Character::isDigit)) {
            // wider than an int is past the end of any list
            Integer index = leadingInt(key);
            return index != null && index < list.size() ? list.get(index) : MISSING;
        }
        return MISSING;
    }

    /** Splits a path on '.' and '[n]'; non-numeric bracket contents are dropped. */
    static List<Object> tokenize(String path) {
        List<Object> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (c == '.') {
                if (current.length() > 0) tokens.add(current.toString());
                current.setLength(0);
                i++;
            } else if (c == '[') {
                if (current.length() > 0) tokens.add(current.toString());
                current.setLength(0);
                i++;
                StringBuilder index = new StringBuilder();
                while (i < path.length() && path.charAt(i) != ']') {
                    index.append(path.charAt(i));
                    i++;
                }
                if (i < path.length()) i++;
                Integer parsed = leadingInt(index.toString().trim());
                if (parsed != null) tokens.add(parsed);
            } else {
                current.append(c);
                i++;
            }
        }
        if (current.length() > 0) tokens.add(current.toString());
        return tokens;
    }

    private static Integer leadingInt(String s) {
        int end = 0;
        if (end < s.length() && s.charAt(end) == '-') end++;
        while (end < s.length() && Character.isDigit(s.charAt(end))) end++;
        String digits = s.substring(0, end);
        if (digits.isEmpty() || "-".equals(digits)) return null;
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return "RuntimeVariableScope" + variables.keySet();
    }
}
