package com.loopflow.loopflow_engine.model.scope;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient number reading shared by conditions and variable steps: a string is read up to the
 * end of its leading numeric prefix, and anything without one is NaN.
 */
public final class NumericText {

    private static final Pattern FLOAT_PREFIX =
            Pattern.compile("^[+-]?(Infinity|(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?)");
    private static final Pattern INT_PREFIX = Pattern.compile("^[+-]?\\d+");

    private NumericText() {
    }

    /** Leading decimal number of {@code text}, or NaN. "12.5kg" → 12.5, "$3" → NaN. */
    public static double parseFloat(String text) {
        if (text == null) return Double.NaN;
        Matcher m = FLOAT_PREFIX.matcher(text.stripLeading());
        if (!m.find()) return Double.NaN;
        String number = m.group();
        if (number.endsWith("Infinity")) {
            return number.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        return Double.parseDouble(number);
    }

    /** Leading integer of {@code text}, or NaN. "2.9" → 2. */
    public static double parseInt(String text) {
        if (text == null) return Double.NaN;
        Matcher m = INT_PREFIX.matcher(text.stripLeading());
        if (!m.find()) return Double.NaN;
        return Double.parseDouble(m.group());
    }

    /** Numeric reading of a stored value: numbers as-is, everything else through {@link #parseFloat}. */
    public static double toDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        return parseFloat(RuntimeVariableScope.stringify(value));
    }

    /** Integral results are kept as Integer / Long so they serialize without a fraction. */
    public static Number normalize(double value) {
        if (Double.isFinite(value) && value == Math.rint(value)) {
            if (Math.abs(value) <= Integer.MAX_VALUE) return (int) value;
            if (Math.abs(value) < 9.0e15) return (long) value;
        }
        return value;
    }
}
