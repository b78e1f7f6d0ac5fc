package com.instaharvest.scraper;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts locale-variant display counts ("1,234", "1.2k", "2,5 mil", "3M") into integers.
 * <p>
 * Rules, in order:
 * <ul>
 *   <li>Surrounding whitespace is stripped.</li>
 *   <li>One trailing multiplier token may follow the number, optionally after a single space:
 *       {@code k} and {@code mil} mean thousands, {@code m} and {@code mi} mean millions (case-insensitive).</li>
 *   <li>When both {@code ,} and {@code .} appear, the rightmost one is the decimal separator and the other is dropped.</li>
 *   <li>A lone {@code ,} followed by exactly one digit is a decimal separator; otherwise commas are dropped.</li>
 *   <li>A lone {@code .} is a decimal separator after a multiplier or before exactly one digit; otherwise dots are dropped.</li>
 *   <li>The multiplier is applied and the result rounded half-up.</li>
 * </ul>
 */
public final class CountTextParser {
    private static final Pattern MULTIPLIER = Pattern.compile("^(.*?)\\s?(mil|mi|k|m)$");
    private static final Pattern NUMBER = Pattern.compile("^\\d+(?:[.,]\\d+)*$");
    private static final Pattern SINGLE_DECIMAL_DIGIT = Pattern.compile("^\\d+[.,]\\d$");

    private CountTextParser() {}

    /**
     * Parses a display count.
     * @param text display string such as {@code "1,2k"}
     * @return non-negative count
     * @throws CountParseException on null, empty, garbled input, or more than one multiplier
     */
    public static long parse(String text) {
        if (text == null) {
            throw new CountParseException("Count text is null");
        }
        String value = text.strip().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            throw new CountParseException("Count text is empty");
        }

        long multiplier = 1;
        String numeric = value;
        Matcher m = MULTIPLIER.matcher(value);
        if (m.matches()) {
            numeric = m.group(1);
            multiplier = multiplierOf(m.group(2));
            if (MULTIPLIER.matcher(numeric).matches()) {
                throw new CountParseException("More than one multiplier in count: '" + text + "'");
            }
        }
        if (!NUMBER.matcher(numeric).matches()) {
            throw new CountParseException("Unrecognized count format: '" + text + "'");
        }

        try {
            BigDecimal number = new BigDecimal(normalizeSeparators(numeric, multiplier > 1));
            return number.multiply(BigDecimal.valueOf(multiplier)).setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new CountParseException("Unrecognized count format: '" + text + "'", e);
        }
    }

    /**
     * Parses the count at the start of an entry-point label such as {@code "1,2 mil followers"},
     * joining a multiplier that was rendered as a separate word.
     */
    public static long parseLeading(String label) {
        if (label == null || label.isBlank()) {
            throw new CountParseException("Count label is empty");
        }
        String[] parts = label.strip().split("\\s+");
        String raw = parts[0];
        if (parts.length > 1 && isMultiplier(parts[1])) {
            raw = raw + " " + parts[1];
        }
        return parse(raw);
    }

    static boolean isMultiplier(String token) {
        switch (token.toLowerCase(Locale.ROOT)) {
            case "k":
            case "m":
            case "mi":
            case "mil":
                return true;
            default:
                return false;
        }
    }

    private static long multiplierOf(String token) {
        return token.equals("k") || token.equals("mil") ? 1_000L : 1_000_000L;
    }

    private static String normalizeSeparators(String numeric, boolean abbreviated) {
        int comma = numeric.lastIndexOf(',');
        int dot = numeric.lastIndexOf('.');
        if (comma >= 0 && dot >= 0) {
            char decimal = comma > dot ? ',' : '.';
            char thousands = decimal == ',' ? '.' : ',';
            return numeric.replace(String.valueOf(thousands), "").replace(decimal, '.');
        }
        if (comma >= 0) {
            return SINGLE_DECIMAL_DIGIT.matcher(numeric).matches() ? numeric.replace(',', '.') : numeric.replace(",", "");
        }
        if (dot >= 0) {
            boolean decimal = abbreviated || SINGLE_DECIMAL_DIGIT.matcher(numeric).matches();
            return decimal ? numeric : numeric.replace(".", "");
        }
        return numeric;
    }
}
