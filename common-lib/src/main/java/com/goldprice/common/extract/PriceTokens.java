package com.goldprice.common.extract;

import com.goldprice.common.model.SeriesKey;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token readers shared by every source: gram weights and rupiah amounts as
 * they appear in price tables.
 */
public final class PriceTokens {

    private static final Pattern WEIGHT_UNIT_OPTIONAL =
        Pattern.compile("([\\d.,]*\\d[\\d.,]*)\\s*(?:gram|gr|g)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern WEIGHT_UNIT_REQUIRED =
        Pattern.compile("([\\d.,]*\\d[\\d.,]*)\\s*(?:gram|gr|g)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBER_TOKEN = Pattern.compile("[\\d.,]*\\d[\\d.,]*");
    private static final Pattern DECIMAL_PREFIX = Pattern.compile("^(\\d+(?:\\.\\d+)?|\\.\\d+)");

    // Long.MAX_VALUE has 19 digits
    private static final int MAX_PRICE_DIGITS = 18;

    private PriceTokens() {}

    /**
     * Finds the first weight token in a cell.
     *
     * @param unitRequired when true the number must be followed by gram/gr/g
     * @return the matched token, e.g. {@code "0,5 gram"}, or {@code null}
     */
    public static String matchWeight(String text, boolean unitRequired) {
        if (text == null) return null;
        Matcher m = (unitRequired ? WEIGHT_UNIT_REQUIRED : WEIGHT_UNIT_OPTIONAL).matcher(text);
        return m.find() ? m.group().trim() : null;
    }

    /**
     * Reads the numeric part of a weight token. The first comma is taken as a
     * decimal separator, then the longest valid decimal prefix is used.
     *
     * @return normalized grams, or {@code null} if no number is present
     */
    public static BigDecimal parseWeight(String token) {
        if (token == null) return null;
        Matcher number = NUMBER_TOKEN.matcher(token);
        if (!number.find()) return null;
        String candidate = number.group().replaceFirst(",", ".");
        Matcher prefix = DECIMAL_PREFIX.matcher(candidate);
        if (!prefix.find()) return null;
        return SeriesKey.normalizeWeight(new BigDecimal(prefix.group(1)));
    }

    /**
     * Strips every non-digit and parses the remainder. Empty and overflowing
     * tokens read as 0.
     */
    public static long parsePrice(String text) {
        if (text == null) return 0L;
        String digits = text.replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > MAX_PRICE_DIGITS) return 0L;
        return Long.parseLong(digits);
    }
}
