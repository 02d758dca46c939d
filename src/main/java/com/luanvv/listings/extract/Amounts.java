package com.luanvv.listings.extract;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Number parsing for the formats the site prints: {@code 2.500.000.000}, {@code 1,250,000},
 * {@code 33,000.50}, {@code 4.5}. The last separator is read as a decimal point unless exactly
 * three digits follow it, or it repeats; otherwise every separator groups thousands.
 */
public final class Amounts {
    private static final Pattern NON_NUMERIC = Pattern.compile("[^0-9.,]");
    private static final Pattern EDGE_SEPARATORS = Pattern.compile("^[.,]+|[.,]+$");
    private static final Pattern INTEGER = Pattern.compile("\\d+");
    private static final Pattern MEASURE = Pattern.compile("\\d[\\d,]*(\\.\\d+)?");

    private Amounts() {
    }

    public static Optional<BigDecimal> parseDecimal(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String s = NON_NUMERIC.matcher(text).replaceAll("");
        s = EDGE_SEPARATORS.matcher(s).replaceAll("");
        if (s.isEmpty() || s.chars().noneMatch(Character::isDigit)) {
            return Optional.empty();
        }
        int lastSep = Math.max(s.lastIndexOf('.'), s.lastIndexOf(','));
        if (lastSep < 0) {
            return Optional.of(new BigDecimal(s));
        }
        char sep = s.charAt(lastSep);
        String head = s.substring(0, lastSep).replaceAll("[.,]", "");
        String tail = s.substring(lastSep + 1).replaceAll("[.,]", "");
        boolean repeated = s.indexOf(sep) != lastSep;
        boolean grouping = repeated || tail.length() == 3;
        if (grouping) {
            return Optional.of(new BigDecimal(head + tail));
        }
        return Optional.of(new BigDecimal((head.isEmpty() ? "0" : head) + "." + tail));
    }

    /**
     * Areas such as {@code 2.575} or {@code 1,250.5}: the dot is always the decimal point and
     * commas group thousands. Reads the first number in the text.
     */
    public static Optional<BigDecimal> parseMeasure(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = MEASURE.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(m.group().replace(",", "")));
    }

    public static Optional<Integer> parseInteger(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher m = INTEGER.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Integer.parseInt(m.group()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
