package org.dpg.jobprocessor.service.catalog;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Normalizes the free-text publication date of MARC 260$c ("[1887?]", "c1923.", "19--",
 * "195-", "1901-05", "MDCCCXC") to a four digit year.
 */
public final class MarcYearParser {

    private static final Pattern BRACKETS_OR_TRAILING_DOT = Pattern.compile("([\\[\\]()]|\\.$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern YEAR_DOT_ZERO = Pattern.compile("^\\d{4}\\.0.*");
    private static final Pattern CENTURY = Pattern.compile("^\\d{2}--.*");
    private static final Pattern DECADE = Pattern.compile("^\\d{3}-.*");
    private static final Pattern FULL_RANGE = Pattern.compile("^\\d{4}\\s*-\\s*\\d{4}.*");
    private static final Pattern SHORT_RANGE = Pattern.compile("^\\d{4}\\s*-\\s*\\d{2}.*");
    private static final Pattern STARTS_WITH_YEAR = Pattern.compile("^\\d{4}.*");

    private static final List<Numeral> NUMERALS = List.of(
            new Numeral("M", 1000), new Numeral("CM", 900), new Numeral("D", 500), new Numeral("CD", 400),
            new Numeral("C", 100), new Numeral("XC", 90), new Numeral("L", 50), new Numeral("XL", 40),
            new Numeral("X", 10), new Numeral("IX", 9), new Numeral("V", 5), new Numeral("IV", 4),
            new Numeral("I", 1));

    private MarcYearParser() {
    }

    /**
     * @return the year, or 0 if none could be determined.
     */
    public static int parseYear(final String raw) {
        try {
            return Integer.parseInt(extractYear(raw).trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /**
     * Best-effort year text. May return something that is not a number when the input is too messy.
     */
    static String extractYear(final String raw) {
        if (raw == null) {
            return "";
        }
        String year = BRACKETS_OR_TRAILING_DOT.matcher(raw).replaceAll("");
        year = WHITESPACE.matcher(year).replaceAll(" ").trim();
        if (year.isEmpty()) {
            return "";
        }

        if (YEAR_DOT_ZERO.matcher(year).matches()) {
            return year.split("\\.")[0];
        }
        if (CENTURY.matcher(year).matches()) {
            return year.substring(0, 2) + "99";
        }
        if (DECADE.matcher(year).matches()) {
            return year.substring(0, 3) + "9";
        }
        // ranges resolve to the later year
        if (FULL_RANGE.matcher(year).matches()) {
            return year.split("-")[1].trim().substring(0, 4);
        }
        if (SHORT_RANGE.matcher(year).matches()) {
            final String[] bits = year.split("-");
            return bits[0].trim().substring(0, 2) + bits[1].trim().substring(0, 2);
        }

        final String digitsOnly = year.replaceAll("[^0-9 ]", "");
        String lastYear = null;
        for (final String part : digitsOnly.split(" ")) {
            if (STARTS_WITH_YEAR.matcher(part).matches()) {
                lastYear = part.substring(0, 4);
            }
        }
        if (lastYear != null) {
            return lastYear;
        }

        final String numeralsOnly = year.replaceAll("[^IVXLCDM ]", "");
        int latest = 0;
        for (final String part : numeralsOnly.split(" ")) {
            final int value = romanToArabic(part);
            if (value > 1500 && value > latest) {
                latest = value;
            }
        }
        if (latest > 0) {
            return Integer.toString(latest);
        }
        return year.split(" ")[0];
    }

    static int romanToArabic(final String roman) {
        int value = 0;
        String rest = roman;
        boolean matched = true;
        while (!rest.isEmpty() && matched) {
            matched = false;
            for (final Numeral numeral : NUMERALS) {
                if (rest.startsWith(numeral.symbol())) {
                    value += numeral.value();
                    rest = rest.substring(numeral.symbol().length());
                    matched = true;
                    break;
                }
            }
        }
        return value;
    }

    private record Numeral(String symbol, int value) {
    }
}
