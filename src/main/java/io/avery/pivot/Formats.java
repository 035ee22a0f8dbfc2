/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.pivot;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAccessor;
import java.time.temporal.TemporalField;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Formats field values for display and for key identity. Formatting follows US conventions regardless of the default
 * locale, so that keys built from formatted values are stable.
 *
 * <p>Number formats are a letter optionally followed by a digit count and trailing commas, each comma scaling the
 * value down by 1000: {@code n} (grouped), {@code f} (fixed), {@code c} (currency), {@code p} (percent), {@code d}
 * (zero-padded integer), {@code g} (general), {@code x} (hexadecimal). Date formats are either one of the standard
 * single-letter formats ({@code d D t T f F g G M m y Y}) or a date pattern, in which double-quoted text is literal.
 * {@link Date} and {@link Instant} values are read in UTC, independent of the default time zone.
 */
final class Formats {
    private Formats() {} // Prevent instantiation
    
    private static final DecimalFormatSymbols SYMBOLS = DecimalFormatSymbols.getInstance(Locale.US);
    private static final Map<String, DateTimeFormatter> DATE_FORMATTERS = new ConcurrentHashMap<>();
    private static final Map<String, List<TemporalField>> DATE_FIELDS = new ConcurrentHashMap<>();
    private static final Map<String, String> STANDARD_DATE_PATTERNS = Map.ofEntries(
        Map.entry("d", "M/d/yyyy"),
        Map.entry("D", "EEEE, MMMM d, yyyy"),
        Map.entry("t", "h:mm a"),
        Map.entry("T", "h:mm:ss a"),
        Map.entry("f", "EEEE, MMMM d, yyyy h:mm a"),
        Map.entry("F", "EEEE, MMMM d, yyyy h:mm:ss a"),
        Map.entry("g", "M/d/yyyy h:mm a"),
        Map.entry("G", "M/d/yyyy h:mm:ss a"),
        Map.entry("M", "MMMM d"),
        Map.entry("m", "MMMM d"),
        Map.entry("y", "MMMM yyyy"),
        Map.entry("Y", "MMMM yyyy")
    );
    
    /**
     * Formats the given value. Strings are returned unchanged, and {@code null} formats as the empty string.
     */
    static String format(Object value, String format) {
        if (value == null)
            return "";
        if (value instanceof String)
            return (String) value;
        if (format == null)
            format = "";
        if (value instanceof Number)
            return formatNumber((Number) value, format);
        if (Utils.isDate(value))
            return formatDate(value, format);
        return String.valueOf(value);
    }
    
    // --- numbers ---
    
    private static String formatNumber(Number number, String format) {
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value))
            return String.valueOf(value);
        if (format.isEmpty())
            return general(number);
        
        char type = Character.toLowerCase(format.charAt(0));
        int i = 1;
        while (i < format.length() && Character.isDigit(format.charAt(i)))
            i++;
        Integer digits = i > 1 ? Integer.valueOf(format.substring(1, i)) : null;
        for (; i < format.length() && format.charAt(i) == ','; i++)
            value /= 1000;
        
        switch (type) {
            case 'n': return decimal("#,##0", digits != null ? digits : 2).format(value);
            case 'f': return decimal("0", digits != null ? digits : 2).format(value);
            case 'c': return decimal("$#,##0", digits != null ? digits : 2).format(value);
            case 'p': return decimal("#,##0", digits != null ? digits : 2, "%").format(value);
            case 'd': {
                String s = Long.toString(Math.abs(Math.round(value)));
                StringBuilder sb = new StringBuilder(value < 0 && Math.round(value) != 0 ? "-" : "");
                for (int pad = digits != null ? digits - s.length() : 0; pad > 0; pad--)
                    sb.append('0');
                return sb.append(s).toString();
            }
            case 'x': {
                String s = Long.toHexString(Math.round(value));
                StringBuilder sb = new StringBuilder();
                for (int pad = digits != null ? digits - s.length() : 0; pad > 0; pad--)
                    sb.append('0');
                return sb.append(s).toString();
            }
            case 'g':
                if (digits != null && digits > 0)
                    return new BigDecimal(value).round(new MathContext(digits, RoundingMode.HALF_UP))
                        .stripTrailingZeros().toPlainString();
                return general(value);
            default:
                return general(number);
        }
    }
    
    private static DecimalFormat decimal(String integerPattern, int digits) {
        return decimal(integerPattern, digits, "");
    }
    
    private static DecimalFormat decimal(String integerPattern, int digits, String suffix) {
        StringBuilder pattern = new StringBuilder(integerPattern);
        if (digits > 0) {
            pattern.append('.');
            for (int i = 0; i < digits; i++)
                pattern.append('0');
        }
        DecimalFormat df = new DecimalFormat(pattern.append(suffix).toString(), SYMBOLS);
        df.setRoundingMode(RoundingMode.HALF_UP);
        return df;
    }
    
    private static String general(Number number) {
        if (number instanceof Integer || number instanceof Long || number instanceof Short || number instanceof Byte)
            return number.toString();
        double value = number.doubleValue();
        if (Double.isNaN(value) || Double.isInfinite(value))
            return String.valueOf(value);
        if (value == Math.rint(value) && Math.abs(value) < 1e15)
            return Long.toString((long) value);
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
    
    // --- dates ---
    
    private static String formatDate(Object value, String format) {
        TemporalAccessor temporal = toTemporal(value);
        try {
            return DATE_FORMATTERS.computeIfAbsent(format, f -> DateTimeFormatter.ofPattern(datePattern(f), Locale.US))
                .format(temporal);
        } catch (DateTimeException | IllegalArgumentException e) {
            // The pattern asks for fields this value does not carry, or is not a valid pattern
            return String.valueOf(value);
        }
    }
    
    /**
     * Returns {@code true} if values in the given date format sort in plain chronological order.
     */
    static boolean isChronologicalDateFormat(String format) {
        return format == null || format.isEmpty() || format.equals("d") || format.equals("D");
    }
    
    /**
     * Compares two dates considering only the calendar fields that the given format displays, from most to least
     * significant. Fields that either value does not carry are ignored.
     */
    static int compareDates(Object a, Object b, String format) {
        TemporalAccessor ta = toTemporal(a);
        TemporalAccessor tb = toTemporal(b);
        if (isChronologicalDateFormat(format))
            return Utils.VALUE_COMPARATOR.compare(comparable(ta), comparable(tb));
        List<TemporalField> fields = DATE_FIELDS.computeIfAbsent(format, f -> displayedFields(datePattern(f)));
        for (TemporalField field : fields) {
            if (!ta.isSupported(field) || !tb.isSupported(field))
                continue;
            int cmp = Long.compare(ta.getLong(field), tb.getLong(field));
            if (cmp != 0)
                return cmp;
        }
        return 0;
    }
    
    private static Object comparable(TemporalAccessor temporal) {
        return temporal instanceof Comparable ? temporal : temporal.toString();
    }
    
    static TemporalAccessor toTemporal(Object value) {
        if (value instanceof Date)
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(((Date) value).getTime()), ZoneOffset.UTC);
        if (value instanceof Instant)
            return LocalDateTime.ofInstant((Instant) value, ZoneOffset.UTC);
        return (TemporalAccessor) value;
    }
    
    /**
     * Converts a standard or custom date format into a {@link DateTimeFormatter} pattern. Double-quoted literals become
     * single-quoted literals; {@code ddd}/{@code dddd} (day names), {@code tt} (AM/PM) and {@code fff} (fractional
     * seconds) are translated to their {@code DateTimeFormatter} equivalents.
     */
    static String datePattern(String format) {
        if (format.isEmpty())
            return STANDARD_DATE_PATTERNS.get("d");
        String standard = STANDARD_DATE_PATTERNS.get(format);
        if (standard != null)
            return standard;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < format.length(); ) {
            char c = format.charAt(i);
            if (c == '"' || c == '\'') {
                int end = format.indexOf(c, i + 1);
                if (end < 0)
                    end = format.length();
                String literal = format.substring(i + 1, end);
                sb.append('\'').append(literal.replace("'", "''")).append('\'');
                i = end + 1;
                continue;
            }
            int run = i;
            while (run < format.length() && format.charAt(run) == c)
                run++;
            int len = run - i;
            if (c == 'd' && len >= 3)
                sb.append(len == 3 ? "EEE" : "EEEE");
            else if (c == 't')
                sb.append('a');
            else if (c == 'f')
                sb.append("S".repeat(len));
            else
                sb.append(format, i, run);
            i = run;
        }
        return sb.toString();
    }
    
    private static List<TemporalField> displayedFields(String pattern) {
        Set<TemporalField> found = new HashSet<>();
        boolean quoted = false;
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '\'') {
                quoted = !quoted;
                continue;
            }
            if (quoted)
                continue;
            switch (c) {
                case 'y': case 'u': case 'Y': found.add(ChronoField.YEAR); break;
                case 'Q': case 'q': found.add(IsoFields.QUARTER_OF_YEAR); break;
                case 'M': case 'L': found.add(ChronoField.MONTH_OF_YEAR); break;
                case 'd': found.add(ChronoField.DAY_OF_MONTH); break;
                case 'E': case 'e': case 'c': found.add(ChronoField.DAY_OF_WEEK); break;
                case 'H': case 'h': case 'k': case 'K': found.add(ChronoField.HOUR_OF_DAY); break;
                case 'm': found.add(ChronoField.MINUTE_OF_HOUR); break;
                case 's': found.add(ChronoField.SECOND_OF_MINUTE); break;
                default: break;
            }
        }
        List<TemporalField> ordered = new ArrayList<>();
        for (TemporalField field : SIGNIFICANCE)
            if (found.contains(field))
                ordered.add(field);
        return ordered;
    }
    
    private static final List<TemporalField> SIGNIFICANCE = List.of(
        ChronoField.YEAR,
        IsoFields.QUARTER_OF_YEAR,
        ChronoField.MONTH_OF_YEAR,
        ChronoField.DAY_OF_MONTH,
        ChronoField.DAY_OF_WEEK,
        ChronoField.HOUR_OF_DAY,
        ChronoField.MINUTE_OF_HOUR,
        ChronoField.SECOND_OF_MINUTE
    );
}
