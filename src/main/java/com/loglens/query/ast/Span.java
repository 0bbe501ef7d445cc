package com.loglens.query.ast;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Bucket width for {@code bin} and {@code timechart}: either a time span
 * such as {@code 5m} or a plain number for numeric buckets.
 */
public final class Span {

    private static final Pattern TIME = Pattern.compile("(\\d{1,9})([smhdw])");
    private static final Pattern NUMERIC = Pattern.compile("\\d{1,15}(\\.\\d{1,9})?");

    /**
     * Units accepted in time spans, with their ClickHouse interval keyword.
     */
    public enum Unit {
        SECOND('s'),
        MINUTE('m'),
        HOUR('h'),
        DAY('d'),
        WEEK('w');

        private final char symbol;

        Unit(char symbol) {
            this.symbol = symbol;
        }

        public char getSymbol() {
            return symbol;
        }

        static Unit fromSymbol(char symbol) {
            for (Unit unit : values()) {
                if (unit.symbol == symbol) {
                    return unit;
                }
            }
            throw new IllegalArgumentException("Unknown span unit '" + symbol + "'");
        }
    }

    private final BigDecimal amount;
    private final Unit unit;

    private Span(BigDecimal amount, Unit unit) {
        this.amount = amount;
        this.unit = unit;
    }

    public static Span ofTime(long amount, Unit unit) {
        if (amount <= 0) {
            throw new IllegalArgumentException("Span must be positive: " + amount);
        }
        return new Span(BigDecimal.valueOf(amount), unit);
    }

    /**
     * @return the span, or empty when the text is neither a positive time
     *         span nor a positive number
     */
    public static Optional<Span> parse(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        Matcher time = TIME.matcher(lower);
        if (time.matches()) {
            long amount = Long.parseLong(time.group(1));
            return amount == 0 ? Optional.empty()
                : Optional.of(ofTime(amount, Unit.fromSymbol(time.group(2).charAt(0))));
        }
        if (NUMERIC.matcher(lower).matches()) {
            BigDecimal amount = new BigDecimal(lower).stripTrailingZeros();
            return amount.signum() > 0 ? Optional.of(new Span(amount, null)) : Optional.empty();
        }
        return Optional.empty();
    }

    public boolean isTime() {
        return unit != null;
    }

    /**
     * The amount as a plain decimal, ready to embed in SQL.
     */
    public String getAmountText() {
        return amount.toPlainString();
    }

    /**
     * Unit of a time span; null for numeric spans.
     */
    public Unit getUnit() {
        return unit;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Span)) return false;
        Span that = (Span) o;
        return amount.compareTo(that.amount) == 0 && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return 31 * amount.stripTrailingZeros().hashCode() + (unit == null ? 0 : unit.hashCode());
    }

    @Override
    public String toString() {
        return isTime() ? getAmountText() + unit.getSymbol() : getAmountText();
    }
}
