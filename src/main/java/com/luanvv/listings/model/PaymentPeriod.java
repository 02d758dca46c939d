package com.luanvv.listings.model;

import java.util.Locale;
import java.util.Objects;

/**
 * How a price is paid: once, per a period named by the site ({@code year}, {@code month},
 * {@code are / year}...) or not at all because the price is given on request.
 */
public final class PaymentPeriod {

    public enum Kind { ONE_TIME, PERIODIC, ON_REQUEST }

    public static final PaymentPeriod ONE_TIME = new PaymentPeriod(Kind.ONE_TIME, "one time");
    public static final PaymentPeriod ON_REQUEST = new PaymentPeriod(Kind.ON_REQUEST, "on request");

    private final Kind kind;
    private final String label;

    private PaymentPeriod(Kind kind, String label) {
        this.kind = kind;
        this.label = label;
    }

    public static PaymentPeriod periodic(String label) {
        if (label == null || label.isBlank()) {
            return ONE_TIME;
        }
        return new PaymentPeriod(Kind.PERIODIC, label.trim().replaceAll("\\s+", " "));
    }

    public static PaymentPeriod fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return ON_REQUEST;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals(ONE_TIME.label) || normalized.equals("one-time")) return ONE_TIME;
        if (normalized.equals(ON_REQUEST.label) || normalized.equals("on-request")) return ON_REQUEST;
        return periodic(value);
    }

    public Kind kind() {
        return kind;
    }

    public String label() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PaymentPeriod other)) return false;
        return kind == other.kind && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, label);
    }

    @Override
    public String toString() {
        return label;
    }
}
