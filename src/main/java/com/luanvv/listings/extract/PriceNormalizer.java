package com.luanvv.listings.extract;

import com.luanvv.listings.model.PaymentPeriod;
import com.luanvv.listings.model.PropertyType;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns the price block of a detail page into an amount and a payment period. Every input
 * yields a quote: text without digits, or text that cannot be read, is "on request".
 *
 * <p>Sale prices are one-time. Rental and land prices may carry a period after a slash:
 * {@code USD 2,000 / month}. For villas a period missing from the first line is looked up on
 * the next one, where it lands when the block wraps; for land only the first line counts.
 */
@Slf4j
public class PriceNormalizer {

    public PriceQuote normalize(String raw, PropertyType type) {
        if (raw == null || raw.isBlank()) {
            return PriceQuote.ON_REQUEST;
        }
        try {
            return switch (type) {
                case VILLA_SALE -> oneTime(raw);
                case VILLA_RENT -> periodic(raw, 1);
                case LAND -> periodic(raw, 0);
            };
        } catch (RuntimeException e) {
            log.warn("Price text '{}' could not be read, using on request: {}", oneLine(raw), e.toString());
            return PriceQuote.ON_REQUEST;
        }
    }

    private PriceQuote oneTime(String raw) {
        return amount(raw)
            .map(amount -> new PriceQuote(amount, PaymentPeriod.ONE_TIME))
            .orElseGet(() -> onRequest(raw));
    }

    private PriceQuote periodic(String raw, int wrappedPeriodLine) {
        List<String> lines = lines(raw);
        String first = lines.get(0);
        int slash = first.indexOf('/');
        String amountText = slash >= 0 ? first.substring(0, slash) : first;
        Optional<BigDecimal> amount = amount(amountText);
        if (amount.isEmpty()) {
            return onRequest(raw);
        }
        PaymentPeriod period = period(first);
        if (period == PaymentPeriod.ONE_TIME && lines.size() > wrappedPeriodLine && wrappedPeriodLine > 0) {
            period = period(lines.get(wrappedPeriodLine));
        }
        return new PriceQuote(amount.get(), period);
    }

    private static PaymentPeriod period(String line) {
        int slash = line.indexOf('/');
        return slash >= 0 ? PaymentPeriod.periodic(line.substring(slash + 1)) : PaymentPeriod.ONE_TIME;
    }

    private PriceQuote onRequest(String raw) {
        log.debug("No amount in price text '{}', using on request", oneLine(raw));
        return PriceQuote.ON_REQUEST;
    }

    private static Optional<BigDecimal> amount(String text) {
        return Amounts.parseDecimal(text).filter(amount -> amount.signum() > 0);
    }

    private static List<String> lines(String raw) {
        List<String> lines = new ArrayList<>();
        for (String line : raw.strip().split("\\R")) {
            if (!line.isBlank()) {
                lines.add(line.strip());
            }
        }
        return lines;
    }

    private static String oneLine(String raw) {
        return raw.replaceAll("\\R", "\\\\n");
    }
}
