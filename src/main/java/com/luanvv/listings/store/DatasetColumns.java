package com.luanvv.listings.store;

import com.luanvv.listings.model.Furnished;
import com.luanvv.listings.model.ListedState;
import com.luanvv.listings.model.ListingRecord;
import com.luanvv.listings.model.PaymentPeriod;
import com.luanvv.listings.model.PropertyType;
import com.luanvv.listings.model.ReconciledRecord;
import com.luanvv.listings.model.SaleType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;

/**
 * Column contract of the stored dataset. Downstream consumers read the sheet by position,
 * so the order below must only change together with {@link #VERSION}.
 */
@Slf4j
public final class DatasetColumns {
    public static final int VERSION = 1;

    public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String UNKNOWN = "Unknown";

    public static final List<String> HEADERS = List.of(
        "Title",
        "Code",
        "First Scrape Date",
        "Last Scrape Date",
        "Listed",
        "Original Price (USD)",
        "Last Price (USD)",
        "Payment Period (USD)",
        "Original Price (IDR)",
        "Last Price (IDR)",
        "Payment Period (IDR)",
        "Location",
        "Type of Sale",
        "Lease Years",
        "URL",
        "Property Type",
        "Year Built",
        "Bedrooms",
        "Bathrooms",
        "Land Size (are)",
        "Building Size (sqm)",
        "Pool",
        "Furnished");

    private DatasetColumns() {
    }

    public static String[] toRow(ReconciledRecord record) {
        ListingRecord l = record.getListing();
        return new String[] {
            text(l.getTitle()),
            l.getCode(),
            timestamp(record.getFirstSeenAt()),
            timestamp(record.getLastSeenAt()),
            record.getListedState().label(),
            number(record.getOriginalPriceUsd()),
            number(l.getPriceUsd()),
            l.getPaymentPeriodUsd().label(),
            number(record.getOriginalPriceLocal()),
            number(l.getPriceLocal()),
            l.getPaymentPeriodLocal().label(),
            l.getLocation() == null ? UNKNOWN : l.getLocation(),
            l.getSaleType().label(),
            number(l.getLeaseYears()),
            text(l.getUrl()),
            l.getPropertyType().label(),
            l.getYearBuilt() == null ? UNKNOWN : l.getYearBuilt(),
            number(l.getBedrooms()),
            number(l.getBathrooms()),
            number(l.getLandSize()),
            number(l.getBuildingSize()),
            l.isPool() ? "Yes" : "No",
            l.getFurnished().label()
        };
    }

    /**
     * @throws IllegalArgumentException when the row cannot be turned into a record
     */
    public static ReconciledRecord fromRow(String[] row) {
        if (row.length < HEADERS.size()) {
            throw new IllegalArgumentException("Expected " + HEADERS.size() + " columns, got " + row.length);
        }
        String code = row[1].trim();
        if (code.isEmpty()) {
            throw new IllegalArgumentException("Row without code");
        }
        ListingRecord listing = ListingRecord.builder()
            .title(row[0])
            .code(code)
            .priceUsd(decimalOrZero(row[6]))
            .paymentPeriodUsd(PaymentPeriod.fromLabel(row[7]))
            .priceLocal(decimalOrZero(row[9]))
            .paymentPeriodLocal(PaymentPeriod.fromLabel(row[10]))
            .location(row[11].isBlank() ? UNKNOWN : row[11])
            .saleType(SaleType.fromKeyword(row[12]))
            .leaseYears(integer(row[13]))
            .url(row[14])
            .propertyType(PropertyType.fromLabel(propertyTypeLabel(row[15], row[14])))
            .yearBuilt(row[16].isBlank() ? UNKNOWN : row[16])
            .bedrooms(integer(row[17]))
            .bathrooms(integer(row[18]))
            .landSize(decimal(row[19]))
            .buildingSize(decimal(row[20]))
            .pool(row[21].trim().toLowerCase(Locale.ROOT).matches("yes|true|y"))
            .furnished(Furnished.normalize(row[22]))
            .build();
        return ReconciledRecord.builder()
            .listing(listing)
            .firstSeenAt(parseTimestamp(row[2]))
            .lastSeenAt(parseTimestamp(row[3]))
            .listedState(ListedState.fromLabel(row[4]))
            .originalPriceUsd(decimalOrZero(row[5]))
            .originalPriceLocal(decimalOrZero(row[8]))
            .build();
    }

    public static String timestamp(LocalDateTime time) {
        return time == null ? "" : TIMESTAMP.format(time);
    }

    /** Also accepts a bare date, as left behind when the sheet is edited by hand. */
    static LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String text = value.trim();
        try {
            return LocalDateTime.parse(text, TIMESTAMP);
        } catch (DateTimeParseException e) {
            try {
                return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE).atStartOfDay();
            } catch (DateTimeParseException dateOnly) {
                throw new IllegalArgumentException("Bad timestamp '" + value + "'", e);
            }
        }
    }

    // older sheets used "villa" for both sale and rent listings, most of them sales
    private static String propertyTypeLabel(String value, String url) {
        if (!"villa".equalsIgnoreCase(value.trim())) {
            return value;
        }
        try {
            return PropertyType.fromUrl(url).label();
        } catch (IllegalArgumentException e) {
            log.warn("Legacy villa row with URL '{}' read as {}", url, PropertyType.VILLA_SALE.label());
            return PropertyType.VILLA_SALE.label();
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    private static String number(Number value) {
        if (value == null) return "";
        if (value instanceof BigDecimal decimal) return decimal.toPlainString();
        return value.toString();
    }

    private static BigDecimal decimal(String value) {
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase(UNKNOWN)) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non numeric value '{}'", value);
            return null;
        }
    }

    private static BigDecimal decimalOrZero(String value) {
        BigDecimal decimal = decimal(value);
        return decimal == null ? BigDecimal.ZERO : decimal;
    }

    private static Integer integer(String value) {
        BigDecimal decimal = decimal(value);
        return decimal == null ? null : decimal.intValue();
    }
}
