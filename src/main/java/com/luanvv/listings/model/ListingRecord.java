package com.luanvv.listings.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * One property as extracted from its detail page during a crawl. Nullable fields hold
 * {@code null} when the page does not carry them; prices use zero for "on request".
 */
@Value
@Builder(toBuilder = true)
public class ListingRecord {
    String title;
    String code;
    @Builder.Default String location = "Unknown";
    PropertyType propertyType;
    @Builder.Default SaleType saleType = SaleType.UNKNOWN;
    Integer leaseYears;
    String url;
    String yearBuilt;
    Integer bedrooms;
    Integer bathrooms;
    BigDecimal landSize;
    BigDecimal buildingSize;
    boolean pool;
    @Builder.Default Furnished furnished = Furnished.UNKNOWN;
    @Builder.Default BigDecimal priceLocal = BigDecimal.ZERO;
    @Builder.Default BigDecimal priceUsd = BigDecimal.ZERO;
    @Builder.Default PaymentPeriod paymentPeriodLocal = PaymentPeriod.ON_REQUEST;
    @Builder.Default PaymentPeriod paymentPeriodUsd = PaymentPeriod.ON_REQUEST;

    public boolean hasCode() {
        return code != null && !code.isBlank();
    }
}
