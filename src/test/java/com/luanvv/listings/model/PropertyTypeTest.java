package com.luanvv.listings.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class PropertyTypeTest {

    @Test
    void derivesTypeFromListingUrl() {
        assertEquals(PropertyType.VILLA_SALE, PropertyType.fromUrl("https://site.com/search/villas-for-sale?page=2"));
        assertEquals(PropertyType.VILLA_RENT, PropertyType.fromUrl("https://site.com/search/villas-for-rent"));
        assertEquals(PropertyType.LAND, PropertyType.fromUrl("https://site.com/search/land-for-sale"));
    }

    @Test
    void rejectsUrlWithoutTypeToken() {
        assertThrows(IllegalArgumentException.class, () -> PropertyType.fromUrl("https://site.com/search/offices"));
    }

    @Test
    void parsesLabelsAndEnumNames() {
        assertEquals(PropertyType.VILLA_RENT, PropertyType.fromLabel("villa-rent"));
        assertEquals(PropertyType.VILLA_SALE, PropertyType.fromLabel("VILLA_SALE"));
        assertEquals(PropertyType.LAND, PropertyType.fromLabel(" Land "));
    }

    @Test
    void saleTypeKeywordsGainHoldSuffix() {
        assertEquals(SaleType.LEASEHOLD, SaleType.fromKeyword("lease"));
        assertEquals(SaleType.FREEHOLD, SaleType.fromKeyword("Free"));
        assertEquals(SaleType.FREEHOLD, SaleType.fromKeyword("freehold"));
        assertEquals(SaleType.UNKNOWN, SaleType.fromKeyword("yearly"));
        assertEquals(SaleType.UNKNOWN, SaleType.fromKeyword(""));
    }

    @Test
    void paymentPeriodLabelsRoundTrip() {
        assertEquals(PaymentPeriod.ONE_TIME, PaymentPeriod.fromLabel("one time"));
        assertEquals(PaymentPeriod.ON_REQUEST, PaymentPeriod.fromLabel("on request"));
        assertEquals(PaymentPeriod.ON_REQUEST, PaymentPeriod.fromLabel(""));
        assertEquals(PaymentPeriod.periodic("year"), PaymentPeriod.fromLabel("year"));
        assertEquals(PaymentPeriod.Kind.PERIODIC, PaymentPeriod.fromLabel(" month ").kind());
        assertEquals("month", PaymentPeriod.fromLabel(" month ").label());
    }
}
