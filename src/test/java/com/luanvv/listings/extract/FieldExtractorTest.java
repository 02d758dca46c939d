package com.luanvv.listings.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.luanvv.listings.Fixtures;
import com.luanvv.listings.model.Furnished;
import com.luanvv.listings.model.ListingRecord;
import com.luanvv.listings.model.PaymentPeriod;
import com.luanvv.listings.model.PropertyType;
import com.luanvv.listings.model.SaleType;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class FieldExtractorTest {
    private static final String URL = "https://www.example.com/villa/modern-villa-v100";

    private final FieldExtractor extractor = new FieldExtractor();

    private ExtractionResult extract(String fixture, String usdPrice, PropertyType type) {
        String html = Fixtures.html(fixture);
        return extractor.extract(
            DetailView.parse(html, URL),
            DetailView.parse(Fixtures.withPrice(html, usdPrice), URL),
            type);
    }

    private static List<String> degradedFields(ExtractionResult result) {
        return result.getDiagnostics().stream().map(FieldDiagnostic::getField).toList();
    }

    @Test
    void villaForSaleWithYearBuilt() {
        ExtractionResult result = extract("villa-sale-year-built.html", "USD 350,000", PropertyType.VILLA_SALE);
        ListingRecord record = result.getRecord();

        assertEquals("V100", record.getCode());
        assertEquals("Modern Villa in Canggu", record.getTitle());
        assertEquals("Canggu", record.getLocation());
        assertEquals(URL, record.getUrl());
        assertEquals(SaleType.LEASEHOLD, record.getSaleType());
        assertEquals(25, record.getLeaseYears());
        assertEquals("2019", record.getYearBuilt());
        assertEquals(new BigDecimal("4.5"), record.getLandSize());
        assertEquals(new BigDecimal("250"), record.getBuildingSize());
        assertEquals(Furnished.FULLY_FURNISHED, record.getFurnished());
        assertEquals(3, record.getBedrooms());
        assertEquals(2, record.getBathrooms());
        assertTrue(record.isPool());
        assertEquals(new BigDecimal("5250000000"), record.getPriceLocal());
        assertEquals(PaymentPeriod.ONE_TIME, record.getPaymentPeriodLocal());
        assertEquals(new BigDecimal("350000"), record.getPriceUsd());
        assertEquals(PaymentPeriod.ONE_TIME, record.getPaymentPeriodUsd());
        assertFalse(result.isDegraded(), () -> result.getDiagnostics().toString());
    }

    @Test
    void villaForSaleWithoutYearBuiltReadsShiftedOffsets() {
        ExtractionResult result = extract("villa-sale-no-year-built.html", "USD 199,000", PropertyType.VILLA_SALE);
        ListingRecord record = result.getRecord();

        assertEquals("V200", record.getCode());
        assertEquals("Unknown", record.getLocation());
        assertEquals(SaleType.FREEHOLD, record.getSaleType());
        assertNull(record.getLeaseYears());
        assertEquals("Unknown", record.getYearBuilt());
        assertEquals(new BigDecimal("6"), record.getLandSize());
        assertEquals(new BigDecimal("320"), record.getBuildingSize());
        assertEquals(Furnished.SEMI_FURNISHED, record.getFurnished());
        assertEquals(4, record.getBedrooms());
        assertFalse(record.isPool());
        assertFalse(result.isDegraded(), () -> result.getDiagnostics().toString());
    }

    @Test
    void villaForRentFallsBackToNextBuildingSizeItem() {
        ExtractionResult result = extract("villa-rent.html", "USD 24,000 / year", PropertyType.VILLA_RENT);
        ListingRecord record = result.getRecord();

        assertEquals("R300", record.getCode());
        assertEquals(SaleType.UNKNOWN, record.getSaleType());
        assertNull(record.getLeaseYears());
        assertEquals(new BigDecimal("3.2"), record.getLandSize());
        assertEquals(new BigDecimal("180"), record.getBuildingSize());
        assertEquals(Furnished.UNKNOWN, record.getFurnished());
        assertEquals(2, record.getBedrooms());
        assertEquals(3, record.getBathrooms());
        assertTrue(record.isPool());
        assertEquals(new BigDecimal("350000000"), record.getPriceLocal());
        assertEquals(PaymentPeriod.periodic("year"), record.getPaymentPeriodLocal());
        assertEquals(new BigDecimal("24000"), record.getPriceUsd());
        assertEquals(PaymentPeriod.periodic("year"), record.getPaymentPeriodUsd());
        assertFalse(result.isDegraded(), () -> result.getDiagnostics().toString());
    }

    @Test
    void fractionalAreIsNotReadAsThousands() {
        String html = Fixtures.html("villa-sale-year-built.html").replace("4.5</p>", "2.575</p>");
        DetailView view = DetailView.parse(html, URL);

        ListingRecord record = extractor.extract(view, view, PropertyType.VILLA_SALE).getRecord();

        assertEquals(new BigDecimal("2.575"), record.getLandSize());
    }

    @Test
    void poolViewIsNotAPool() {
        String html = Fixtures.html("villa-sale-year-built.html").replace("<i>pool</i>Pool", "<i>view</i>Pool View");
        DetailView view = DetailView.parse(html, URL);

        assertFalse(extractor.extract(view, view, PropertyType.VILLA_SALE).getRecord().isPool());
    }

    @Test
    void landHasNoRoomsOrBuilding() {
        ExtractionResult result = extract("land.html", "USD 780 / are / year", PropertyType.LAND);
        ListingRecord record = result.getRecord();

        assertEquals("L400", record.getCode());
        assertEquals(PropertyType.LAND, record.getPropertyType());
        assertEquals(SaleType.LEASEHOLD, record.getSaleType());
        assertEquals(30, record.getLeaseYears());
        assertEquals(new BigDecimal("15"), record.getLandSize());
        assertNull(record.getBuildingSize());
        assertNull(record.getBedrooms());
        assertNull(record.getBathrooms());
        assertFalse(record.isPool());
        assertEquals(Furnished.UNFURNISHED, record.getFurnished());
        assertEquals(new BigDecimal("12000000"), record.getPriceLocal());
        assertEquals(PaymentPeriod.periodic("are / year"), record.getPaymentPeriodLocal());
        assertEquals(new BigDecimal("780"), record.getPriceUsd());
        assertFalse(result.isDegraded(), () -> result.getDiagnostics().toString());
    }

    @Test
    void missingBlocksDegradeFieldByFieldWithoutAbortingTheRecord() {
        String html = """
            <html><body>
            <h1 class="name">Half rendered</h1>
            <span class="code">V900</span>
            <div class="regular-price">Price on Request</div>
            <div class="property-description-row flexbox">
            <p>Type
            Villa</p>
            <p>Status
            Leasehold</p>
            <p>Area
            Canggu</p>
            <p>Land Size
            n/a</p>
            </div>
            </body></html>
            """;
        DetailView view = DetailView.parse(html, URL);
        ExtractionResult result = extractor.extract(view, view, PropertyType.VILLA_SALE);
        ListingRecord record = result.getRecord();

        assertEquals("V900", record.getCode());
        assertEquals("Half rendered", record.getTitle());
        assertEquals("Unknown", record.getLocation());
        assertEquals(SaleType.UNKNOWN, record.getSaleType());
        assertNull(record.getLandSize());
        assertNull(record.getBuildingSize());
        assertEquals(Furnished.UNKNOWN, record.getFurnished());
        assertNull(record.getBedrooms());
        assertEquals(BigDecimal.ZERO, record.getPriceLocal());
        assertEquals(PaymentPeriod.ON_REQUEST, record.getPaymentPeriodUsd());

        List<String> degraded = degradedFields(result);
        assertTrue(degraded.containsAll(List.of(
            "location", "saleType", "landSize", "buildingSize", "furnished", "bedrooms", "bathrooms")), degraded::toString);
        FieldDiagnostic landSize = result.getDiagnostics().stream()
            .filter(d -> d.getField().equals("landSize")).findFirst().orElseThrow();
        assertEquals("n/a", landSize.getRaw());
    }

    @Test
    void unrecognizedFurnishedTextIsReportedWithRawText() {
        String html = Fixtures.html("villa-sale-year-built.html").replace("full furnished", "ask the agent");
        DetailView view = DetailView.parse(html, URL);
        ExtractionResult result = extractor.extract(view, view, PropertyType.VILLA_SALE);

        assertEquals(Furnished.UNKNOWN, result.getRecord().getFurnished());
        assertEquals(List.of("furnished"), degradedFields(result));
        assertEquals("ask the agent", result.getDiagnostics().get(0).getRaw());
    }

    @Test
    void missingCodeIsReportedNotThrown() {
        String html = Fixtures.html("land.html").replace("<span class=\"code\">L400</span>", "");
        DetailView view = DetailView.parse(html, URL);
        ExtractionResult result = extractor.extract(view, view, PropertyType.LAND);

        assertFalse(result.getRecord().hasCode());
        assertEquals(List.of("code"), degradedFields(result));
    }
}
