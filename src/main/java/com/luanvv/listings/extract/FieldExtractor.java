package com.luanvv.listings.extract;

import com.luanvv.listings.model.Furnished;
import com.luanvv.listings.model.ListingRecord;
import com.luanvv.listings.model.PropertyType;
import com.luanvv.listings.model.SaleType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link ListingRecord} from the two renderings of a detail page, one per currency.
 * A field that cannot be read falls back to its unknown sentinel and is reported as a
 * {@link FieldDiagnostic}; it never stops the other fields from being read.
 */
@Slf4j
@RequiredArgsConstructor
public class FieldExtractor {
    private final PriceNormalizer priceNormalizer;

    public FieldExtractor() {
        this(new PriceNormalizer());
    }

    public ExtractionResult extract(DetailView local, DetailView usd, PropertyType type) {
        List<FieldDiagnostic> diagnostics = new ArrayList<>();
        ListingRecord.ListingRecordBuilder builder = ListingRecord.builder()
            .propertyType(type)
            .url(local.getUrl());

        builder.code(read("code", local, ExtractionRules.CODE, null, diagnostics));
        builder.title(read("title", local, ExtractionRules.TITLE, "", diagnostics));
        builder.location(read("location", local, ExtractionRules.LOCATION, ExtractionRules.UNKNOWN, diagnostics));

        // rentals carry no sale type on the site
        if (type != PropertyType.VILLA_RENT) {
            SaleType saleType = read("saleType", local, ExtractionRules.SALE_TYPE, SaleType.UNKNOWN, diagnostics);
            builder.saleType(saleType);
            if (saleType == SaleType.LEASEHOLD) {
                builder.leaseYears(read("leaseYears", local, ExtractionRules.LEASE_YEARS, null, diagnostics));
            }
        }

        DescriptionLayout layout = DescriptionLayout.select(type, local);
        builder.yearBuilt(read("yearBuilt", local, layout::yearBuilt, ExtractionRules.UNKNOWN, diagnostics));
        builder.landSize(read("landSize", local, layout::landSize, null, diagnostics));
        if (layout.hasBuildingSize()) {
            builder.buildingSize(read("buildingSize", local, layout::buildingSize, null, diagnostics));
        }
        builder.furnished(read("furnished", local, layout::furnished, Furnished.UNKNOWN, diagnostics));

        if (type.isVilla()) {
            builder.bedrooms(read("bedrooms", local, ExtractionRules.BEDROOMS, null, diagnostics));
            builder.bathrooms(read("bathrooms", local, ExtractionRules.BATHROOMS, null, diagnostics));
            builder.pool(read("pool", local, ExtractionRules.POOL, false, diagnostics));
        }

        PriceQuote localPrice = priceNormalizer.normalize(local.getPriceText(), type);
        PriceQuote usdPrice = usd == null ? PriceQuote.ON_REQUEST : priceNormalizer.normalize(usd.getPriceText(), type);
        builder.priceLocal(localPrice.getAmount())
            .paymentPeriodLocal(localPrice.getPeriod())
            .priceUsd(usdPrice.getAmount())
            .paymentPeriodUsd(usdPrice.getPeriod());

        ListingRecord record = builder.build();
        for (FieldDiagnostic diagnostic : diagnostics) {
            log.warn("{} [{}] degraded {}", record.getUrl(), record.getCode(), diagnostic);
        }
        return new ExtractionResult(record, List.copyOf(diagnostics));
    }

    private static <T> T read(String field, DetailView view, Function<DetailView, FieldValue<T>> rule, T fallback,
                              List<FieldDiagnostic> diagnostics) {
        FieldValue<T> value = rule.apply(view);
        if (value.isPresent()) {
            return value.getValue() != null ? value.getValue() : fallback;
        }
        diagnostics.add(new FieldDiagnostic(field, value.getRaw(), value.getProblem()));
        return fallback;
    }
}
