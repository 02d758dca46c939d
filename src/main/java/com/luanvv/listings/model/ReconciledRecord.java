package com.luanvv.listings.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A listing with its provenance across runs. {@code firstSeenAt} and the original prices
 * are captured once and carried forward untouched by every later reconciliation.
 */
@Value
@Builder(toBuilder = true)
public class ReconciledRecord {
    ListingRecord listing;
    LocalDateTime firstSeenAt;
    LocalDateTime lastSeenAt;
    BigDecimal originalPriceLocal;
    BigDecimal originalPriceUsd;
    ListedState listedState;

    public String getCode() {
        return listing.getCode();
    }

    public static ReconciledRecord firstSeen(ListingRecord listing, LocalDateTime now) {
        return ReconciledRecord.builder()
            .listing(listing)
            .firstSeenAt(now)
            .lastSeenAt(now)
            .originalPriceLocal(listing.getPriceLocal())
            .originalPriceUsd(listing.getPriceUsd())
            .listedState(ListedState.LISTED)
            .build();
    }
}
