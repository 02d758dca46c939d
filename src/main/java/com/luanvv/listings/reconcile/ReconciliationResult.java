package com.luanvv.listings.reconcile;

import com.luanvv.listings.model.Dataset;
import java.time.LocalDateTime;
import lombok.Value;

@Value
public class ReconciliationResult {
    Dataset dataset;
    ReconciliationStats stats;
    LocalDateTime runTime;
}
