package com.luanvv.listings.extract;

import com.luanvv.listings.model.ListingRecord;
import java.util.List;
import lombok.Value;

@Value
public class ExtractionResult {
    ListingRecord record;
    List<FieldDiagnostic> diagnostics;

    public boolean isDegraded() {
        return !diagnostics.isEmpty();
    }
}
