package com.luanvv.listings.crawl;

import com.luanvv.listings.extract.ExtractionResult;
import com.luanvv.listings.model.ListingRecord;
import java.util.List;
import lombok.Value;

/** Everything one crawl produced, in configured target order. */
@Value
public class CrawlBatch {
    List<TargetOutcome> outcomes;

    public List<ListingRecord> records() {
        return outcomes.stream()
            .flatMap(o -> o.getResults().stream())
            .map(ExtractionResult::getRecord)
            .toList();
    }

    public List<String> failedLinks() {
        return outcomes.stream().flatMap(o -> o.getFailedLinks().stream()).toList();
    }

    public int degradedFields() {
        return outcomes.stream().mapToInt(TargetOutcome::degradedFields).sum();
    }
}
