package com.luanvv.listings.crawl;

import com.luanvv.listings.extract.ExtractionResult;
import com.luanvv.listings.model.PropertyType;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class TargetOutcome {
    private final String targetId;
    private final PropertyType propertyType;
    private int pages;
    private int links;
    private final List<ExtractionResult> results = new ArrayList<>();
    private final List<String> failedLinks = new ArrayList<>();

    public int degradedFields() {
        return results.stream().mapToInt(r -> r.getDiagnostics().size()).sum();
    }
}
