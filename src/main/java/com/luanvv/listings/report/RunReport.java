package com.luanvv.listings.report;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/** Summary of one run, written next to the dataset for whoever repairs extraction rules. */
@Data
public class RunReport {
    private String startedAt;
    private String finishedAt;
    private int datasetSize;
    private int degradedFields;
    private Reconciliation reconciliation = new Reconciliation();
    private List<Target> targets = new ArrayList<>();
    private List<String> failedLinks = new ArrayList<>();

    @Data
    public static class Target {
        private String id;
        private String propertyType;
        private int pages;
        private int links;
        private int recorded;
        private int failed;
        private int degradedFields;
    }

    @Data
    public static class Reconciliation {
        private int created;
        private int updated;
        private int relisted;
        private int unlisted;
        private int dropped;
        private int duplicates;
    }
}
