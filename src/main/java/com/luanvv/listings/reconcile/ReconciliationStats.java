package com.luanvv.listings.reconcile;

import lombok.Data;

@Data
public class ReconciliationStats {
    private int created;
    private int updated;
    private int relisted;
    private int unlisted;
    private int dropped;
    private int duplicates;

    void recordCreated() { created++; }
    void recordUpdated() { updated++; }
    void recordRelisted() { relisted++; }
    void recordUnlisted() { unlisted++; }
    void recordDropped() { dropped++; }
    void recordDuplicate() { duplicates++; }
}
