package com.luanvv.listings.extract;

import lombok.Value;

/** A field that fell back to its unknown sentinel, kept for repairing extraction rules. */
@Value
public class FieldDiagnostic {
    String field;
    String raw;
    String problem;

    @Override
    public String toString() {
        return field + ": " + problem + (raw != null ? " (raw='" + raw.replace("\n", "\\n") + "')" : "");
    }
}
