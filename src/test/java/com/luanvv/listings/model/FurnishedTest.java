package com.luanvv.listings.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class FurnishedTest {

    @ParameterizedTest
    @CsvSource({
        "yes, FURNISHED",
        "Furnish, FURNISHED",
        "FURNISHED, FURNISHED",
        "full, FULLY_FURNISHED",
        "Fully, FULLY_FURNISHED",
        "full furnish, FULLY_FURNISHED",
        "Full  Furnished, FULLY_FURNISHED",
        "no, UNFURNISHED",
        "No Furnish, UNFURNISHED",
        "un-furnish, UNFURNISHED",
        "Unfurnished, UNFURNISHED",
        "semi, SEMI_FURNISHED",
        "Semi-Furnished, SEMI_FURNISHED",
        "semi frunished, SEMI_FURNISHED",
        "SEMI FURNISH, SEMI_FURNISHED",
        "fully-furnished, FULLY_FURNISHED"
    })
    void mapsSiteSpellingsIntoFourBuckets(String raw, Furnished expected) {
        assertEquals(expected, Furnished.normalize(raw));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "partly", "ask agent", "maybe furnished"})
    void unrecognizedTextIsUnknown(String raw) {
        assertEquals(Furnished.UNKNOWN, Furnished.normalize(raw));
    }
}
