package com.luanvv.listings.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class AmountsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "Rp 2.500.000.000 | 2500000000",
        "IDR 500.000      | 500000",
        "USD 1,250,000    | 1250000",
        "USD 33,000.50    | 33000.50",
        "$ 450.5          | 450.5",
        "4.5              | 4.5",
        "250              | 250",
        "Rp. 5.000        | 5000",
        "1.234.567,89     | 1234567.89"
    })
    void readsSiteNumberFormats(String text, String expected) {
        assertEquals(new BigDecimal(expected), Amounts.parseDecimal(text).orElseThrow());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Price on Request", "", "-", "..", "USD"})
    void noDigitsMeansNoAmount(String text) {
        assertTrue(Amounts.parseDecimal(text).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({"3, 3", "'Bedrooms 4', 4", "'25 years', 25"})
    void readsFirstInteger(String text, int expected) {
        assertEquals(expected, Amounts.parseInteger(text).orElseThrow());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "2.575       | 2.575",
        "4.5 are     | 4.5",
        "1,250.5 sqm | 1250.5",
        "1,250       | 1250",
        "300         | 300"
    })
    void sizesUseTheDotAsDecimalPoint(String text, String expected) {
        assertEquals(new BigDecimal(expected), Amounts.parseMeasure(text).orElseThrow());
    }
}
