package com.rightsparser.util;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DateNormalizer.
 */
class DateNormalizerTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2025-01-01|2025-01-01",
            "15/03/2024|2024-03-15",
            "1-4-2025|2025-04-01",
            "31.12.2031|2031-12-31",
            "2025/06/30|2025-06-30",
            "1 January 2025|2025-01-01",
            "5 Mar 2026|2026-03-05",
            "January 15, 2025|2025-01-15",
            "1st April 2025|2025-04-01",
            "22nd July 2024|2024-07-22"
    })
    void normalize_KnownStyles(String input, String expected) {
        assertThat(DateNormalizer.normalize(input)).contains(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"India", "2,500,000", "5", "5 years", "Sony Pictures Entertainment", "INR 100 crore"})
    void normalize_LeavesOtherValuesAlone(String input) {
        assertThat(DateNormalizer.normalize(input)).isEmpty();
    }
}
