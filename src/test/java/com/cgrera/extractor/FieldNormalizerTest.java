package com.cgrera.extractor;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;

public class FieldNormalizerTest {
    private final FieldNormalizer normalizer = new FieldNormalizer();

    @Test
    void testNormalizeDateFormats() {
        assertEquals(Optional.of("2024-03-15"), normalizer.normalizeDate("15/03/2024"));
        assertEquals(Optional.of("2023-02-01"), normalizer.normalizeDate("01-02-2023"));
        assertEquals(Optional.of("2024-03-15"), normalizer.normalizeDate("2024-03-15"));
        assertEquals(Optional.of("2024-03-15"), normalizer.normalizeDate("15 Mar 2024"));
        assertEquals(Optional.of("2025-12-05"), normalizer.normalizeDate("5 December 2025"));
    }

    @Test
    void testNormalizeDateFindsEmbeddedDate() {
        assertEquals(Optional.of("2026-12-31"), normalizer.normalizeDate("Valid till 31/12/2026"));
    }

    @Test
    void testNormalizeDateRejectsUnparseableValues() {
        assertTrue(normalizer.normalizeDate("not-a-date").isEmpty());
        assertTrue(normalizer.normalizeDate("31/02/2024").isEmpty());
        assertTrue(normalizer.normalizeDate("").isEmpty());
        assertTrue(normalizer.normalizeDate(null).isEmpty());
    }

    @Test
    void testNormalizeNumbers() {
        assertEquals(Optional.of("1250"), normalizer.normalizeInteger("1,250 units"));
        assertTrue(normalizer.normalizeInteger("nil").isEmpty());
        assertEquals(Optional.of("4046.86"), normalizer.normalizeDecimal("4,046.86 sq m"));
        assertEquals(Optional.of("12"), normalizer.normalizeDecimal("12.00 acres"));
        assertTrue(normalizer.normalizeDecimal("n/a").isEmpty());
    }

    @Test
    void testNormalizeByType() {
        assertEquals(Optional.of("Raipur City"), normalizer.normalize(FieldType.TEXT, "  Raipur \n City "));
        assertEquals(Optional.of("2024-03-15"), normalizer.normalize(FieldType.DATE, "15.03.2024"));
        assertEquals(Optional.of("40"), normalizer.normalize(FieldType.INTEGER, "40"));
    }

    @Test
    void testExtractPostalCode() {
        assertEquals(Optional.of("492001"), normalizer.extractPostalCode("123 Main St, Raipur, CG 492001"));
        assertEquals(Optional.of("495001"), normalizer.extractPostalCode("Plot 7, Bilaspur-495001"));
        assertTrue(normalizer.extractPostalCode("Survey No 1234567, Raipur").isEmpty());
        assertTrue(normalizer.extractPostalCode("Near Bus Stand").isEmpty());
        assertTrue(normalizer.extractPostalCode(null).isEmpty());
    }
}
