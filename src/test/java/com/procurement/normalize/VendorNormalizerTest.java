package com.procurement.normalize;

import com.procurement.config.ProcurementProperties;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.VendorNormalizationEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static com.procurement.RawTransactionFixtures.valid;
import static org.junit.jupiter.api.Assertions.*;

class VendorNormalizerTest {

    private static final Instant T0 = Instant.parse("2024-04-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-04-02T00:00:00Z");

    private VendorNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new VendorNormalizer(new ProcurementProperties());
    }

    @Nested
    @DisplayName("Canonicalization")
    class Canonicalization {

        @Test
        void differentSpellingsOfSameVendor_collapseToOneName() {
            assertEquals("ABC", VendorNormalizer.canonicalize("ABC Pvt. Ltd."));
            assertEquals("ABC", VendorNormalizer.canonicalize("abc pvt ltd"));
        }

        @Test
        void surroundingWhitespace_isTrimmed() {
            assertEquals("ACME", VendorNormalizer.canonicalize("  acme inc  "));
        }

        @Test
        void suffixTokenInsideLongerWord_isStillRemoved() {
            // literal replace, not word-anchored
            assertEquals("GLOBALTRADERS", VendorNormalizer.canonicalize("Global Ltdtraders"));
            assertEquals("MEGAORPORATED", VendorNormalizer.canonicalize("Mega Incorporated"));
        }

        @Test
        void suffixWithoutLeadingSpace_isKept() {
            assertEquals("PVTCO", VendorNormalizer.canonicalize("pvtco"));
        }

        @Test
        void emptyName_staysEmpty() {
            assertEquals("", VendorNormalizer.canonicalize(""));
            assertEquals("", VendorNormalizer.canonicalize("   "));
        }
    }

    @Nested
    @DisplayName("Map refresh")
    class Refresh {

        @Test
        void oneEntryPerDistinctRawName_caseSensitive() {
            List<RawTransaction> raw = List.of(
                valid("P1", "Acme Ltd", "10"),
                valid("P2", "Acme Ltd", "20"),
                valid("P3", "ACME LTD", "30"),
                valid("P4", null, "40"));

            List<VendorNormalizationEntry> map = normalizer.refresh(raw, List.of(), T0);

            assertEquals(2, map.size());
            assertEquals("Acme Ltd", map.get(0).rawVendorName());
            assertEquals("ACME LTD", map.get(1).rawVendorName());
            map.forEach(e -> {
                assertEquals("ACME", e.cleanVendorName());
                assertEquals(VendorNormalizer.RULE_DESCRIPTION, e.normalizationRule());
                assertFalse(e.manualOverride());
            });
        }

        @Test
        void vendorsNoLongerStaged_areDropped() {
            List<VendorNormalizationEntry> first = normalizer.refresh(
                List.of(valid("P1", "Old Vendor", "10"), valid("P2", "Kept Inc", "10")), List.of(), T0);

            List<VendorNormalizationEntry> second = normalizer.refresh(
                List.of(valid("P2", "Kept Inc", "10")), first, T1);

            assertEquals(1, second.size());
            assertEquals("Kept Inc", second.get(0).rawVendorName());
        }

        @Test
        void unchangedGeneratedEntries_keepTheirCreationTime() {
            List<RawTransaction> raw = List.of(valid("P1", "Acme Ltd", "10"));
            List<VendorNormalizationEntry> first = normalizer.refresh(raw, List.of(), T0);
            List<VendorNormalizationEntry> second = normalizer.refresh(raw, first, T1);

            assertEquals(first, second);
            assertEquals(T0, second.get(0).createdAt());
        }

        @Test
        void manualOverride_survivesRefresh() {
            VendorNormalizationEntry curated = new VendorNormalizationEntry(
                "Acme Ltd", "ACME HOLDINGS", VendorOverrideService.MANUAL_RULE, true, T0);

            List<VendorNormalizationEntry> map = normalizer.refresh(
                List.of(valid("P1", "Acme Ltd", "10")), List.of(curated), T1);

            assertEquals(List.of(curated), map);
        }

        @Test
        void manualOverride_isDiscardedWhenPreservationDisabled() {
            ProcurementProperties properties = new ProcurementProperties();
            properties.getNormalization().setPreserveManualOverrides(false);
            VendorNormalizer destructive = new VendorNormalizer(properties);
            VendorNormalizationEntry curated = new VendorNormalizationEntry(
                "Acme Ltd", "ACME HOLDINGS", VendorOverrideService.MANUAL_RULE, true, T0);

            List<VendorNormalizationEntry> map = destructive.refresh(
                List.of(valid("P1", "Acme Ltd", "10")), List.of(curated), T1);

            assertEquals(1, map.size());
            assertEquals("ACME", map.get(0).cleanVendorName());
            assertFalse(map.get(0).manualOverride());
            assertEquals(T1, map.get(0).createdAt());
        }

        @Test
        void emptyStaging_yieldsEmptyMap() {
            assertTrue(normalizer.refresh(List.of(), List.of(), T0).isEmpty());
        }
    }
}
