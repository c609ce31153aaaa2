package com.procurement.normalize;

import com.procurement.config.ProcurementProperties;
import com.procurement.contract.RawTransaction;
import com.procurement.contract.VendorNormalizationEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Vendor Normalizer: derives one canonical vendor identity per distinct raw
 * vendor string.
 *
 * Canonical form: upper-case, then literal removal of each legal suffix token
 * in {@link #LEGAL_SUFFIXES} order (anywhere in the string, not only at the
 * end), then trim.
 *
 * The map is merged by raw vendor name rather than truncated: generated
 * entries are recomputed, curated overrides survive while their raw name is
 * still staged, and names no longer staged drop out.
 */
@Component
public class VendorNormalizer {

    private static final Logger log = LoggerFactory.getLogger(VendorNormalizer.class);

    public static final String RULE_DESCRIPTION = "UPPER + TRIM + REMOVE LEGAL SUFFIXES";

    static final List<String> LEGAL_SUFFIXES = List.of(" PVT.", " PVT", " LTD.", " LTD", " INC");

    private final boolean preserveManualOverrides;

    public VendorNormalizer(ProcurementProperties properties) {
        this.preserveManualOverrides = properties.getNormalization().isPreserveManualOverrides();
    }

    public static String canonicalize(String rawVendorName) {
        String cleaned = rawVendorName.toUpperCase(Locale.ROOT);
        for (String suffix : LEGAL_SUFFIXES) {
            cleaned = cleaned.replace(suffix, "");
        }
        return cleaned.trim();
    }

    /**
     * Rebuilds the normalization map for the given staging rows.
     *
     * @param rawRows the full current staging set
     * @param existing the map as of the previous run
     * @param now creation time for entries that are new in this run
     * @return exactly one entry per distinct non-null raw vendor name, in first-seen order
     */
    public List<VendorNormalizationEntry> refresh(List<RawTransaction> rawRows,
                                                  List<VendorNormalizationEntry> existing,
                                                  Instant now) {
        Map<String, VendorNormalizationEntry> previous = new LinkedHashMap<>();
        for (VendorNormalizationEntry entry : existing) {
            previous.put(entry.rawVendorName(), entry);
        }

        Set<String> distinctNames = new LinkedHashSet<>();
        for (RawTransaction row : rawRows) {
            if (row.vendorName() != null) {
                distinctNames.add(row.vendorName());
            }
        }

        List<VendorNormalizationEntry> refreshed = new ArrayList<>(distinctNames.size());
        int overridesKept = 0;
        for (String rawName : distinctNames) {
            VendorNormalizationEntry prior = previous.get(rawName);
            if (prior != null && prior.manualOverride() && preserveManualOverrides) {
                refreshed.add(prior);
                overridesKept++;
                continue;
            }

            String clean = canonicalize(rawName);
            if (prior != null && !prior.manualOverride() && clean.equals(prior.cleanVendorName())) {
                refreshed.add(prior);
            } else {
                refreshed.add(new VendorNormalizationEntry(rawName, clean, RULE_DESCRIPTION, false, now));
            }
        }

        log.info("Vendor normalization refreshed: distinct_raw_names={}, manual_overrides_kept={}, dropped={}",
            refreshed.size(), overridesKept, countDropped(previous, distinctNames));
        return refreshed;
    }

    private static long countDropped(Map<String, VendorNormalizationEntry> previous, Set<String> current) {
        return previous.keySet().stream().filter(name -> !current.contains(name)).count();
    }
}
