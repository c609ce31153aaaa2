package com.procurement.normalize;

import com.procurement.contract.VendorNormalizationEntry;
import com.procurement.pipeline.ProcurementPipelineService;
import com.procurement.store.ProcurementStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Curates manual vendor mappings. An override takes effect on the next
 * pipeline run and persists across runs while its raw name stays staged.
 *
 * Overrides are refused while a run is in flight: the run commits a map built
 * from the state it read at start and would drop them.
 */
@Service
public class VendorOverrideService {

    private static final Logger log = LoggerFactory.getLogger(VendorOverrideService.class);

    public static final String MANUAL_RULE = "MANUAL OVERRIDE";

    private final ProcurementStore store;
    private final ProcurementPipelineService pipeline;

    public VendorOverrideService(ProcurementStore store, ProcurementPipelineService pipeline) {
        this.store = store;
        this.pipeline = pipeline;
    }

    public VendorNormalizationEntry override(String rawVendorName, String cleanVendorName) {
        if (rawVendorName == null) {
            throw new IllegalArgumentException("raw_vendor_name is required");
        }
        if (cleanVendorName == null || cleanVendorName.isBlank()) {
            throw new IllegalArgumentException("clean_vendor_name is required");
        }
        VendorNormalizationEntry entry = new VendorNormalizationEntry(
            rawVendorName, cleanVendorName.trim(), MANUAL_RULE, true, Instant.now());
        pipeline.whileIdle(() -> {
            store.upsertNormalization(entry);
            return entry;
        });
        log.info("Manual vendor override stored: raw='{}' clean='{}'", rawVendorName, entry.cleanVendorName());
        return entry;
    }
}
