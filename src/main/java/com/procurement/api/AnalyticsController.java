package com.procurement.api;

import com.procurement.contract.AcceptedTransaction;
import com.procurement.contract.FactRecord;
import com.procurement.contract.RejectedTransaction;
import com.procurement.contract.VendorNormalizationEntry;
import com.procurement.normalize.VendorOverrideService;
import com.procurement.store.ProcurementStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Read access to the tables published by the last successful run, plus
 * curation of vendor overrides.
 *
 * GET /v1/analytics/facts?purchaseMonth=2024-03
 * GET /v1/analytics/accepted
 * GET /v1/analytics/rejects
 * GET /v1/analytics/vendors
 * PUT /v1/analytics/vendors/overrides
 */
@RestController
@RequestMapping("/v1/analytics")
public class AnalyticsController {

    private static final Pattern PURCHASE_MONTH = Pattern.compile("^[0-9]{4}-[0-9]{2}$");

    private final ProcurementStore store;
    private final VendorOverrideService overrides;

    public AnalyticsController(ProcurementStore store, VendorOverrideService overrides) {
        this.store = store;
        this.overrides = overrides;
    }

    @GetMapping("/facts")
    public List<FactRecord> facts(@RequestParam(required = false) String purchaseMonth) {
        if (purchaseMonth == null) {
            return store.readFacts();
        }
        if (!PURCHASE_MONTH.matcher(purchaseMonth).matches()) {
            throw new IllegalArgumentException("purchaseMonth must look like yyyy-MM");
        }
        return store.readFacts().stream()
            .filter(f -> purchaseMonth.equals(f.purchaseMonth()))
            .toList();
    }

    @GetMapping("/accepted")
    public List<AcceptedTransaction> accepted() {
        return store.readAccepted();
    }

    @GetMapping("/rejects")
    public List<RejectedTransaction> rejects() {
        return store.readRejected();
    }

    @GetMapping("/vendors")
    public List<VendorNormalizationEntry> vendors() {
        return store.readNormalizationMap();
    }

    @PutMapping("/vendors/overrides")
    public VendorNormalizationEntry override(@RequestBody VendorOverrideRequest request) {
        return overrides.override(request.rawVendorName(), request.cleanVendorName());
    }
}
