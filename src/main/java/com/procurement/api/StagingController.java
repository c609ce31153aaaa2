package com.procurement.api;

import com.procurement.contract.RawTransaction;
import com.procurement.pipeline.ProcurementPipelineService;
import com.procurement.store.ProcurementStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Staging load endpoint.
 *
 * PUT /v1/staging/transactions replaces the whole raw set; the next pipeline
 * run re-derives everything from it. Rejected while a run is in progress so
 * a run always sees a stable raw snapshot.
 */
@RestController
@RequestMapping("/v1/staging/transactions")
public class StagingController {

    private final ProcurementStore store;
    private final ProcurementPipelineService pipeline;

    public StagingController(ProcurementStore store, ProcurementPipelineService pipeline) {
        this.store = store;
        this.pipeline = pipeline;
    }

    @PutMapping
    public Map<String, Object> replace(@RequestBody List<RawTransaction> rows) {
        if (rows == null) {
            throw new IllegalArgumentException("request body must be a JSON array of transactions");
        }
        pipeline.whileIdle(() -> {
            store.replaceAllRaw(rows);
            return rows.size();
        });
        return Map.of(
            "status", "loaded",
            "staging_rows", rows.size()
        );
    }

    @GetMapping
    public List<RawTransaction> list() {
        return store.readAllRaw();
    }
}
