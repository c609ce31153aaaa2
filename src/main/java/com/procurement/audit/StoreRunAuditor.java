package com.procurement.audit;

import com.procurement.contract.PipelineRunSummary;
import com.procurement.store.ProcurementStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StoreRunAuditor implements RunAuditor {

    private static final Logger log = LoggerFactory.getLogger(StoreRunAuditor.class);

    private final ProcurementStore store;

    public StoreRunAuditor(ProcurementStore store) {
        this.store = store;
    }

    @Override
    public void record(PipelineRunSummary summary) {
        store.appendRunSummary(summary);
        log.info("{} {} run_id={}: {}", summary.actionType(), summary.status(),
            summary.runId(), summary.description());
    }
}
