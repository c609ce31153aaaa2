package com.procurement.audit;

import com.procurement.contract.PipelineRunSummary;

/**
 * Append-only sink for pipeline run summaries.
 */
public interface RunAuditor {

    void record(PipelineRunSummary summary);
}
