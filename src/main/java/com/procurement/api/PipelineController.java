package com.procurement.api;

import com.procurement.contract.PipelineRunSummary;
import com.procurement.pipeline.ProcurementPipelineService;
import com.procurement.store.ProcurementStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/pipeline/runs")
public class PipelineController {

    private final ProcurementPipelineService pipeline;
    private final ProcurementStore store;

    public PipelineController(ProcurementPipelineService pipeline, ProcurementStore store) {
        this.pipeline = pipeline;
        this.store = store;
    }

    @PostMapping
    public PipelineRunSummary run() {
        return pipeline.run();
    }

    @GetMapping
    public List<PipelineRunSummary> history() {
        return store.readRunSummaries();
    }
}
