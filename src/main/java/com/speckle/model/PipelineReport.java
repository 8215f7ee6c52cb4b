package com.speckle.model;

import java.util.ArrayList;
import java.util.List;

public class PipelineReport {
    public final BurstPlan burstPlan;
    public final List<BatchResult> batches;
    public final int zeroGainDenominators;
    public final int transcribedImages;

    public PipelineReport(BurstPlan burstPlan, List<BatchResult> batches, int zeroGainDenominators, int transcribedImages) {
        this.burstPlan = burstPlan;
        this.batches = List.copyOf(batches);
        this.zeroGainDenominators = zeroGainDenominators;
        this.transcribedImages = transcribedImages;
    }

    public List<Integer> failedBatches() {
        List<Integer> failed = new ArrayList<>();
        for (BatchResult r : batches) if (r.failed()) failed.add(r.batchId);
        return failed;
    }

    // A degraded run finished, but at least one output needs re-inspection.
    public boolean isDegraded() {
        return !failedBatches().isEmpty() || zeroGainDenominators > 0;
    }
}
