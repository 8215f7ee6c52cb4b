package com.speckle.model;

import java.util.List;

public class BurstPlan {
    public final List<Integer> batchIds;
    public final int burstCount;
    public final int framesDropped;

    public BurstPlan(List<Integer> batchIds, int burstCount, int framesDropped) {
        this.batchIds = List.copyOf(batchIds);
        this.burstCount = burstCount;
        this.framesDropped = framesDropped;
    }
}
