package com.zzf.simon.pipeline;

import lombok.Value;

@Value
public class RouteDecision {
    public enum Source { RULE, MODEL, FALLBACK }

    Route route;
    double confidence;
    Source source;
}
