package com.northstar.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class ExpectedImpact {

    @Column(name = "impact_metric")
    private String metric;

    @Column(name = "impact_delta_pct")
    private double deltaPct;

    protected ExpectedImpact() {}   // required by JPA

    public ExpectedImpact(String metric, double deltaPct) {
        this.metric   = metric;
        this.deltaPct = deltaPct;
    }

    public String getMetric()   { return metric; }
    public double getDeltaPct() { return deltaPct; }
}
