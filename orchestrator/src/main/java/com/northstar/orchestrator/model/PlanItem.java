package com.northstar.orchestrator.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/** One row of a proposal's technical plan. */
@Embeddable
public class PlanItem {

    @Column(name = "file_path")
    private String file;

    @Column(columnDefinition = "TEXT")
    private String action;

    protected PlanItem() {}   // required by JPA

    public PlanItem(String file, String action) {
        this.file   = file;
        this.action = action;
    }

    public String getFile()   { return file; }
    public String getAction() { return action; }
}
