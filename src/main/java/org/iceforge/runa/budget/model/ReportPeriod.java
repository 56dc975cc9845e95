package org.iceforge.runa.budget.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public class ReportPeriod {

    @NotNull
    @JsonAlias("type")
    private Frequency frequency;

    @NotNull
    @Valid
    private PeriodSelection selection;

    public ReportPeriod() {
    }

    public ReportPeriod(Frequency frequency, PeriodSelection selection) {
        this.frequency = frequency;
        this.selection = selection;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public void setFrequency(Frequency frequency) {
        this.frequency = frequency;
    }

    public PeriodSelection getSelection() {
        return selection;
    }

    public void setSelection(PeriodSelection selection) {
        this.selection = selection;
    }
}
