package org.iceforge.runa.budget.model;

public record SeriesPoint(String date, double value) {
}
