package org.iceforge.runa.budget.model;

public record YearRange(int startYear, int endYear) {
}
