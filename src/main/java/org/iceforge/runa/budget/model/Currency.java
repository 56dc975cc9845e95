package org.iceforge.runa.budget.model;

public enum Currency {
    RON,
    EUR,
    USD
}
