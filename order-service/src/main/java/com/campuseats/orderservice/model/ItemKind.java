package com.campuseats.orderservice.model;

/**
 * Inventory kinds a vendor can stock.
 * RETAIL items carry a countable quantity, PRODUCE items a single availability flag,
 * RAW_MATERIAL items are tracked as bulk opening/closing amounts and can't be ordered.
 */
public enum ItemKind {
    RETAIL,
    PRODUCE,
    RAW_MATERIAL
}
