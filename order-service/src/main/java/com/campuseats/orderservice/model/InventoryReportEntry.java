package com.campuseats.orderservice.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "inventory_report_entries", uniqueConstraints = @UniqueConstraint(
        name = "uk_report_vendor_date_item",
        columnNames = {"vendor_id", "report_date", "item_id", "item_kind"}))
@Getter
@Setter
public class InventoryReportEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "vendor_id", nullable = false)
    private UUID vendorId;

    @Column(name = "report_date", nullable = false)
    private LocalDate reportDate;

    @Column(name = "item_id", nullable = false)
    private UUID itemId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_kind", nullable = false)
    private ItemKind itemKind;

    @Column(name = "opening_qty", nullable = false)
    private int openingQty;

    @Column(name = "sold_qty", nullable = false)
    private int soldQty;

    @Column(name = "closing_qty", nullable = false)
    private int closingQty;
}
