package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.InventoryReportEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Daily report rows are created with insert-if-absent and then incremented, so two
 * commits selling the same item on the same day both count.
 */
@Repository
public interface InventoryReportRepository extends JpaRepository<InventoryReportEntry, UUID> {

    @Transactional
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO inventory_report_entries " +
            "(id, vendor_id, report_date, item_id, item_kind, opening_qty, sold_qty, closing_qty) " +
            "VALUES (gen_random_uuid(), :vendorId, :reportDate, :itemId, :itemKind, :openingQty, 0, :openingQty) " +
            "ON CONFLICT (vendor_id, report_date, item_id, item_kind) DO NOTHING", nativeQuery = true)
    int insertIfAbsent(@Param("vendorId") UUID vendorId,
            @Param("reportDate") LocalDate reportDate,
            @Param("itemId") UUID itemId,
            @Param("itemKind") String itemKind,
            @Param("openingQty") int openingQty);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryReportEntry e SET e.soldQty = e.soldQty + :sold, e.closingQty = :closingQty " +
            "WHERE e.vendorId = :vendorId AND e.reportDate = :reportDate AND e.itemId = :itemId " +
            "AND e.itemKind = com.campuseats.orderservice.model.ItemKind.RETAIL")
    int recordRetailSale(@Param("vendorId") UUID vendorId,
            @Param("reportDate") LocalDate reportDate,
            @Param("itemId") UUID itemId,
            @Param("sold") int sold,
            @Param("closingQty") int closingQty);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE InventoryReportEntry e SET e.soldQty = e.soldQty + :sold " +
            "WHERE e.vendorId = :vendorId AND e.reportDate = :reportDate AND e.itemId = :itemId " +
            "AND e.itemKind = com.campuseats.orderservice.model.ItemKind.PRODUCE")
    int recordProduceSale(@Param("vendorId") UUID vendorId,
            @Param("reportDate") LocalDate reportDate,
            @Param("itemId") UUID itemId,
            @Param("sold") int sold);

    Optional<InventoryReportEntry> findByVendorIdAndReportDateAndItemId(UUID vendorId, LocalDate reportDate,
            UUID itemId);

    List<InventoryReportEntry> findByVendorIdAndReportDate(UUID vendorId, LocalDate reportDate);
}
