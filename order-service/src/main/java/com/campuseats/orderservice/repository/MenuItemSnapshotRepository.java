package com.campuseats.orderservice.repository;

import com.campuseats.orderservice.model.MenuItemSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface MenuItemSnapshotRepository extends JpaRepository<MenuItemSnapshot, UUID> {
}
