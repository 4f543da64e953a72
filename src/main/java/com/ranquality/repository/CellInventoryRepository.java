package com.ranquality.repository;

import com.ranquality.entity.CellInventory;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CellInventoryRepository extends JpaRepository<CellInventory, String> {

    List<CellInventory> findBySiteAttOrderByCellIdAsc(String siteAtt);
}
