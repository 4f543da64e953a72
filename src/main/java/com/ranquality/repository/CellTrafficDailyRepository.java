package com.ranquality.repository;

import com.ranquality.entity.CellTrafficDaily;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CellTrafficDailyRepository extends JpaRepository<CellTrafficDaily, Long> {

    List<CellTrafficDaily> findByCellIdOrderByTrafficDateAsc(String cellId);

    List<CellTrafficDaily> findByCellIdAndVendorOrderByTrafficDateAsc(String cellId, String vendor);
}
