package com.ranquality.repository;

import com.ranquality.entity.CellTrafficPeriod;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CellTrafficPeriodRepository extends JpaRepository<CellTrafficPeriod, Long> {

    List<CellTrafficPeriod> findByCellIdOrderByInitDateAsc(String cellId);
}
