package com.ranquality.repository;

import com.ranquality.entity.SiteKpiDaily;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface SiteKpiDailyRepository extends JpaRepository<SiteKpiDaily, Long> {

    List<SiteKpiDaily> findBySiteAttAndKpiDateBetweenOrderByKpiDateAsc(
        String siteAtt, LocalDate from, LocalDate to);

    @Query("SELECT MAX(k.kpiDate) FROM SiteKpiDaily k WHERE k.siteAtt = :siteAtt")
    Optional<LocalDate> findMaxDate(@Param("siteAtt") String siteAtt);
}
