package com.ranquality.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/** One row per site and day of the consolidated site-level KPI table. */
@Entity
@Table(
    name = "site_kpi_daily",
    uniqueConstraints = @UniqueConstraint(name = "uq_site_kpi_day", columnNames = {"site_att", "kpi_date"}),
    indexes = {
        @Index(name = "idx_site_kpi_site", columnList = "site_att"),
        @Index(name = "idx_site_kpi_date", columnList = "kpi_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SiteKpiDaily {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "site_att", nullable = false, length = 32)
    private String siteAtt;

    @Column(name = "kpi_date", nullable = false)
    private LocalDate kpiDate;

    @Column(name = "umts_cqi")
    private Double umtsCqi;

    @Column(name = "lte_cqi")
    private Double lteCqi;

    @Column(name = "nr_cqi")
    private Double nrCqi;

    @Column(name = "data_traffic_gb")
    private Double dataTrafficGb;

    @Column(name = "voice_traffic_erl")
    private Double voiceTrafficErl;
}
