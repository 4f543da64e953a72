package com.ranquality.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

/** Traffic-active periods maintained by the upstream period job; {@code endDate} is null while still open. */
@Entity
@Table(
    name = "cell_traffic_period",
    indexes = {
        @Index(name = "idx_cell_period_cell", columnList = "cell_id"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CellTrafficPeriod {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cell_id", nullable = false, length = 64)
    private String cellId;

    @Column(length = 32)
    private String vendor;

    @Column(name = "init_date", nullable = false)
    private LocalDate initDate;

    @Column(name = "end_date")
    private LocalDate endDate;

    @Column(name = "min_run")
    private Integer minRun;
}
