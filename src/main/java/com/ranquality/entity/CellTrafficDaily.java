package com.ranquality.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "cell_traffic_daily",
    indexes = {
        @Index(name = "idx_cell_traffic_cell", columnList = "cell_id"),
        @Index(name = "idx_cell_traffic_date", columnList = "traffic_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CellTrafficDaily {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cell_id", nullable = false, length = 64)
    private String cellId;

    @Column(length = 32)
    private String vendor;

    @Column(name = "traffic_date", nullable = false)
    private LocalDate trafficDate;

    private Double traffic;
}
