package com.ranquality.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(
    name = "cell_inventory",
    indexes = @Index(name = "idx_cell_inventory_site", columnList = "site_att")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CellInventory {

    @Id
    @Column(name = "cell_id", nullable = false, length = 64)
    private String cellId;

    @Column(name = "site_att", nullable = false, length = 32)
    private String siteAtt;

    @Column(length = 32)
    private String band;

    @Column(length = 32)
    private String vendor;

    /** UMTS, LTE or NR (3G/4G/5G are accepted too). */
    @Column(nullable = false, length = 8)
    private String technology;
}
