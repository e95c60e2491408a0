package com.sandy.fleet.health.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactor {
    /** age, hours, maintenance_cost, repair_frequency, emergency_repairs, downtime, maintenance_overdue */
    private String category;
    /** medium / high / critical */
    private String severity;
    private String description;
}
