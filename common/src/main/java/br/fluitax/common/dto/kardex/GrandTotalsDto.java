package br.fluitax.common.dto.kardex;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Report-wide totals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrandTotalsDto {

    // Raw material (window)
    private BigDecimal entriesSacks;
    private BigDecimal exitsSacks;
    private BigDecimal blockedSacks;
    private int blockedMovementCount;

    // Ledger state at the end of the report
    private BigDecimal closingBalanceSacks;
    private BigDecimal closingBalanceValue;
    private BigDecimal closingMovingAverageCost;

    // Finished goods (window)
    private BigDecimal unitsSold;
    private BigDecimal netRevenue;
    private BigDecimal rawMaterialConsumedSacks;
    private BigDecimal rawMaterialCostValue;
    private BigDecimal averageRawMaterialCostPerSack;
}
