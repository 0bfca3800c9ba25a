package br.fluitax.common.dto.kardex;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Finished-good sales totals for one product alias.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductTotalDto {
    private ProductAlias productAlias;
    private String productLabel;
    private BigDecimal unitsSold;
    private BigDecimal netRevenue;
    private BigDecimal averageUnitPrice;
    private BigDecimal revenuePerSack;                  // average unit price x units per sack
    private BigDecimal rawMaterialConsumedSacks;
    private BigDecimal rawMaterialCostValue;
    private BigDecimal averageRawMaterialCostPerSack;
}
