package br.fluitax.common.dto.kardex;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Finished-goods sales for a closed period, costed with the Kardex moving average.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesByPeriodReportDto {
    private KardexFiltersDto filters;
    private List<ProductTotalDto> products;
    private BigDecimal totalUnitsSold;
    private BigDecimal totalRawMaterialConsumedSacks;
    private BigDecimal averageRawMaterialCostPerSack;
}
