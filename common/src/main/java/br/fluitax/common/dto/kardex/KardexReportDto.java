package br.fluitax.common.dto.kardex;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Consolidated Kardex report.
 *
 * Renderers (JSON, CSV, XLSX) only read this structure; nothing downstream recomputes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KardexReportDto {
    private KardexFiltersDto filters;
    private LedgerMovement openingBalance;          // OPENING or PRIOR_BALANCE row of the window
    private List<LedgerMovement> movements;
    private List<FinishedSaleRecord> finishedSales;
    private List<DailyTotalDto> dailyTotals;
    private List<ProductTotalDto> productTotals;
    private GrandTotalsDto grandTotals;
}
