package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.KardexFiltersDto;
import br.fluitax.common.dto.kardex.KardexReportDto;
import br.fluitax.common.dto.kardex.ProductTotalDto;
import br.fluitax.common.dto.kardex.SalesByPeriodReportDto;
import br.fluitax.common.exception.ValidationException;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.common.util.DateUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Finished-goods sales of a closed period, costed with the raw-material moving average
 * in effect at each sale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SalesByPeriodService {

    private final KardexReportService kardexReportService;
    private final KardexAggregator aggregator;

    public SalesByPeriodReportDto buildReport(LocalDate from, LocalDate to) {
        if (from == null || to == null) {
            throw new ValidationException("period", "Both from and to are required");
        }
        if (from.isAfter(to)) {
            throw new ValidationException("from", "from must be on or before to");
        }

        // Costs depend on the whole history, so the Kardex is always built from the epoch
        KardexReportDto kardex = kardexReportService.buildReport(null, to);

        LocalDateTime periodStart = DateUtils.startOfDay(from);
        LocalDateTime periodEnd = DateUtils.endOfDay(to);
        List<FinishedSaleRecord> sales = kardex.getFinishedSales().stream()
                .filter(sale -> DateUtils.isWithin(sale.getTimestamp(), periodStart, periodEnd))
                .toList();

        List<ProductTotalDto> products = aggregator.productTotals(sales);

        BigDecimal units = BigDecimal.ZERO;
        BigDecimal consumed = BigDecimal.ZERO;
        BigDecimal costValue = BigDecimal.ZERO;
        for (ProductTotalDto product : products) {
            units = units.add(product.getUnitsSold());
            consumed = consumed.add(product.getRawMaterialConsumedSacks());
            costValue = costValue.add(product.getRawMaterialCostValue());
        }

        log.info("Sales by period {}..{}: {} sales across {} products", from, to, sales.size(), products.size());

        return SalesByPeriodReportDto.builder()
                .filters(KardexFiltersDto.builder()
                        .from(periodStart)
                        .to(periodEnd)
                        .companies(kardex.getFilters().getCompanies())
                        .build())
                .products(products)
                .totalUnitsSold(units)
                .totalRawMaterialConsumedSacks(consumed)
                .averageRawMaterialCostPerSack(AmountUtils.round(AmountUtils.divide(costValue, consumed)))
                .build();
    }
}
