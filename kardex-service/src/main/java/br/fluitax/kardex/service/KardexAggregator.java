package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.DailyTotalDto;
import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.GrandTotalsDto;
import br.fluitax.common.dto.kardex.LedgerMovement;
import br.fluitax.common.dto.kardex.MovementType;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.dto.kardex.ProductTotalDto;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.LedgerResult;
import br.fluitax.kardex.domain.LedgerWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Pure reductions over a ledger window: per-day raw-material totals, per-product
 * finished-goods totals and report-wide totals.
 */
@Component
@RequiredArgsConstructor
public class KardexAggregator {

    private final KardexSettings settings;

    /**
     * Entries and exits per calendar day, with the balance and moving average at the end of the day.
     * OPENING and PRIOR_BALANCE rows are state snapshots, not movements, and are skipped.
     */
    public List<DailyTotalDto> dailyTotals(List<LedgerMovement> movements) {
        Map<LocalDate, DailyTotalDto> byDay = new TreeMap<>();

        for (LedgerMovement movement : movements) {
            if (!isMovement(movement) || movement.getTimestamp() == null) {
                continue;
            }
            DailyTotalDto day = byDay.computeIfAbsent(movement.getTimestamp().toLocalDate(),
                    date -> DailyTotalDto.builder()
                            .date(date)
                            .entriesSacks(BigDecimal.ZERO)
                            .exitsSacks(BigDecimal.ZERO)
                            .build());

            if (movement.getType() == MovementType.ENTRY) {
                day.setEntriesSacks(day.getEntriesSacks().add(movement.getAppliedQuantitySacks()));
            } else {
                day.setExitsSacks(day.getExitsSacks().add(movement.getAppliedQuantitySacks()));
            }
            day.setBalanceSacks(movement.getBalanceQuantityAfter());
            day.setMovingAverageCost(movement.getMovingAverageCostAfter());
        }
        return new ArrayList<>(byDay.values());
    }

    /**
     * Finished-goods totals in product order; products without sales are omitted.
     */
    public List<ProductTotalDto> productTotals(List<FinishedSaleRecord> sales) {
        Map<ProductAlias, List<FinishedSaleRecord>> byProduct = new EnumMap<>(ProductAlias.class);
        for (FinishedSaleRecord sale : sales) {
            byProduct.computeIfAbsent(sale.getProductAlias(), alias -> new ArrayList<>()).add(sale);
        }

        List<ProductTotalDto> totals = new ArrayList<>();
        byProduct.forEach((alias, productSales) -> totals.add(productTotal(alias, productSales)));
        return totals;
    }

    private ProductTotalDto productTotal(ProductAlias alias, List<FinishedSaleRecord> sales) {
        BigDecimal units = BigDecimal.ZERO;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal consumed = BigDecimal.ZERO;
        BigDecimal costValue = BigDecimal.ZERO;

        for (FinishedSaleRecord sale : sales) {
            BigDecimal saleUnits = orZero(sale.getUnitsSold());
            units = units.add(saleUnits);
            revenue = revenue.add(orZero(sale.getUnitNetPrice()).multiply(saleUnits));
            consumed = consumed.add(orZero(sale.getRawMaterialConsumedSacks()));
            if (sale.getRawMaterialCostValue() != null) {
                costValue = costValue.add(sale.getRawMaterialCostValue());
            }
        }

        BigDecimal averageUnitPrice = AmountUtils.round(AmountUtils.divide(revenue, units));
        return ProductTotalDto.builder()
                .productAlias(alias)
                .productLabel(alias.getLabel())
                .unitsSold(units)
                .netRevenue(AmountUtils.round(revenue))
                .averageUnitPrice(averageUnitPrice)
                .revenuePerSack(AmountUtils.round(averageUnitPrice.multiply(settings.getFinishedUnitsPerSack())))
                .rawMaterialConsumedSacks(AmountUtils.round(consumed))
                .rawMaterialCostValue(AmountUtils.round(costValue))
                .averageRawMaterialCostPerSack(AmountUtils.round(AmountUtils.divide(costValue, consumed)))
                .build();
    }

    /**
     * Window totals plus the ledger state after the last processed event.
     */
    public GrandTotalsDto grandTotals(LedgerWindow window, LedgerResult ledger, List<ProductTotalDto> productTotals) {
        BigDecimal entries = BigDecimal.ZERO;
        BigDecimal exits = BigDecimal.ZERO;
        BigDecimal blocked = BigDecimal.ZERO;
        int blockedCount = 0;

        for (LedgerMovement movement : window.getMovements()) {
            if (!isMovement(movement)) {
                continue;
            }
            if (movement.getType() == MovementType.ENTRY) {
                entries = entries.add(movement.getAppliedQuantitySacks());
            } else {
                exits = exits.add(movement.getAppliedQuantitySacks());
            }
            if (movement.isBlocked()) {
                blocked = blocked.add(movement.getRequestedQuantitySacks());
                blockedCount++;
            }
        }

        BigDecimal units = BigDecimal.ZERO;
        BigDecimal revenue = BigDecimal.ZERO;
        BigDecimal consumed = BigDecimal.ZERO;
        BigDecimal costValue = BigDecimal.ZERO;
        for (ProductTotalDto total : productTotals) {
            units = units.add(total.getUnitsSold());
            revenue = revenue.add(total.getNetRevenue());
            consumed = consumed.add(total.getRawMaterialConsumedSacks());
            costValue = costValue.add(total.getRawMaterialCostValue());
        }

        return GrandTotalsDto.builder()
                .entriesSacks(entries)
                .exitsSacks(exits)
                .blockedSacks(blocked)
                .blockedMovementCount(blockedCount)
                .closingBalanceSacks(ledger.getClosingBalanceSacks())
                .closingBalanceValue(ledger.getClosingBalanceValue())
                .closingMovingAverageCost(ledger.getClosingMovingAverageCost())
                .unitsSold(units)
                .netRevenue(revenue)
                .rawMaterialConsumedSacks(consumed)
                .rawMaterialCostValue(costValue)
                .averageRawMaterialCostPerSack(AmountUtils.round(AmountUtils.divide(costValue, consumed)))
                .build();
    }

    private static boolean isMovement(LedgerMovement movement) {
        return movement.getType() == MovementType.ENTRY || movement.getType() == MovementType.EXIT;
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
