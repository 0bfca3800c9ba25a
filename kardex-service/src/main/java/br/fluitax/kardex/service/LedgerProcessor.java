package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import br.fluitax.common.dto.kardex.MovementStatus;
import br.fluitax.common.dto.kardex.MovementType;
import br.fluitax.common.dto.kardex.StockEventType;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.LedgerResult;
import br.fluitax.kardex.domain.StockEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Moving-average Kardex state machine for the raw material.
 *
 * State is (balance quantity, balance value, moving-average cost), seeded from the
 * configured opening stock. Events are applied in (timestamp, invoiceId, itemId, event order)
 * order. Entries are never clamped; exits and consumptions never take the balance below
 * zero, and whatever they could not take is recorded as a blocked movement.
 *
 * Every folded value is rounded to {@link AmountUtils#INTERNAL_SCALE} digits.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerProcessor {

    static final String NOTE_OPENING = "Opening balance";
    static final String NOTE_LIMITED = "Quantity limited to available balance";
    static final String NOTE_NOT_APPLIED = "Movement not applied (zero balance)";
    static final String NOTE_BLOCKED_QUANTITY = "Blocked quantity: %s SC";
    static final String NOTE_SEPARATOR = " | ";

    public static final Comparator<StockEvent> EVENT_ORDER = Comparator
            .comparing(StockEvent::getTimestamp, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(StockEvent::getInvoiceId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(StockEvent::getItemId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(StockEvent::getEventOrder);

    private final KardexSettings settings;

    /**
     * Apply all events to a fresh ledger.
     *
     * @param events           stock events in any order
     * @param openingTimestamp date of the OPENING row
     * @return every movement (OPENING first), completed sales in processing order and the closing state
     */
    public LedgerResult process(List<StockEvent> events, LocalDateTime openingTimestamp) {
        LedgerState state = LedgerState.opening(settings.getOpeningStockSacks(), settings.getOpeningUnitCost());

        List<LedgerMovement> movements = new ArrayList<>();
        List<FinishedSaleRecord> sales = new ArrayList<>();
        movements.add(openingMovement(state, openingTimestamp));

        List<StockEvent> sorted = new ArrayList<>(events);
        sorted.sort(EVENT_ORDER);

        for (StockEvent event : sorted) {
            if (event.getType() == StockEventType.ENTRY) {
                movements.add(applyEntry(state, event));
            } else {
                applyWithdrawal(state, event, movements, sales);
            }
        }

        long blocked = movements.stream().filter(LedgerMovement::isBlocked).count();
        log.info("Ledger processed {} events into {} movements ({} blocked), closing balance {} SC @ {}",
                sorted.size(), movements.size(), blocked, state.quantity, state.averageCost);

        return LedgerResult.builder()
                .movements(movements)
                .finishedSales(sales)
                .closingBalanceSacks(state.quantity)
                .closingBalanceValue(state.value)
                .closingMovingAverageCost(state.averageCost)
                .build();
    }

    private LedgerMovement openingMovement(LedgerState state, LocalDateTime timestamp) {
        return LedgerMovement.builder()
                .type(MovementType.OPENING)
                .timestamp(timestamp)
                .appliedQuantitySacks(AmountUtils.round(BigDecimal.ZERO))
                .requestedQuantitySacks(AmountUtils.round(BigDecimal.ZERO))
                .unitCost(state.averageCost)
                .movingAverageCostAfter(state.averageCost)
                .balanceQuantityAfter(state.quantity)
                .balanceValueAfter(state.value)
                .balanceQuantityBefore(state.quantity)
                .balanceValueBefore(state.value)
                .status(MovementStatus.NORMAL)
                .notes(NOTE_OPENING)
                .build();
    }

    private LedgerMovement applyEntry(LedgerState state, StockEvent event) {
        BigDecimal entryQuantity = AmountUtils.round(event.getQuantitySacks());

        BigDecimal unitCost;
        if (event.getUnitCost() != null) {
            unitCost = AmountUtils.round(event.getUnitCost());
        } else if (event.getNetTotal() != null) {
            unitCost = AmountUtils.round(AmountUtils.divide(event.getNetTotal(), entryQuantity));
        } else {
            unitCost = state.averageCost;
        }
        BigDecimal entryValue = event.getNetTotal() != null
                ? AmountUtils.round(event.getNetTotal())
                : AmountUtils.round(unitCost.multiply(entryQuantity));

        BigDecimal quantityBefore = state.quantity;
        BigDecimal valueBefore = state.value;
        boolean costRestart = quantityBefore.signum() == 0 && entryQuantity.signum() > 0;

        state.quantity = AmountUtils.round(state.quantity.add(entryQuantity));
        state.value = AmountUtils.round(state.value.add(entryValue));
        if (costRestart) {
            state.averageCost = unitCost;
        } else if (state.quantity.signum() != 0) {
            state.averageCost = AmountUtils.round(AmountUtils.divide(state.value, state.quantity));
        }
        if (state.quantity.signum() == 0) {
            state.value = AmountUtils.round(BigDecimal.ZERO);
        }

        return baseMovement(event, MovementType.ENTRY)
                .appliedQuantitySacks(entryQuantity)
                .requestedQuantitySacks(entryQuantity)
                .unitCost(unitCost)
                .movingAverageCostAfter(state.averageCost)
                .balanceQuantityAfter(state.quantity)
                .balanceValueAfter(state.value)
                .balanceQuantityBefore(quantityBefore)
                .balanceValueBefore(valueBefore)
                .status(MovementStatus.NORMAL)
                .costRestarted(costRestart)
                .notes(event.getNotes())
                .build();
    }

    private void applyWithdrawal(LedgerState state,
                                 StockEvent event,
                                 List<LedgerMovement> movements,
                                 List<FinishedSaleRecord> sales) {
        BigDecimal requested = AmountUtils.round(event.getQuantitySacks()).abs();
        BigDecimal quantityBefore = state.quantity;
        BigDecimal valueBefore = state.value;
        BigDecimal averageCost = state.averageCost;

        if (quantityBefore.signum() == 0) {
            if (event.getSaleDraft() != null) {
                sales.add(completeSale(event.getSaleDraft(), AmountUtils.round(BigDecimal.ZERO), null, null));
            }
            movements.add(blockedMovement(state, event, requested, joinNotes(event.getNotes(), NOTE_NOT_APPLIED)));
            return;
        }

        BigDecimal applied = requested.min(quantityBefore);
        BigDecimal exitValue = AmountUtils.round(averageCost.multiply(applied));

        state.quantity = clampAtZero(AmountUtils.round(state.quantity.subtract(applied)));
        state.value = clampAtZero(AmountUtils.round(state.value.subtract(exitValue)));
        if (state.quantity.signum() == 0) {
            state.value = AmountUtils.round(BigDecimal.ZERO);
        }

        if (event.getSaleDraft() != null) {
            FinishedSaleRecord sale = applied.signum() == 0
                    ? completeSale(event.getSaleDraft(), applied, null, null)
                    : completeSale(event.getSaleDraft(), applied, averageCost, exitValue);
            sales.add(sale);
        }

        BigDecimal remainder = requested.subtract(applied);
        String notes = remainder.signum() > 0 ? joinNotes(event.getNotes(), NOTE_LIMITED) : event.getNotes();

        movements.add(baseMovement(event, MovementType.EXIT)
                .appliedQuantitySacks(applied)
                .requestedQuantitySacks(requested)
                .unitCost(averageCost)
                .movingAverageCostAfter(state.averageCost)
                .balanceQuantityAfter(state.quantity)
                .balanceValueAfter(state.value)
                .balanceQuantityBefore(quantityBefore)
                .balanceValueBefore(valueBefore)
                .status(MovementStatus.NORMAL)
                .notes(notes)
                .build());

        if (remainder.signum() > 0) {
            String blockedNotes = joinNotes(joinNotes(event.getNotes(), NOTE_NOT_APPLIED),
                    String.format(NOTE_BLOCKED_QUANTITY, AmountUtils.format(remainder, 4)));
            movements.add(blockedMovement(state, event, remainder, blockedNotes));
        }
    }

    private LedgerMovement blockedMovement(LedgerState state, StockEvent event, BigDecimal requested, String notes) {
        return baseMovement(event, MovementType.EXIT)
                .appliedQuantitySacks(AmountUtils.round(BigDecimal.ZERO))
                .requestedQuantitySacks(requested)
                .unitCost(state.averageCost)
                .movingAverageCostAfter(state.averageCost)
                .balanceQuantityAfter(state.quantity)
                .balanceValueAfter(state.value)
                .balanceQuantityBefore(state.quantity)
                .balanceValueBefore(state.value)
                .status(MovementStatus.BLOCKED_ZERO_BALANCE)
                .notes(notes)
                .build();
    }

    private static LedgerMovement.LedgerMovementBuilder baseMovement(StockEvent event, MovementType type) {
        return LedgerMovement.builder()
                .type(type)
                .eventType(event.getType())
                .timestamp(event.getTimestamp())
                .invoiceId(event.getInvoiceId())
                .itemId(event.getItemId())
                .document(event.getDocument())
                .counterparty(event.getCounterpartyName() != null
                        ? event.getCounterpartyName()
                        : event.getCounterpartyCnpj())
                .counterpartyCnpj(event.getCounterpartyCnpj())
                .cfop(event.getCfop());
    }

    private static FinishedSaleRecord completeSale(FinishedSaleRecord draft,
                                                   BigDecimal consumed,
                                                   BigDecimal costPerSack,
                                                   BigDecimal costValue) {
        return draft.toBuilder()
                .rawMaterialConsumedSacks(consumed)
                .costPerSackAtConsumption(costPerSack)
                .rawMaterialCostValue(costValue)
                .build();
    }

    private static String joinNotes(String first, String second) {
        return first == null || first.isEmpty() ? second : first + NOTE_SEPARATOR + second;
    }

    private static BigDecimal clampAtZero(BigDecimal value) {
        return value.signum() < 0 ? AmountUtils.round(BigDecimal.ZERO) : value;
    }

    /**
     * Mutable fold state, local to one {@link #process} call.
     */
    private static final class LedgerState {
        private BigDecimal quantity;
        private BigDecimal value;
        private BigDecimal averageCost;

        static LedgerState opening(BigDecimal openingQuantity, BigDecimal openingUnitCost) {
            LedgerState state = new LedgerState();
            state.quantity = AmountUtils.round(openingQuantity == null ? BigDecimal.ZERO : openingQuantity);
            BigDecimal cost = openingUnitCost == null ? BigDecimal.ZERO : openingUnitCost;
            state.value = AmountUtils.round(state.quantity.multiply(cost));
            state.averageCost = state.quantity.signum() == 0
                    ? AmountUtils.round(BigDecimal.ZERO)
                    : AmountUtils.round(AmountUtils.divide(state.value, state.quantity));
            return state;
        }
    }
}
