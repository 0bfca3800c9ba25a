package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import br.fluitax.common.dto.kardex.MovementStatus;
import br.fluitax.common.dto.kardex.MovementType;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.common.util.DateUtils;
import br.fluitax.kardex.domain.LedgerResult;
import br.fluitax.kardex.domain.LedgerWindow;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Cuts a full-history ledger down to a report period.
 *
 * A window opened mid-history starts from a PRIOR_BALANCE row carrying the state of the
 * last movement before the period, so balances inside the window stay consistent with
 * the complete history. Rows without a timestamp are always kept.
 */
@Component
public class PeriodWindower {

    static final String NOTE_PRIOR_BALANCE = "Balance prior to the selected period";

    /**
     * @param ledger full-history ledger
     * @param from   inclusive start, null for the whole history
     * @param to     inclusive end, null for no upper bound
     */
    public LedgerWindow window(LedgerResult ledger, LocalDateTime from, LocalDateTime to) {
        List<LedgerMovement> all = ledger.getMovements();
        List<LedgerMovement> movements = new ArrayList<>();

        if (from != null) {
            LedgerMovement previous = findLastBefore(all, from);
            if (previous != null) {
                movements.add(priorBalance(previous, from));
            }
        }

        for (LedgerMovement movement : all) {
            if (movement.getTimestamp() == null || DateUtils.isWithin(movement.getTimestamp(), from, to)) {
                movements.add(movement);
            }
        }

        List<FinishedSaleRecord> sales = ledger.getFinishedSales().stream()
                .filter(sale -> sale.getTimestamp() == null || DateUtils.isWithin(sale.getTimestamp(), from, to))
                .toList();

        LedgerMovement openingBalance = movements.stream()
                .filter(m -> m.getType() == MovementType.OPENING || m.getType() == MovementType.PRIOR_BALANCE)
                .findFirst()
                .orElse(null);

        return LedgerWindow.builder()
                .openingBalance(openingBalance)
                .movements(movements)
                .finishedSales(sales)
                .build();
    }

    private static LedgerMovement findLastBefore(List<LedgerMovement> movements, LocalDateTime from) {
        for (int i = movements.size() - 1; i >= 0; i--) {
            LedgerMovement candidate = movements.get(i);
            if (candidate.getTimestamp() != null && candidate.getTimestamp().isBefore(from)) {
                return candidate;
            }
        }
        return null;
    }

    private static LedgerMovement priorBalance(LedgerMovement previous, LocalDateTime from) {
        BigDecimal zero = AmountUtils.round(BigDecimal.ZERO);
        return LedgerMovement.builder()
                .type(MovementType.PRIOR_BALANCE)
                .timestamp(from)
                .appliedQuantitySacks(zero)
                .requestedQuantitySacks(zero)
                .unitCost(previous.getMovingAverageCostAfter())
                .movingAverageCostAfter(previous.getMovingAverageCostAfter())
                .balanceQuantityAfter(previous.getBalanceQuantityAfter())
                .balanceValueAfter(previous.getBalanceValueAfter())
                .balanceQuantityBefore(previous.getBalanceQuantityAfter())
                .balanceValueBefore(previous.getBalanceValueAfter())
                .status(MovementStatus.NORMAL)
                .notes(NOTE_PRIOR_BALANCE)
                .build();
    }
}
