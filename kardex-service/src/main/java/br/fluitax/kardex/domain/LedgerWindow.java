package br.fluitax.kardex.domain;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The part of a full-history ledger that falls inside a report period.
 */
@Value
@Builder
public class LedgerWindow {

    /**
     * OPENING or PRIOR_BALANCE row the window starts from; null only for an empty window.
     */
    LedgerMovement openingBalance;

    /**
     * Movements of the period, starting with {@link #openingBalance} when present.
     */
    List<LedgerMovement> movements;

    List<FinishedSaleRecord> finishedSales;
}
