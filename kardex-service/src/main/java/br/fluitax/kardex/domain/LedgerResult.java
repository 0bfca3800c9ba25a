package br.fluitax.kardex.domain;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Full-history ledger: every movement (OPENING first), the completed sales and the closing state.
 */
@Value
@Builder
public class LedgerResult {
    List<LedgerMovement> movements;
    List<FinishedSaleRecord> finishedSales;
    BigDecimal closingBalanceSacks;
    BigDecimal closingBalanceValue;
    BigDecimal closingMovingAverageCost;
}
