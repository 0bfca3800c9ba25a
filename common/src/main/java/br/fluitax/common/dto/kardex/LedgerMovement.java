package br.fluitax.common.dto.kardex;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of the raw-material Kardex, carrying the ledger state after the movement.
 *
 * Quantities are unsigned sacks; the direction is given by {@link #type}.
 */
@Value
@Builder(toBuilder = true)
public class LedgerMovement {

    MovementType type;
    StockEventType eventType;       // null for OPENING / PRIOR_BALANCE

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime timestamp;

    String invoiceId;
    String itemId;
    String document;
    String counterparty;
    String counterpartyCnpj;
    String cfop;

    BigDecimal appliedQuantitySacks;
    BigDecimal requestedQuantitySacks;
    BigDecimal unitCost;
    BigDecimal movingAverageCostAfter;
    BigDecimal balanceQuantityAfter;
    BigDecimal balanceValueAfter;
    BigDecimal balanceQuantityBefore;
    BigDecimal balanceValueBefore;

    MovementStatus status;
    boolean costRestarted;
    String notes;

    public boolean isBlocked() {
        return status == MovementStatus.BLOCKED_ZERO_BALANCE;
    }

    public String getStatusLabel() {
        return status == null ? null : status.getLabel();
    }
}
