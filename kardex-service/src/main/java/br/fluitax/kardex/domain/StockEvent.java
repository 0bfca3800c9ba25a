package br.fluitax.kardex.domain;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.dto.kardex.StockEventType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raw-material stock event derived from one invoice line, before it is applied to the ledger.
 */
@Value
@Builder
public class StockEvent {

    StockEventType type;
    LocalDateTime timestamp;
    String invoiceId;
    String itemId;
    ProductAlias productAlias;

    BigDecimal quantitySacks;
    BigDecimal unitCost;        // per sack, entries only
    BigDecimal netTotal;        // invoice net value of the line, entries only

    String counterpartyName;
    String counterpartyCnpj;
    String document;
    String cfop;
    String notes;

    /**
     * Present on CONSUMPTION events: the sale to complete once the consumption is applied.
     */
    FinishedSaleRecord saleDraft;

    public int getEventOrder() {
        return type.getOrder();
    }
}
