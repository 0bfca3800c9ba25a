package br.fluitax.common.dto.kardex;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Sale of a finished good and the raw material it consumed.
 *
 * Drafted by the extractor with the nominal consumption; the ledger completes it with the
 * applied (possibly clamped) consumption. Cost fields stay null when nothing could be
 * consumed, meaning the cost is not attributable.
 */
@Value
@Builder(toBuilder = true)
public class FinishedSaleRecord {

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    LocalDateTime timestamp;

    String invoiceId;
    String itemId;
    ProductAlias productAlias;
    String document;
    String counterparty;
    String counterpartyCnpj;
    String cfop;
    String natureOfOperation;

    BigDecimal unitsSold;
    BigDecimal unitNetPrice;
    BigDecimal valuePerSack;                // unitNetPrice x finished units per sack
    BigDecimal nominalConsumptionSacks;
    BigDecimal rawMaterialConsumedSacks;
    BigDecimal costPerSackAtConsumption;
    BigDecimal rawMaterialCostValue;
}
