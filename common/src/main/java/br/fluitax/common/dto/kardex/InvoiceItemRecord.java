package br.fluitax.common.dto.kardex;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One invoice line (NFe item) flattened with its invoice header.
 *
 * Read-only input of the Kardex engine. Decimal fields are already coerced;
 * malformed source values arrive as zero.
 */
@Value
@Builder
public class InvoiceItemRecord {

    String invoiceId;
    String itemId;
    String companyId;               // company that owns (uploaded) the invoice

    LocalDateTime issuedAt;         // emissao
    InvoiceDirection direction;
    String issuerCnpj;
    String recipientCnpj;
    String invoiceNumber;           // numero
    String accessKey;               // chave (44 digits)
    String natureOfOperation;       // natOp
    boolean cancelled;

    String cfop;
    String description;
    String productCode;
    String mappedProductName;       // catalogue product mapped to this line, if any
    String mappedProductDescription;

    String unit;
    BigDecimal quantity;
    BigDecimal unitPrice;
    BigDecimal grossValue;
    BigDecimal discount;
}
