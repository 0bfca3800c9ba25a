package br.fluitax.common.dto.kardex;

/**
 * Invoice direction from the perspective of the owning company.
 *
 * INBOUND: the company received the goods (purchase, NFe de entrada)
 * OUTBOUND: the company shipped the goods (sale, NFe de saida)
 */
public enum InvoiceDirection {
    INBOUND,
    OUTBOUND
}
