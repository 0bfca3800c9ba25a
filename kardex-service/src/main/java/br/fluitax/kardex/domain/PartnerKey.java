package br.fluitax.kardex.domain;

/**
 * Partner lookup key: the same CNPJ may carry different display names per company.
 */
public record PartnerKey(String companyId, String cnpj) {
}
