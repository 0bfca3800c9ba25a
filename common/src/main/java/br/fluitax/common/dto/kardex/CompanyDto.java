package br.fluitax.common.dto.kardex;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Legal entity taking part in the consolidated Kardex.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyDto {
    private String id;
    private String name;
    private String cnpj;
    private String alias;           // matcher alias (e.g. "JM"), null when chosen by ID/CNPJ without a match
}
