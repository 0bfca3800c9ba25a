package br.fluitax.kardex.config;

import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.kardex.domain.CompanyMatcher;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration of the consolidated Kardex.
 *
 * Built once by {@link KardexConfig} and handed to every engine component; report
 * builds never read the environment themselves.
 */
@Value
@Builder(toBuilder = true)
public class KardexSettings {

    /**
     * Start of the reconstructed history. Nothing earlier is fetched.
     */
    LocalDate epochDate;

    BigDecimal openingStockSacks;
    BigDecimal openingUnitCost;

    /**
     * Raw-material sacks consumed per finished unit sold.
     */
    BigDecimal consumptionRatioSacksPerUnit;

    /**
     * Finished units per raw-material sack (price-per-sack conversions).
     */
    BigDecimal finishedUnitsPerSack;

    @Singular
    Set<String> blockedCnpjs;

    @Singular
    Set<String> excludedCfops;

    @Singular
    List<String> companyIds;

    @Singular
    List<String> companyCnpjs;

    @Singular
    List<CompanyMatcher> companyMatchers;

    @Singular
    Map<ProductAlias, List<String>> productNames;

    int fetchTimeoutSeconds;
}
