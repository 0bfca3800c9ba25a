package br.fluitax.kardex.config;

import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.util.CnpjUtils;
import br.fluitax.common.util.DateUtils;
import br.fluitax.kardex.domain.CompanyMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Reads the kardex.* properties and exposes them as one {@link KardexSettings} bean.
 */
@Slf4j
@Configuration
public class KardexConfig {

    @Value("${kardex.epoch-date:2025-01-01}")
    private String epochDate;

    @Value("${kardex.opening-stock.quantity-sacks:0}")
    private BigDecimal openingStockSacks;

    @Value("${kardex.opening-stock.unit-cost:0}")
    private BigDecimal openingUnitCost;

    @Value("${kardex.consumption-ratio-sacks-per-unit:0.104167}")
    private BigDecimal consumptionRatio;

    @Value("${kardex.finished-units-per-sack:9.6}")
    private BigDecimal finishedUnitsPerSack;

    @Value("${kardex.blocked-cnpjs:}")
    private List<String> blockedCnpjs;

    @Value("${kardex.excluded-cfops:5905,5906}")
    private List<String> excludedCfops;

    @Value("${kardex.company-ids:}")
    private List<String> companyIds;

    @Value("${kardex.company-cnpjs:}")
    private List<String> companyCnpjs;

    @Value("${kardex.company-matchers:}")
    private String companyMatchers;

    @Value("${kardex.product-names.raw-material:}")
    private List<String> rawMaterialNames;

    @Value("${kardex.product-names.finished-rancho-10x500:}")
    private List<String> rancho10x500Names;

    @Value("${kardex.product-names.finished-rancho-20x250:}")
    private List<String> rancho20x250Names;

    @Value("${kardex.product-names.finished-nova-era-10x500:}")
    private List<String> novaEra10x500Names;

    @Value("${kardex.fetch-timeout-seconds:60}")
    private int fetchTimeoutSeconds;

    @Bean
    public KardexSettings kardexSettings() {
        LocalDate epoch = DateUtils.parseDate(epochDate);
        if (epoch == null) {
            throw new IllegalStateException("kardex.epoch-date must be YYYY-MM-DD, got: " + epochDate);
        }

        KardexSettings settings = KardexSettings.builder()
                .epochDate(epoch)
                .openingStockSacks(openingStockSacks)
                .openingUnitCost(openingUnitCost)
                .consumptionRatioSacksPerUnit(consumptionRatio)
                .finishedUnitsPerSack(finishedUnitsPerSack)
                .blockedCnpjs(cleanCnpjs(blockedCnpjs))
                .excludedCfops(clean(excludedCfops))
                .companyIds(clean(companyIds))
                .companyCnpjs(cleanCnpjs(companyCnpjs))
                .companyMatchers(CompanyMatcher.parseAll(companyMatchers))
                .productName(ProductAlias.RAW_MATERIAL, clean(rawMaterialNames))
                .productName(ProductAlias.FINISHED_RANCHO_10X500, clean(rancho10x500Names))
                .productName(ProductAlias.FINISHED_RANCHO_20X250, clean(rancho20x250Names))
                .productName(ProductAlias.FINISHED_NOVA_ERA_10X500, clean(novaEra10x500Names))
                .fetchTimeoutSeconds(fetchTimeoutSeconds)
                .build();

        log.info("Kardex configured: epoch={}, openingStock={} SC @ {}, ratio={} SC/unit, matchers={}, blockedCnpjs={}",
                settings.getEpochDate(), settings.getOpeningStockSacks(), settings.getOpeningUnitCost(),
                settings.getConsumptionRatioSacksPerUnit(), settings.getCompanyMatchers().size(),
                settings.getBlockedCnpjs().size());
        return settings;
    }

    private static List<String> clean(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(v -> !v.isEmpty())
                .collect(Collectors.toList());
    }

    // Only well-formed 14-digit CNPJs survive; anything else could never match an invoice.
    private static List<String> cleanCnpjs(List<String> values) {
        return clean(values).stream()
                .map(CnpjUtils::normalize)
                .filter(v -> v.length() == 14)
                .collect(Collectors.toList());
    }
}
