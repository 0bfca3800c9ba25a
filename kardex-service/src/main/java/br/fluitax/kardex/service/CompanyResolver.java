package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.CompanyDto;
import br.fluitax.common.exception.KardexConfigurationException;
import br.fluitax.common.util.CnpjUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.CompanyMatcher;
import br.fluitax.kardex.repository.CompanyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Determines the legal entities whose invoices are consolidated into one Kardex.
 *
 * Selection precedence: explicit IDs, then explicit CNPJs, then the name-token matchers.
 * Partial consolidation is never allowed: intercompany exclusion is only correct when
 * the full company set is known, so every miss is a configuration error.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CompanyResolver {

    private final CompanyRepository companyRepository;
    private final KardexSettings settings;

    /**
     * @return participating companies in configuration order
     * @throws KardexConfigurationException when the configured set cannot be fully resolved
     */
    public List<CompanyDto> resolve() {
        List<CompanyDto> companies = companyRepository.findAll();

        if (!settings.getCompanyIds().isEmpty()) {
            return resolveExplicit(companies, settings.getCompanyIds(), CompanyDto::getId, "IDs");
        }
        if (!settings.getCompanyCnpjs().isEmpty()) {
            return resolveExplicit(companies, settings.getCompanyCnpjs(),
                    company -> CnpjUtils.normalize(company.getCnpj()), "CNPJs");
        }
        return resolveByMatchers(companies);
    }

    private List<CompanyDto> resolveExplicit(List<CompanyDto> companies,
                                             List<String> requested,
                                             Function<CompanyDto, String> keyExtractor,
                                             String label) {
        Map<String, CompanyDto> byKey = new LinkedHashMap<>();
        for (CompanyDto company : companies) {
            byKey.putIfAbsent(keyExtractor.apply(company), company);
        }

        List<CompanyDto> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String key : requested) {
            CompanyDto company = byKey.get(key);
            if (company == null) {
                missing.add(key);
            } else {
                resolved.add(withAlias(company, findMatcherAlias(company)));
            }
        }

        if (resolved.isEmpty()) {
            log.warn("No company matches the configured {}: {}", label, requested);
            throw new KardexConfigurationException("No company matches the configured " + label);
        }
        if (!missing.isEmpty()) {
            log.warn("Companies not found for {}: {}", label, missing);
            throw new KardexConfigurationException(
                    "Companies not found for " + label + ": " + String.join(", ", missing));
        }

        log.info("Consolidating {} companies selected by {}", resolved.size(), label);
        return resolved;
    }

    private List<CompanyDto> resolveByMatchers(List<CompanyDto> companies) {
        List<CompanyMatcher> matchers = settings.getCompanyMatchers();
        List<CompanyDto> resolved = new ArrayList<>();
        List<String> missingAliases = new ArrayList<>();

        for (CompanyMatcher matcher : matchers) {
            companies.stream()
                    .filter(company -> matcher.matches(company.getName()))
                    .findFirst()
                    .ifPresentOrElse(
                            company -> resolved.add(withAlias(company, matcher.getAlias())),
                            () -> missingAliases.add(matcher.getAlias()));
        }

        if (resolved.isEmpty()) {
            log.warn("No target company found for the consolidated Kardex (matchers: {})", matchers.size());
            throw new KardexConfigurationException("No target company found for the consolidated Kardex");
        }
        if (!missingAliases.isEmpty()) {
            log.warn("Target companies not found: {}", missingAliases);
            throw new KardexConfigurationException(
                    "Target companies not found: " + String.join(", ", missingAliases));
        }

        log.info("Consolidating companies {}", resolved.stream()
                .map(CompanyDto::getAlias)
                .collect(Collectors.joining(", ")));
        return resolved;
    }

    private String findMatcherAlias(CompanyDto company) {
        return settings.getCompanyMatchers().stream()
                .filter(matcher -> matcher.matches(company.getName()))
                .map(CompanyMatcher::getAlias)
                .findFirst()
                .orElse(null);
    }

    private static CompanyDto withAlias(CompanyDto company, String alias) {
        return CompanyDto.builder()
                .id(company.getId())
                .name(company.getName())
                .cnpj(company.getCnpj())
                .alias(alias)
                .build();
    }
}
