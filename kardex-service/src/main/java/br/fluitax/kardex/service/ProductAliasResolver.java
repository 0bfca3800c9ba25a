package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.InvoiceItemRecord;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.util.TextNormalizer;
import br.fluitax.kardex.config.KardexSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Maps an invoice line to the product it represents.
 *
 * Candidate fields are tried in order (mapped name, mapped description, description,
 * product code). Each candidate is checked against the configured name table and then the
 * processed-Conilon keywords before the next one is looked at. A line no rule recognizes
 * is not part of the Kardex.
 */
@Slf4j
@Component
public class ProductAliasResolver {

    private static final List<String> RAW_MATERIAL_KEYWORDS = List.of("CAFECONILON", "CAFECONILLON", "CAFECANILON");
    private static final String PROCESSED_KEYWORD = "BENEFICIAD";

    private final Map<String, ProductAlias> lookup = new HashMap<>();

    public ProductAliasResolver(KardexSettings settings) {
        settings.getProductNames().forEach((alias, names) -> names.forEach(name -> register(name, alias)));
        // Codes and labels always resolve to themselves
        for (ProductAlias alias : ProductAlias.values()) {
            register(alias.getCode(), alias);
            register(alias.getLabel(), alias);
        }
        log.debug("Product alias table loaded with {} keys", lookup.size());
    }

    private void register(String name, ProductAlias alias) {
        String key = TextNormalizer.normalizeKey(name);
        if (key.isEmpty()) {
            return;
        }
        ProductAlias previous = lookup.putIfAbsent(key, alias);
        if (previous != null && previous != alias) {
            log.warn("Product name '{}' configured for both {} and {}, keeping {}", name, previous, alias, previous);
        }
    }

    /**
     * @return the product alias, or null when the line is not a tracked product
     */
    public ProductAlias resolve(InvoiceItemRecord item) {
        List<String> keys = Stream.of(
                        item.getMappedProductName(),
                        item.getMappedProductDescription(),
                        item.getDescription(),
                        item.getProductCode())
                .map(TextNormalizer::normalizeKey)
                .filter(key -> !key.isEmpty())
                .toList();

        for (String key : keys) {
            ProductAlias alias = lookup.get(key);
            if (alias != null) {
                return alias;
            }
            if (isProcessedConilon(key)) {
                return ProductAlias.RAW_MATERIAL;
            }
        }
        return null;
    }

    private static boolean isProcessedConilon(String key) {
        return key.contains(PROCESSED_KEYWORD)
                && RAW_MATERIAL_KEYWORDS.stream().anyMatch(key::contains);
    }
}
