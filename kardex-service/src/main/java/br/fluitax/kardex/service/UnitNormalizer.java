package br.fluitax.kardex.service;

import br.fluitax.common.util.AmountUtils;
import br.fluitax.common.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Converts invoice quantities of the raw material into 60 kg sacks.
 *
 * Supported units: kilograms, sacks, tonnes. Any other unit is passed through
 * unchanged (and logged), since that is how legacy invoices were always read.
 */
@Slf4j
@Component
public class UnitNormalizer {

    static final BigDecimal KG_PER_SACK = new BigDecimal("60");
    static final BigDecimal KG_PER_TONNE = new BigDecimal("1000");

    private static final Set<String> KILOGRAM_UNITS = Set.of("KG", "KILOGRAMA", "KILOGRAMAS");
    private static final Set<String> SACK_UNITS = Set.of("SC", "SACA", "SACAS", "SC60KG", "SACAS DE 60KG");
    private static final Set<String> TONNE_UNITS = Set.of("TON", "TONELADA", "TONELADAS");

    /**
     * @return quantity in sacks, rounded to the internal ledger precision
     */
    public BigDecimal toSacks(BigDecimal quantity, String unit) {
        if (quantity == null) {
            return AmountUtils.round(BigDecimal.ZERO);
        }
        String normalized = TextNormalizer.normalizeText(unit);

        if (KILOGRAM_UNITS.contains(normalized)) {
            return AmountUtils.round(AmountUtils.divide(quantity, KG_PER_SACK));
        }
        if (SACK_UNITS.contains(normalized)) {
            return AmountUtils.round(quantity);
        }
        if (TONNE_UNITS.contains(normalized)) {
            return AmountUtils.round(AmountUtils.divide(quantity.multiply(KG_PER_TONNE), KG_PER_SACK));
        }

        log.warn("Unknown unit '{}' for raw material, quantity {} taken as sacks", unit, quantity);
        return AmountUtils.round(quantity);
    }
}
