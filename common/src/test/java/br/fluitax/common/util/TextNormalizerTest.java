package br.fluitax.common.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TextNormalizerTest {

    @Test
    void normalizeText_ShouldStripAccentsAndCollapseWhitespace() {
        assertEquals("CAFE CONILON", TextNormalizer.normalizeText("  Café   conilon "));
        assertEquals("SACAS DE 60KG", TextNormalizer.normalizeText("Sacas de 60kg"));
        assertEquals("", TextNormalizer.normalizeText(null));
    }

    @Test
    void normalizeKey_ShouldKeepOnlyLettersAndDigits() {
        assertEquals("CAFECONILON60KG", TextNormalizer.normalizeKey("Café Conilon - 60kg"));
        assertEquals("", TextNormalizer.normalizeKey("  -- "));
    }

    @Test
    void tokens_ShouldSplitNormalizedText() {
        assertEquals(List.of("JM", "CAFE", "LTDA"), TextNormalizer.tokens("JM Café ltda"));
        assertTrue(TextNormalizer.tokens("   ").isEmpty());
    }

    @Test
    void cnpj_ShouldNormalizeAndValidateLength() {
        assertEquals("12345678000190", CnpjUtils.normalize("12.345.678/0001-90"));
        assertEquals("", CnpjUtils.normalize(null));
        assertTrue(CnpjUtils.isCnpj("12.345.678/0001-90"));
        assertFalse(CnpjUtils.isCnpj("123.456.789-01"));
    }
}
