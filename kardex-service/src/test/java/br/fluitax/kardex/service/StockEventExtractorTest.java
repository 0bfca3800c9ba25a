package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.InvoiceDirection;
import br.fluitax.common.dto.kardex.InvoiceItemRecord;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.dto.kardex.StockEventType;
import br.fluitax.kardex.KardexTestData;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.PartnerKey;
import br.fluitax.kardex.domain.StockEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static br.fluitax.kardex.KardexTestData.finishedSale;
import static br.fluitax.kardex.KardexTestData.rawPurchase;
import static org.junit.jupiter.api.Assertions.*;

class StockEventExtractorTest {

    private static final LocalDateTime DAY_1 = LocalDateTime.of(2025, 2, 3, 9, 0);
    private static final LocalDateTime DAY_2 = LocalDateTime.of(2025, 2, 4, 15, 30);

    private StockEventExtractor extractor;
    private Map<PartnerKey, String> partnerNames;

    @BeforeEach
    void setUp() {
        KardexSettings settings = KardexTestData.settings();
        extractor = new StockEventExtractor(new ProductAliasResolver(settings), new UnitNormalizer(), settings);
        partnerNames = Map.of(new PartnerKey(KardexTestData.JM_ID, KardexTestData.SUPPLIER_CNPJ), "Fazenda Boa Vista");
    }

    @Test
    void extract_ShouldTurnRawPurchaseIntoEntryPricedPerSack() {
        InvoiceItemRecord purchase = rawPurchase("inv-1", DAY_1, "6000", "KG", "60000")
                .discount(new BigDecimal("600"))
                .build();

        List<StockEvent> events = extractor.extract(List.of(purchase), KardexTestData.companies(), partnerNames);

        assertEquals(1, events.size());
        StockEvent entry = events.get(0);
        assertEquals(StockEventType.ENTRY, entry.getType());
        assertEquals(0, new BigDecimal("100").compareTo(entry.getQuantitySacks()));
        assertEquals(0, new BigDecimal("594").compareTo(entry.getUnitCost()));
        assertEquals(0, new BigDecimal("59400").compareTo(entry.getNetTotal()));
        assertEquals("Fazenda Boa Vista", entry.getCounterpartyName());
        assertEquals(KardexTestData.SUPPLIER_CNPJ, entry.getCounterpartyCnpj());
        assertEquals("NF-inv-1", entry.getDocument());
        assertEquals("Raw material entry", entry.getNotes());
        assertEquals(0, entry.getEventOrder());
    }

    @Test
    void extract_ShouldTurnRawSaleIntoExit() {
        InvoiceItemRecord sale = rawPurchase("inv-2", DAY_1, "10", "SC", "6000")
                .direction(InvoiceDirection.OUTBOUND)
                .issuerCnpj(KardexTestData.JM_CNPJ)
                .recipientCnpj(KardexTestData.CUSTOMER_CNPJ)
                .invoiceNumber(null)
                .accessKey("35250211111111000111550010000000021000000021")
                .build();

        StockEvent exit = extractor.extract(List.of(sale), KardexTestData.companies(), partnerNames).get(0);

        assertEquals(StockEventType.EXIT, exit.getType());
        assertEquals("Raw material sale", exit.getNotes());
        // No partner registered: the CNPJ is the display name
        assertEquals(KardexTestData.CUSTOMER_CNPJ, exit.getCounterpartyName());
        assertEquals("35250211111111000111550010000000021000000021", exit.getDocument());
    }

    @Test
    void extract_ShouldTurnFinishedSaleIntoConsumptionWithDraft() {
        InvoiceItemRecord sale = finishedSale("inv-3", DAY_2, "Cafe do Rancho 10x500g", "20", "400").build();

        List<StockEvent> events = extractor.extract(List.of(sale), KardexTestData.companies(), partnerNames);

        assertEquals(1, events.size());
        StockEvent consumption = events.get(0);
        assertEquals(StockEventType.CONSUMPTION, consumption.getType());
        assertEquals(0, new BigDecimal("10").compareTo(consumption.getQuantitySacks()));
        assertEquals("Consumption by ACABADO_RANCHO_10X500", consumption.getNotes());

        FinishedSaleRecord draft = consumption.getSaleDraft();
        assertNotNull(draft);
        assertEquals(ProductAlias.FINISHED_RANCHO_10X500, draft.getProductAlias());
        assertEquals(0, new BigDecimal("20").compareTo(draft.getUnitNetPrice()));
        assertEquals(0, new BigDecimal("192").compareTo(draft.getValuePerSack()));
        assertEquals("VENDA DE PRODUCAO", draft.getNatureOfOperation());
        assertNull(draft.getRawMaterialCostValue());
    }

    @Test
    void extract_ShouldIgnoreFinishedGoodsPurchasesAndZeroQuantitySales() {
        InvoiceItemRecord inbound = finishedSale("inv-4", DAY_2, "Cafe do Rancho 10x500g", "20", "400")
                .direction(InvoiceDirection.INBOUND)
                .build();
        InvoiceItemRecord zero = finishedSale("inv-5", DAY_2, "Cafe do Rancho 10x500g", "0", "0").build();

        assertTrue(extractor.extract(List.of(inbound, zero), KardexTestData.companies(), partnerNames).isEmpty());
    }

    @Test
    void extract_ShouldDropIntercompanyInvoicesEntirely() {
        InvoiceItemRecord first = rawPurchase("inv-6", DAY_1, "10", "SC", "5000")
                .issuerCnpj(KardexTestData.OLG_CNPJ)
                .recipientCnpj(KardexTestData.JM_CNPJ)
                .build();
        InvoiceItemRecord second = finishedSale("inv-6", DAY_1, "Cafe do Rancho 10x500g", "5", "100")
                .itemId("inv-6-2")
                .build();

        assertTrue(extractor.extract(List.of(first, second), KardexTestData.companies(), partnerNames).isEmpty());
    }

    @Test
    void extract_ShouldDropBlockedCancelledAndRemittanceItems() {
        InvoiceItemRecord blocked = rawPurchase("inv-7", DAY_1, "10", "SC", "5000")
                .issuerCnpj("99.999.999/0001-99")
                .build();
        InvoiceItemRecord cancelled = rawPurchase("inv-8", DAY_1, "10", "SC", "5000")
                .cancelled(true)
                .build();
        InvoiceItemRecord remittance = rawPurchase("inv-9", DAY_1, "10", "SC", "5000")
                .cfop("5905")
                .build();
        InvoiceItemRecord unknown = rawPurchase("inv-10", DAY_1, "10", "SC", "5000")
                .description("Embalagem valvulada")
                .build();

        List<StockEvent> events = extractor.extract(
                List.of(blocked, cancelled, remittance, unknown), KardexTestData.companies(), partnerNames);

        assertTrue(events.isEmpty());
    }

    @Test
    void computeUnitNetPrice_ShouldBeZeroForZeroQuantity() {
        InvoiceItemRecord item = rawPurchase("inv-11", DAY_1, "0", "SC", "100").build();
        assertEquals(0, BigDecimal.ZERO.compareTo(StockEventExtractor.computeUnitNetPrice(item)));
    }
}
