package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import br.fluitax.common.dto.kardex.MovementStatus;
import br.fluitax.common.dto.kardex.MovementType;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.dto.kardex.StockEventType;
import br.fluitax.kardex.KardexTestData;
import br.fluitax.kardex.domain.LedgerResult;
import br.fluitax.kardex.domain.StockEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LedgerProcessorTest {

    private static final LocalDateTime OPENING = LocalDateTime.of(2025, 1, 1, 0, 0);

    private LedgerProcessor processor;

    @BeforeEach
    void setUp() {
        processor = new LedgerProcessor(KardexTestData.settings());
    }

    @Test
    void process_ShouldStartFromConfiguredOpeningStock() {
        LedgerResult result = processor.process(List.of(), OPENING);

        LedgerMovement opening = result.getMovements().get(0);
        assertEquals(MovementType.OPENING, opening.getType());
        assertEquals(OPENING, opening.getTimestamp());
        assertEquals(0, new BigDecimal("100").compareTo(opening.getBalanceQuantityAfter()));
        assertEquals(0, new BigDecimal("50000").compareTo(opening.getBalanceValueAfter()));
        assertEquals(0, new BigDecimal("500").compareTo(opening.getMovingAverageCostAfter()));
        assertEquals(0, new BigDecimal("500").compareTo(result.getClosingMovingAverageCost()));
    }

    @Test
    void process_ShouldWeightEntriesIntoMovingAverage() {
        LedgerResult result = processor.process(List.of(entry("e1", at(2), "50", "600")), OPENING);

        LedgerMovement entry = result.getMovements().get(1);
        assertEquals(MovementType.ENTRY, entry.getType());
        assertEquals(0, new BigDecimal("150").compareTo(entry.getBalanceQuantityAfter()));
        assertEquals(0, new BigDecimal("80000").compareTo(entry.getBalanceValueAfter()));
        assertEquals(new BigDecimal("533.333333"), entry.getMovingAverageCostAfter());
        assertFalse(entry.isCostRestarted());
    }

    @Test
    void process_ShouldClampExitAndRecordBlockedRemainder() {
        LedgerResult result = processor.process(List.of(
                entry("e1", at(2), "50", "600"),
                exit("x1", at(3), "200")), OPENING);

        List<LedgerMovement> movements = result.getMovements();
        assertEquals(4, movements.size());

        LedgerMovement exit = movements.get(2);
        assertEquals(MovementStatus.NORMAL, exit.getStatus());
        assertEquals(0, new BigDecimal("150").compareTo(exit.getAppliedQuantitySacks()));
        assertEquals(0, new BigDecimal("200").compareTo(exit.getRequestedQuantitySacks()));
        assertEquals(0, BigDecimal.ZERO.compareTo(exit.getBalanceQuantityAfter()));
        assertEquals(0, BigDecimal.ZERO.compareTo(exit.getBalanceValueAfter()));
        assertEquals("Raw material sale | Quantity limited to available balance", exit.getNotes());

        LedgerMovement blocked = movements.get(3);
        assertTrue(blocked.isBlocked());
        assertEquals(0, BigDecimal.ZERO.compareTo(blocked.getAppliedQuantitySacks()));
        assertEquals(0, new BigDecimal("50").compareTo(blocked.getRequestedQuantitySacks()));
        assertEquals("Raw material sale | Movement not applied (zero balance) | Blocked quantity: 50.0000 SC",
                blocked.getNotes());
    }

    @Test
    void process_ShouldRestartCostWhenEntryReplenishesZeroBalance() {
        LedgerResult result = processor.process(List.of(
                entry("e1", at(2), "50", "600"),
                exit("x1", at(3), "200"),
                entry("e2", at(4), "30", "700")), OPENING);

        LedgerMovement restart = result.getMovements().get(4);
        assertTrue(restart.isCostRestarted());
        assertEquals(0, new BigDecimal("700").compareTo(restart.getMovingAverageCostAfter()));
        assertEquals(0, new BigDecimal("30").compareTo(restart.getBalanceQuantityAfter()));
        assertEquals(0, new BigDecimal("21000").compareTo(restart.getBalanceValueAfter()));
    }

    @Test
    void process_ShouldCostConsumptionAtCurrentAverage() {
        LedgerResult result = processor.process(List.of(
                consumption("s1", at(2), "5", "10")), OPENING);

        FinishedSaleRecord sale = result.getFinishedSales().get(0);
        assertEquals(0, new BigDecimal("5").compareTo(sale.getRawMaterialConsumedSacks()));
        assertEquals(0, new BigDecimal("500").compareTo(sale.getCostPerSackAtConsumption()));
        assertEquals(0, new BigDecimal("2500").compareTo(sale.getRawMaterialCostValue()));

        LedgerMovement movement = result.getMovements().get(1);
        assertEquals(MovementType.EXIT, movement.getType());
        assertEquals(StockEventType.CONSUMPTION, movement.getEventType());
        assertEquals(0, new BigDecimal("95").compareTo(movement.getBalanceQuantityAfter()));
        assertEquals(0, new BigDecimal("500").compareTo(movement.getMovingAverageCostAfter()));
    }

    @Test
    void process_ShouldLimitConsumptionToBalanceAndBlockRemainder() {
        LedgerResult result = processor.process(List.of(
                entry("e1", at(2), "50", "800"),
                exit("x1", at(3), "120"),
                consumption("s1", at(4), "60", "120")), OPENING);

        // 100 @ 500 + 50 @ 800 -> 150 @ 600; exit leaves 30 @ 600
        List<LedgerMovement> movements = result.getMovements();
        assertEquals(5, movements.size());

        LedgerMovement consumption = movements.get(3);
        assertEquals(StockEventType.CONSUMPTION, consumption.getEventType());
        assertFalse(consumption.isBlocked());
        assertEquals(0, new BigDecimal("30").compareTo(consumption.getAppliedQuantitySacks()));
        assertEquals(0, new BigDecimal("60").compareTo(consumption.getRequestedQuantitySacks()));
        assertEquals(0, new BigDecimal("600").compareTo(consumption.getUnitCost()));
        assertEquals(0, BigDecimal.ZERO.compareTo(consumption.getBalanceQuantityAfter()));
        assertEquals(0, BigDecimal.ZERO.compareTo(consumption.getBalanceValueAfter()));
        assertEquals("Consumption by ACABADO_RANCHO_10X500 | Quantity limited to available balance",
                consumption.getNotes());

        LedgerMovement blocked = movements.get(4);
        assertTrue(blocked.isBlocked());
        assertEquals(StockEventType.CONSUMPTION, blocked.getEventType());
        assertEquals(0, BigDecimal.ZERO.compareTo(blocked.getAppliedQuantitySacks()));
        assertEquals(0, new BigDecimal("30").compareTo(blocked.getRequestedQuantitySacks()));
        assertEquals("Consumption by ACABADO_RANCHO_10X500 | Movement not applied (zero balance)"
                + " | Blocked quantity: 30.0000 SC", blocked.getNotes());
        assertEquals(1, movements.stream().filter(LedgerMovement::isBlocked).count());

        assertEquals(1, result.getFinishedSales().size());
        FinishedSaleRecord sale = result.getFinishedSales().get(0);
        assertEquals(0, new BigDecimal("30").compareTo(sale.getRawMaterialConsumedSacks()));
        assertEquals(0, new BigDecimal("60").compareTo(sale.getNominalConsumptionSacks()));
        assertEquals(0, new BigDecimal("600").compareTo(sale.getCostPerSackAtConsumption()));
        assertEquals(0, new BigDecimal("18000").compareTo(sale.getRawMaterialCostValue()));
    }

    @Test
    void process_ShouldBlockWithdrawalsAtZeroBalanceWithoutChangingState() {
        LedgerResult result = processor.process(List.of(
                exit("x1", at(2), "100"),
                consumption("s1", at(3), "5", "10")), OPENING);

        LedgerMovement blocked = result.getMovements().get(2);
        assertTrue(blocked.isBlocked());
        assertEquals(0, BigDecimal.ZERO.compareTo(blocked.getAppliedQuantitySacks()));
        assertEquals(0, new BigDecimal("5").compareTo(blocked.getRequestedQuantitySacks()));
        assertEquals(0, BigDecimal.ZERO.compareTo(blocked.getBalanceQuantityAfter()));
        assertEquals("Consumption by ACABADO_RANCHO_10X500 | Movement not applied (zero balance)", blocked.getNotes());

        FinishedSaleRecord sale = result.getFinishedSales().get(0);
        assertEquals(0, BigDecimal.ZERO.compareTo(sale.getRawMaterialConsumedSacks()));
        assertNull(sale.getCostPerSackAtConsumption());
        assertNull(sale.getRawMaterialCostValue());
        assertEquals(0, new BigDecimal("5").compareTo(sale.getNominalConsumptionSacks()));
    }

    @Test
    void process_ShouldApplyEntriesBeforeWithdrawalsOfTheSameLine() {
        LocalDateTime sameTime = at(2);
        StockEvent exitFirst = StockEvent.builder()
                .type(StockEventType.EXIT).timestamp(sameTime).invoiceId("inv").itemId("1")
                .quantitySacks(new BigDecimal("120")).build();
        StockEvent entrySecond = StockEvent.builder()
                .type(StockEventType.ENTRY).timestamp(sameTime).invoiceId("inv").itemId("1")
                .quantitySacks(new BigDecimal("20")).unitCost(new BigDecimal("500")).build();

        LedgerResult result = processor.process(List.of(exitFirst, entrySecond), OPENING);

        assertEquals(MovementType.ENTRY, result.getMovements().get(1).getType());
        LedgerMovement exit = result.getMovements().get(2);
        assertEquals(0, new BigDecimal("120").compareTo(exit.getAppliedQuantitySacks()));
        assertFalse(exit.isBlocked());
    }

    @Test
    void process_ShouldUseAverageCostForEntriesWithoutPrice() {
        StockEvent unpriced = StockEvent.builder()
                .type(StockEventType.ENTRY).timestamp(at(2)).invoiceId("e0").itemId("1")
                .quantitySacks(new BigDecimal("100")).build();

        LedgerResult result = processor.process(List.of(unpriced), OPENING);

        LedgerMovement entry = result.getMovements().get(1);
        assertEquals(0, new BigDecimal("500").compareTo(entry.getUnitCost()));
        assertEquals(0, new BigDecimal("100000").compareTo(entry.getBalanceValueAfter()));
        assertEquals(0, new BigDecimal("500").compareTo(entry.getMovingAverageCostAfter()));
    }

    @Test
    void process_ShouldKeepBalancesNonNegativeAndConserveQuantity() {
        List<StockEvent> events = mixedHistory();

        LedgerResult result = processor.process(events, OPENING);

        BigDecimal expected = new BigDecimal("100");
        for (LedgerMovement movement : result.getMovements()) {
            assertTrue(movement.getBalanceQuantityAfter().signum() >= 0);
            if (movement.getBalanceQuantityAfter().signum() == 0) {
                assertEquals(0, movement.getBalanceValueAfter().signum());
            }
            if (movement.getType() == MovementType.ENTRY) {
                expected = expected.add(movement.getAppliedQuantitySacks());
            } else if (movement.getType() == MovementType.EXIT) {
                expected = expected.subtract(movement.getAppliedQuantitySacks());
            }
        }
        assertEquals(0, expected.compareTo(result.getClosingBalanceSacks()));
    }

    @Test
    void process_ShouldBeDeterministicRegardlessOfInputOrder() {
        List<StockEvent> events = mixedHistory();
        List<StockEvent> shuffled = new ArrayList<>(events);
        Collections.shuffle(shuffled, new Random(42));

        LedgerResult first = processor.process(events, OPENING);
        LedgerResult second = processor.process(shuffled, OPENING);

        assertEquals(first.getMovements(), second.getMovements());
        assertEquals(first.getFinishedSales(), second.getFinishedSales());
    }

    private List<StockEvent> mixedHistory() {
        return List.of(
                entry("e1", at(2), "50", "600"),
                consumption("s1", at(3), "12.5", "25"),
                exit("x1", at(4), "200"),
                consumption("s2", at(5), "3", "6"),
                entry("e2", at(6), "30.333333", "710.55"),
                exit("x2", at(7), "10.1"),
                entry("e3", at(8), "80", "655.10"),
                consumption("s3", at(9), "1.041667", "10"));
    }

    private static LocalDateTime at(int day) {
        return LocalDateTime.of(2025, 1, day, 10, 0);
    }

    private static StockEvent entry(String invoiceId, LocalDateTime timestamp, String sacks, String unitCost) {
        BigDecimal quantity = new BigDecimal(sacks);
        BigDecimal cost = new BigDecimal(unitCost);
        return StockEvent.builder()
                .type(StockEventType.ENTRY)
                .timestamp(timestamp)
                .invoiceId(invoiceId)
                .itemId("1")
                .productAlias(ProductAlias.RAW_MATERIAL)
                .quantitySacks(quantity)
                .unitCost(cost)
                .netTotal(quantity.multiply(cost))
                .notes("Raw material entry")
                .build();
    }

    private static StockEvent exit(String invoiceId, LocalDateTime timestamp, String sacks) {
        return StockEvent.builder()
                .type(StockEventType.EXIT)
                .timestamp(timestamp)
                .invoiceId(invoiceId)
                .itemId("1")
                .productAlias(ProductAlias.RAW_MATERIAL)
                .quantitySacks(new BigDecimal(sacks))
                .notes("Raw material sale")
                .build();
    }

    private static StockEvent consumption(String invoiceId, LocalDateTime timestamp, String sacks, String units) {
        FinishedSaleRecord draft = FinishedSaleRecord.builder()
                .timestamp(timestamp)
                .invoiceId(invoiceId)
                .itemId("1")
                .productAlias(ProductAlias.FINISHED_RANCHO_10X500)
                .unitsSold(new BigDecimal(units))
                .unitNetPrice(new BigDecimal("20"))
                .nominalConsumptionSacks(new BigDecimal(sacks))
                .rawMaterialConsumedSacks(new BigDecimal(sacks))
                .build();
        return StockEvent.builder()
                .type(StockEventType.CONSUMPTION)
                .timestamp(timestamp)
                .invoiceId(invoiceId)
                .itemId("1")
                .productAlias(ProductAlias.FINISHED_RANCHO_10X500)
                .quantitySacks(new BigDecimal(sacks))
                .notes("Consumption by ACABADO_RANCHO_10X500")
                .saleDraft(draft)
                .build();
    }
}
