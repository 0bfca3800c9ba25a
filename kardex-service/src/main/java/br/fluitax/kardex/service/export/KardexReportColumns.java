package br.fluitax.kardex.service.export;

import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.LedgerMovement;
import br.fluitax.common.dto.kardex.MovementType;
import br.fluitax.common.util.AmountUtils;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Column layout shared by the CSV and Excel renderings of the Kardex report.
 * Quantities are shown with 4 digits, money with 2.
 */
final class KardexReportColumns {

    static final char CSV_SEPARATOR = ';';
    static final String CSV_LINE_END = "\n";

    static final int QUANTITY_DIGITS = 4;
    static final int MONEY_DIGITS = 2;

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    static final List<String> LEDGER_HEADER = List.of(
            "Date/Time", "Document", "Counterparty", "CFOP", "Type", "Status",
            "Qty (SC)", "Requested (SC)", "Unit Cost (R$/SC)", "Moving Avg Cost After (R$/SC)",
            "Balance (SC)", "Balance Value (R$)", "Cost Restart", "Notes");

    static final List<String> SALES_HEADER = List.of(
            "Date/Time", "Document", "Counterparty", "Product", "Qty (units)", "Unit Sale Price (R$)",
            "Raw Material Consumed (SC)", "Avg Cost per SC at Sale (R$)", "Raw Material Cost (R$)",
            "Value per Sack (R$)");

    private KardexReportColumns() {
        // Utility class - no instantiation
    }

    /**
     * Writes the rows as semicolon CSV. Values are quoted only when they contain a quote,
     * the separator or a line break.
     */
    static String toCsv(List<List<String>> rows) {
        StringWriter out = new StringWriter();
        try (ICSVWriter writer = new CSVWriterBuilder(out)
                .withSeparator(CSV_SEPARATOR)
                .withLineEnd(CSV_LINE_END)
                .build()) {
            for (List<String> row : rows) {
                writer.writeNext(row.toArray(new String[0]), false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString();
    }

    static List<String> ledgerRow(LedgerMovement movement) {
        return Arrays.asList(
                timestamp(movement.getTimestamp()),
                movement.getDocument(),
                movement.getCounterparty(),
                movement.getCfop(),
                typeLabel(movement.getType()),
                movement.getStatusLabel(),
                quantity(movement.getType() == MovementType.OPENING || movement.getType() == MovementType.PRIOR_BALANCE
                        ? movement.getBalanceQuantityAfter()
                        : movement.getAppliedQuantitySacks()),
                quantity(movement.getRequestedQuantitySacks()),
                money(movement.getUnitCost()),
                money(movement.getMovingAverageCostAfter()),
                quantity(movement.getBalanceQuantityAfter()),
                money(movement.getBalanceValueAfter()),
                movement.isCostRestarted() ? "Yes" : "No",
                movement.getNotes());
    }

    static List<String> saleRow(FinishedSaleRecord sale) {
        return Arrays.asList(
                timestamp(sale.getTimestamp()),
                sale.getDocument(),
                sale.getCounterparty(),
                sale.getProductAlias() == null ? null : sale.getProductAlias().getCode(),
                quantity(sale.getUnitsSold()),
                money(sale.getUnitNetPrice()),
                quantity(sale.getRawMaterialConsumedSacks()),
                money(sale.getCostPerSackAtConsumption()),
                money(sale.getRawMaterialCostValue()),
                money(sale.getValuePerSack()));
    }

    static String typeLabel(MovementType type) {
        if (type == null) {
            return null;
        }
        return switch (type) {
            case OPENING -> "Opening Balance";
            case PRIOR_BALANCE -> "Prior Balance";
            case ENTRY -> "Entry";
            case EXIT -> "Exit";
        };
    }

    static String timestamp(LocalDateTime value) {
        return value == null ? "" : value.format(TIMESTAMP_FORMAT);
    }

    static String quantity(BigDecimal value) {
        return AmountUtils.format(value, QUANTITY_DIGITS);
    }

    static String money(BigDecimal value) {
        return AmountUtils.format(value, MONEY_DIGITS);
    }
}
