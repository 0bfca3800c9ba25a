package br.fluitax.kardex.service.export;

import br.fluitax.common.dto.kardex.ProductTotalDto;
import br.fluitax.common.dto.kardex.SalesByPeriodReportDto;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static br.fluitax.kardex.service.export.KardexReportColumns.money;
import static br.fluitax.kardex.service.export.KardexReportColumns.quantity;

/**
 * Renders the sales-by-period report as a semicolon CSV, one row per product plus a total row.
 */
@Component
public class SalesByPeriodCsvExporter {

    static final List<String> HEADER = List.of(
            "Product", "Qty (units)", "Avg Unit Price (R$)", "Price per Sack (R$)",
            "Raw Material Consumed (SC)", "Avg Raw Material Cost per SC (R$)");

    public String export(SalesByPeriodReportDto report) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(HEADER);
        for (ProductTotalDto product : report.getProducts()) {
            rows.add(Arrays.asList(
                    product.getProductLabel(),
                    quantity(product.getUnitsSold()),
                    money(product.getAverageUnitPrice()),
                    money(product.getRevenuePerSack()),
                    quantity(product.getRawMaterialConsumedSacks()),
                    money(product.getAverageRawMaterialCostPerSack())));
        }
        rows.add(Arrays.asList(
                "TOTAL",
                quantity(report.getTotalUnitsSold()),
                "",
                "",
                quantity(report.getTotalRawMaterialConsumedSacks()),
                money(report.getAverageRawMaterialCostPerSack())));
        return KardexReportColumns.toCsv(rows);
    }
}
