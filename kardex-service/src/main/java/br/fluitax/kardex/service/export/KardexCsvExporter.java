package br.fluitax.kardex.service.export;

import br.fluitax.common.dto.kardex.KardexReportDto;
import br.fluitax.common.dto.kardex.ProductAlias;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the Kardex report as a semicolon CSV with two blocks:
 * the raw-material ledger and the finished-goods sales.
 */
@Component
public class KardexCsvExporter {

    static final String TITLE = "Consolidated Kardex Report";

    public String export(KardexReportDto report) {
        List<List<String>> rows = new ArrayList<>();
        rows.add(List.of(TITLE));
        rows.add(List.of("Block 1 - Raw Material Ledger (" + ProductAlias.RAW_MATERIAL.getCode() + ")"));
        rows.add(KardexReportColumns.LEDGER_HEADER);
        report.getMovements().forEach(movement -> rows.add(KardexReportColumns.ledgerRow(movement)));
        rows.add(List.of(""));
        rows.add(List.of("Block 2 - Finished Goods Sales"));
        rows.add(KardexReportColumns.SALES_HEADER);
        report.getFinishedSales().forEach(sale -> rows.add(KardexReportColumns.saleRow(sale)));
        return KardexReportColumns.toCsv(rows);
    }
}
