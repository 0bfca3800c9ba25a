package br.fluitax.kardex.service.export;

import br.fluitax.common.dto.kardex.KardexReportDto;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.function.Function;

/**
 * Renders the Kardex report as an .xlsx workbook: one sheet for the raw-material
 * ledger, one for the finished-goods sales. Cells carry the same text as the CSV.
 */
@Slf4j
@Component
public class KardexExcelExporter {

    static final String LEDGER_SHEET = "Raw Material Ledger";
    static final String SALES_SHEET = "Finished Goods Sales";

    // 20 characters, in 1/256 units
    private static final int COLUMN_WIDTH = 20 * 256;

    public byte[] export(KardexReportDto report) {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {

            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            writeSheet(workbook.createSheet(LEDGER_SHEET), headerStyle,
                    KardexReportColumns.LEDGER_HEADER, report.getMovements(), KardexReportColumns::ledgerRow);
            writeSheet(workbook.createSheet(SALES_SHEET), headerStyle,
                    KardexReportColumns.SALES_HEADER, report.getFinishedSales(), KardexReportColumns::saleRow);

            workbook.write(out);
            log.debug("Kardex workbook written: {} movements, {} sales",
                    report.getMovements().size(), report.getFinishedSales().size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write Kardex workbook", e);
        }
    }

    private static <T> void writeSheet(Sheet sheet,
                                       CellStyle headerStyle,
                                       List<String> header,
                                       List<T> records,
                                       Function<T, List<String>> rowMapper) {
        Row headerRow = sheet.createRow(0);
        for (int c = 0; c < header.size(); c++) {
            Cell cell = headerRow.createCell(c);
            cell.setCellValue(header.get(c));
            cell.setCellStyle(headerStyle);
        }

        int rowIndex = 1;
        for (T record : records) {
            Row row = sheet.createRow(rowIndex++);
            List<String> values = rowMapper.apply(record);
            for (int c = 0; c < values.size(); c++) {
                String value = values.get(c);
                row.createCell(c).setCellValue(value == null ? "" : value);
            }
        }

        for (int c = 0; c < header.size(); c++) {
            sheet.setColumnWidth(c, COLUMN_WIDTH);
        }
    }
}
