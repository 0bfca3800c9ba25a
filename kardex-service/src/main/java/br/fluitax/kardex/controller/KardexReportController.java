package br.fluitax.kardex.controller;

import br.fluitax.common.dto.ApiResponse;
import br.fluitax.common.dto.kardex.KardexReportDto;
import br.fluitax.kardex.service.KardexReportService;
import br.fluitax.kardex.service.export.KardexCsvExporter;
import br.fluitax.kardex.service.export.KardexExcelExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * REST Controller for the consolidated raw-material Kardex.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to KardexReportService; exporters only render its result.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Tag(name = "Kardex", description = "Consolidated moving-average Kardex of the raw material")
public class KardexReportController {

    static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);
    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private final KardexReportService kardexReportService;
    private final KardexCsvExporter csvExporter;
    private final KardexExcelExporter excelExporter;

    @GetMapping("/kardex")
    @Operation(summary = "Consolidated Kardex for a period (from optional, to defaults to today)")
    public ResponseEntity<ApiResponse<KardexReportDto>> getKardex(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        KardexReportDto report = buildReport(from, to);
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @GetMapping("/kardex.csv")
    @Operation(summary = "Consolidated Kardex as semicolon-separated CSV")
    public ResponseEntity<String> getKardexCsv(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        String csv = csvExporter.export(buildReport(from, to));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"kardex-consolidated.csv\"")
                .contentType(TEXT_CSV)
                .body(csv);
    }

    @GetMapping("/kardex.xlsx")
    @Operation(summary = "Consolidated Kardex as an Excel workbook")
    public ResponseEntity<byte[]> getKardexXlsx(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        byte[] workbook = excelExporter.export(buildReport(from, to));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"kardex-consolidated.xlsx\"")
                .contentType(XLSX)
                .body(workbook);
    }

    private KardexReportDto buildReport(String from, String to) {
        return kardexReportService.buildReport(
                ReportDateParams.parseOptional("from", from),
                ReportDateParams.parseOptional("to", to));
    }
}
