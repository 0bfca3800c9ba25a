package br.fluitax.kardex.controller;

import br.fluitax.common.dto.ApiResponse;
import br.fluitax.common.dto.kardex.SalesByPeriodReportDto;
import br.fluitax.kardex.service.SalesByPeriodService;
import br.fluitax.kardex.service.export.SalesByPeriodCsvExporter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for finished-goods sales of a closed period.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to SalesByPeriodService.
 */
@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Tag(name = "Sales by Period", description = "Finished-goods sales costed with the Kardex moving average")
public class SalesByPeriodController {

    private final SalesByPeriodService salesByPeriodService;
    private final SalesByPeriodCsvExporter csvExporter;

    @GetMapping("/sales-by-period")
    @Operation(summary = "Finished-goods sales summary (from and to required)")
    public ResponseEntity<ApiResponse<SalesByPeriodReportDto>> getSalesByPeriod(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        SalesByPeriodReportDto report = buildReport(from, to);
        return ResponseEntity.ok(ApiResponse.success(report));
    }

    @GetMapping("/sales-by-period.csv")
    @Operation(summary = "Finished-goods sales summary as semicolon-separated CSV")
    public ResponseEntity<String> getSalesByPeriodCsv(
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to) {
        String csv = csvExporter.export(buildReport(from, to));
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"sales-by-period.csv\"")
                .contentType(KardexReportController.TEXT_CSV)
                .body(csv);
    }

    private SalesByPeriodReportDto buildReport(String from, String to) {
        return salesByPeriodService.buildReport(
                ReportDateParams.parseOptional("from", from),
                ReportDateParams.parseOptional("to", to));
    }
}
