package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.CompanyDto;
import br.fluitax.common.dto.kardex.InvoiceItemRecord;
import br.fluitax.common.dto.kardex.KardexFiltersDto;
import br.fluitax.common.dto.kardex.KardexReportDto;
import br.fluitax.common.dto.kardex.ProductTotalDto;
import br.fluitax.common.exception.ValidationException;
import br.fluitax.common.util.DateUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.LedgerResult;
import br.fluitax.kardex.domain.LedgerWindow;
import br.fluitax.kardex.domain.PartnerKey;
import br.fluitax.kardex.domain.StockEvent;
import br.fluitax.kardex.repository.InvoiceItemRepository;
import br.fluitax.kardex.repository.PartnerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the consolidated raw-material Kardex.
 *
 * The ledger is always rebuilt from the epoch so that a report opened mid-history starts
 * from the exact balance and moving average of everything before it.
 * ALL business logic for the report lives in the engine components; controllers only delegate here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KardexReportService {

    private final CompanyResolver companyResolver;
    private final InvoiceItemRepository invoiceItemRepository;
    private final PartnerRepository partnerRepository;
    private final StockEventExtractor extractor;
    private final LedgerProcessor ledgerProcessor;
    private final PeriodWindower windower;
    private final KardexAggregator aggregator;
    private final KardexSettings settings;

    /**
     * @param from  first day of the report, null for the whole history
     * @param until last day of the report (inclusive), null for today
     */
    public KardexReportDto buildReport(LocalDate from, LocalDate until) {
        LocalDate effectiveUntil = until != null ? until : LocalDate.now();
        if (from != null && from.isAfter(effectiveUntil)) {
            throw new ValidationException("from", "from must be on or before to");
        }

        LocalDateTime windowStart = DateUtils.startOfDay(from);
        LocalDateTime windowEnd = DateUtils.endOfDay(effectiveUntil);
        log.info("Building consolidated Kardex: from={} until={}", from, effectiveUntil);

        // Configuration errors abort before anything is fetched
        List<CompanyDto> companies = companyResolver.resolve();
        List<String> companyIds = companies.stream().map(CompanyDto::getId).toList();

        LocalDateTime historyStart = DateUtils.startOfDay(settings.getEpochDate());
        List<InvoiceItemRecord> items = invoiceItemRepository.findByCompaniesAndPeriod(
                companyIds, historyStart, windowEnd);
        Map<PartnerKey, String> partnerNames = partnerRepository.findNamesByCompanies(companyIds);

        List<StockEvent> events = extractor.extract(items, companies, partnerNames);
        LedgerResult ledger = ledgerProcessor.process(events, openingTimestamp(items, historyStart));
        LedgerWindow window = windower.window(ledger, windowStart, windowEnd);
        List<ProductTotalDto> productTotals = aggregator.productTotals(window.getFinishedSales());

        KardexReportDto report = KardexReportDto.builder()
                .filters(KardexFiltersDto.builder()
                        .from(windowStart)
                        .to(windowEnd)
                        .companies(companies)
                        .build())
                .openingBalance(window.getOpeningBalance())
                .movements(window.getMovements())
                .finishedSales(window.getFinishedSales())
                .dailyTotals(aggregator.dailyTotals(window.getMovements()))
                .productTotals(productTotals)
                .grandTotals(aggregator.grandTotals(window, ledger, productTotals))
                .build();

        log.info("Consolidated Kardex built: {} items, {} events, {} movements in window, {} finished sales",
                items.size(), events.size(), report.getMovements().size(), report.getFinishedSales().size());
        return report;
    }

    /**
     * Start of the day of the earliest fetched item, never before the epoch.
     */
    static LocalDateTime openingTimestamp(List<InvoiceItemRecord> items, LocalDateTime historyStart) {
        return items.stream()
                .map(InvoiceItemRecord::getIssuedAt)
                .filter(Objects::nonNull)
                .min(LocalDateTime::compareTo)
                .map(issuedAt -> issuedAt.toLocalDate().atStartOfDay())
                .filter(day -> day.isAfter(historyStart))
                .orElse(historyStart);
    }
}
