package br.fluitax.kardex.repository;

import br.fluitax.common.dto.kardex.InvoiceDirection;
import br.fluitax.common.dto.kardex.InvoiceItemRecord;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.kardex.config.KardexSettings;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QuerySnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Date;
import java.util.List;
import java.util.Locale;

/**
 * Repository for invoice lines stored in Firebase.
 *
 * Collection "invoiceItems" holds one document per NFe item, flattened with the
 * invoice header fields (written by the upload pipeline).
 * Data access only - NO business logic here.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class InvoiceItemRepository {

    private static final String COLLECTION = "invoiceItems";

    /**
     * Orders lines the way the ledger consumes them: issue time, invoice, item.
     */
    public static final Comparator<InvoiceItemRecord> FETCH_ORDER = Comparator
            .comparing(InvoiceItemRecord::getIssuedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(InvoiceItemRecord::getInvoiceId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(InvoiceItemRecord::getItemId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final Firestore firestore;
    private final KardexSettings settings;

    /**
     * Bulk fetch of every line of the given companies issued within [from, until],
     * sorted by (issuedAt, invoiceId, itemId).
     */
    public List<InvoiceItemRecord> findByCompaniesAndPeriod(List<String> companyIds,
                                                           LocalDateTime from,
                                                           LocalDateTime until) {
        if (companyIds == null || companyIds.isEmpty()) {
            return List.of();
        }

        Query query = firestore.collection(COLLECTION)
                .whereIn("companyId", companyIds)
                .whereGreaterThanOrEqualTo("issuedAt", toTimestamp(from))
                .whereLessThanOrEqualTo("issuedAt", toTimestamp(until));

        QuerySnapshot snapshot = FirestoreReads.await(query.get(), settings.getFetchTimeoutSeconds(), COLLECTION);

        List<InvoiceItemRecord> items = snapshot.getDocuments().stream()
                .map(this::documentToRecord)
                .sorted(FETCH_ORDER)
                .toList();

        log.info("Fetched {} invoice items for {} companies between {} and {}",
                items.size(), companyIds.size(), from, until);
        return items;
    }

    private InvoiceItemRecord documentToRecord(DocumentSnapshot doc) {
        String itemId = doc.getString("itemId");
        return InvoiceItemRecord.builder()
                .invoiceId(doc.getString("invoiceId"))
                .itemId(itemId != null ? itemId : doc.getId())
                .companyId(doc.getString("companyId"))
                .issuedAt(toLocalDateTime(doc.getTimestamp("issuedAt")))
                .direction(parseDirection(doc.getString("direction")))
                .issuerCnpj(doc.getString("issuerCnpj"))
                .recipientCnpj(doc.getString("recipientCnpj"))
                .invoiceNumber(doc.getString("invoiceNumber"))
                .accessKey(doc.getString("accessKey"))
                .natureOfOperation(doc.getString("natureOfOperation"))
                .cancelled(Boolean.TRUE.equals(doc.getBoolean("cancelled")))
                .cfop(doc.getString("cfop"))
                .description(doc.getString("description"))
                .productCode(doc.getString("productCode"))
                .mappedProductName(doc.getString("mappedProductName"))
                .mappedProductDescription(doc.getString("mappedProductDescription"))
                .unit(doc.getString("unit"))
                .quantity(readDecimal(doc, "quantity"))
                .unitPrice(readDecimal(doc, "unitPrice"))
                .grossValue(readDecimal(doc, "gross"))
                .discount(readDecimal(doc, "discount"))
                .build();
    }

    private BigDecimal readDecimal(DocumentSnapshot doc, String field) {
        Object raw = doc.get(field);
        if (AmountUtils.isMalformed(raw)) {
            log.warn("Malformed numeric value in {}/{} field '{}': '{}' treated as zero",
                    COLLECTION, doc.getId(), field, raw);
        }
        return AmountUtils.toDecimal(raw);
    }

    static InvoiceDirection parseDirection(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "IN", "INBOUND", "ENTRADA" -> InvoiceDirection.INBOUND;
            case "OUT", "OUTBOUND", "SAIDA" -> InvoiceDirection.OUTBOUND;
            default -> null;
        };
    }

    private static Timestamp toTimestamp(LocalDateTime value) {
        return Timestamp.of(Date.from(value.toInstant(ZoneOffset.UTC)));
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        if (timestamp == null) {
            return null;
        }
        return LocalDateTime.ofInstant(timestamp.toDate().toInstant(), ZoneOffset.UTC);
    }
}
