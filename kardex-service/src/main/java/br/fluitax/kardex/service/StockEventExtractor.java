package br.fluitax.kardex.service;

import br.fluitax.common.dto.kardex.CompanyDto;
import br.fluitax.common.dto.kardex.FinishedSaleRecord;
import br.fluitax.common.dto.kardex.InvoiceDirection;
import br.fluitax.common.dto.kardex.InvoiceItemRecord;
import br.fluitax.common.dto.kardex.ProductAlias;
import br.fluitax.common.dto.kardex.StockEventType;
import br.fluitax.common.util.AmountUtils;
import br.fluitax.common.util.CnpjUtils;
import br.fluitax.kardex.config.KardexSettings;
import br.fluitax.kardex.domain.PartnerKey;
import br.fluitax.kardex.domain.StockEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns invoice lines into raw-material stock events.
 *
 * Raw-material lines become ENTRY (inbound) or EXIT (outbound) events in sacks.
 * Outbound finished-good lines become CONSUMPTION events carrying a draft sale.
 * Cancelled lines, storage remittances, blocked counterparties, intercompany
 * transfers and unrecognized products are dropped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StockEventExtractor {

    static final String NOTE_RAW_MATERIAL_ENTRY = "Raw material entry";
    static final String NOTE_RAW_MATERIAL_SALE = "Raw material sale";
    static final String NOTE_CONSUMPTION_PREFIX = "Consumption by ";

    private final ProductAliasResolver aliasResolver;
    private final UnitNormalizer unitNormalizer;
    private final KardexSettings settings;

    /**
     * @param items        invoice lines sorted by (issuedAt, invoiceId, itemId)
     * @param companies    resolved company set
     * @param partnerNames display names keyed by (companyId, CNPJ)
     * @return events in item order; the ledger sorts them again
     */
    public List<StockEvent> extract(List<InvoiceItemRecord> items,
                                    List<CompanyDto> companies,
                                    Map<PartnerKey, String> partnerNames) {
        Map<String, String> companyCnpjs = new HashMap<>();
        for (CompanyDto company : companies) {
            companyCnpjs.put(company.getId(), CnpjUtils.normalize(company.getCnpj()));
        }
        Set<String> consolidatedCnpjs = new HashSet<>(companyCnpjs.values());
        consolidatedCnpjs.remove("");

        Set<String> excludedInvoices = new HashSet<>();
        List<StockEvent> events = new ArrayList<>();
        int skipped = 0;

        for (InvoiceItemRecord item : items) {
            if (item.isCancelled() || settings.getExcludedCfops().contains(item.getCfop())) {
                skipped++;
                continue;
            }
            if (excludedInvoices.contains(item.getInvoiceId())) {
                skipped++;
                continue;
            }
            if (isExcludedInvoice(item, consolidatedCnpjs)) {
                log.debug("Invoice {} excluded (blocked counterparty or intercompany)", item.getInvoiceId());
                excludedInvoices.add(item.getInvoiceId());
                skipped++;
                continue;
            }

            ProductAlias alias = aliasResolver.resolve(item);
            if (alias == null || item.getDirection() == null) {
                skipped++;
                continue;
            }

            String ownCnpj = companyCnpjs.get(item.getCompanyId());
            StockEvent event = alias.isFinishedGood()
                    ? toConsumption(item, alias, ownCnpj, partnerNames)
                    : toRawMaterialMovement(item, alias, ownCnpj, partnerNames);
            if (event == null) {
                skipped++;
            } else {
                events.add(event);
            }
        }

        log.info("Extracted {} stock events from {} invoice items ({} skipped, {} invoices excluded)",
                events.size(), items.size(), skipped, excludedInvoices.size());
        return events;
    }

    boolean isExcludedInvoice(InvoiceItemRecord item, Set<String> consolidatedCnpjs) {
        String issuer = CnpjUtils.normalize(item.getIssuerCnpj());
        String recipient = CnpjUtils.normalize(item.getRecipientCnpj());

        Set<String> blocked = settings.getBlockedCnpjs();
        if ((!issuer.isEmpty() && blocked.contains(issuer)) || (!recipient.isEmpty() && blocked.contains(recipient))) {
            return true;
        }
        return !issuer.equals(recipient)
                && consolidatedCnpjs.contains(issuer)
                && consolidatedCnpjs.contains(recipient);
    }

    private StockEvent toRawMaterialMovement(InvoiceItemRecord item,
                                             ProductAlias alias,
                                             String ownCnpj,
                                             Map<PartnerKey, String> partnerNames) {
        BigDecimal quantity = nonNull(item.getQuantity());
        BigDecimal quantitySacks = unitNormalizer.toSacks(quantity, item.getUnit());
        BigDecimal unitPriceNative = computeUnitNetPrice(item);
        BigDecimal netTotal = unitPriceNative.multiply(quantity);
        BigDecimal unitCostPerSack = AmountUtils.divide(netTotal, quantitySacks);

        boolean inbound = item.getDirection() == InvoiceDirection.INBOUND;
        String counterpartyCnpj = resolveCounterpartyCnpj(item, ownCnpj);

        return StockEvent.builder()
                .type(inbound ? StockEventType.ENTRY : StockEventType.EXIT)
                .timestamp(item.getIssuedAt())
                .invoiceId(item.getInvoiceId())
                .itemId(item.getItemId())
                .productAlias(alias)
                .quantitySacks(quantitySacks)
                .unitCost(unitCostPerSack)
                .netTotal(netTotal)
                .counterpartyCnpj(counterpartyCnpj)
                .counterpartyName(resolveCounterpartyName(item, counterpartyCnpj, partnerNames))
                .document(resolveDocument(item))
                .cfop(item.getCfop())
                .notes(inbound ? NOTE_RAW_MATERIAL_ENTRY : NOTE_RAW_MATERIAL_SALE)
                .build();
    }

    private StockEvent toConsumption(InvoiceItemRecord item,
                                     ProductAlias alias,
                                     String ownCnpj,
                                     Map<PartnerKey, String> partnerNames) {
        if (item.getDirection() != InvoiceDirection.OUTBOUND) {
            return null;
        }
        BigDecimal units = nonNull(item.getQuantity());
        if (units.signum() == 0) {
            return null;
        }

        BigDecimal unitNetPrice = computeUnitNetPrice(item);
        BigDecimal nominalConsumption = units.multiply(settings.getConsumptionRatioSacksPerUnit());
        String counterpartyCnpj = resolveCounterpartyCnpj(item, ownCnpj);
        String counterpartyName = resolveCounterpartyName(item, counterpartyCnpj, partnerNames);
        String document = resolveDocument(item);

        FinishedSaleRecord draft = FinishedSaleRecord.builder()
                .timestamp(item.getIssuedAt())
                .invoiceId(item.getInvoiceId())
                .itemId(item.getItemId())
                .productAlias(alias)
                .document(document)
                .counterparty(counterpartyName)
                .counterpartyCnpj(counterpartyCnpj)
                .cfop(item.getCfop())
                .natureOfOperation(item.getNatureOfOperation())
                .unitsSold(units)
                .unitNetPrice(unitNetPrice)
                .valuePerSack(unitNetPrice.multiply(settings.getFinishedUnitsPerSack()))
                .nominalConsumptionSacks(nominalConsumption)
                .rawMaterialConsumedSacks(nominalConsumption)
                .build();

        return StockEvent.builder()
                .type(StockEventType.CONSUMPTION)
                .timestamp(item.getIssuedAt())
                .invoiceId(item.getInvoiceId())
                .itemId(item.getItemId())
                .productAlias(alias)
                .quantitySacks(nominalConsumption)
                .counterpartyCnpj(counterpartyCnpj)
                .counterpartyName(counterpartyName)
                .document(document)
                .cfop(item.getCfop())
                .notes(NOTE_CONSUMPTION_PREFIX + alias.getCode())
                .saleDraft(draft)
                .build();
    }

    /**
     * Net unit price in the invoice's own unit: (gross - discount) / quantity, zero for zero quantity.
     */
    static BigDecimal computeUnitNetPrice(InvoiceItemRecord item) {
        BigDecimal quantity = nonNull(item.getQuantity());
        if (quantity.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal net = nonNull(item.getGrossValue()).subtract(nonNull(item.getDiscount()));
        return AmountUtils.divide(net, quantity);
    }

    /**
     * Inbound: the issuer unless it is the owning company, then the recipient. Outbound: the reverse.
     */
    static String resolveCounterpartyCnpj(InvoiceItemRecord item, String ownCnpj) {
        String issuer = CnpjUtils.normalize(item.getIssuerCnpj());
        String recipient = CnpjUtils.normalize(item.getRecipientCnpj());
        String counterparty;
        if (item.getDirection() == InvoiceDirection.INBOUND) {
            counterparty = !issuer.equals(ownCnpj) ? issuer : recipient;
        } else {
            counterparty = !recipient.equals(ownCnpj) ? recipient : issuer;
        }
        return counterparty.isEmpty() ? null : counterparty;
    }

    private static String resolveCounterpartyName(InvoiceItemRecord item,
                                                  String counterpartyCnpj,
                                                  Map<PartnerKey, String> partnerNames) {
        if (counterpartyCnpj == null) {
            return null;
        }
        return partnerNames.getOrDefault(new PartnerKey(item.getCompanyId(), counterpartyCnpj), counterpartyCnpj);
    }

    private static String resolveDocument(InvoiceItemRecord item) {
        String number = item.getInvoiceNumber();
        return number != null && !number.isBlank() ? number : item.getAccessKey();
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
