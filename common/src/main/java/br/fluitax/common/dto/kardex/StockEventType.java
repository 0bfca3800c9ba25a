package br.fluitax.common.dto.kardex;

/**
 * Kind of stock event extracted from an invoice line.
 *
 * The rank breaks ties between events of the same invoice line: entries are
 * applied before exits, exits before consumption.
 */
public enum StockEventType {

    ENTRY(0),
    EXIT(1),
    CONSUMPTION(2);

    private final int order;

    StockEventType(int order) {
        this.order = order;
    }

    public int getOrder() {
        return order;
    }
}
