package br.fluitax.common.dto.kardex;

/**
 * Whether a withdrawal was applied to the balance or blocked for lack of stock.
 */
public enum MovementStatus {

    NORMAL("Normal"),
    BLOCKED_ZERO_BALANCE("Blocked (zero balance)");

    private final String label;

    MovementStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
