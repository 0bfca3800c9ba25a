package br.fluitax.common.dto.kardex;

/**
 * Ledger row type.
 *
 * OPENING: configured opening stock at the start of history
 * PRIOR_BALANCE: synthetic snapshot that opens a report window mid-history
 * ENTRY: raw material received
 * EXIT: raw material sold or consumed by a finished-good sale
 */
public enum MovementType {
    OPENING,
    PRIOR_BALANCE,
    ENTRY,
    EXIT
}
