package br.fluitax.common.dto.kardex;

/**
 * Product identities the consolidated Kardex tracks.
 *
 * One raw material (green conilon coffee, counted in 60 kg sacks) and the
 * finished goods whose sales consume it. Declaration order is the report order.
 */
public enum ProductAlias {

    RAW_MATERIAL("MP_CONILON", "CAFE CONILON BENEFICIADO", false),
    FINISHED_RANCHO_10X500("ACABADO_RANCHO_10X500", "CAFE DO RANCHO 10X500", true),
    FINISHED_RANCHO_20X250("ACABADO_RANCHO_20X250", "CAFE DO RANCHO 20X250", true),
    FINISHED_NOVA_ERA_10X500("ACABADO_NOVAERA_10X500", "CAFE NOVA ERA 10X500", true);

    private final String code;
    private final String label;
    private final boolean finishedGood;

    ProductAlias(String code, String label, boolean finishedGood) {
        this.code = code;
        this.label = label;
        this.finishedGood = finishedGood;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean isFinishedGood() {
        return finishedGood;
    }
}
