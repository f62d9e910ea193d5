package work.lcod.notegen.resolution;

public enum WarningReason {
    MISSING_SOURCE("missing_source"),
    FORMULA_ERROR("formula_error"),
    INVALID_REF("invalid_ref"),
    TYPE_MISMATCH("type_mismatch"),
    UNRESOLVED_SLOT("unresolved_slot");

    private final String wireName;

    WarningReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
