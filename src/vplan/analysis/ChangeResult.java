package vplan.analysis;

/** Whether an update modified an analysis state. */
public enum ChangeResult {
    NO_CHANGE,
    CHANGE;

    public ChangeResult or(ChangeResult other) {
        return this == CHANGE || other == CHANGE ? CHANGE : NO_CHANGE;
    }

    public boolean isChanged() {
        return this == CHANGE;
    }

    public static ChangeResult of(boolean changed) {
        return changed ? CHANGE : NO_CHANGE;
    }
}
