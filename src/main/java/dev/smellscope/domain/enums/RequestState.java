package dev.smellscope.domain.enums;

/**
 * Lifecycle: PENDING → FANNING_OUT → AGGREGATING → COMPLETED
 */
public enum RequestState {
    PENDING, FANNING_OUT, AGGREGATING, COMPLETED;

    public boolean canAdvanceTo(RequestState next) {
        return next != null && next.ordinal() == this.ordinal() + 1;
    }
}
