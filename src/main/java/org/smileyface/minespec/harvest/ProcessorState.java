package org.smileyface.minespec.harvest;

/**
 * Lifecycle state of a {@link HarvestProcessor}.
 */
public enum ProcessorState {
    NEW,
    RUNNING,
    STOPPED,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED || this == ERROR;
    }
}
