package org.smileyface.minespec.harvest;

import java.time.Instant;

/**
 * Immutable snapshot of a processor's status.
 */
public final class ProcessorStatus {
    private final String id;
    private final String brand;
    private final String model;
    private final ProcessorState state;
    private final int urlCount;
    private final int documentsProcessed;
    private final int recordsStored;
    private final int keysFailed;
    private final String lastUrl;
    private final String lastError;
    private final Instant startedAt;
    private final Instant finishedAt;

    public ProcessorStatus(String id, String brand, String model, ProcessorState state, int urlCount,
                           int documentsProcessed, int recordsStored, int keysFailed, String lastUrl,
                           String lastError, Instant startedAt, Instant finishedAt) {
        this.id = id;
        this.brand = brand;
        this.model = model;
        this.state = state;
        this.urlCount = urlCount;
        this.documentsProcessed = documentsProcessed;
        this.recordsStored = recordsStored;
        this.keysFailed = keysFailed;
        this.lastUrl = lastUrl;
        this.lastError = lastError;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    public String getId() { return id; }
    public String getBrand() { return brand; }
    public String getModel() { return model; }
    public ProcessorState getState() { return state; }
    public int getUrlCount() { return urlCount; }
    public int getDocumentsProcessed() { return documentsProcessed; }
    public int getRecordsStored() { return recordsStored; }
    public int getKeysFailed() { return keysFailed; }
    public String getLastUrl() { return lastUrl; }
    public String getLastError() { return lastError; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
}
