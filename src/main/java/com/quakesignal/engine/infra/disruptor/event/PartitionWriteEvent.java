package com.quakesignal.engine.infra.disruptor.event;

import com.quakesignal.engine.domain.model.CanonicalRecord;
import com.quakesignal.engine.domain.model.PartitionKey;

import java.util.List;

public class PartitionWriteEvent {

    private PartitionKey partitionKey;
    private List<CanonicalRecord> records;
    private String paramsHash;
    private long publishNanoTime;

    public void clear() {
        partitionKey = null;
        records = null;
        paramsHash = null;
        publishNanoTime = 0L;
    }

    public PartitionKey getPartitionKey() {
        return partitionKey;
    }

    public void setPartitionKey(PartitionKey partitionKey) {
        this.partitionKey = partitionKey;
    }

    public List<CanonicalRecord> getRecords() {
        return records;
    }

    public void setRecords(List<CanonicalRecord> records) {
        this.records = records;
    }

    public String getParamsHash() {
        return paramsHash;
    }

    public void setParamsHash(String paramsHash) {
        this.paramsHash = paramsHash;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "PartitionWriteEvent{partition=" + partitionKey + ", rows=" + (records == null ? 0 : records.size()) + "}";
    }
}
