package com.quakesignal.engine.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class PartitionWriteEventFactory implements EventFactory<PartitionWriteEvent> {

    @Override
    public PartitionWriteEvent newInstance() {
        return new PartitionWriteEvent();
    }
}
