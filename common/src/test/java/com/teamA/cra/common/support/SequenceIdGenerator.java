package com.teamA.cra.common.support;

import com.teamA.cra.common.id.RequestIdGenerator;

import java.util.concurrent.atomic.AtomicInteger;

public class SequenceIdGenerator implements RequestIdGenerator {

    private final String prefix;
    private final AtomicInteger seq = new AtomicInteger();

    public SequenceIdGenerator(String prefix) {
        this.prefix = prefix;
    }

    @Override
    public String nextId() {
        return String.format("%s%02d", prefix, seq.incrementAndGet());
    }
}
