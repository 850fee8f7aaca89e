package com.delta.mailverify.pipeline.model;

public record RunJobCounts(long queued, long running, long succeeded, long failed) {

    public long open() {
        return queued + running;
    }

    public long total() {
        return queued + running + succeeded + failed;
    }
}
