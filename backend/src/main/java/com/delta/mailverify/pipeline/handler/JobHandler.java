package com.delta.mailverify.pipeline.handler;

import com.delta.mailverify.pipeline.model.JobResult;
import com.delta.mailverify.pipeline.model.PipelineJob;

/**
 * Executes one claimed job of a single type. Unexpected failures are thrown to the worker.
 */
public interface JobHandler {

    String jobType();

    JobResult handle(PipelineJob job);
}
