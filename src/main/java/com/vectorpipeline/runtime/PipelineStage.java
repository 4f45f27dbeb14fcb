package com.vectorpipeline.runtime;

public enum PipelineStage {
    READ_SOURCE,
    EMBED,
    ENCODE_SPARSE,
    ASSEMBLE,
    WRITE_OUTPUT,
    LOAD_DATAPOINTS,
    UPSERT,
    DELETE
}
