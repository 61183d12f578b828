package com.openrangelabs.donpetre.pipeline.storage.dual;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class VectorDocument {

    String id;
    String fingerprint;
    float[] values;
    Map<String, Object> payload;
}
