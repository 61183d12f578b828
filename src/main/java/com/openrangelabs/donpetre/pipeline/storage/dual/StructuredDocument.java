package com.openrangelabs.donpetre.pipeline.storage.dual;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class StructuredDocument {

    String id;
    String fingerprint;
    String content;
    Map<String, Object> fields;
    boolean embedded;
}
