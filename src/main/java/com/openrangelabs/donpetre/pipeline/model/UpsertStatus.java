package com.openrangelabs.donpetre.pipeline.model;

public enum UpsertStatus {
    SUCCESS,
    PARTIAL_FAILURE,
    FAILURE
}
