package com.openrangelabs.donpetre.pipeline.model;

public enum SourceType {
    REST, GRAPHQL, WEBSOCKET
}
