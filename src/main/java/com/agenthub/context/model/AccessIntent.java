package com.agenthub.context.model;

public enum AccessIntent {
    READ,
    WRITE
}
