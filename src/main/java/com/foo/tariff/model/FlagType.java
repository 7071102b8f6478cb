package com.foo.tariff.model;

public enum FlagType {
    BOOLEAN,
    INTEGER,
    TEXT
}
