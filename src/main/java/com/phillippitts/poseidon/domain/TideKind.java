package com.phillippitts.poseidon.domain;

public enum TideKind {
    HIGH,
    LOW
}
