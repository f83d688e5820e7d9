package com.example.appendagetransfer.model;

public enum JobKind {
    SHOT,
    ASSET
}
