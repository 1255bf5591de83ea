package com.connectpro.shared.model;

public enum MessageKind {
    TEXT,
    PHOTO
}
