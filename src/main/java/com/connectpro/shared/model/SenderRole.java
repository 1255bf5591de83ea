package com.connectpro.shared.model;

public enum SenderRole {
    USER,
    OWNER
}
