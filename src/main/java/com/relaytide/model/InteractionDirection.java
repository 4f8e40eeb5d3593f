package com.relaytide.model;

public enum InteractionDirection {
    INBOUND,
    OUTBOUND
}
