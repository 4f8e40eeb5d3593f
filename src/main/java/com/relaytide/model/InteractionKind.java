package com.relaytide.model;

public enum InteractionKind {
    MAIL,
    MEETING
}
