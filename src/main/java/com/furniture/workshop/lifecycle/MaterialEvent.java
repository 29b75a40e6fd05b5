package com.furniture.workshop.lifecycle;

public enum MaterialEvent {
    ORDER,
    RECEIVE,
    GIVE_BACK,
    STOCK,
    USE,
    INSTALL
}
