package com.furniture.workshop.lifecycle;

public enum OrderEvent {
    SEND,
    RECEIVE_ALL,
    REVERT_TO_DRAFT
}
