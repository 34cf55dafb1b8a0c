package com.serge.scheduler.service;

public enum OwnershipCheck {
    OK, NOT_FOUND, FORBIDDEN
}
