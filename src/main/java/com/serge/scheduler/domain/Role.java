package com.serge.scheduler.domain;

public enum Role { USER, ADMIN }
