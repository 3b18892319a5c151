package com.webharvest.core.model;

public enum SeedState { PENDING, RUNNING, DONE, INVALID }
