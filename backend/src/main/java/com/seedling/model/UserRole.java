package com.seedling.model;

public enum UserRole {
    FOUNDER,
    JUDGE,
    ADMIN
}
