package com.example.clubservice.entity;

/**
 * Member account status.
 * Only ACTIVE members can log in or refresh tokens.
 */
public enum MemberStatus {
    ACTIVE,
    INACTIVE,
    SUSPENDED
}
