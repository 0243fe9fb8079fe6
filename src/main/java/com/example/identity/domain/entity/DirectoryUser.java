package com.example.identity.domain.entity;

/**
 * User Directory Record - the subset of the directory entry this service reads
 */
public record DirectoryUser(
    String id,
    String externalSubject,
    String email,
    String displayName
) {}
