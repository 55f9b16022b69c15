package com.schooltrack.collab.security;

/**
 * Verified caller identity, resolved before a connection may join a room.
 */
public record UserIdentity(String userId, String displayName, String email) {}
