package com.vidrecorder.security;

/**
 * Caller identity as asserted by the room service's token.
 */
public record RecordingUser(String id, String name) {
}
