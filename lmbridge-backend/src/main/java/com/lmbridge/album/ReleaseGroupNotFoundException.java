package com.lmbridge.album;

public class ReleaseGroupNotFoundException extends RuntimeException {
    public ReleaseGroupNotFoundException(String mbid) {
        super("Release group not found: " + mbid);
    }
}
