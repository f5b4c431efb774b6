package com.lmbridge.version;

import com.lmbridge.config.BridgeEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves the bridge version: {@code LMBRIDGE_VERSION}, else the contents of
 * {@code LMBRIDGE_VERSION_FILE} (default {@code /metadata/VERSION}), else {@code unknown}.
 */
@Slf4j
@Service
public class VersionService {

    public static final String UNKNOWN = "unknown";
    static final String DEFAULT_VERSION_FILE = "/metadata/VERSION";

    private final BridgeEnvironment environment;

    public VersionService(BridgeEnvironment environment) {
        this.environment = environment;
    }

    public String getVersion() {
        String version = environment.getTrimmed("lmbridge.version", "LMBRIDGE_VERSION");
        if (version != null) {
            return version;
        }
        Path file = Paths.get(environment.getOrDefault(DEFAULT_VERSION_FILE, "lmbridge.version-file", "LMBRIDGE_VERSION_FILE"));
        try {
            return Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            log.debug("Version file {} not readable: {}", file, e.getMessage());
            return UNKNOWN;
        }
    }
}
