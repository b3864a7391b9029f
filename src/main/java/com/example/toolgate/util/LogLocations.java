package com.example.toolgate.util;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.CodeSource;

public final class LogLocations {

    private LogLocations() {
    }

    public static Path resolveLogFile(Class<?> referenceClass, String fileName) {
        Path configured = Path.of(fileName);
        if (configured.isAbsolute()) {
            return configured;
        }
        Path baseDirectory = resolveCodeDirectory(referenceClass);
        if (baseDirectory == null) {
            return null;
        }
        return baseDirectory.resolve(configured);
    }

    static Path resolveCodeDirectory(Class<?> referenceClass) {
        CodeSource codeSource = referenceClass.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        URL location = codeSource.getLocation();
        if (location == null) {
            return null;
        }
        try {
            Path resolvedPath = Paths.get(location.toURI());
            if (Files.isRegularFile(resolvedPath)) {
                return resolvedPath.getParent();
            }
            return Files.isDirectory(resolvedPath) ? resolvedPath : null;
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
