/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

import com.curioloop.qp.QpSolverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Loads the JNI shim that binds the CPLEX callable library.
 * <p>
 * Lookup order: the path in system property {@value #PATH_PROPERTY}, then
 * {@code java.library.path}, then a copy extracted from the JAR resource
 * {@code /native/<os>-<arch>/<lib>}. The CPLEX shared library itself must be
 * resolvable by the platform loader.
 * </p>
 */
public final class NativeLibraryLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(NativeLibraryLoader.class);

    /** System property with an absolute path to the shim */
    public static final String PATH_PROPERTY = "qp.cplex.native.path";

    static final String LIBRARY_NAME = "cplexjni";

    private static volatile boolean loaded = false;
    private static final Object lock = new Object();

    private NativeLibraryLoader() {}

    /**
     * Loads the native library.
     * <p>
     * This method is thread-safe and will only load the library once.
     * </p>
     *
     * @throws QpSolverException if the library cannot be loaded
     */
    public static void load() {
        if (loaded) return;

        synchronized (lock) {
            if (loaded) return;

            String customPath = System.getProperty(PATH_PROPERTY);
            if (customPath != null && !customPath.isEmpty()) {
                try {
                    System.load(customPath);
                    LOGGER.debug("Loaded {} from {}", LIBRARY_NAME, customPath);
                    loaded = true;
                    return;
                } catch (UnsatisfiedLinkError e) {
                    throw new QpSolverException(
                        "Failed to load native library from custom path: " + customPath, e);
                }
            }

            try {
                System.loadLibrary(LIBRARY_NAME);
                LOGGER.debug("Loaded {} from java.library.path", LIBRARY_NAME);
                loaded = true;
                return;
            } catch (UnsatisfiedLinkError e) {
                LOGGER.debug("{} not on java.library.path, extracting from JAR", LIBRARY_NAME);
            }

            try {
                Path tempLib = extractLibrary();
                System.load(tempLib.toString());
                LOGGER.debug("Loaded {} from {}", LIBRARY_NAME, tempLib);
                loaded = true;
            } catch (IOException e) {
                throw new QpSolverException("Failed to extract native library", e);
            } catch (UnsatisfiedLinkError e) {
                throw new QpSolverException("Failed to load native library", e);
            }
        }
    }

    /**
     * Checks if the native library is loaded.
     * @return true if loaded
     */
    public static boolean isLoaded() {
        return loaded;
    }

    /**
     * Detects the current operating system.
     * @param osName Value of {@code os.name}
     * @return OS name (windows, linux, darwin)
     */
    static String detectOS(String osName) {
        String os = osName.toLowerCase();
        if (os.contains("mac") || os.contains("darwin")) {
            return "darwin";
        } else if (os.contains("win")) {
            return "windows";
        } else if (os.contains("linux")) {
            return "linux";
        } else {
            throw new QpSolverException("Unsupported operating system: " + osName);
        }
    }

    /**
     * Detects the current CPU architecture.
     * @param osArch Value of {@code os.arch}
     * @return Architecture name (x86_64, aarch64)
     */
    static String detectArch(String osArch) {
        String arch = osArch.toLowerCase();
        if (arch.contains("amd64") || arch.contains("x86_64")) {
            return "x86_64";
        } else if (arch.contains("aarch64") || arch.contains("arm64")) {
            return "aarch64";
        } else {
            throw new QpSolverException("Unsupported architecture: " + osArch);
        }
    }

    /**
     * Gets the library file name for the given platform.
     * @param os Operating system
     * @return Library file name
     */
    static String getLibraryName(String os) {
        switch (os) {
            case "windows":
                return LIBRARY_NAME + ".dll";
            case "darwin":
                return "lib" + LIBRARY_NAME + ".dylib";
            case "linux":
            default:
                return "lib" + LIBRARY_NAME + ".so";
        }
    }

    /**
     * Gets the JAR resource path of the library for the given platform.
     * @param os Operating system
     * @param arch Architecture
     * @return Resource path
     */
    static String resourcePath(String os, String arch) {
        return "/native/" + os + "-" + arch + "/" + getLibraryName(os);
    }

    private static Path extractLibrary() throws IOException {
        String os = detectOS(System.getProperty("os.name"));
        String arch = detectArch(System.getProperty("os.arch"));
        String resourcePath = resourcePath(os, arch);

        try (InputStream in = NativeLibraryLoader.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                throw new IOException("Native library not found in JAR: " + resourcePath);
            }

            String libName = getLibraryName(os);
            String suffix = libName.substring(libName.lastIndexOf('.'));
            Path tempFile = Files.createTempFile(LIBRARY_NAME + "_", suffix);
            tempFile.toFile().deleteOnExit();

            Files.copy(in, tempFile, StandardCopyOption.REPLACE_EXISTING);
            return tempFile;
        }
    }
}
