/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp.cplex;

import com.curioloop.qp.QpSolverException;
import com.curioloop.qp.QuadraticProgram;
import com.curioloop.qp.SparseMatrix;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for native library resolution. No CPLEX installation is assumed.
 */
public class NativeLibraryLoaderTest {

    @AfterEach
    void clearPath() {
        System.clearProperty(NativeLibraryLoader.PATH_PROPERTY);
    }

    @ParameterizedTest(name = "{0} / {1} -> {2}")
    @CsvSource({
        "Linux,        amd64,   /native/linux-x86_64/libcplexjni.so",
        "Mac OS X,     aarch64, /native/darwin-aarch64/libcplexjni.dylib",
        "Windows 11,   x86_64,  /native/windows-x86_64/cplexjni.dll"
    })
    @DisplayName("Platform is resolved to a JAR resource path")
    void testResourcePath(String osName, String osArch, String expected) {
        String os = NativeLibraryLoader.detectOS(osName);
        String arch = NativeLibraryLoader.detectArch(osArch);

        assertThat(NativeLibraryLoader.resourcePath(os, arch)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Unsupported platforms are reported as solver exceptions")
    void testUnsupportedPlatform() {
        assertThatThrownBy(() -> NativeLibraryLoader.detectOS("Plan 9"))
            .isInstanceOf(QpSolverException.class)
            .hasMessageContaining("Plan 9");
        assertThatThrownBy(() -> NativeLibraryLoader.detectArch("sparc"))
            .isInstanceOf(QpSolverException.class)
            .hasMessageContaining("sparc");
    }

    @Test
    @DisplayName("A bad custom path fails with the link error as cause")
    void testBadCustomPath() {
        System.setProperty(NativeLibraryLoader.PATH_PROPERTY, "/nonexistent/libcplexjni.so");

        assertThatThrownBy(NativeLibraryLoader::load)
            .isInstanceOf(QpSolverException.class)
            .hasMessageContaining("/nonexistent/libcplexjni.so")
            .hasCauseInstanceOf(UnsatisfiedLinkError.class);
        assertThat(NativeLibraryLoader.isLoaded()).isFalse();
    }

    @Test
    @DisplayName("Default solver surfaces loader failures from solve")
    void testDefaultSolverWithoutLibrary() {
        System.setProperty(NativeLibraryLoader.PATH_PROPERTY, "/nonexistent/libcplexjni.so");
        double[] lb = {Double.NEGATIVE_INFINITY};
        QuadraticProgram problem = QuadraticProgram.builder()
            .quadraticCost(SparseMatrix.fromDense(new double[][]{{1}}))
            .bounds(lb, new double[]{1})
            .build();

        assertThatThrownBy(() -> new CplexQpSolver().solve(problem))
            .isInstanceOf(QpSolverException.class);
        // Sentinel rewrite happens before the model is opened
        assertThat(lb[0]).isEqualTo(-CplexModel.INFINITY);
    }
}
