/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.qp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.*;

public class QpResultTest {

    @Test
    @DisplayName("Result arrays are copied in and out")
    void testImmutability() {
        double[] x = {1, 2};
        QpResult result = new QpResult(QpStatus.OPTIMAL, 3.0, x, null, new double[]{4}, null, null, 0.5);
        x[0] = 99;
        result.getSolution()[1] = 99;

        assertThat(result.getSolution()).containsExactly(1, 2);
        assertThat(result.getEqualityDuals()).isEmpty();
        assertThat(result.getInequalityDuals()).containsExactly(4);
        assertThat(result.getDimension()).isEqualTo(2);
        assertThat(result.toString()).contains("OPTIMAL").contains("[1.0, 2.0]");
    }

    @Test
    @DisplayName("Status is required")
    void testNullStatus() {
        assertThatThrownBy(() -> new QpResult(null, 0, null, null, null, null, null, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(QpStatus.class)
    @DisplayName("Only OPTIMAL and OPTIMAL_INACCURATE are optimal")
    void testStatusFlags(QpStatus status) {
        boolean optimal = status == QpStatus.OPTIMAL || status == QpStatus.OPTIMAL_INACCURATE;

        assertThat(status.isOptimal()).isEqualTo(optimal);
        assertThat(status.isError()).isEqualTo(status == QpStatus.SOLVER_ERROR);
        assertThat(status.getMessage()).isNotBlank();
    }
}
