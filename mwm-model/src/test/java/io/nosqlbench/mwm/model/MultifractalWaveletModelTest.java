package io.nosqlbench.mwm.model;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import java.util.Arrays;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class MultifractalWaveletModelTest {

    private static final NormalScalarModel ROOT = new NormalScalarModel(1.2, 0.4);

    @Test
    void exposesParameters() {
        MultifractalWaveletModel model = new MultifractalWaveletModel(ROOT, new double[]{16.0, 2.5, 3.5}, 5);

        assertEquals(3, model.getScales());
        assertEquals(8, model.getPathLength());
        assertEquals(5, model.getCoarseBlocks());
        assertEquals(1.2, model.getMean());
        assertEquals(0.4, model.getStdDev());
        assertEquals(2.5, model.getShape(1));
        assertSame(ROOT, model.getRoot());
    }

    @Test
    void shapesAreDefensivelyCopied() {
        double[] shapes = {1.0, 2.0};
        MultifractalWaveletModel model = new MultifractalWaveletModel(ROOT, shapes, 2);

        shapes[0] = 99;
        model.getShapes()[1] = 99;

        assertArrayEquals(new double[]{1.0, 2.0}, model.getShapes());
    }

    @Test
    void multiplierIsSymmetricBetaOnPlusMinusOne() {
        MultifractalWaveletModel model = new MultifractalWaveletModel(ROOT, new double[]{3.0}, 2);
        BetaScalarModel multiplier = model.getMultiplier(0);

        assertEquals(3.0, multiplier.getAlpha());
        assertEquals(3.0, multiplier.getBeta());
        assertEquals(-1.0, multiplier.getLower());
        assertEquals(1.0, multiplier.getUpper());
        assertEquals(0.0, multiplier.getMean(), 1e-15);
        assertEquals(1.0 / 7.0, multiplier.getVariance(), 1e-15);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0, Double.NaN, Double.POSITIVE_INFINITY})
    void rejectsInvalidShape(double shape) {
        assertThrows(IllegalArgumentException.class,
            () -> new MultifractalWaveletModel(ROOT, new double[]{1.0, shape}, 2));
    }

    @Test
    void rejectsEmptyOrOversizedShapeList() {
        assertThrows(IllegalArgumentException.class,
            () -> new MultifractalWaveletModel(ROOT, new double[0], 2));
        double[] tooMany = new double[MultifractalWaveletModel.MAX_SCALES + 1];
        Arrays.fill(tooMany, 1.0);
        assertThrows(IllegalArgumentException.class,
            () -> new MultifractalWaveletModel(ROOT, tooMany, 2));
    }

    @Test
    void scaleIndexIsChecked() {
        MultifractalWaveletModel model = new MultifractalWaveletModel(ROOT, new double[]{1.0}, 2);
        assertThrows(IndexOutOfBoundsException.class, () -> model.getShape(1));
    }

    @Test
    void equalityIsByValue() {
        MultifractalWaveletModel a = new MultifractalWaveletModel(ROOT, new double[]{1.0, 2.0}, 4);
        MultifractalWaveletModel b = new MultifractalWaveletModel(new NormalScalarModel(1.2, 0.4), new double[]{1.0, 2.0}, 4);
        MultifractalWaveletModel c = new MultifractalWaveletModel(ROOT, new double[]{1.0, 2.0000001}, 4);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertTrue(a.toString().contains("shapes=[1.0, 2.0]"));
    }

    @Test
    void normalRootAcceptsZeroButNotNegativeStdDev() {
        assertTrue(new NormalScalarModel(1.0, 0.0).isDegenerate());
        assertThrows(IllegalArgumentException.class, () -> new NormalScalarModel(1.0, -0.1));
        assertThrows(IllegalArgumentException.class, () -> new NormalScalarModel(Double.NaN, 1.0));
    }

    @Test
    void betaModelValidatesSupport() {
        assertThrows(IllegalArgumentException.class, () -> new BetaScalarModel(1.0, 1.0, 1.0, -1.0));
        assertThrows(IllegalArgumentException.class, () -> new BetaScalarModel(0.0, 1.0));
        assertFalse(new BetaScalarModel(2.0, 5.0).isSymmetric());
        assertEquals(2.0 / 7.0, new BetaScalarModel(2.0, 5.0).getMean(), 1e-15);
    }
}
