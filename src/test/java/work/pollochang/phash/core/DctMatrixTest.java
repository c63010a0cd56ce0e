package work.pollochang.phash.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DctMatrixTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testBasis_ShouldBeOrthonormal() {
        DctMatrix dct = new DctMatrix(32);

        for (int i = 0; i < 32; i++) {
            for (int j = 0; j < 32; j++) {
                double dot = 0;
                for (int k = 0; k < 32; k++) {
                    dot += dct.get(i, k) * dct.get(j, k);
                }
                assertEquals(i == j ? 1.0 : 0.0, dot, EPSILON, "row " + i + " · row " + j);
            }
        }
    }

    @Test
    void testFirstRow_ShouldBeConstant() {
        DctMatrix dct = new DctMatrix(32);

        for (int col = 0; col < 32; col++) {
            assertEquals(1.0 / Math.sqrt(32), dct.get(0, col), EPSILON);
        }
        assertEquals(Math.sqrt(2.0 / 32) * Math.cos(Math.PI / 64 * 3 * 5), dct.get(3, 2), EPSILON);
    }

    /**
     * 常數矩陣只有直流項
     */
    @Test
    void testConstantInput_ShouldOnlyHaveDcTerm() {
        DctMatrix dct = new DctMatrix(32);
        double[][] pixels = new double[32][32];
        for (double[] row : pixels) {
            java.util.Arrays.fill(row, 10.0);
        }

        double[][] coefficients = dct.transform(pixels);

        assertEquals(320.0, coefficients[0][0], EPSILON);
        for (int i = 0; i < 32; i++) {
            for (int j = 0; j < 32; j++) {
                if (i != 0 || j != 0) {
                    assertEquals(0.0, coefficients[i][j], EPSILON);
                }
            }
        }
        assertEquals(10.0, pixels[5][7], "input must not be modified");
    }

    @Test
    void testInvalidSize_ShouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> new DctMatrix(0));
        assertThrows(IllegalArgumentException.class, () -> new DctMatrix(32).transform(new double[8][8]));
    }
}
