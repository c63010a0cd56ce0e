package work.pollochang.phash.core;

/**
 * 正規正交的 DCT-II 基底矩陣 (N×N)，建構後不可變，可由多個執行緒共用唯讀存取。
 *
 * <p>第 0 列為 {@code 1/sqrt(N)}，其餘為
 * {@code sqrt(2/N) * cos(PI / (2N) * row * (2 * col + 1))}。
 *
 * @author PolloChang
 * @since 1.0.0
 */
public final class DctMatrix {

    private final int size;
    private final double[][] basis;
    private final double[][] transposed;

    public DctMatrix(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive: " + size);
        }
        this.size = size;
        this.basis = new double[size][size];
        this.transposed = new double[size][size];

        double c0 = 1.0 / Math.sqrt(size);
        double c1 = Math.sqrt(2.0 / size);
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                double value = row == 0
                        ? c0
                        : c1 * Math.cos(Math.PI / (2.0 * size) * row * (2 * col + 1));
                basis[row][col] = value;
                transposed[col][row] = value;
            }
        }
    }

    public int size() {
        return size;
    }

    public double get(int row, int col) {
        return basis[row][col];
    }

    /**
     * 計算二維 DCT：{@code DCT × pixels × DCTᵗ}。
     *
     * @param pixels N×N 的實數矩陣，不會被修改
     * @return 新的 N×N 係數矩陣
     */
    public double[][] transform(double[][] pixels) {
        if (pixels.length != size) {
            throw new IllegalArgumentException("expected " + size + " rows but got " + pixels.length);
        }
        return multiply(multiply(basis, pixels), transposed);
    }

    private double[][] multiply(double[][] a, double[][] b) {
        double[][] result = new double[size][size];
        for (int i = 0; i < size; i++) {
            double[] out = result[i];
            for (int k = 0; k < size; k++) {
                double aik = a[i][k];
                double[] bk = b[k];
                for (int j = 0; j < size; j++) {
                    out[j] += aik * bk[j];
                }
            }
        }
        return result;
    }
}
