package com.example.autolist.util;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * 64비트 DCT 기반 perceptual hash
 * <p>
 * 32x32 그레이스케일로 축소한 뒤 2차원 DCT를 적용하고, 좌상단 8x8 저주파 계수를
 * 중앙값과 비교해 비트를 만듭니다. 같은 사진을 다시 인코딩하거나 크기만 바꾼 경우
 * 같은 해시 또는 매우 가까운 해시가 나옵니다.
 */
public class PerceptualHash {

    private static final int SAMPLE_SIZE = 32;
    private static final int HASH_SIZE = 8;

    private static final double[][] DCT_COEFFICIENTS = buildDctMatrix();

    /**
     * 이미지 파일의 해시 계산
     *
     * @throws IOException 파일을 읽을 수 없거나 이미지로 해석할 수 없는 경우
     */
    public static long compute(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new IOException("이미지 파일이 존재하지 않습니다: " + path);
        }
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("이미지로 해석할 수 없는 파일입니다: " + path);
        }
        return compute(image);
    }

    public static long compute(BufferedImage image) {
        double[][] pixels = grayscale(image);
        double[][] dct = dct2d(pixels);

        double[] lowFrequencies = new double[HASH_SIZE * HASH_SIZE];
        for (int y = 0; y < HASH_SIZE; y++) {
            for (int x = 0; x < HASH_SIZE; x++) {
                lowFrequencies[y * HASH_SIZE + x] = dct[y][x];
            }
        }
        double median = median(lowFrequencies);

        long hash = 0L;
        for (int i = 0; i < lowFrequencies.length; i++) {
            if (lowFrequencies[i] > median) {
                hash |= 1L << i;
            }
        }
        return hash;
    }

    /**
     * 두 해시 간 해밍 거리
     */
    public static int distance(long first, long second) {
        return Long.bitCount(first ^ second);
    }

    public static String toHex(long hash) {
        return String.format("%016x", hash);
    }

    private static double[][] grayscale(BufferedImage source) {
        BufferedImage scaled = new BufferedImage(SAMPLE_SIZE, SAMPLE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, SAMPLE_SIZE, SAMPLE_SIZE, null);
        } finally {
            graphics.dispose();
        }

        double[][] pixels = new double[SAMPLE_SIZE][SAMPLE_SIZE];
        for (int y = 0; y < SAMPLE_SIZE; y++) {
            for (int x = 0; x < SAMPLE_SIZE; x++) {
                int rgb = scaled.getRGB(x, y);
                int r = (rgb >> 16) & 0xff;
                int g = (rgb >> 8) & 0xff;
                int b = rgb & 0xff;
                pixels[y][x] = 0.299 * r + 0.587 * g + 0.114 * b;
            }
        }
        return pixels;
    }

    // 행 방향, 열 방향 순서로 1차원 DCT-II를 적용
    private static double[][] dct2d(double[][] input) {
        int n = SAMPLE_SIZE;
        double[][] rows = new double[n][n];
        for (int y = 0; y < n; y++) {
            for (int u = 0; u < n; u++) {
                double sum = 0.0;
                for (int x = 0; x < n; x++) {
                    sum += DCT_COEFFICIENTS[u][x] * input[y][x];
                }
                rows[y][u] = sum;
            }
        }
        double[][] output = new double[n][n];
        for (int u = 0; u < n; u++) {
            for (int v = 0; v < n; v++) {
                double sum = 0.0;
                for (int y = 0; y < n; y++) {
                    sum += DCT_COEFFICIENTS[v][y] * rows[y][u];
                }
                output[v][u] = sum;
            }
        }
        return output;
    }

    private static double[][] buildDctMatrix() {
        int n = SAMPLE_SIZE;
        double[][] matrix = new double[n][n];
        for (int u = 0; u < n; u++) {
            double scale = u == 0 ? Math.sqrt(1.0 / n) : Math.sqrt(2.0 / n);
            for (int x = 0; x < n; x++) {
                matrix[u][x] = scale * Math.cos(((2 * x + 1) * u * Math.PI) / (2.0 * n));
            }
        }
        return matrix;
    }

    private static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int middle = sorted.length / 2;
        return (sorted[middle - 1] + sorted[middle]) / 2.0;
    }

    private PerceptualHash() {
        // 유틸 클래스이므로 인스턴스 생성 방지
    }
}
