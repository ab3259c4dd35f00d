package com.edge.precision.core.tau;

import com.edge.precision.config.NativeLibraryLoader;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.ToDoubleFunction;

/**
 * tau 曲线导出：CSV 与双面板 PNG（上：分类率，下：各组平均 IPN）
 */
public class TauCurveExporter {
    private static final Logger logger = LoggerFactory.getLogger(TauCurveExporter.class);

    public static final String CSV_HEADER =
        "tau,threshold_ratio,balanced_accuracy,tpr,tnr,mean_ipn_good,mean_ipn_bad,mean_ipn_gap,tp,fn,tn,fp";

    private static final int WIDTH = 900;
    private static final int PANEL_HEIGHT = 320;
    private static final int MARGIN = 50;

    public int writeCsv(Iterable<TauCurvePoint> curve, Path path) throws IOException {
        createParent(path);
        int rows = 0;
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(CSV_HEADER);
            writer.newLine();
            for (TauCurvePoint p : curve) {
                writer.write(String.format(Locale.ROOT, "%.10f,%.10f,%.6f,%.6f,%.6f,%.4f,%.4f,%.4f,%d,%d,%d,%d",
                    p.getTau(), p.getThresholdRatio(), p.getBalancedAccuracy(), p.getTpr(), p.getTnr(),
                    p.getMeanIpnGood(), p.getMeanIpnBad(), p.getMeanIpnGap(),
                    p.getTp(), p.getFn(), p.getTn(), p.getFp()));
                writer.newLine();
                rows++;
            }
        }
        logger.info("Tau curve CSV written: {} ({} points)", path, rows);
        return rows;
    }

    public void writePng(Iterable<TauCurvePoint> curve, Double selectedTau, Path path) throws IOException {
        NativeLibraryLoader.loadNativeLibraries();
        createParent(path);
        List<TauCurvePoint> points = new ArrayList<>();
        curve.forEach(points::add);
        if (points.isEmpty()) {
            throw new IllegalArgumentException("Tau curve is empty");
        }
        double tauLo = points.get(0).getTau();
        double tauHi = points.get(points.size() - 1).getTau();
        if (tauHi <= tauLo) {
            tauHi = tauLo + 1e-9;
        }

        Mat canvas = new Mat(PANEL_HEIGHT * 2, WIDTH, CvType.CV_8UC3, new Scalar(255, 255, 255));
        try {
            // 上面板：BA / TPR / TNR，纵轴 [0, 1]
            drawAxes(canvas, 0, "rates");
            drawSeries(canvas, points, 0, 1.0, tauLo, tauHi, TauCurvePoint::getBalancedAccuracy, new Scalar(0, 0, 0));
            drawSeries(canvas, points, 0, 1.0, tauLo, tauHi, TauCurvePoint::getTpr, new Scalar(0, 160, 0));
            drawSeries(canvas, points, 0, 1.0, tauLo, tauHi, TauCurvePoint::getTnr, new Scalar(200, 0, 0));

            // 下面板：平均 IPN，纵轴 [0, 100]
            drawAxes(canvas, PANEL_HEIGHT, "mean IPN");
            drawSeries(canvas, points, PANEL_HEIGHT, 100.0, tauLo, tauHi, TauCurvePoint::getMeanIpnGood, new Scalar(0, 160, 0));
            drawSeries(canvas, points, PANEL_HEIGHT, 100.0, tauLo, tauHi, TauCurvePoint::getMeanIpnBad, new Scalar(0, 0, 200));

            if (selectedTau != null) {
                int x = toX(selectedTau, tauLo, tauHi);
                Imgproc.line(canvas, new Point(x, MARGIN / 2.0), new Point(x, PANEL_HEIGHT * 2 - MARGIN / 2.0),
                    new Scalar(128, 128, 128), 1);
                Imgproc.putText(canvas, String.format(Locale.ROOT, "tau=%.4f", selectedTau), new Point(x + 4, MARGIN),
                    Imgproc.FONT_HERSHEY_SIMPLEX, 0.45, new Scalar(64, 64, 64), 1);
            }
            Imgproc.putText(canvas, String.format(Locale.ROOT, "%.4f", tauLo), new Point(MARGIN, PANEL_HEIGHT * 2 - 10),
                Imgproc.FONT_HERSHEY_SIMPLEX, 0.4, new Scalar(0, 0, 0), 1);
            Imgproc.putText(canvas, String.format(Locale.ROOT, "%.4f", tauHi), new Point(WIDTH - MARGIN - 40, PANEL_HEIGHT * 2 - 10),
                Imgproc.FONT_HERSHEY_SIMPLEX, 0.4, new Scalar(0, 0, 0), 1);

            if (!Imgcodecs.imwrite(path.toString(), canvas)) {
                throw new IOException("Failed to write tau curve image: " + path);
            }
            logger.info("Tau curve PNG written: {}", path);
        } finally {
            canvas.release();
        }
    }

    private static void drawAxes(Mat canvas, int top, String label) {
        Scalar axis = new Scalar(0, 0, 0);
        int bottom = top + PANEL_HEIGHT - MARGIN;
        Imgproc.line(canvas, new Point(MARGIN, top + MARGIN / 2.0), new Point(MARGIN, bottom), axis, 1);
        Imgproc.line(canvas, new Point(MARGIN, bottom), new Point(WIDTH - MARGIN, bottom), axis, 1);
        Imgproc.putText(canvas, label, new Point(MARGIN + 5, top + MARGIN / 2.0 + 12),
            Imgproc.FONT_HERSHEY_SIMPLEX, 0.45, axis, 1);
    }

    private static void drawSeries(Mat canvas, List<TauCurvePoint> points, int top, double yMax,
                                   double tauLo, double tauHi, ToDoubleFunction<TauCurvePoint> value, Scalar color) {
        Point previous = null;
        for (TauCurvePoint p : points) {
            double v = Math.max(0.0, Math.min(yMax, value.applyAsDouble(p)));
            double y = top + PANEL_HEIGHT - MARGIN - v / yMax * (PANEL_HEIGHT - 1.5 * MARGIN);
            Point current = new Point(toX(p.getTau(), tauLo, tauHi), y);
            if (previous != null) {
                Imgproc.line(canvas, previous, current, color, 2);
            }
            previous = current;
        }
    }

    private static int toX(double tau, double tauLo, double tauHi) {
        return (int) Math.round(MARGIN + (tau - tauLo) / (tauHi - tauLo) * (WIDTH - 2.0 * MARGIN));
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
