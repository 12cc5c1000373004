package com.visionsentinel.core.postprocess;

import com.visionsentinel.core.model.Detection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Polygonal regions of interest that detections must fall into.
 *
 * <p>
 * Parsed from strings such as {@code "(10,10),(200,10),(200,150);(300,0),(400,0),(400,90)"}:
 * polygons are separated by {@code ;}, each point is {@code (x,y)}. Polygons
 * with fewer than three points are ignored. With no polygons nothing is
 * filtered.
 * </p>
 *
 * @since 1.0.0
 */
public final class DetectionRegions {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionRegions.class);

    private static final Pattern POINT = Pattern.compile(
            "\\(\\s*(-?\\d+(?:\\.\\d+)?)\\s*,\\s*(-?\\d+(?:\\.\\d+)?)\\s*\\)");

    /** Regions that accept every detection. */
    public static final DetectionRegions NONE = new DetectionRegions(List.of());

    private final List<double[][]> polygons;

    private DetectionRegions(List<double[][]> polygons) {
        this.polygons = Collections.unmodifiableList(polygons);
    }

    /**
     * Parse an area string; {@code null} or blank yields {@link #NONE}.
     */
    public static DetectionRegions parse(String area) {
        if (area == null || area.isBlank()) {
            return NONE;
        }
        List<double[][]> polygons = new ArrayList<>();
        for (String part : area.split(";")) {
            List<double[]> points = new ArrayList<>();
            Matcher m = POINT.matcher(part);
            while (m.find()) {
                points.add(new double[] { Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2)) });
            }
            if (points.size() >= 3) {
                polygons.add(points.toArray(new double[0][]));
            } else if (!part.isBlank()) {
                LOG.warn("Ignoring region '{}': a polygon needs at least 3 points", part.trim());
            }
        }
        return polygons.isEmpty() ? NONE : new DetectionRegions(polygons);
    }

    public boolean isEmpty() {
        return polygons.isEmpty();
    }

    public int polygonCount() {
        return polygons.size();
    }

    /**
     * @return {@code true} if ({@code x}, {@code y}) lies in any polygon, or
     *         there are no polygons
     */
    public boolean contains(double x, double y) {
        if (polygons.isEmpty()) {
            return true;
        }
        for (double[][] polygon : polygons) {
            if (inside(polygon, x, y)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Keep detections whose center lies inside the regions.
     */
    public List<Detection> filter(List<Detection> detections) {
        if (polygons.isEmpty()) {
            return detections;
        }
        return detections.stream()
                .filter(d -> contains(d.getCenterX(), d.getCenterY()))
                .toList();
    }

    // Ray casting: count edge crossings of a horizontal ray from the point.
    private static boolean inside(double[][] polygon, double x, double y) {
        boolean inside = false;
        for (int i = 0, j = polygon.length - 1; i < polygon.length; j = i++) {
            double xi = polygon[i][0];
            double yi = polygon[i][1];
            double xj = polygon[j][0];
            double yj = polygon[j][1];
            if ((yi > y) != (yj > y)
                    && x < (xj - xi) * (y - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        return inside;
    }

    @Override
    public String toString() {
        return "DetectionRegions{polygons=" + polygons.size() + '}';
    }
}
