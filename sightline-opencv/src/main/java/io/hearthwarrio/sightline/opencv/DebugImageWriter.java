package io.hearthwarrio.sightline.opencv;

import io.hearthwarrio.sightline.core.GrayImage;
import io.hearthwarrio.sightline.core.Match;
import io.hearthwarrio.sightline.core.Peak;
import io.hearthwarrio.sightline.core.SearchObserver;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Dumps intermediate search images as PNG files.
 * <p>
 * File names: {@code sightline_<epochMicros>__<elementName>__<suffix>.png}, where suffix is one of
 * {@code screenshot}, the candidate score in percent, {@code covered_<i>}, {@code best} or {@code all}.
 */
public class DebugImageWriter implements SearchObserver {

    public static final Path DEFAULT_DIRECTORY = Paths.get("temp");

    private static final Scalar RED = new Scalar(0, 0, 255);
    private static final Scalar GREEN = new Scalar(0, 200, 0);

    private final Path directory;
    private final Clock clock;

    public DebugImageWriter() {
        this(DEFAULT_DIRECTORY);
    }

    public DebugImageWriter(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public DebugImageWriter(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        OpenCvLibrary.load();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void onScreen(String elementName, GrayImage screen) {
        write(elementName, "screenshot", Mats.toMat(screen));
    }

    @Override
    public void onScaleCandidate(String elementName, GrayImage resized, Peak peak, GrayImage template) {
        Mat canvas = toColor(resized);
        Imgproc.rectangle(
                canvas,
                new Point(peak.getX(), peak.getY()),
                new Point(peak.getX() + template.getWidth(), peak.getY() + template.getHeight()),
                RED,
                2
        );
        write(elementName, String.valueOf((int) (peak.getScore() * 100)), canvas);
    }

    @Override
    public void onCovered(String elementName, int iteration, GrayImage covered) {
        write(elementName, "covered_" + iteration, Mats.toMat(covered));
    }

    @Override
    public void onTemplateMatches(String elementName, GrayImage screen, List<Match> matches) {
        if (!matches.isEmpty()) {
            write(elementName, "best", drawMatches(screen, Collections.singletonList(matches.get(0)), RED));
        }
        write(elementName, "all", drawMatches(screen, matches, GREEN));
    }

    /**
     * @return the file a dump with the given suffix would be written to at {@code instant}
     */
    Path fileFor(String elementName, String suffix, Instant instant) {
        long micros = instant.getEpochSecond() * 1_000_000L + instant.getNano() / 1_000;
        return directory.resolve("sightline_" + micros + "__" + elementName + "__" + suffix + ".png");
    }

    private static Mat drawMatches(GrayImage screen, List<Match> matches, Scalar color) {
        Mat canvas = toColor(screen);
        for (Match m : matches) {
            Imgproc.rectangle(
                    canvas,
                    new Point(m.getLeft(), m.getTop()),
                    new Point(m.getLeft() + m.getWidth(), m.getTop() + m.getHeight()),
                    color,
                    2
            );
        }
        return canvas;
    }

    private static Mat toColor(GrayImage image) {
        Mat gray = Mats.toMat(image);
        Mat color = new Mat();
        try {
            Imgproc.cvtColor(gray, color, Imgproc.COLOR_GRAY2BGR);
            return color;
        } finally {
            gray.release();
        }
    }

    private void write(String elementName, String suffix, Mat image) {
        try {
            Files.createDirectories(directory);
            Path file = fileFor(elementName, suffix, clock.instant());
            if (!Imgcodecs.imwrite(file.toString(), image)) {
                throw new UncheckedIOException(new IOException("Failed to write debug image " + file));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create debug directory " + directory, e);
        } finally {
            image.release();
        }
    }
}
