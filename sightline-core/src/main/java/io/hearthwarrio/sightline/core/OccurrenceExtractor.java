package io.hearthwarrio.sightline.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Recovers every non-overlapping occurrence of a template at the scale chosen by {@link ScalePyramidSearcher}.
 * <p>
 * Greedy find-then-erase: the last matched rectangle is painted with {@link #BLANK} and the correlation
 * is run again, until the best score no longer clears the threshold or {@code maxOccurrences} matches
 * were collected. Overlapping occurrences get partially erased and are usually lost.
 */
public class OccurrenceExtractor {

    public static final int BLANK = 0;

    private final CorrelationPrimitive correlation;

    public OccurrenceExtractor(CorrelationPrimitive correlation) {
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
    }

    public List<Match> extract(
            ScaledPeak best,
            GrayImage template,
            double threshold,
            MatchMethod method,
            int maxOccurrences
    ) {
        return extract(best, template, threshold, method, maxOccurrences, "", "", SearchObserver.NONE);
    }

    /**
     * @param best           winning alignment; its resized image is not modified
     * @param template       template that produced {@code best}
     * @param maxOccurrences upper bound on returned matches
     * @param templatePath   recorded on every produced {@link Match}
     * @return matches in discovery order (best first), never more than {@code maxOccurrences}
     */
    public List<Match> extract(
            ScaledPeak best,
            GrayImage template,
            double threshold,
            MatchMethod method,
            int maxOccurrences,
            String templatePath,
            String elementName,
            SearchObserver observer
    ) {
        Objects.requireNonNull(best, "best must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(observer, "observer must not be null");
        if (maxOccurrences < 1) {
            return Collections.emptyList();
        }

        int tw = template.getWidth();
        int th = template.getHeight();
        double ratio = best.getRatio();

        List<Match> out = new ArrayList<>();
        Peak peak = best.getPeak();
        out.add(toMatch(peak, tw, th, ratio, templatePath));

        GrayImage covered = best.getResized();
        int iteration = 0;
        while (out.size() < maxOccurrences) {
            covered = covered.withFilledRect(peak.getX(), peak.getY(), tw, th, BLANK);
            observer.onCovered(elementName, iteration++, covered);

            peak = correlation.bestPeak(covered, template, method);
            if (peak.getScore() <= threshold) {
                break;
            }
            out.add(toMatch(peak, tw, th, ratio, templatePath));
        }

        return out;
    }

    static Match toMatch(Peak peak, int templateWidth, int templateHeight, double ratio, String templatePath) {
        int startX = (int) (peak.getX() * ratio);
        int startY = (int) (peak.getY() * ratio);
        int endX = (int) ((peak.getX() + templateWidth) * ratio);
        int endY = (int) ((peak.getY() + templateHeight) * ratio);
        return Match.ofBounds(startX, startY, endX, endY, peak.getScore(), templatePath);
    }
}
