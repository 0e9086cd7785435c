package io.hearthwarrio.sightline.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Finds the best-scoring alignment of a template over a pyramid of downscaled copies of the source.
 * <p>
 * Scales are visited largest first and the search stops at the first scale where the resized source
 * is smaller than the template in either axis. An incumbent is only replaced by a strictly higher
 * score, so on exact ties the larger scale wins.
 */
public class ScalePyramidSearcher {

    private final CorrelationPrimitive correlation;
    private final ImageProcessor processor;
    private final ScalePyramid pyramid;

    public ScalePyramidSearcher(CorrelationPrimitive correlation, ImageProcessor processor) {
        this(correlation, processor, ScalePyramid.defaultPyramid());
    }

    public ScalePyramidSearcher(CorrelationPrimitive correlation, ImageProcessor processor, ScalePyramid pyramid) {
        this.correlation = Objects.requireNonNull(correlation, "correlation must not be null");
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.pyramid = Objects.requireNonNull(pyramid, "pyramid must not be null");
    }

    public ScalePyramid getPyramid() {
        return pyramid;
    }

    public Optional<ScaledPeak> search(GrayImage source, GrayImage template, double threshold, MatchMethod method) {
        return search(source, template, threshold, method, "", SearchObserver.NONE);
    }

    /**
     * @return best alignment scoring strictly above {@code threshold}, or empty if no scale produced one
     */
    public Optional<ScaledPeak> search(
            GrayImage source,
            GrayImage template,
            double threshold,
            MatchMethod method,
            String elementName,
            SearchObserver observer
    ) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(template, "template must not be null");
        Objects.requireNonNull(method, "method must not be null");
        Objects.requireNonNull(observer, "observer must not be null");

        ScaledPeak best = null;

        for (double scale : pyramid.getScales()) {
            int width = (int) (source.getWidth() * scale);
            int height = (int) (source.getHeight() * (width / (double) source.getWidth()));
            if (width < template.getWidth() || height < template.getHeight()) {
                break;
            }

            GrayImage resized = width == source.getWidth() ? source : processor.resizeToWidth(source, width);
            if (resized.isSmallerThan(template)) {
                break;
            }
            double ratio = source.getWidth() / (double) resized.getWidth();

            Peak peak = correlation.bestPeak(resized, template, method);
            if (peak.getScore() <= threshold) {
                continue;
            }

            if (best == null || peak.getScore() > best.getScore()) {
                best = new ScaledPeak(peak, ratio, resized);
            }
            observer.onScaleCandidate(elementName, resized, peak, template);
        }

        return Optional.ofNullable(best);
    }
}
