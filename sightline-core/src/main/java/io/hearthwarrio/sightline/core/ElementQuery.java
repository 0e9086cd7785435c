package io.hearthwarrio.sightline.core;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable description of one visual element: which templates to look for and how to rank what is found.
 * <p>
 * Every {@code with*} method returns a modified copy. Values are validated when a search runs
 * (see {@link #validate()}), not when they are set.
 */
public final class ElementQuery {

    public static final int DEFAULT_ORDER_INDEX = 0;
    public static final DisposalPolicy DEFAULT_DISPOSAL = DisposalPolicy.BY_CONFIDENCE_DESC;
    public static final double DEFAULT_SIMILARITY = 0.7;
    public static final MatchMethod DEFAULT_METHOD = MatchMethod.CCOEFF_NORMED;
    public static final int DEFAULT_MAX_OCCURRENCES = 16;

    private static final Pattern NON_WORD = Pattern.compile("\\W+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String templateSource;
    private final int orderIndex;
    private final DisposalPolicy disposalPolicy;
    private final double similarityThreshold;
    private final MatchMethod method;
    private final int maxOccurrences;
    private final String name;
    private final boolean debug;

    private ElementQuery(
            String templateSource,
            int orderIndex,
            DisposalPolicy disposalPolicy,
            double similarityThreshold,
            MatchMethod method,
            int maxOccurrences,
            String name,
            boolean debug
    ) {
        this.templateSource = templateSource;
        this.orderIndex = orderIndex;
        this.disposalPolicy = disposalPolicy;
        this.similarityThreshold = similarityThreshold;
        this.method = method;
        this.maxOccurrences = maxOccurrences;
        this.name = name;
        this.debug = debug;
    }

    /**
     * Creates a query with default settings.
     *
     * @param templateSource template file path or glob pattern (for example {@code templates/ok_*.png})
     * @throws ConfigurationException if {@code templateSource} is null or blank
     */
    public static ElementQuery of(String templateSource) {
        if (templateSource == null || templateSource.isBlank()) {
            throw new ConfigurationException("Template route must not be blank: " + templateSource);
        }
        return new ElementQuery(
                templateSource,
                DEFAULT_ORDER_INDEX,
                DEFAULT_DISPOSAL,
                DEFAULT_SIMILARITY,
                DEFAULT_METHOD,
                DEFAULT_MAX_OCCURRENCES,
                deriveName(templateSource),
                false
        );
    }

    public ElementQuery withOrderIndex(int orderIndex) {
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    public ElementQuery withDisposal(DisposalPolicy disposalPolicy) {
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    public ElementQuery withSimilarity(double similarityThreshold) {
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    public ElementQuery withMethod(MatchMethod method) {
        Objects.requireNonNull(method, "method must not be null");
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    public ElementQuery withMaxOccurrences(int maxOccurrences) {
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    /**
     * Overrides the diagnostic name. A null or blank name restores the one derived from the template source.
     */
    public ElementQuery withName(String name) {
        String n = name == null || name.isBlank() ? deriveName(templateSource) : name;
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, n, debug);
    }

    public ElementQuery withDebug(boolean debug) {
        return new ElementQuery(templateSource, orderIndex, disposalPolicy, similarityThreshold, method,
                maxOccurrences, name, debug);
    }

    public String getTemplateSource() {
        return templateSource;
    }

    public int getOrderIndex() {
        return orderIndex;
    }

    public DisposalPolicy getDisposalPolicy() {
        return disposalPolicy;
    }

    public double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public MatchMethod getMethod() {
        return method;
    }

    public int getMaxOccurrences() {
        return maxOccurrences;
    }

    public String getName() {
        return name;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Checks the settings that do not depend on the screen.
     *
     * @throws ConfigurationException if the query can never be searched
     */
    public void validate() {
        if (disposalPolicy == null) {
            throw new ConfigurationException("Disposal policy not valid for \"" + name + "\": null");
        }
        if (maxOccurrences < 1) {
            throw new ConfigurationException(
                    "Max occurrences must be >= 1 for \"" + name + "\", got " + maxOccurrences
            );
        }
        if (orderIndex < 0 || orderIndex >= maxOccurrences) {
            throw new ConfigurationException(
                    "Order above max occurrences for \"" + name + "\": " + orderIndex + " >= " + maxOccurrences
            );
        }
        if (Double.isNaN(similarityThreshold) || similarityThreshold < 0.0 || similarityThreshold >= 1.0) {
            throw new ConfigurationException(
                    "Similarity threshold must be in [0, 1) for \"" + name + "\", got " + similarityThreshold
            );
        }
    }

    /**
     * File stem of the last path segment with every run of non-word characters replaced by {@code _}.
     * <p>
     * {@code "img/Login Button.png"} becomes {@code "Login_Button"}.
     */
    static String deriveName(String templateSource) {
        String s = templateSource.replace('\\', '/');
        int slash = s.lastIndexOf('/');
        String fileName = slash >= 0 ? s.substring(slash + 1) : s;
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return NON_WORD.matcher(stem).replaceAll("_");
    }

    @Override
    public String toString() {
        return "ElementQuery{" +
                "name='" + name + '\'' +
                ", templateSource='" + templateSource + '\'' +
                ", orderIndex=" + orderIndex +
                ", disposal=" + disposalPolicy +
                ", similarity=" + similarityThreshold +
                ", method=" + method +
                ", maxOccurrences=" + maxOccurrences +
                ", debug=" + debug +
                '}';
    }
}
