package io.hearthwarrio.sightline.core;

/**
 * Thrown when a ranked match is requested beyond the number of occurrences actually found.
 */
public class MatchIndexOutOfRangeException extends IndexOutOfBoundsException {

    private final String elementName;
    private final int requestedIndex;
    private final int foundCount;

    public MatchIndexOutOfRangeException(String elementName, int requestedIndex, int foundCount) {
        super("Index above matches for \"" + elementName + "\": " + requestedIndex + " >= " + foundCount);
        this.elementName = elementName;
        this.requestedIndex = requestedIndex;
        this.foundCount = foundCount;
    }

    public String getElementName() {
        return elementName;
    }

    public int getRequestedIndex() {
        return requestedIndex;
    }

    public int getFoundCount() {
        return foundCount;
    }
}
