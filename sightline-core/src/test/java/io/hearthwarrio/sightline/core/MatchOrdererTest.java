package io.hearthwarrio.sightline.core;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MatchOrdererTest {

    private final Match topRightWeak = new Match(300, 10, 20, 20, 0.75);
    private final Match middleLeftStrong = new Match(10, 200, 20, 20, 0.98);
    private final Match bottomCenterMedium = new Match(150, 400, 20, 20, 0.85);

    private final List<Match> matches = Arrays.asList(topRightWeak, middleLeftStrong, bottomCenterMedium);

    @Test
    void confidenceOrderPutsMostSimilarFirst() {
        List<Match> ordered = MatchOrderer.order(matches, DisposalPolicy.BY_CONFIDENCE_DESC);

        assertEquals(Arrays.asList(middleLeftStrong, bottomCenterMedium, topRightWeak), ordered);
    }

    @Test
    void verticalOrderPutsTopFirst() {
        List<Match> ordered = MatchOrderer.order(matches, DisposalPolicy.BY_VERTICAL_ASC);

        assertEquals(Arrays.asList(topRightWeak, middleLeftStrong, bottomCenterMedium), ordered);
    }

    @Test
    void horizontalOrderPutsLeftFirst() {
        List<Match> ordered = MatchOrderer.order(matches, DisposalPolicy.BY_HORIZONTAL_ASC);

        assertEquals(Arrays.asList(middleLeftStrong, bottomCenterMedium, topRightWeak), ordered);
    }

    @Test
    void sortIsStable() {
        Match a = new Match(10, 50, 5, 5, 0.8, "a.png");
        Match b = new Match(90, 50, 5, 5, 0.9, "b.png");
        Match c = new Match(40, 50, 5, 5, 0.7, "c.png");

        List<Match> ordered = MatchOrderer.order(Arrays.asList(a, b, c), DisposalPolicy.BY_VERTICAL_ASC);

        assertEquals(Arrays.asList(a, b, c), ordered);
    }

    @Test
    void leavesInputUntouched() {
        List<Match> input = Arrays.asList(topRightWeak, middleLeftStrong);

        MatchOrderer.order(input, DisposalPolicy.BY_CONFIDENCE_DESC);

        assertEquals(Arrays.asList(topRightWeak, middleLeftStrong), input);
    }

    @Test
    void nullPolicyIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> MatchOrderer.order(matches, null));
    }

    @Test
    void policyCodesRoundTripAndUnknownCodesFail() {
        for (DisposalPolicy p : DisposalPolicy.values()) {
            assertSame(p, DisposalPolicy.fromCode(p.getCode()));
        }
        assertSame(DisposalPolicy.BY_HORIZONTAL_ASC, DisposalPolicy.fromCode(2));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> DisposalPolicy.fromCode(3));
        assertTrue(ex.getMessage().contains("3"));
    }
}
