package org.janelia.mosaic.pool;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.mosaic.color.ColorRGB;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MatchSelector} class.
 */
public class MatchSelectorTest {

    @Test
    public void testUnusedCandidatesArePreferred() {

        final CandidatePool pool = buildPool(new ColorRGB(250, 0, 0),
                                             new ColorRGB(200, 0, 0),
                                             new ColorRGB(0, 0, 255));
        final ColorRGB red = new ColorRGB(255, 0, 0);

        Assert.assertEquals("first selection should be closest candidate",
                            "c0", MatchSelector.selectClosest(red, pool).getFilePath());
        Assert.assertEquals("second selection should be closest unused candidate",
                            "c1", MatchSelector.selectClosest(red, pool).getFilePath());
        Assert.assertEquals("third selection should be only unused candidate",
                            "c2", MatchSelector.selectClosest(red, pool).getFilePath());

        final CandidateImage reused = MatchSelector.selectClosest(red, pool);
        Assert.assertEquals("fourth selection should reuse closest candidate", "c0", reused.getFilePath());
        Assert.assertEquals("invalid usage count for reused candidate", 2, reused.getUsageCount());
    }

    @Test
    public void testReuseAfterExhaustion() {

        final int poolSize = 5;
        final ColorRGB[] colors = new ColorRGB[poolSize];
        for (int i = 0; i < poolSize; i++) {
            colors[i] = new ColorRGB(i * 50, i * 10, 0);
        }
        final CandidatePool pool = buildPool(colors);

        final ColorRGB target = new ColorRGB(100, 100, 100);
        for (int i = 0; i <= poolSize; i++) {
            Assert.assertNotNull("selection " + i + " failed", MatchSelector.selectClosest(target, pool));
        }

        int totalUsage = 0;
        int maxUsage = 0;
        for (final CandidateImage candidate : pool.getCandidates()) {
            Assert.assertTrue("every candidate should be used before reuse", candidate.getUsageCount() > 0);
            totalUsage += candidate.getUsageCount();
            maxUsage = Math.max(maxUsage, candidate.getUsageCount());
        }

        Assert.assertEquals("invalid total usage", poolSize + 1, totalUsage);
        Assert.assertEquals("one candidate should have been reused", 2, maxUsage);
    }

    @Test
    public void testTiesUsePoolOrder() {
        final ColorRGB gray = new ColorRGB(128, 128, 128);
        final CandidatePool pool = buildPool(gray, gray, gray);
        Assert.assertEquals("tie should select first candidate",
                            "c0", MatchSelector.selectClosest(gray, pool).getFilePath());
        Assert.assertEquals("tie among unused candidates should select first unused candidate",
                            "c1", MatchSelector.selectClosest(gray, pool).getFilePath());
    }

    @Test
    public void testEmptyPool() {
        Assert.assertNull("empty pool should not produce match",
                          MatchSelector.selectClosest(ColorRGB.WHITE, CandidatePool.empty()));
    }

    @Test
    public void testFindClosestIgnoringUsage() {
        final CandidatePool pool = buildPool(ColorRGB.BLACK, ColorRGB.WHITE);
        final List<CandidateImage> candidates = pool.getCandidates();
        candidates.get(0).incrementUsageCount();

        Assert.assertEquals("unused search should skip used candidate",
                            "c1", MatchSelector.findClosest(ColorRGB.BLACK, candidates, true).getFilePath());
        Assert.assertEquals("full search should find used candidate",
                            "c0", MatchSelector.findClosest(ColorRGB.BLACK, candidates, false).getFilePath());
    }

    @Test
    public void testPoolOrderIsSourceOrder() {
        final List<CandidateImage> candidates = new ArrayList<>(Arrays.asList(
                new CandidateImage("c2", ColorRGB.WHITE, 2),
                new CandidateImage("c0", ColorRGB.WHITE, 0),
                new CandidateImage("c1", ColorRGB.WHITE, 1)));
        final CandidatePool pool = new CandidatePool(candidates, 3, 0);
        Assert.assertEquals("pool should be sorted by source index", "c0", pool.get(0).getFilePath());
        Assert.assertEquals("pool should be sorted by source index", "c2", pool.get(2).getFilePath());
    }

    static CandidatePool buildPool(final ColorRGB... colors) {
        final List<CandidateImage> candidates = new ArrayList<>();
        for (int i = 0; i < colors.length; i++) {
            candidates.add(new CandidateImage("c" + i, colors[i], i));
        }
        return new CandidatePool(candidates, colors.length, 0);
    }

}
