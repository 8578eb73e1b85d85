package de.bsommerfeld.coversync.engine.merge;

import de.bsommerfeld.coversync.core.domain.SizedCoverFile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SizeBucketFilterTest {

    @Test
    void bucketKey_shouldFloorToWholeKibibytes() {
        assertEquals(0, SizeBucketFilter.bucketKey(0));
        assertEquals(0, SizeBucketFilter.bucketKey(1023));
        assertEquals(1, SizeBucketFilter.bucketKey(1024));
        assertEquals(488, SizeBucketFilter.bucketKey(500001));
        assertEquals(488, SizeBucketFilter.bucketKey(500050));
    }

    @Test
    void bucket_shouldGroupBySizeKeepingInputOrder() {
        SizedCoverFile a = new SizedCoverFile("a", 500001);
        SizedCoverFile b = new SizedCoverFile("b", 2048);
        SizedCoverFile c = new SizedCoverFile("c", 500050);

        Map<Long, List<SizedCoverFile>> buckets = SizeBucketFilter.bucket(List.of(a, b, c));

        assertEquals(List.of(2L, 488L), List.copyOf(buckets.keySet()));
        assertEquals(List.of(a, c), buckets.get(488L));
    }

    @Test
    void hashCandidates_shouldDropSingletonBuckets() {
        SizedCoverFile a = new SizedCoverFile("a", 1000);
        SizedCoverFile b = new SizedCoverFile("b", 5000);
        SizedCoverFile c = new SizedCoverFile("c", 5100);

        List<List<SizedCoverFile>> candidates = SizeBucketFilter.hashCandidates(List.of(a, b, c));

        assertEquals(List.of(List.of(b, c)), candidates);
    }

    @Test
    void hashCandidates_shouldBeEmptyForDistinctSizes() {
        assertTrue(SizeBucketFilter.hashCandidates(List.of(
                new SizedCoverFile("a", 100),
                new SizedCoverFile("b", 4096),
                new SizedCoverFile("c", 9000))).isEmpty());
    }
}
