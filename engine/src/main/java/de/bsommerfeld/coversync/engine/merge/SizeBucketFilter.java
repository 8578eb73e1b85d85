package de.bsommerfeld.coversync.engine.merge;

import de.bsommerfeld.coversync.core.domain.SizedCoverFile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Cheap pre-filter in front of content hashing. Files are grouped by their
 * size in whole KiB; only groups with at least two members can contain
 * duplicates, so everything else is never read.
 *
 * <p>
 * Files of different size can share a bucket (e.g. 500001 and 500050 bytes
 * both land in bucket 488). That is fine: the hash tells them apart.
 */
public final class SizeBucketFilter {

    static final long BUCKET_WIDTH = 1024;

    private SizeBucketFilter() {
    }

    public static long bucketKey(long sizeBytes) {
        return sizeBytes / BUCKET_WIDTH;
    }

    /**
     * Groups files by {@link #bucketKey(long)}, ordered by key. Files keep
     * their input order within a bucket.
     */
    public static Map<Long, List<SizedCoverFile>> bucket(Collection<SizedCoverFile> files) {
        Map<Long, List<SizedCoverFile>> buckets = new TreeMap<>();
        for (SizedCoverFile file : files) {
            buckets.computeIfAbsent(bucketKey(file.sizeBytes()), k -> new ArrayList<>()).add(file);
        }
        return buckets;
    }

    /**
     * Buckets with two or more files, i.e. the only files worth hashing.
     */
    public static List<List<SizedCoverFile>> hashCandidates(Collection<SizedCoverFile> files) {
        List<List<SizedCoverFile>> candidates = new ArrayList<>();
        for (List<SizedCoverFile> bucket : bucket(files).values()) {
            if (bucket.size() >= 2) {
                candidates.add(bucket);
            }
        }
        return candidates;
    }
}
