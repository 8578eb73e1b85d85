package de.bsommerfeld.coversync.engine.cleanup;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.coversync.core.domain.CoverKind;
import de.bsommerfeld.coversync.db.CoverDatabase;
import de.bsommerfeld.coversync.db.CoverQueries;
import de.bsommerfeld.coversync.db.StoreException;
import de.bsommerfeld.coversync.db.StoreLease;
import de.bsommerfeld.coversync.db.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drops inline payloads that have been migrated, i.e. rows that also carry a
 * path pointer. Rows without a pointer keep their payload.
 */
@Singleton
public class InlineCoverCleaner {

    private static final Logger LOG = LoggerFactory.getLogger(InlineCoverCleaner.class);

    private final CoverDatabase database;

    @Inject
    public InlineCoverCleaner(CoverDatabase database) {
        this.database = database;
    }

    /**
     * Clears tracks and albums in one transaction.
     *
     * @return number of rows whose inline payload was dropped
     */
    public int clearInlineAfterMigration() throws StoreException {
        try (StoreLease lease = database.acquire();
             StoreTransaction tx = lease.beginTransaction()) {
            int tracks = CoverQueries.clearInline(tx, CoverKind.TRACK);
            int albums = CoverQueries.clearInline(tx, CoverKind.ALBUM);
            tx.commit();
            LOG.info("Cleared inline covers of {} tracks and {} albums", tracks, albums);
            return tracks + albums;
        }
    }
}
