/**
 * Access to the library database for cover maintenance.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Engines: migration / sync / merge / cleanup]
 *        │  acquire()            (bounded wait, fatal on timeout)
 *        ▼
 *   CoverDatabase  ── one Connection, one ReentrantLock
 *        │
 *        ▼
 *   StoreLease     ── query / execute / beginTransaction, close() unlocks
 *        │
 *        ▼
 *   StoreTransaction ── execute / commit, close() rolls back if uncommitted
 * </pre>
 *
 * <h2>Cover columns</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │ tracks                                                       │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ id  (PK)         │ store-assigned, immutable                 │
 * │ album            │ album name; merge groups by this text     │
 * │ album_id         │ optional FK → albums.id                   │
 * │ track_cover      │ legacy inline payload (BLOB or base64)    │
 * │ track_cover_path │ absolute path of the cover file           │
 * └──────────────────┴───────────────────────────────────────────┘
 * ┌──────────────────────────────────────────────────────────────┐
 * │ albums                                                       │
 * ├──────────────────┬───────────────────────────────────────────┤
 * │ id  (PK)         │ store-assigned, immutable                 │
 * │ art_data         │ legacy inline payload                     │
 * │ art_path         │ absolute path of the art file             │
 * └──────────────────┴───────────────────────────────────────────┘
 * </pre>
 *
 * The inline and path columns are independent. See
 * {@link de.bsommerfeld.coversync.core.domain.CoverState} for how the engines
 * interpret each combination.
 *
 * <h2>SQL File Inventory</h2>
 * All statements live in {@code sql/*.sql}, loaded via {@link SqlLoader}:
 * <ul>
 * <li>{@code select-tracks-pending-migration.sql},
 * {@code select-albums-pending-migration.sql}</li>
 * <li>{@code update-track-cover-path.sql}, {@code update-album-art-path.sql}</li>
 * <li>{@code select-album-names.sql}, {@code select-album-track-covers.sql}</li>
 * <li>{@code clear-track-inline-covers.sql}, {@code clear-album-inline-art.sql}</li>
 * <li>{@code select-track-cover-path.sql}, {@code select-album-art-path.sql},
 * {@code select-track-cover-paths-in.sql}</li>
 * <li>{@code select-referenced-cover-paths.sql}, {@code select-cover-path-references.sql}</li>
 * </ul>
 */
package de.bsommerfeld.coversync.db;
