package io.rockmap.core.keyspace;

import io.rockmap.core.config.DatabaseConfig;
import org.rocksdb.ReadOptions;
import org.rocksdb.ReadTier;
import org.rocksdb.WriteOptions;

/**
 * Read and write options computed once when a keyspace opens.
 * Iterators get a fresh ReadOptions each because their bounds differ.
 *
 * {@link #cacheRead()} never touches storage: a point read tries it first and
 * falls back to {@link #read()} when the answer is not in memory.
 */
public final class OptionProfiles implements AutoCloseable {

    private final ReadOptions read;
    private final ReadOptions cacheRead;
    private final WriteOptions write;
    private final boolean verifyChecksums;

    private OptionProfiles(ReadOptions read, ReadOptions cacheRead, WriteOptions write, boolean verifyChecksums) {
        this.read = read;
        this.cacheRead = cacheRead;
        this.write = write;
        this.verifyChecksums = verifyChecksums;
    }

    public static OptionProfiles of(DatabaseConfig config) {
        ReadOptions read = new ReadOptions()
                .setVerifyChecksums(config.verifyChecksums)
                .setFillCache(true);
        ReadOptions cacheRead = new ReadOptions()
                .setVerifyChecksums(config.verifyChecksums)
                .setReadTier(ReadTier.BLOCK_CACHE_TIER);
        WriteOptions write = new WriteOptions()
                .setSync(config.syncWrites)
                .setDisableWAL(config.disableWal);
        return new OptionProfiles(read, cacheRead, write, config.verifyChecksums);
    }

    public ReadOptions read() { return read; }

    public ReadOptions cacheRead() { return cacheRead; }

    public WriteOptions write() { return write; }

    /** Iterators scan once; keep them from evicting hot point-read blocks. */
    public ReadOptions newIteratorOptions() {
        return new ReadOptions()
                .setVerifyChecksums(verifyChecksums)
                .setFillCache(false);
    }

    @Override
    public void close() {
        read.close();
        cacheRead.close();
        write.close();
    }
}
