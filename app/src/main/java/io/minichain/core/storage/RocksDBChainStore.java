package io.minichain.core.storage;

import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.ChainCodec;
import org.rocksdb.*;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Persistent ChainStore using RocksDB.
 *
 * Layout (column families):
 *  - "blocks" : key = index(8, big-endian), val = JSON block record (same as the peer wire)
 *  - "meta"   : key = "length",             val = block count(8, big-endian)
 *
 * Appends and replacements are single write batches, so a crash never leaves
 * a length that disagrees with the stored blocks.
 */
public final class RocksDBChainStore implements ChainStore {

    static {
        RocksDB.loadLibrary();
    }

    private static final byte[] LENGTH_KEY = "length".getBytes(StandardCharsets.US_ASCII);

    private final RocksDB db;
    private final ColumnFamilyHandle cfBlocks;
    private final ColumnFamilyHandle cfMeta;
    private final DBOptions dbOptions;
    private final ColumnFamilyOptions cfOptions;

    private RocksDBChainStore(RocksDB db,
                              ColumnFamilyHandle cfBlocks,
                              ColumnFamilyHandle cfMeta,
                              DBOptions dbOptions,
                              ColumnFamilyOptions cfOptions) {
        this.db = db;
        this.cfBlocks = cfBlocks;
        this.cfMeta = cfMeta;
        this.dbOptions = dbOptions;
        this.cfOptions = cfOptions;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBChainStore open(String dataDir) {
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        ColumnFamilyOptions cfOpts = new ColumnFamilyOptions();
        try {
            List<ColumnFamilyDescriptor> cfDescs = Arrays.asList(
                    new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY, cfOpts),
                    new ColumnFamilyDescriptor("blocks".getBytes(StandardCharsets.US_ASCII), cfOpts),
                    new ColumnFamilyDescriptor("meta".getBytes(StandardCharsets.US_ASCII), cfOpts)
            );
            List<ColumnFamilyHandle> cfHandles = new ArrayList<>();

            RocksDB db = RocksDB.open(dbOpts, dataDir, cfDescs, cfHandles);

            // the default CF at index 0 is unused; close its handle right away
            cfHandles.get(0).close();
            return new RocksDBChainStore(db, cfHandles.get(1), cfHandles.get(2), dbOpts, cfOpts);
        } catch (RocksDBException e) {
            cfOpts.close();
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- ChainStore API ----------------

    @Override
    public synchronized Optional<List<Block>> load() {
        try {
            long length = storedLength();
            if (length == 0) {
                return Optional.empty();
            }
            List<Block> blocks = new ArrayList<>((int) length);
            for (long i = 0; i < length; i++) {
                byte[] body = db.get(cfBlocks, longToBytes(i));
                if (body == null) {
                    throw new IllegalStateException("Missing block " + i + " of " + length);
                }
                blocks.add(ChainCodec.blockFromJson(body));
            }
            return Optional.of(blocks);
        } catch (RocksDBException e) {
            throw new IllegalStateException("load failed", e);
        }
    }

    @Override
    public synchronized void append(Block block) {
        if (block == null) return;
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            long length = storedLength();
            if (block.index() != length) {
                throw new IllegalArgumentException("Expected block " + length + ", got " + block.index());
            }
            batch.put(cfBlocks, longToBytes(block.index()), ChainCodec.blockToJson(block));
            batch.put(cfMeta, LENGTH_KEY, longToBytes(length + 1));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("append failed", e);
        }
    }

    @Override
    public synchronized void replace(List<Block> blocks) {
        try (WriteOptions wo = new WriteOptions().setSync(true);
             WriteBatch batch = new WriteBatch()) {
            long previous = storedLength();
            if (previous > blocks.size()) {
                batch.deleteRange(cfBlocks, longToBytes(blocks.size()), longToBytes(previous));
            }
            for (Block block : blocks) {
                batch.put(cfBlocks, longToBytes(block.index()), ChainCodec.blockToJson(block));
            }
            batch.put(cfMeta, LENGTH_KEY, longToBytes(blocks.size()));
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("replace failed", e);
        }
    }

    @Override
    public synchronized long size() {
        try {
            return storedLength();
        } catch (RocksDBException e) {
            throw new IllegalStateException("size failed", e);
        }
    }

    @Override
    public synchronized void close() {
        // handles first, then DB/options
        cfBlocks.close();
        cfMeta.close();
        db.close();
        cfOptions.close();
        dbOptions.close();
    }

    // -------------- helpers ----------------

    private long storedLength() throws RocksDBException {
        byte[] raw = db.get(cfMeta, LENGTH_KEY);
        return raw == null ? 0L : bytesToLong(raw);
    }

    private static byte[] longToBytes(long v) {
        ByteBuffer b = ByteBuffer.allocate(8);
        b.putLong(v);
        return b.array();
    }

    private static long bytesToLong(byte[] a) {
        ByteBuffer b = ByteBuffer.wrap(a);
        return b.getLong();
    }
}
