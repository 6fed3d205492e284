package io.minichain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON codec for the peer wire format: a chain is an ordered array of {@link BlockRecord}s.
 */
public final class ChainCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<BlockRecord>> RECORDS = new TypeReference<List<BlockRecord>>() {};

    private ChainCodec(){}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static List<BlockRecord> toRecords(List<Block> blocks) {
        List<BlockRecord> out = new ArrayList<>(blocks.size());
        for (Block b : blocks) out.add(BlockRecord.of(b));
        return out;
    }

    public static byte[] toJson(List<Block> blocks) {
        try {
            return MAPPER.writeValueAsBytes(toRecords(blocks));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode chain", e);
        }
    }

    public static JsonNode toTree(List<Block> blocks) {
        return MAPPER.valueToTree(toRecords(blocks));
    }

    public static List<Block> fromJson(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new IllegalArgumentException("Empty chain payload");
        }
        if (bytes.length > ProtocolLimits.MAX_CHAIN_BODY_BYTES) {
            throw new IllegalArgumentException("Chain payload too large: " + bytes.length + " bytes");
        }
        try {
            return toBlocks(MAPPER.readValue(bytes, RECORDS));
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed chain payload", ex);
        }
    }

    public static List<Block> fromTree(JsonNode node) {
        if (node == null || !node.isArray()) {
            throw new IllegalArgumentException("Chain payload must be a JSON array");
        }
        try {
            return toBlocks(MAPPER.convertValue(node, RECORDS));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Malformed chain payload", ex);
        }
    }

    public static byte[] blockToJson(Block block) {
        try {
            return MAPPER.writeValueAsBytes(BlockRecord.of(block));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode block " + block.index(), e);
        }
    }

    public static Block blockFromJson(byte[] bytes) {
        try {
            return MAPPER.readValue(bytes, BlockRecord.class).toBlock();
        } catch (IOException ex) {
            throw new IllegalArgumentException("Malformed block record", ex);
        }
    }

    private static List<Block> toBlocks(List<BlockRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Chain payload has no blocks");
        }
        List<Block> blocks = new ArrayList<>(records.size());
        for (BlockRecord record : records) {
            if (record == null) throw new IllegalArgumentException("null block record");
            blocks.add(record.toBlock());
        }
        return blocks;
    }
}
