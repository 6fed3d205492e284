package io.minichain.core.chain;

import io.minichain.core.protocol.Block;
import io.minichain.core.protocol.BlockRecord;
import io.minichain.core.protocol.ChainCodec;
import io.minichain.core.protocol.Hash;
import io.minichain.core.protocol.Transaction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChainTest {

    static Chain buildChain(int length, int difficulty) {
        Chain chain = Chain.genesis();
        while (chain.length() < length) {
            Block tip = chain.latest();
            List<Transaction> txs = List.of(new Transaction("alice", "bob", tip.index() + 1));
            chain.append(new Block(tip.index() + 1, txs, tip.hash()).mine(difficulty));
        }
        return chain;
    }

    @Test
    void genesisChainIsValid() {
        Chain chain = Chain.genesis();
        assertEquals(1, chain.length());
        assertTrue(chain.validate());
        assertEquals(chain.genesisHash(), GenesisBuilder.buildGenesis().hash());
    }

    @Test
    void chainBuiltThroughAppendIsValid() {
        Chain chain = buildChain(5, 1);
        assertEquals(5, chain.length());
        assertTrue(chain.validate());
        List<Block> blocks = chain.blocks();
        for (int i = 1; i < blocks.size(); i++) {
            assertEquals(blocks.get(i - 1).hash(), blocks.get(i).previousHash());
            assertEquals(i, blocks.get(i).index());
        }
    }

    @Test
    void appendRejectsBlockNotLinkedToTip() {
        Chain chain = buildChain(2, 0);
        Block stray = new Block(2, List.of(), Hash.ZERO);
        assertThrows(ChainLinkageException.class, () -> chain.append(stray));
        assertEquals(2, chain.length());
    }

    @Test
    void appendRejectsWrongIndex() {
        Chain chain = buildChain(2, 0);
        Block skipped = new Block(5, List.of(), chain.latest().hash());
        assertThrows(ChainLinkageException.class, () -> chain.append(skipped));
    }

    @Test
    void tamperedTransactionInvalidatesChain() {
        Chain chain = buildChain(3, 1);
        List<Block> blocks = new ArrayList<>(chain.blocks());
        Block original = blocks.get(1);
        blocks.set(1, Block.restore(original.index(), List.of(new Transaction("alice", "mallory", 1_000)),
                original.previousHash(), original.timestamp(), original.nonce(), original.hash()));

        Chain tampered = Chain.of(blocks);
        assertFalse(tampered.validate());
        assertTrue(tampered.validationError().orElseThrow().contains("hash mismatch"));
    }

    @Test
    void tamperedWireRecordInvalidatesChain() {
        Chain chain = buildChain(3, 1);
        List<BlockRecord> records = new ArrayList<>(ChainCodec.toRecords(chain.blocks()));
        BlockRecord r = records.get(2);
        records.set(2, new BlockRecord(r.index(), r.timestamp() + 1, r.transactions(), r.previousHash(), r.nonce(), r.hash()));

        List<Block> decoded = new ArrayList<>();
        for (BlockRecord record : records) {
            decoded.add(record.toBlock());
        }
        assertFalse(Chain.of(decoded).validate());
    }

    @Test
    void brokenLinkInvalidatesChain() {
        Chain chain = buildChain(3, 0);
        List<Block> blocks = new ArrayList<>(chain.blocks());
        Block last = blocks.get(2);
        blocks.set(2, new Block(2, last.transactions(), Hash.ZERO, last.timestamp()));
        assertFalse(Chain.of(blocks).validate());
    }

    @Test
    void nonGenesisFirstBlockIsInvalid() {
        Chain chain = buildChain(3, 0);
        assertFalse(Chain.of(chain.blocks().subList(1, 3)).validate());
    }

    @Test
    void jsonRoundTripKeepsChainValid() {
        Chain chain = buildChain(4, 1);
        Chain decoded = Chain.of(ChainCodec.fromJson(ChainCodec.toJson(chain.blocks())));
        assertTrue(decoded.validate());
        assertTrue(decoded.sameAs(chain));
        assertEquals(chain.blocks(), decoded.blocks());
    }

    @Test
    void wireFormatUsesSnakeCasePreviousHash() {
        String json = new String(ChainCodec.toJson(buildChain(2, 0).blocks()));
        assertTrue(json.contains("\"previous_hash\""));
        assertTrue(json.contains("\"transactions\":[{\"sender\":\"alice\",\"recipient\":\"bob\",\"amount\":1}]"));
    }

    @Test
    void blocksSnapshotIsImmutable() {
        Chain chain = buildChain(2, 0);
        assertThrows(UnsupportedOperationException.class, () -> chain.blocks().clear());
    }
}
