package io.minichain.core.node;

/** Simple config holder for a node. */
public final class NodeConfig {
    public static final String REWARD_SENDER = "network";

    public final String address;
    public final int difficulty;
    public final long rewardAmount;
    public final long peerTimeoutMillis;
    public final long miningTimeoutMillis;

    public NodeConfig(String address, int difficulty, long rewardAmount, long peerTimeoutMillis, long miningTimeoutMillis) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Node address required");
        }
        if (difficulty < 0 || difficulty > 64) {
            throw new IllegalArgumentException("difficulty must be within 0..64");
        }
        if (rewardAmount <= 0) {
            throw new IllegalArgumentException("rewardAmount must be > 0");
        }
        this.address = address;
        this.difficulty = difficulty;
        this.rewardAmount = rewardAmount;
        this.peerTimeoutMillis = peerTimeoutMillis;
        this.miningTimeoutMillis = miningTimeoutMillis;
    }

    public static NodeConfig defaultLocal(String address) {
        return new NodeConfig(
                address,
                4,          // leading zero hex digits
                1L,         // reward per mined block
                3_000L,     // per-peer network timeout
                0L          // no mining deadline
        );
    }

    public NodeConfig withDifficulty(int difficulty) {
        return new NodeConfig(address, difficulty, rewardAmount, peerTimeoutMillis, miningTimeoutMillis);
    }

    public NodeConfig withReward(long rewardAmount) {
        return new NodeConfig(address, difficulty, rewardAmount, peerTimeoutMillis, miningTimeoutMillis);
    }

    public NodeConfig withPeerTimeout(long peerTimeoutMillis) {
        return new NodeConfig(address, difficulty, rewardAmount, peerTimeoutMillis, miningTimeoutMillis);
    }

    public NodeConfig withMiningTimeout(long miningTimeoutMillis) {
        return new NodeConfig(address, difficulty, rewardAmount, peerTimeoutMillis, miningTimeoutMillis);
    }
}
