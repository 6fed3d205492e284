package io.minichain.core.protocol;

public final class ProtocolLimits {
    private ProtocolLimits(){}

    public static final int MAX_TXS_PER_BLOCK = 100_000;
    public static final int MAX_ADDRESS_LEN = 256;          // host:port sanity cap
    public static final int MAX_CHAIN_BODY_BYTES = 64 * 1024 * 1024;
}
