package io.minichain.core.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable value transfer. The identity hash covers exactly sender, recipient and amount,
 * so two submissions of the same transfer share an identity.
 */
public final class Transaction {

    private final String sender;
    private final String recipient;
    private final long amount;

    private final Hash identityHash;

    public Transaction(String sender, String recipient, long amount) {
        if (sender == null || sender.isBlank()) throw new IllegalArgumentException("Missing sender");
        if (recipient == null || recipient.isBlank()) throw new IllegalArgumentException("Missing recipient");
        if (amount <= 0) throw new InvalidAmountException(amount);
        this.sender = sender;
        this.recipient = recipient;
        this.amount = amount;
        this.identityHash = Hashes.digest(serialize());
    }

    // -------------------- getters --------------------
    public String sender() { return sender; }
    public String recipient() { return recipient; }
    public long amount() { return amount; }
    public Hash identityHash() { return identityHash; }

    // -------------------- core methods --------------------

    /** Canonical bytes: len(sender) || sender || len(recipient) || recipient || amount. */
    public byte[] serialize() {
        byte[] s = sender.getBytes(StandardCharsets.UTF_8);
        byte[] r = recipient.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(4 + s.length + 4 + r.length + 8);
        putBytes(buf, s);
        putBytes(buf, r);
        buf.putLong(amount);
        return buf.array();
    }

    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return amount == other.amount
                && sender.equals(other.sender)
                && recipient.equals(other.recipient);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sender, recipient, amount);
    }

    @Override public String toString() {
        return "Transaction{" + sender + " -> " + recipient + ", amount=" + amount + "}";
    }
}
