package io.minichain.core.protocol;

/** A transfer amount that is zero or negative. Such transactions never reach a mempool. */
public class InvalidAmountException extends IllegalArgumentException {
    private final long amount;

    public InvalidAmountException(long amount) {
        super("amount must be > 0, got " + amount);
        this.amount = amount;
    }

    public long amount() { return amount; }
}
