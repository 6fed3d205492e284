package io.minichain.core.protocol;

/** Wire form of a transaction: {@code {sender, recipient, amount}}. */
public record TransactionRecord(String sender, String recipient, long amount) {

    public static TransactionRecord of(Transaction tx) {
        return new TransactionRecord(tx.sender(), tx.recipient(), tx.amount());
    }

    public Transaction toTransaction() {
        return new Transaction(sender, recipient, amount);
    }
}
