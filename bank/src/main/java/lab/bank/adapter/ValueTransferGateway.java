package lab.bank.adapter;

import java.math.BigInteger;

/**
 * Moves custodied value out to an external address.
 * Implementations report transport and chain failures through {@link TransferResult} instead of throwing,
 * and must return within a bounded time.
 */
public interface ValueTransferGateway {

    TransferResult send(String to, BigInteger amountWei);

    record TransferResult(
            boolean success,
            String reference,
            String reason
    ) {
        public static TransferResult succeeded(String reference) {
            return new TransferResult(true, reference, null);
        }

        public static TransferResult failed(String reason) {
            return new TransferResult(false, null, reason == null || reason.isBlank() ? "unknown transfer failure" : reason);
        }
    }
}
