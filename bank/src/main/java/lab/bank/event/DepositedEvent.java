package lab.bank.event;

import java.math.BigInteger;

public record DepositedEvent(
        String account,
        BigInteger amount,
        BigInteger newBalance
) {}
