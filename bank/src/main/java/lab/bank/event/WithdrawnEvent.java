package lab.bank.event;

import java.math.BigInteger;

public record WithdrawnEvent(
        String account,
        BigInteger amount,
        BigInteger newBalance,
        String transferReference
) {}
