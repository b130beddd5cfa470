package lab.bank.oracle;

import java.math.BigInteger;

public record Valuation(
        String account,
        BigInteger balanceWei,
        BigInteger price,
        int priceDecimals,
        BigInteger valueInQuote18,
        BigInteger valueInQuote,
        int quoteDecimals
) {}
