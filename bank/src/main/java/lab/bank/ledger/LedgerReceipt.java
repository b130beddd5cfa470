package lab.bank.ledger;

import lab.bank.domain.history.TxHistoryKind;

import java.math.BigInteger;

public record LedgerReceipt(
        String account,
        TxHistoryKind kind,
        BigInteger amount,
        BigInteger newBalance,
        long historyIndex,
        BigInteger totalBalance,
        String transferReference
) {}
