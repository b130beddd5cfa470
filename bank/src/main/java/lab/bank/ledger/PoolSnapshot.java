package lab.bank.ledger;

import lab.bank.domain.pool.CustodyPool;

import java.math.BigInteger;

public record PoolSnapshot(
        BigInteger totalBalance,
        long depositCount,
        long withdrawalCount,
        BigInteger withdrawLimit,
        BigInteger bankCap
) {
    static PoolSnapshot of(CustodyPool pool) {
        return new PoolSnapshot(
                pool.getTotalBalance(),
                pool.getDepositCount(),
                pool.getWithdrawalCount(),
                pool.getWithdrawLimit(),
                pool.getBankCap()
        );
    }
}
