package lab.bank.ledger;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.math.BigInteger;
import java.util.Map;

public class LimitExceededException extends BankException {

    private final BigInteger amount;
    private final BigInteger withdrawLimit;

    public LimitExceededException(BigInteger amount, BigInteger withdrawLimit) {
        super(ErrorCode.LIMIT_EXCEEDED, "withdrawal exceeds per-operation limit: amount=" + amount + ", withdrawLimit=" + withdrawLimit);
        this.amount = amount;
        this.withdrawLimit = withdrawLimit;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getWithdrawLimit() {
        return withdrawLimit;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("amount", amount.toString(), "withdrawLimit", withdrawLimit.toString());
    }
}
