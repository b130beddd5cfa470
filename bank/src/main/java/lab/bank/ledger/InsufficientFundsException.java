package lab.bank.ledger;

import lab.bank.common.BankException;
import lab.bank.common.ErrorCode;

import java.math.BigInteger;
import java.util.Map;

public class InsufficientFundsException extends BankException {

    private final String account;
    private final BigInteger amount;
    private final BigInteger balance;

    public InsufficientFundsException(String account, BigInteger amount, BigInteger balance) {
        super(ErrorCode.INSUFFICIENT_FUNDS, "insufficient funds: account=" + account + ", amount=" + amount + ", balance=" + balance);
        this.account = account;
        this.amount = amount;
        this.balance = balance;
    }

    public String getAccount() {
        return account;
    }

    public BigInteger getAmount() {
        return amount;
    }

    public BigInteger getBalance() {
        return balance;
    }

    @Override
    public Map<String, Object> details() {
        return Map.of("account", account, "amount", amount.toString(), "balance", balance.toString());
    }
}
