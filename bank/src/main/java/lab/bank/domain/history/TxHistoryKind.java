package lab.bank.domain.history;

public enum TxHistoryKind {
    DEPOSIT,
    WITHDRAWAL
}
