package lab.bank.common;

import java.util.Map;

public abstract class BankException extends RuntimeException {

    private final ErrorCode code;

    protected BankException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected BankException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public abstract Map<String, Object> details();
}
