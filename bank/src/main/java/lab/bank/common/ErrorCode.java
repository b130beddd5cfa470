package lab.bank.common;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT),
    LIMIT_EXCEEDED(HttpStatus.UNPROCESSABLE_ENTITY),
    INSUFFICIENT_FUNDS(HttpStatus.UNPROCESSABLE_ENTITY),
    TRANSFER_FAILED(HttpStatus.BAD_GATEWAY),
    REENTRANCY_DETECTED(HttpStatus.CONFLICT),
    NOT_AUTHORIZED(HttpStatus.FORBIDDEN),
    ORACLE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INVALID_REQUEST(HttpStatus.BAD_REQUEST);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
