package lab.bank.event;

public record OracleAddressUpdatedEvent(
        String oracleAddress
) {}
