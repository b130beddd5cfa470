package lab.bank.event;

public record OwnerChangedEvent(
        String previousOwner,
        String newOwner
) {}
