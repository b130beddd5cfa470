package lab.bank.common;

import java.util.Locale;
import java.util.regex.Pattern;

public final class Addresses {

    private static final Pattern EVM_ADDRESS_PATTERN = Pattern.compile("^0x[a-fA-F0-9]{40}$");
    private static final int MAX_LENGTH = 64;

    private Addresses() {
    }

    // Account identifiers are opaque, but compared case-insensitively so 0xAbC.. and 0xabc.. share one account.
    public static String normalize(String address) {
        if (address == null || address.isBlank()) {
            throw new InvalidRequestException("address is required");
        }
        String trimmed = address.trim();
        if (trimmed.length() > MAX_LENGTH) {
            throw new InvalidRequestException("address is too long: " + trimmed.length() + " > " + MAX_LENGTH);
        }
        return trimmed.toLowerCase(Locale.ROOT);
    }

    public static String normalizeEvm(String address) {
        String normalized = normalize(address);
        if (!isEvmAddress(normalized)) {
            throw new InvalidRequestException("invalid EVM address: " + address);
        }
        return normalized;
    }

    public static boolean isEvmAddress(String address) {
        return address != null && EVM_ADDRESS_PATTERN.matcher(address).matches();
    }
}
