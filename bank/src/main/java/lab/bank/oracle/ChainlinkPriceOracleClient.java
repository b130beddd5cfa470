package lab.bank.oracle;

import lab.bank.admin.AdminRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.NumericType;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Int256;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint80;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.exceptions.ClientConnectionException;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

// Address is read from AdminRegistry on every call.
@Component
@ConditionalOnProperty(prefix = "bank.chain", name = "mode", havingValue = "rpc")
@Slf4j
public class ChainlinkPriceOracleClient implements PriceOracleClient {

    private static final Function LATEST_ROUND_DATA = new Function(
            "latestRoundData",
            List.of(),
            List.<TypeReference<?>>of(
                    new TypeReference<Uint80>() {},
                    new TypeReference<Int256>() {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Uint80>() {}
            )
    );

    private final Web3j web3j;
    private final AdminRegistry adminRegistry;
    private final Duration maxStaleness;
    private final Clock clock;

    @Autowired
    public ChainlinkPriceOracleClient(
            Web3j web3j,
            AdminRegistry adminRegistry,
            @Value("${bank.oracle.max-staleness-seconds:0}") long maxStalenessSeconds
    ) {
        this(web3j, adminRegistry, Duration.ofSeconds(maxStalenessSeconds), Clock.systemUTC());
    }

    ChainlinkPriceOracleClient(Web3j web3j, AdminRegistry adminRegistry, Duration maxStaleness, Clock clock) {
        this.web3j = web3j;
        this.adminRegistry = adminRegistry;
        this.maxStaleness = maxStaleness;
        this.clock = clock;
    }

    @Override
    public OraclePrice latestPrice() {
        String oracleAddress = adminRegistry.getOracleAddress();
        String encoded = FunctionEncoder.encode(LATEST_ROUND_DATA);

        EthCall response;
        try {
            response = web3j.ethCall(
                    Transaction.createEthCallTransaction(null, oracleAddress, encoded),
                    DefaultBlockParameterName.LATEST
            ).send();
        } catch (IOException | ClientConnectionException e) {
            log.warn("event=oracle.latest_price.rpc_error oracleAddress={} error={}", oracleAddress, e.toString());
            throw new OracleUnavailableException(oracleAddress, "RPC request failed: " + e.getMessage(), e);
        }

        if (response.hasError()) {
            throw new OracleUnavailableException(oracleAddress, "RPC error: " + response.getError().getMessage());
        }
        if (response.isReverted()) {
            throw new OracleUnavailableException(oracleAddress, "call reverted: " + response.getRevertReason());
        }

        String value = response.getValue();
        if (value == null || value.isBlank() || "0x".equalsIgnoreCase(value)) {
            throw new OracleUnavailableException(oracleAddress, "empty response from feed");
        }

        List<Type> decoded = FunctionReturnDecoder.decode(value, LATEST_ROUND_DATA.getOutputParameters());
        if (decoded.size() != LATEST_ROUND_DATA.getOutputParameters().size()) {
            throw new OracleUnavailableException(oracleAddress, "unexpected latestRoundData layout: " + decoded.size() + " values");
        }

        BigInteger roundId = ((NumericType) decoded.get(0)).getValue();
        BigInteger answer = ((NumericType) decoded.get(1)).getValue();
        Instant updatedAt = Instant.ofEpochSecond(((NumericType) decoded.get(3)).getValue().longValueExact());

        if (!maxStaleness.isZero() && updatedAt.plus(maxStaleness).isBefore(clock.instant())) {
            log.warn("event=oracle.latest_price.stale oracleAddress={} roundId={} updatedAt={}", oracleAddress, roundId, updatedAt);
            throw new OracleUnavailableException(oracleAddress, "stale price: updatedAt=" + updatedAt + ", maxStaleness=" + maxStaleness);
        }

        log.debug("event=oracle.latest_price.read oracleAddress={} roundId={} answer={} updatedAt={}", oracleAddress, roundId, answer, updatedAt);
        return new OraclePrice(answer, PRICE_DECIMALS, updatedAt, roundId);
    }
}
