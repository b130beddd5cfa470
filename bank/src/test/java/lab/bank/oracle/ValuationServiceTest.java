package lab.bank.oracle;

import lab.bank.ledger.LedgerService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValuationServiceTest {

    private static final String ACCOUNT = "0x00000000000000000000000000000000000000a1";

    @Mock LedgerService ledgerService;
    @Mock PriceOracleClient priceOracleClient;

    @Test
    void valuesBalanceInQuoteDecimals() {
        ValuationService service = new ValuationService(ledgerService, priceOracleClient, 6);
        when(ledgerService.getBalance(ACCOUNT)).thenReturn(new BigInteger("1500000000000000000"));
        when(priceOracleClient.latestPrice()).thenReturn(price(200_012_345_678L));

        Valuation valuation = service.valueOf(ACCOUNT.toUpperCase().replace("0X", "0x"));

        assertThat(valuation.account()).isEqualTo(ACCOUNT);
        assertThat(valuation.valueInQuote18()).isEqualTo(new BigInteger("3000185185170000000000"));
        assertThat(valuation.valueInQuote()).isEqualTo(BigInteger.valueOf(3_000_185_185L));
        assertThat(valuation.quoteDecimals()).isEqualTo(6);
        assertThat(valuation.priceDecimals()).isEqualTo(8);
    }

    @Test
    void emptyBalanceIsWorthNothing() {
        ValuationService service = new ValuationService(ledgerService, priceOracleClient, 6);
        when(ledgerService.getBalance(ACCOUNT)).thenReturn(BigInteger.ZERO);
        when(priceOracleClient.latestPrice()).thenReturn(price(200_000_000_000L));

        assertThat(service.valueOf(ACCOUNT).valueInQuote()).isZero();
    }

    @Test
    void oracleOutageSurfaces() {
        ValuationService service = new ValuationService(ledgerService, priceOracleClient, 6);
        when(ledgerService.getBalance(ACCOUNT)).thenReturn(BigInteger.TEN);
        when(priceOracleClient.latestPrice()).thenThrow(new OracleUnavailableException(null, "feed offline"));

        assertThatThrownBy(() -> service.valueOf(ACCOUNT)).isInstanceOf(OracleUnavailableException.class);
    }

    @Test
    void rejectsNegativeQuoteDecimals() {
        assertThatThrownBy(() -> new ValuationService(ledgerService, priceOracleClient, -1))
                .isInstanceOf(IllegalStateException.class);
    }

    private static OraclePrice price(long answer) {
        return new OraclePrice(BigInteger.valueOf(answer), PriceOracleClient.PRICE_DECIMALS, Instant.now(), BigInteger.ONE);
    }
}
