package lab.bank.oracle;

import lab.bank.common.Addresses;
import lab.bank.ledger.LedgerService;
import lab.bank.unit.UnitConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigInteger;

// Values a custodied balance in USD: 18-decimal intermediate, then rescaled to the quote token precision.
@Service
@Slf4j
public class ValuationService {

    private final LedgerService ledgerService;
    private final PriceOracleClient priceOracleClient;
    private final int quoteDecimals;

    public ValuationService(
            LedgerService ledgerService,
            PriceOracleClient priceOracleClient,
            @Value("${bank.quote.decimals:6}") int quoteDecimals
    ) {
        if (quoteDecimals < 0) {
            throw new IllegalStateException("bank.quote.decimals must be non-negative: " + quoteDecimals);
        }
        this.ledgerService = ledgerService;
        this.priceOracleClient = priceOracleClient;
        this.quoteDecimals = quoteDecimals;
    }

    public Valuation valueOf(String address) {
        String account = Addresses.normalize(address);
        BigInteger balanceWei = ledgerService.getBalance(account);
        OraclePrice price = priceOracleClient.latestPrice();

        BigInteger valueInQuote18 = PriceOracleClient.quote(balanceWei, price);
        BigInteger valueInQuote = UnitConverter.rescale(valueInQuote18, UnitConverter.ETHER_DECIMALS, quoteDecimals);
        log.info(
                "event=valuation.computed account={} balanceWei={} price={} valueInQuote={} quoteDecimals={}",
                account,
                balanceWei,
                price.answer(),
                valueInQuote,
                quoteDecimals
        );
        return new Valuation(account, balanceWei, price.answer(), price.decimals(), valueInQuote18, valueInQuote, quoteDecimals);
    }
}
