package lab.bank.ledger;

import lab.bank.common.Addresses;
import lab.bank.common.CorrelationIdFilter;
import lab.bank.common.InvalidRequestException;
import lab.bank.domain.history.TxHistoryEntry;
import lab.bank.oracle.Valuation;
import lab.bank.oracle.ValuationService;
import lab.bank.unit.UnitConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/bank")
@Slf4j
public class LedgerController {

    private final LedgerService ledgerService;
    private final ValuationService valuationService;

    @PostMapping("/deposits")
    public ResponseEntity<LedgerReceipt> deposit(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody AmountRequest req
    ) {
        BigInteger amountWei = req.resolveWei();
        log.info("event=bank.deposit.request caller={} amountWei={}", caller, amountWei);
        LedgerReceipt receipt = ledgerService.deposit(caller, amountWei);
        log.info("event=bank.deposit.response account={} newBalanceWei={}", receipt.account(), receipt.newBalance());
        return ResponseEntity.ok(receipt);
    }

    // Plain value transfer into the bank: no operation chosen, so it is booked as a deposit for the sender.
    @PostMapping("/receive")
    public ResponseEntity<LedgerReceipt> receive(@RequestBody InboundTransferRequest req) {
        if (req.amountWei() == null) {
            throw new InvalidRequestException("amountWei is required");
        }
        log.info("event=bank.receive.request from={} amountWei={}", req.from(), req.amountWei());
        return ResponseEntity.ok(ledgerService.receive(req.from(), req.amountWei()));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<LedgerReceipt> withdraw(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody AmountRequest req
    ) {
        BigInteger amountWei = req.resolveWei();
        log.info("event=bank.withdraw.request caller={} amountWei={}", caller, amountWei);
        LedgerReceipt receipt = ledgerService.withdraw(caller, amountWei);
        log.info("event=bank.withdraw.response account={} newBalanceWei={} transferRef={}", receipt.account(), receipt.newBalance(), receipt.transferReference());
        return ResponseEntity.ok(receipt);
    }

    @GetMapping("/accounts/{address}/balance")
    public ResponseEntity<BalanceResponse> balance(@PathVariable String address) {
        BigInteger balanceWei = ledgerService.getBalance(address);
        return ResponseEntity.ok(new BalanceResponse(
                Addresses.normalize(address),
                balanceWei,
                UnitConverter.formatMajorUnit(balanceWei)
        ));
    }

    @GetMapping("/accounts/{address}/history")
    public ResponseEntity<List<TxHistoryEntry>> history(@PathVariable String address) {
        List<TxHistoryEntry> entries = ledgerService.getHistory(address);
        log.info("event=bank.history.response account={} count={}", address, entries.size());
        return ResponseEntity.ok(entries);
    }

    @GetMapping("/accounts/{address}/valuation")
    public ResponseEntity<Valuation> valuation(@PathVariable String address) {
        return ResponseEntity.ok(valuationService.valueOf(address));
    }

    @GetMapping("/pool")
    public ResponseEntity<PoolSnapshot> pool() {
        return ResponseEntity.ok(ledgerService.getPoolSnapshot());
    }

    public record AmountRequest(
            BigInteger amountWei,
            BigDecimal amountEth
    ) {
        // Exactly one of the two units must be given.
        BigInteger resolveWei() {
            if (amountWei != null && amountEth != null) {
                throw new InvalidRequestException("specify either amountWei or amountEth, not both");
            }
            if (amountWei != null) {
                return amountWei;
            }
            if (amountEth != null) {
                return UnitConverter.parseMajorUnit(amountEth);
            }
            throw new InvalidRequestException("amountWei or amountEth is required");
        }
    }

    public record InboundTransferRequest(
            String from,
            BigInteger amountWei
    ) {}

    public record BalanceResponse(
            String address,
            BigInteger balanceWei,
            String balanceEth
    ) {}
}
