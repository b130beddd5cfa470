package lab.bank.admin;

import lab.bank.common.CorrelationIdFilter;
import lab.bank.domain.admin.BankAdministration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/admin")
@Slf4j
public class AdminController {

    private final AdminRegistry adminRegistry;

    @GetMapping
    public ResponseEntity<AdminView> get() {
        return ResponseEntity.ok(AdminView.of(adminRegistry.current()));
    }

    @PutMapping("/owner")
    public ResponseEntity<AdminView> changeOwner(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody ChangeOwnerRequest req
    ) {
        log.info("event=admin.change_owner.request caller={} newOwner={}", caller, req.newOwner());
        return ResponseEntity.ok(AdminView.of(adminRegistry.changeOwner(caller, req.newOwner())));
    }

    @PutMapping("/oracle")
    public ResponseEntity<AdminView> updateOracle(
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String caller,
            @RequestBody UpdateOracleRequest req
    ) {
        log.info("event=admin.update_oracle.request caller={} oracleAddress={}", caller, req.oracleAddress());
        return ResponseEntity.ok(AdminView.of(adminRegistry.updateOracleAddress(caller, req.oracleAddress())));
    }

    public record ChangeOwnerRequest(String newOwner) {}

    public record UpdateOracleRequest(String oracleAddress) {}

    public record AdminView(String owner, String oracleAddress) {
        static AdminView of(BankAdministration administration) {
            return new AdminView(administration.getOwner(), administration.getOracleAddress());
        }
    }
}
