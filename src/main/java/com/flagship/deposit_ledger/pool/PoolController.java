package com.flagship.deposit_ledger.pool;

import com.flagship.deposit_ledger.market.LedgerConfig;
import com.flagship.deposit_ledger.market.MarketSummary;
import com.flagship.deposit_ledger.pool.dto.AmountRequest;
import com.flagship.deposit_ledger.pool.dto.BalanceResponse;
import com.flagship.deposit_ledger.pool.dto.InitializeMarketRequest;
import com.flagship.deposit_ledger.pool.dto.InterestRateRequest;
import com.flagship.deposit_ledger.pool.dto.ReceiptResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST Controller for markets, deposits and withdrawals.
 *
 * Caller identity is taken from the X-Caller-Id header; authorization is
 * decided by the pool and its ledgers, not here. The header is trusted as
 * given, so it must be set by an authenticating gateway that strips any
 * client-supplied value. Exposed directly, any client could act as the owner.
 */
@RestController
@RequestMapping("/api/markets")
@RequiredArgsConstructor
@Slf4j
public class PoolController {

    public static final String CALLER_HEADER = "X-Caller-Id";

    private final PoolCoordinator poolCoordinator;

    @PostMapping
    public ResponseEntity<MarketSummary> initializeMarket(
            @Valid @RequestBody InitializeMarketRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        log.info("Received market initialization request: assetId={}, symbol={}, rate={}",
                request.getAssetId(), request.getSymbol(), request.getInitialRate());

        MarketSummary market = poolCoordinator.initializeMarket(caller, request.getAssetId(),
                LedgerConfig.of(request.getName(), request.getSymbol(), request.getInitialRate()));

        return ResponseEntity.status(HttpStatus.CREATED).body(market);
    }

    @GetMapping
    public List<MarketSummary> listMarkets() {
        return poolCoordinator.listMarkets();
    }

    @GetMapping("/{assetId}")
    public MarketSummary getMarket(@PathVariable("assetId") String assetId) {
        return poolCoordinator.getMarket(assetId);
    }

    @PutMapping("/{assetId}/interest-rate")
    public MarketSummary setInterestRate(
            @PathVariable("assetId") String assetId,
            @Valid @RequestBody InterestRateRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        log.info("Received interest rate change: assetId={}, rate={}", assetId, request.getRate());
        return poolCoordinator.setInterestRate(caller, assetId, request.getRate());
    }

    @PostMapping("/{assetId}/deposits")
    public ResponseEntity<ReceiptResponse> deposit(
            @PathVariable("assetId") String assetId,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        log.info("Received deposit request: assetId={}, amount={}", assetId, request.getAmount());

        PoolReceipt receipt = poolCoordinator.deposit(caller, assetId, request.getAmount());
        return ResponseEntity.status(HttpStatus.CREATED).body(ReceiptResponse.from(receipt));
    }

    @PostMapping("/{assetId}/withdrawals")
    public ResponseEntity<ReceiptResponse> withdraw(
            @PathVariable("assetId") String assetId,
            @Valid @RequestBody AmountRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {

        log.info("Received withdraw request: assetId={}, amount={}", assetId, request.getAmount());

        PoolReceipt receipt = poolCoordinator.withdraw(caller, assetId, request.getAmount());
        return ResponseEntity.ok(ReceiptResponse.from(receipt));
    }

    @GetMapping("/{assetId}/balances/{user}")
    public BalanceResponse getBalance(@PathVariable("assetId") String assetId,
                                      @PathVariable("user") String user) {
        return BalanceResponse.from(poolCoordinator.getPosition(assetId, user));
    }
}
