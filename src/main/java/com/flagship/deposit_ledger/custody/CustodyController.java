package com.flagship.deposit_ledger.custody;

import com.flagship.deposit_ledger.pool.PoolController;
import com.flagship.deposit_ledger.pool.dto.AmountRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Funding and inspection of the bundled in-memory custody.
 *
 * Crediting is owner-only, with the owner identified by the same
 * {@link PoolController#CALLER_HEADER} header, which only a trusted gateway
 * may set.
 */
@RestController
@RequestMapping("/api/custody/{assetId}")
@RequiredArgsConstructor
@Slf4j
public class CustodyController {

    private final InMemoryAssetCustody custody;

    @PostMapping("/accounts/{holder}/credits")
    public Map<String, Object> credit(@PathVariable("assetId") String assetId,
                                      @PathVariable("holder") String holder,
                                      @Valid @RequestBody AmountRequest request,
                                      @RequestHeader(PoolController.CALLER_HEADER) String caller) {
        BigInteger balance = custody.credit(caller, assetId, holder, request.getAmount());
        return accountView(assetId, holder, balance);
    }

    @GetMapping("/accounts/{holder}")
    public Map<String, Object> getAccount(@PathVariable("assetId") String assetId,
                                          @PathVariable("holder") String holder) {
        return accountView(assetId, holder, custody.balanceOf(assetId, holder));
    }

    @GetMapping("/pool")
    public Map<String, Object> getPool(@PathVariable("assetId") String assetId) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("asset_id", assetId);
        response.put("pool_balance", custody.poolBalance(assetId));
        return response;
    }

    private static Map<String, Object> accountView(String assetId, String holder, BigInteger balance) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("asset_id", assetId);
        response.put("holder", holder);
        response.put("balance", balance);
        return response;
    }
}
