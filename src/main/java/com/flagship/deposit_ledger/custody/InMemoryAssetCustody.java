package com.flagship.deposit_ledger.custody;

import com.flagship.deposit_ledger.auth.AuthorizationPolicy;
import com.flagship.deposit_ledger.auth.LedgerOperation;
import com.flagship.deposit_ledger.exception.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local custody: one balance book per asset plus the pool's holdings.
 *
 * Transfers never go negative; an unfunded transfer returns false and leaves
 * both sides untouched. Each asset's book is locked for the duration of a
 * transfer so the debit and credit are applied together.
 */
@Component
@Slf4j
public class InMemoryAssetCustody implements AssetCustody {

    private final ConcurrentMap<String, Book> books = new ConcurrentHashMap<>();
    private final AuthorizationPolicy authorizationPolicy;

    public InMemoryAssetCustody(AuthorizationPolicy authorizationPolicy) {
        this.authorizationPolicy = authorizationPolicy;
    }

    @Override
    public boolean transferIn(String assetId, String from, BigInteger amount) {
        if (!isValidTransfer(assetId, from, amount)) {
            return false;
        }
        Book book = book(assetId);
        synchronized (book) {
            BigInteger available = book.holders.getOrDefault(from, BigInteger.ZERO);
            if (available.compareTo(amount) < 0) {
                log.warn("Custody transfer in rejected, insufficient holder funds: assetId={}, holder={}, available={}, amount={}",
                        assetId, from, available, amount);
                return false;
            }
            book.holders.put(from, available.subtract(amount));
            book.pool = book.pool.add(amount);
        }
        log.debug("Custody transfer in: assetId={}, holder={}, amount={}", assetId, from, amount);
        return true;
    }

    @Override
    public boolean transferOut(String assetId, String to, BigInteger amount) {
        if (!isValidTransfer(assetId, to, amount)) {
            return false;
        }
        Book book = book(assetId);
        synchronized (book) {
            if (book.pool.compareTo(amount) < 0) {
                log.warn("Custody transfer out rejected, insufficient pool funds: assetId={}, pool={}, amount={}",
                        assetId, book.pool, amount);
                return false;
            }
            book.pool = book.pool.subtract(amount);
            book.holders.merge(to, amount, BigInteger::add);
        }
        log.debug("Custody transfer out: assetId={}, holder={}, amount={}", assetId, to, amount);
        return true;
    }

    @Override
    public BigInteger balanceOf(String assetId, String holder) {
        Book book = books.get(assetId);
        if (book == null) {
            return BigInteger.ZERO;
        }
        synchronized (book) {
            return book.holders.getOrDefault(holder, BigInteger.ZERO);
        }
    }

    @Override
    public BigInteger poolBalance(String assetId) {
        Book book = books.get(assetId);
        if (book == null) {
            return BigInteger.ZERO;
        }
        synchronized (book) {
            return book.pool;
        }
    }

    /**
     * Issues new units of the asset to a holder. Owner only.
     *
     * @return the holder's balance after the credit
     */
    public BigInteger credit(String caller, String assetId, String holder, BigInteger amount) {
        if (!authorizationPolicy.isAuthorized(caller, LedgerOperation.CREDIT_CUSTODY)) {
            throw LedgerException.unauthorized(caller, LedgerOperation.CREDIT_CUSTODY);
        }
        if (amount == null || amount.signum() <= 0) {
            throw LedgerException.invalidAmount("Credit amount must be greater than 0");
        }
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Holder is required");
        }
        Book book = book(assetId);
        BigInteger updated;
        synchronized (book) {
            updated = book.holders.merge(holder, amount, BigInteger::add);
        }
        log.info("Custody credit: assetId={}, holder={}, amount={}, balance={}", assetId, holder, amount, updated);
        return updated;
    }

    private Book book(String assetId) {
        return books.computeIfAbsent(assetId, id -> new Book());
    }

    private static boolean isValidTransfer(String assetId, String holder, BigInteger amount) {
        return assetId != null && holder != null && amount != null && amount.signum() > 0;
    }

    private static final class Book {
        private final Map<String, BigInteger> holders = new HashMap<>();
        private BigInteger pool = BigInteger.ZERO;
    }
}
