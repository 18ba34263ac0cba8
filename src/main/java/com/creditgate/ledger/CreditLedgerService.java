package com.creditgate.ledger;

import com.creditgate.shared.model.CreditAccount;
import com.creditgate.shared.model.CreditTransaction;
import com.creditgate.shared.model.TransactionKind;
import com.creditgate.shared.repository.CreditAccountRepository;
import com.creditgate.shared.repository.CreditTransactionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Credit ledger: per-tenant balance row plus the append-only transaction log.
 *
 * Every mutation runs in one transaction that locks the tenant's account row
 * (SELECT ... FOR UPDATE), reads the balance, writes the new balance and inserts
 * the log entry. Concurrent mutators for the same tenant are serialized on that lock.
 * Any failure, including a lock wait that outlives the transaction timeout,
 * rolls back both writes.
 */
@Service
public class CreditLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(CreditLedgerService.class);

    static final int MUTATION_TIMEOUT_SECONDS = 5;
    static final int MAX_HISTORY_PAGE = 100;
    private static final int SUMMARY_RECENT_TRANSACTIONS = 10;

    private final CreditAccountRepository accountRepository;
    private final CreditTransactionRepository transactionRepository;
    private final Clock clock;

    public CreditLedgerService(CreditAccountRepository accountRepository,
                               CreditTransactionRepository transactionRepository,
                               Clock clock) {
        this.accountRepository = accountRepository;
        this.transactionRepository = transactionRepository;
        this.clock = clock;
    }

    /**
     * Gets the current account of a tenant.
     * @param tenantId the tenant id
     * @return Optional containing the account, empty if the tenant never had credits
     */
    @Transactional(readOnly = true)
    public Optional<CreditAccount> getBalance(Long tenantId) {
        return accountRepository.findByTenantId(tenantId);
    }

    /**
     * Read-only balance check. Does not lock, so the answer may be stale by the time
     * a deduction runs; {@link #deduct} re-checks under the lock.
     */
    @Transactional(readOnly = true)
    public boolean checkSufficient(Long tenantId, long required) {
        return accountRepository.findByTenantId(tenantId)
                .map(account -> account.getBalance() >= required)
                .orElse(false);
    }

    /**
     * Creates a zero-balance account if the tenant has none. Idempotent.
     */
    @Transactional
    public CreditAccount initializeAccount(Long tenantId) {
        int inserted = accountRepository.insertIfAbsent(tenantId);
        if (inserted > 0) {
            logger.info("Initialized credit account for tenant {}", tenantId);
        }
        return accountRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new AccountNotFoundException(tenantId));
    }

    /**
     * Charges a tenant for one billable operation.
     *
     * @param tenantId the tenant to charge
     * @param actorId the acting user, null for credential-only calls
     * @param amount credits to deduct, must be positive
     * @param linkedOperationRef reference to the billed operation, may be null
     * @param description human readable reason
     * @return the USAGE transaction written
     * @throws AccountNotFoundException if the tenant has no account
     * @throws InsufficientCreditsException if the balance is below amount; nothing is written
     */
    @Transactional(timeout = MUTATION_TIMEOUT_SECONDS)
    public CreditTransaction deduct(Long tenantId, Long actorId, long amount,
                                    String linkedOperationRef, String description) {
        requirePositive(amount);

        CreditAccount account = accountRepository.findByTenantIdForUpdate(tenantId)
                .orElseThrow(() -> new AccountNotFoundException(tenantId));

        long balanceBefore = account.getBalance();
        if (balanceBefore < amount) {
            logger.info("Insufficient credits: tenant={}, required={}, balance={}",
                    tenantId, amount, balanceBefore);
            throw new InsufficientCreditsException(tenantId, amount, balanceBefore);
        }

        account.debit(amount);
        CreditTransaction transaction = transactionRepository.save(new CreditTransaction(
                tenantId, actorId, TransactionKind.USAGE, -amount, balanceBefore,
                linkedOperationRef, description));

        logger.debug("Deducted {} credit(s): tenant={}, balance {} -> {}",
                amount, tenantId, balanceBefore, transaction.getBalanceAfter());
        return transaction;
    }

    /**
     * Writes a zero-amount USAGE entry so free operations stay visible in the audit trail.
     * Takes the row lock like any other mutation to keep the log chain ordered.
     */
    @Transactional(timeout = MUTATION_TIMEOUT_SECONDS)
    public CreditTransaction recordFreeOperation(Long tenantId, Long actorId,
                                                 String linkedOperationRef, String description) {
        CreditAccount account = accountRepository.findByTenantIdForUpdate(tenantId)
                .orElseThrow(() -> new AccountNotFoundException(tenantId));

        return transactionRepository.save(new CreditTransaction(
                tenantId, actorId, TransactionKind.USAGE, 0, account.getBalance(),
                linkedOperationRef, description));
    }

    /**
     * Adds purchased credits, creating the account on first purchase.
     *
     * @param paymentRef reference of the settled payment
     * @return the PURCHASE transaction written
     */
    @Transactional(timeout = MUTATION_TIMEOUT_SECONDS)
    public CreditTransaction add(Long tenantId, Long actorId, long amount,
                                 String paymentRef, String description) {
        return credit(tenantId, actorId, amount, TransactionKind.PURCHASE, paymentRef, description);
    }

    /**
     * Adds credits of any positive kind (PURCHASE, REFUND, ADJUSTMENT, PROMO).
     */
    @Transactional(timeout = MUTATION_TIMEOUT_SECONDS)
    public CreditTransaction credit(Long tenantId, Long actorId, long amount, TransactionKind kind,
                                    String reference, String description) {
        requirePositive(amount);
        if (!kind.isCredit()) {
            throw new IllegalArgumentException("Use deduct() for " + kind + " transactions");
        }

        accountRepository.insertIfAbsent(tenantId);
        CreditAccount account = accountRepository.findByTenantIdForUpdate(tenantId)
                .orElseThrow(() -> new AccountNotFoundException(tenantId));

        long balanceBefore = account.getBalance();
        account.credit(amount, kind, Instant.now(clock));
        CreditTransaction transaction = transactionRepository.save(new CreditTransaction(
                tenantId, actorId, kind, amount, balanceBefore, reference, description));

        logger.info("Credited {} credit(s) ({}): tenant={}, balance {} -> {}",
                amount, kind, tenantId, balanceBefore, transaction.getBalanceAfter());
        return transaction;
    }

    /**
     * Gets a page of a tenant's transactions, newest first.
     */
    @Transactional(readOnly = true)
    public List<CreditTransaction> getHistory(Long tenantId, int limit, int offset) {
        if (limit <= 0 || limit > MAX_HISTORY_PAGE) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_PAGE);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must not be negative");
        }
        return transactionRepository.findHistory(tenantId, limit, offset);
    }

    @Transactional(readOnly = true)
    public CreditSummary getSummary(Long tenantId, long lowBalanceThreshold) {
        Optional<CreditAccount> account = accountRepository.findByTenantId(tenantId);
        long balance = account.map(CreditAccount::getBalance).orElse(0L);
        return new CreditSummary(
                balance,
                account.map(CreditAccount::getTotalPurchased).orElse(0L),
                account.map(CreditAccount::getTotalUsed).orElse(0L),
                account.map(CreditAccount::getLastPurchaseAt).orElse(null),
                balance > 0 && balance < lowBalanceThreshold,
                transactionRepository.findHistory(tenantId, SUMMARY_RECENT_TRANSACTIONS, 0));
    }

    /**
     * Reconciles the account row against the log: the amounts must sum to the balance,
     * each entry must start where the previous one ended, and the totals must add up.
     */
    @Transactional(readOnly = true)
    public LedgerIntegrityReport verifyIntegrity(Long tenantId) {
        CreditAccount account = accountRepository.findByTenantId(tenantId)
                .orElseThrow(() -> new AccountNotFoundException(tenantId));
        List<CreditTransaction> entries = transactionRepository.findByTenantIdOrderByCreatedAtAscIdAsc(tenantId);

        long running = 0;
        Long firstBroken = null;
        for (CreditTransaction entry : entries) {
            if (firstBroken == null && entry.getBalanceBefore() != running) {
                firstBroken = entry.getId();
            }
            running += entry.getAmount();
        }

        boolean totalsConsistent =
                account.getBalance() == account.getTotalPurchased() - account.getTotalUsed();
        LedgerIntegrityReport report = new LedgerIntegrityReport(tenantId, account.getBalance(), running,
                entries.size(), totalsConsistent, firstBroken == null, firstBroken);

        if (!report.isConsistent()) {
            logger.error("Ledger integrity violation: tenant={}, balance={}, sum={}, firstBrokenTx={}",
                    tenantId, account.getBalance(), running, firstBroken);
        }
        return report;
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive, got " + amount);
        }
    }
}
