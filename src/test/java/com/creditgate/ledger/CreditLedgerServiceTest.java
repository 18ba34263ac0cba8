package com.creditgate.ledger;

import com.creditgate.shared.model.CreditAccount;
import com.creditgate.shared.model.CreditTransaction;
import com.creditgate.shared.model.TransactionKind;
import com.creditgate.shared.repository.CreditTransactionRepository;
import com.creditgate.support.AbstractIntegrationTest;
import com.creditgate.support.PostgresTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CreditLedgerServiceTest extends AbstractIntegrationTest {

    @Autowired
    private CreditLedgerService ledgerService;

    @Autowired
    private CreditTransactionRepository transactionRepository;

    @Test
    void add_createsAccountOnFirstPurchase() {
        long tenantId = PostgresTestSupport.newTenantId();
        assertThat(ledgerService.getBalance(tenantId)).isEmpty();

        CreditTransaction purchase = ledgerService.add(tenantId, 7L, 50, "pay_123", "Starter pack");

        assertThat(purchase.getKind()).isEqualTo(TransactionKind.PURCHASE);
        assertThat(purchase.getBalanceBefore()).isZero();
        assertThat(purchase.getBalanceAfter()).isEqualTo(50);
        assertThat(purchase.getLinkedOperationRef()).isEqualTo("pay_123");

        CreditAccount account = ledgerService.getBalance(tenantId).orElseThrow();
        assertThat(account.getBalance()).isEqualTo(50);
        assertThat(account.getTotalPurchased()).isEqualTo(50);
        assertThat(account.getLastPurchaseAt()).isNotNull();
    }

    @Test
    void deduct_withoutAccountFails() {
        long tenantId = PostgresTestSupport.newTenantId();

        assertThat(ledgerService.checkSufficient(tenantId, 1)).isFalse();
        assertThatThrownBy(() -> ledgerService.deduct(tenantId, null, 1, null, "lookup"))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    void deduct_insufficientBalanceWritesNothing() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 3, "pay_1", "top-up");

        assertThatThrownBy(() -> ledgerService.deduct(tenantId, null, 5, "op-1", "lookup"))
                .isInstanceOfSatisfying(InsufficientCreditsException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(5);
                    assertThat(e.getBalance()).isEqualTo(3);
                });

        assertThat(ledgerService.getBalance(tenantId).orElseThrow().getBalance()).isEqualTo(3);
        assertThat(transactionRepository.countByTenantId(tenantId)).isEqualTo(1);
    }

    @Test
    void deductThenAdd_restoresBalanceWithOffsettingEntries() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 40, "pay_1", "top-up");

        CreditTransaction usage = ledgerService.deduct(tenantId, null, 10, "op-rt", "lookup");
        CreditTransaction restore = ledgerService.add(tenantId, null, 10, "pay_2", "restore");

        assertThat(usage.getAmount()).isEqualTo(-10);
        assertThat(restore.getAmount()).isEqualTo(10);
        assertThat(restore.getBalanceBefore()).isEqualTo(usage.getBalanceAfter());
        assertThat(restore.getBalanceAfter()).isEqualTo(40);

        long balance = ledgerService.getBalance(tenantId).orElseThrow().getBalance();
        assertThat(balance).isEqualTo(40);
        assertThat(transactionRepository.countByTenantId(tenantId)).isEqualTo(3);
        assertThat(transactionRepository.sumAmountsByTenantId(tenantId)).isEqualTo(balance);
    }

    @Test
    void deduct_exactBalanceReachesZero() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 2, "pay_1", "top-up");

        CreditTransaction usage = ledgerService.deduct(tenantId, null, 2, "op-1", "lookup");

        assertThat(usage.getAmount()).isEqualTo(-2);
        assertThat(usage.getBalanceAfter()).isZero();
        assertThat(ledgerService.checkSufficient(tenantId, 1)).isFalse();
    }

    @Test
    void deduct_rejectsNonPositiveAmounts() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 5, "pay_1", "top-up");

        assertThatThrownBy(() -> ledgerService.deduct(tenantId, null, 0, null, "lookup"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.add(tenantId, null, -1, null, "top-up"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentDeducts_neverOverdraw() throws Exception {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 10, "pay_1", "top-up");

        List<Object> results = runConcurrently(2,
                () -> ledgerService.deduct(tenantId, null, 6, null, "lookup"));

        long succeeded = results.stream().filter(CreditTransaction.class::isInstance).count();
        long rejected = results.stream().filter(InsufficientCreditsException.class::isInstance).count();
        assertThat(succeeded).isEqualTo(1);
        assertThat(rejected).isEqualTo(1);
        assertThat(ledgerService.getBalance(tenantId).orElseThrow().getBalance()).isEqualTo(4);
    }

    @Test
    void concurrentDeducts_serializeIntoAContinuousChain() throws Exception {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 100, "pay_1", "top-up");

        List<Object> results = runConcurrently(3,
                () -> ledgerService.deduct(tenantId, null, 10, null, "lookup"));

        assertThat(results).allMatch(CreditTransaction.class::isInstance);
        assertThat(results.stream()
                .map(CreditTransaction.class::cast)
                .map(CreditTransaction::getBalanceBefore)
                .toList())
                .containsExactlyInAnyOrder(100L, 90L, 80L);
        assertThat(ledgerService.getBalance(tenantId).orElseThrow().getBalance()).isEqualTo(70);
        assertThat(transactionRepository.sumAmountsByTenantId(tenantId)).isEqualTo(70L);
        assertThat(ledgerService.verifyIntegrity(tenantId).isConsistent()).isTrue();
    }

    @Test
    void recordFreeOperation_writesZeroAmountEntry() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 5, "pay_1", "top-up");

        CreditTransaction free = ledgerService.recordFreeOperation(tenantId, null, "op-9", "EXACT lookup, no results");

        assertThat(free.getAmount()).isZero();
        assertThat(free.getBalanceBefore()).isEqualTo(5);
        assertThat(free.getBalanceAfter()).isEqualTo(5);
        assertThat(ledgerService.getBalance(tenantId).orElseThrow().getTotalUsed()).isZero();
    }

    @Test
    void credit_nonPurchaseKindsKeepLastPurchaseAt() {
        long tenantId = PostgresTestSupport.newTenantId();

        CreditTransaction promo = ledgerService.credit(tenantId, null, 5, TransactionKind.PROMO, null, "Welcome bonus");

        assertThat(promo.getKind()).isEqualTo(TransactionKind.PROMO);
        CreditAccount account = ledgerService.getBalance(tenantId).orElseThrow();
        assertThat(account.getBalance()).isEqualTo(5);
        assertThat(account.getLastPurchaseAt()).isNull();
        assertThatThrownBy(() -> ledgerService.credit(tenantId, null, 5, TransactionKind.USAGE, null, "no"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getHistory_pagesNewestFirst() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 10, "pay_1", "top-up");
        ledgerService.deduct(tenantId, null, 1, "op-1", "first");
        ledgerService.deduct(tenantId, null, 1, "op-2", "second");

        List<CreditTransaction> firstPage = ledgerService.getHistory(tenantId, 2, 0);
        List<CreditTransaction> secondPage = ledgerService.getHistory(tenantId, 2, 2);

        assertThat(firstPage).extracting(CreditTransaction::getLinkedOperationRef).containsExactly("op-2", "op-1");
        assertThat(secondPage).extracting(CreditTransaction::getLinkedOperationRef).containsExactly("pay_1");
        assertThatThrownBy(() -> ledgerService.getHistory(tenantId, 101, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledgerService.getHistory(tenantId, 10, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void getSummary_flagsLowBalance() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 12, "pay_1", "top-up");
        ledgerService.deduct(tenantId, null, 4, "op-1", "lookup");

        CreditSummary summary = ledgerService.getSummary(tenantId, 10);

        assertThat(summary.getBalance()).isEqualTo(8);
        assertThat(summary.getTotalPurchased()).isEqualTo(12);
        assertThat(summary.getTotalUsed()).isEqualTo(4);
        assertThat(summary.isNeedsLowBalanceAlert()).isTrue();
        assertThat(summary.getRecentTransactions()).hasSize(2);
    }

    @Test
    void verifyIntegrity_reconcilesBalanceAndLog() {
        long tenantId = PostgresTestSupport.newTenantId();
        ledgerService.add(tenantId, null, 20, "pay_1", "top-up");
        ledgerService.deduct(tenantId, null, 3, "op-1", "lookup");
        ledgerService.recordFreeOperation(tenantId, null, "op-2", "free");
        ledgerService.credit(tenantId, null, 2, TransactionKind.REFUND, "op-1", "refund");

        LedgerIntegrityReport report = ledgerService.verifyIntegrity(tenantId);

        assertThat(report.isConsistent()).isTrue();
        assertThat(report.getBalance()).isEqualTo(19);
        assertThat(report.getSumOfAmounts()).isEqualTo(19);
        assertThat(report.getTransactionCount()).isEqualTo(4);
        assertThat(report.getFirstBrokenTransactionId()).isNull();
    }

    private static List<Object> runConcurrently(int callers, Callable<Object> call) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Object>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return call.call();
                }));
            }
            start.countDown();

            List<Object> results = new ArrayList<>();
            for (Future<Object> future : futures) {
                try {
                    results.add(future.get(30, TimeUnit.SECONDS));
                } catch (ExecutionException e) {
                    results.add(e.getCause());
                } catch (TimeoutException e) {
                    throw new AssertionError("Concurrent ledger call did not finish", e);
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }
}
