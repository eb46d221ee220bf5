package gov.pmis.budget_ledger.transaction;

import gov.pmis.budget_ledger.exception.AlreadyProcessedException;
import gov.pmis.budget_ledger.exception.InsufficientBudgetException;
import gov.pmis.budget_ledger.ledger.AmendBudgetCommand;
import gov.pmis.budget_ledger.ledger.BudgetLine;
import gov.pmis.budget_ledger.ledger.BudgetUtilization;
import gov.pmis.budget_ledger.support.LedgerFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static gov.pmis.budget_ledger.support.LedgerFixture.CONTROLLER;
import static gov.pmis.budget_ledger.support.LedgerFixture.amount;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger: concurrent over-subscription, racing approvals and a
 * long randomized sequence checked against an independent model.
 */
class LedgerConcurrencyTest {

    private LedgerFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new LedgerFixture();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Ten concurrent 100.00 debits against 999.00 yield exactly nine")
    void concurrentRecordsNeverOversubscribe() throws Exception {
        printTestHeader("Concurrent over-subscription");

        BudgetLine line = fixture.allocate("999.00");
        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        List<Throwable> unexpected = new ArrayList<>();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    fixture.record(line.getId(), TransactionType.EXPENSE, "100.00");
                    succeeded.incrementAndGet();
                } catch (InsufficientBudgetException e) {
                    insufficient.incrementAndGet();
                } catch (Throwable t) {
                    synchronized (unexpected) {
                        unexpected.add(t);
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS), "All threads should finish");
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Insufficient", insufficient.get());
        assertTrue(unexpected.isEmpty(), "Unexpected failures: " + unexpected);
        assertEquals(9, succeeded.get());
        assertEquals(1, insufficient.get());

        BudgetUtilization utilization = fixture.ledgerService.getUtilization(line.getId());
        assertEquals(amount("900.00"), utilization.getCommitted());
        assertEquals(amount("99.00"), utilization.getAvailable());
        printSuccess("floor(999 / 100) = 9 debits recorded");
    }

    @Test
    @DisplayName("Racing approvals never push spent above the allocation")
    void concurrentApprovalsRespectAllocation() throws Exception {
        BudgetLine line = fixture.allocate("1000");
        List<UUID> pending = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            pending.add(fixture.record(line.getId(), TransactionType.EXPENSE, "100").getId());
        }
        // shrinking the line leaves room for only four of the ten approvals
        fixture.ledgerService.amend(line.getId(), AmendBudgetCommand.of(amount("400")));

        ExecutorService executor = Executors.newFixedThreadPool(pending.size());
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(pending.size());
        AtomicInteger approved = new AtomicInteger();
        AtomicInteger refused = new AtomicInteger();

        for (UUID transactionId : pending) {
            executor.submit(() -> {
                try {
                    start.await();
                    fixture.processor.decide(transactionId, TransactionDecision.APPROVED, CONTROLLER, null);
                    approved.incrementAndGet();
                } catch (InsufficientBudgetException e) {
                    refused.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(4, approved.get());
        assertEquals(6, refused.get());
        assertEquals(amount("400.00"), fixture.ledgerService.getUtilization(line.getId()).getSpent());
    }

    @Test
    @DisplayName("1,000 random operations keep available = allocated - spent - committed")
    void randomizedSequenceMatchesModel() {
        printTestHeader("Randomized ledger sequence");

        Random random = new Random(20260615L);
        BudgetLine line = fixture.allocate("5000");
        BigDecimal allocated = line.getAllocatedAmount();

        List<ModelTransaction> model = new ArrayList<>();
        int recorded = 0;
        int refusedRecords = 0;
        int refusedApprovals = 0;

        for (int step = 0; step < 1000; step++) {
            int op = random.nextInt(10);
            if (op < 5) {
                TransactionType type = TransactionType.values()[random.nextInt(TransactionType.values().length)];
                BigDecimal value = BigDecimal.valueOf(1 + random.nextInt(40000), 2);
                boolean fits = !type.isDebit() || value.compareTo(available(model, allocated)) <= 0;
                try {
                    BudgetTransaction tx = fixture.record(line.getId(), type, value.toPlainString());
                    assertTrue(fits, "Debit beyond available was accepted at step " + step);
                    model.add(new ModelTransaction(tx.getId(), type, value));
                    recorded++;
                } catch (InsufficientBudgetException e) {
                    assertFalse(fits, "Debit within available was refused at step " + step);
                    refusedRecords++;
                }
            } else if (op < 9) {
                List<ModelTransaction> open = model.stream().filter(tx -> tx.status == TransactionStatus.PENDING).toList();
                if (open.isEmpty()) {
                    continue;
                }
                ModelTransaction target = open.get(random.nextInt(open.size()));
                boolean approve = random.nextInt(4) != 0;
                if (approve) {
                    boolean fits = !target.type.isDebit()
                        || spent(model).add(target.amount).compareTo(allocated) <= 0;
                    try {
                        fixture.processor.decide(target.id, TransactionDecision.APPROVED, CONTROLLER, null);
                        assertTrue(fits, "Overspending approval was accepted at step " + step);
                        target.status = TransactionStatus.APPROVED;
                    } catch (InsufficientBudgetException e) {
                        assertFalse(fits, "Approval within allocation was refused at step " + step);
                        refusedApprovals++;
                    }
                } else {
                    fixture.processor.decide(target.id, TransactionDecision.REJECTED, CONTROLLER, "random");
                    target.status = TransactionStatus.REJECTED;
                }
            } else {
                BigDecimal floor = spent(model);
                BigDecimal next = floor.add(BigDecimal.valueOf(random.nextInt(300000), 2));
                fixture.ledgerService.amend(line.getId(), AmendBudgetCommand.of(next));
                allocated = next.setScale(2);
            }

            BudgetUtilization utilization = fixture.ledgerService.getUtilization(line.getId());
            assertEquals(0, spent(model).compareTo(utilization.getSpent()), "spent at step " + step);
            assertEquals(0, committed(model).compareTo(utilization.getCommitted()), "committed at step " + step);
            assertEquals(0, available(model, allocated).compareTo(utilization.getAvailable()), "available at step " + step);
            assertTrue(utilization.getSpent().compareTo(utilization.getAllocated()) <= 0, "spent > allocated at step " + step);
        }

        printOutput("Recorded", recorded);
        printOutput("Refused records", refusedRecords);
        printOutput("Refused approvals", refusedApprovals);
        printSuccess("Ledger matched the model for 1,000 steps");
    }

    @Test
    @DisplayName("A transaction can be decided only once even when decisions race")
    void racingDecisionsDecideOnce() throws Exception {
        BudgetLine line = fixture.allocate("1000");
        UUID transactionId = fixture.record(line.getId(), TransactionType.EXPENSE, "100").getId();

        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(8);
        AtomicInteger decided = new AtomicInteger();
        AtomicInteger alreadyProcessed = new AtomicInteger();

        for (int i = 0; i < 8; i++) {
            TransactionDecision decision = i % 2 == 0 ? TransactionDecision.APPROVED : TransactionDecision.REJECTED;
            executor.submit(() -> {
                try {
                    start.await();
                    fixture.processor.decide(transactionId, decision, CONTROLLER, "race");
                    decided.incrementAndGet();
                } catch (AlreadyProcessedException e) {
                    alreadyProcessed.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(1, decided.get());
        assertEquals(7, alreadyProcessed.get());
    }

    private static BigDecimal spent(List<ModelTransaction> model) {
        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        for (ModelTransaction tx : model) {
            if (tx.status == TransactionStatus.APPROVED) {
                if (tx.type.isDebit()) {
                    debits = debits.add(tx.amount);
                } else {
                    credits = credits.add(tx.amount);
                }
            }
        }
        return debits.subtract(credits).max(BigDecimal.ZERO);
    }

    private static BigDecimal committed(List<ModelTransaction> model) {
        return model.stream()
            .filter(tx -> tx.status == TransactionStatus.PENDING && tx.type.isDebit())
            .map(tx -> tx.amount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal available(List<ModelTransaction> model, BigDecimal allocated) {
        return allocated.subtract(spent(model)).subtract(committed(model));
    }

    private static final class ModelTransaction {
        final UUID id;
        final TransactionType type;
        final BigDecimal amount;
        TransactionStatus status = TransactionStatus.PENDING;

        ModelTransaction(UUID id, TransactionType type, BigDecimal amount) {
            this.id = id;
            this.type = type;
            this.amount = amount;
        }
    }
}
