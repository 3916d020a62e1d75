package com.govsandbox.ledger;

import com.govsandbox.common.ErrorKind;
import com.govsandbox.common.SandboxException;
import com.govsandbox.domain.AccountSnapshot;
import com.govsandbox.domain.Transaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Virtual accounts and their histories. {@link #applyTransfer} is the only balance mutator.
 * <p>
 * Locking: every operation touching an account holds that account's lock; two-account operations lock both in
 * ascending id order. Mutators also hold the shared side of a store-wide read/write lock so that
 * {@link #snapshotAll()} (exclusive side) never sees a transfer half-applied. All locks are reentrant, so callers
 * may wrap several store calls plus their own work in {@link #withAccountsLocked}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerStore {

    public static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private final Clock clock;
    private final Map<String, Account> accounts = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock storeLock = new ReentrantReadWriteLock();

    /**
     * @throws SandboxException DUPLICATE_ACCOUNT, INVALID_INPUT, or INVALID_AMOUNT for a negative balance
     */
    public AccountSnapshot createAccount(String accountId, BigDecimal initialBalance, String currency) {
        validateNewAccount(accountId, initialBalance, currency);
        return withAccountLocked(accountId, () -> {
            Account account = new Account(accountId, initialBalance, currency, clock.millis());
            if (accounts.putIfAbsent(accountId, account) != null) {
                throw new SandboxException(ErrorKind.DUPLICATE_ACCOUNT, "Account already exists: " + accountId);
            }
            log.debug("Account {} created with {} {}", accountId, initialBalance.toPlainString(), currency);
            return account.snapshot();
        });
    }

    /**
     * Runs every check {@link #createAccount} would, without creating anything.
     */
    public void validateNewAccount(String accountId, BigDecimal initialBalance, String currency) {
        if (accountId == null || accountId.isBlank()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Account id must not be blank");
        }
        if (initialBalance == null || initialBalance.signum() < 0) {
            throw new SandboxException(ErrorKind.INVALID_AMOUNT, "Initial balance must be non-negative, got: " + initialBalance);
        }
        if (currency == null || !CURRENCY_CODE.matcher(currency).matches()) {
            throw new SandboxException(ErrorKind.INVALID_INPUT, "Currency must be a 3-letter code, got: " + currency);
        }
        if (accounts.containsKey(accountId)) {
            throw new SandboxException(ErrorKind.DUPLICATE_ACCOUNT, "Account already exists: " + accountId);
        }
    }

    /**
     * @throws SandboxException ACCOUNT_NOT_FOUND
     */
    public AccountSnapshot getAccount(String accountId) {
        return findAccount(accountId)
                .orElseThrow(() -> new SandboxException(ErrorKind.ACCOUNT_NOT_FOUND, "Account not found: " + accountId));
    }

    public Optional<AccountSnapshot> findAccount(String accountId) {
        if (accountId == null || !accounts.containsKey(accountId)) {
            return Optional.empty();
        }
        return withAccountLocked(accountId, () -> Optional.ofNullable(accounts.get(accountId)).map(Account::snapshot));
    }

    /**
     * Checks a transfer against current balances and returns the balances it would produce. Mutates nothing.
     *
     * @throws SandboxException INVALID_AMOUNT when {@code amount <= 0}
     */
    public TransferProjection projectTransfer(String sourceId, String destinationId, BigDecimal amount, String currency) {
        requirePositive(amount);
        return withAccountsLocked(sourceId, destinationId, () -> {
            Account source = accounts.get(sourceId);
            Account destination = accounts.get(destinationId);
            ErrorKind rejection = checkTransfer(source, destination, amount, currency);
            if (rejection != null) {
                return TransferProjection.rejected(rejection);
            }
            return TransferProjection.accepted(source.balance().subtract(amount), destination.balance().add(amount));
        });
    }

    /**
     * Debits source and credits destination as one step and appends the transaction id to both histories.
     *
     * @throws SandboxException INVALID_AMOUNT, ACCOUNT_NOT_FOUND, CURRENCY_MISMATCH, INSUFFICIENT_FUNDS
     */
    public TransferResult applyTransfer(Transaction transaction) {
        requirePositive(transaction.getAmount());
        String sourceId = transaction.getSourceAccountId();
        String destinationId = transaction.getDestinationAccountId();
        return withAccountsLocked(sourceId, destinationId, () -> {
            Account source = accounts.get(sourceId);
            Account destination = accounts.get(destinationId);
            ErrorKind rejection = checkTransfer(source, destination, transaction.getAmount(), transaction.getCurrency());
            if (rejection != null) {
                throw new SandboxException(rejection, "Transfer " + transaction.getTransactionId() + " rejected: " + rejection);
            }
            source.debit(transaction.getAmount(), transaction.getTransactionId());
            destination.credit(transaction.getAmount(), transaction.getTransactionId());
            log.info("Transfer {} applied: {} {} {} -> {}", transaction.getTransactionId(),
                    transaction.getAmount().toPlainString(), transaction.getCurrency(), sourceId, destinationId);
            return new TransferResult(source.snapshot(), destination.snapshot());
        });
    }

    public <T> T withAccountLocked(String accountId, Supplier<T> work) {
        storeLock.readLock().lock();
        ReentrantLock lock = lockFor(accountId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
            storeLock.readLock().unlock();
        }
    }

    /**
     * Runs {@code work} holding both account locks (ascending id order) and the shared store lock.
     */
    public <T> T withAccountsLocked(String firstId, String secondId, Supplier<T> work) {
        if (firstId.equals(secondId)) {
            return withAccountLocked(firstId, work);
        }
        boolean ordered = firstId.compareTo(secondId) < 0;
        ReentrantLock lower = lockFor(ordered ? firstId : secondId);
        ReentrantLock upper = lockFor(ordered ? secondId : firstId);
        storeLock.readLock().lock();
        lower.lock();
        try {
            upper.lock();
            try {
                return work.get();
            } finally {
                upper.unlock();
            }
        } finally {
            lower.unlock();
            storeLock.readLock().unlock();
        }
    }

    /** Consistent point-in-time view of every account, ordered by id. */
    public List<AccountSnapshot> snapshotAll() {
        storeLock.writeLock().lock();
        try {
            return accounts.values().stream()
                    .map(Account::snapshot)
                    .sorted(Comparator.comparing(AccountSnapshot::accountId))
                    .toList();
        } finally {
            storeLock.writeLock().unlock();
        }
    }

    public BigDecimal totalBalance(String currency) {
        return snapshotAll().stream()
                .filter(a -> a.currency().equals(currency))
                .map(AccountSnapshot::balance)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public int accountCount() {
        return accounts.size();
    }

    private static ErrorKind checkTransfer(Account source, Account destination, BigDecimal amount, String currency) {
        if (source == null || destination == null) {
            return ErrorKind.ACCOUNT_NOT_FOUND;
        }
        if (!source.currency().equals(currency) || !destination.currency().equals(currency)) {
            return ErrorKind.CURRENCY_MISMATCH;
        }
        if (source.balance().compareTo(amount) < 0) {
            return ErrorKind.INSUFFICIENT_FUNDS;
        }
        return null;
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new SandboxException(ErrorKind.INVALID_AMOUNT, "Transfer amount must be positive, got: " + amount);
        }
    }

    private ReentrantLock lockFor(String accountId) {
        return accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock());
    }
}
