package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.RewardLedgerEntry;
import com.practiceacademy.tournament.repository.RewardLedgerEntryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Insert-or-read on the reward ledger keyed by idempotency key.
 * <p>
 * The insert runs in its own transaction so a unique-key violation does not poison the caller's transaction; the
 * winning row is then read back.
 */
@Service
public class IdempotentLedgerWriter {

    private static final Logger log = LoggerFactory.getLogger(IdempotentLedgerWriter.class);

    private final RewardLedgerEntryRepository rewardLedgerEntryRepository;
    private final TransactionTemplate requiresNewTransaction;

    public IdempotentLedgerWriter(
            RewardLedgerEntryRepository rewardLedgerEntryRepository,
            PlatformTransactionManager transactionManager
    ) {
        this.rewardLedgerEntryRepository = rewardLedgerEntryRepository;
        this.requiresNewTransaction = new TransactionTemplate(transactionManager);
        this.requiresNewTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public WriteResult insertOrRead(RewardLedgerEntry entry) {
        try {
            RewardLedgerEntry saved = requiresNewTransaction.execute(status -> rewardLedgerEntryRepository.saveAndFlush(entry));
            return new WriteResult(saved, true);
        } catch (DataIntegrityViolationException ex) {
            RewardLedgerEntry existing = rewardLedgerEntryRepository.findByIdempotencyKey(entry.getIdempotencyKey())
                    .orElseThrow(() -> new IllegalStateException(
                            "Ledger insert for " + entry.getIdempotencyKey() + " failed but no existing row was found",
                            ex
                    ));
            log.debug("Ledger entry {} already exists, reusing {}", entry.getIdempotencyKey(), existing.getEntryId());
            return new WriteResult(existing, false);
        }
    }

    public record WriteResult(
            RewardLedgerEntry entry,
            boolean created
    ) {
    }
}
