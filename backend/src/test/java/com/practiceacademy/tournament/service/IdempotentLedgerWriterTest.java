package com.practiceacademy.tournament.service;

import com.practiceacademy.tournament.model.RewardKind;
import com.practiceacademy.tournament.model.RewardLedgerEntry;
import com.practiceacademy.tournament.repository.RewardLedgerEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IdempotentLedgerWriterTest {

    private static final String KEY = "reward:00000000-0000-0000-0000-00000000a001:00000000-0000-0000-0000-000000000001:CREDIT:placement";

    @Mock
    private RewardLedgerEntryRepository rewardLedgerEntryRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private IdempotentLedgerWriter writer;

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        writer = new IdempotentLedgerWriter(rewardLedgerEntryRepository, transactionManager);
    }

    @Test
    void insertsInItsOwnTransaction() {
        RewardLedgerEntry entry = entry();
        when(rewardLedgerEntryRepository.saveAndFlush(entry)).thenReturn(entry);

        IdempotentLedgerWriter.WriteResult result = writer.insertOrRead(entry);

        assertTrue(result.created());
        assertSame(entry, result.entry());
        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
    }

    @Test
    void duplicateKeyReturnsStoredEntry() {
        RewardLedgerEntry attempted = entry();
        RewardLedgerEntry stored = entry();
        when(rewardLedgerEntryRepository.saveAndFlush(attempted))
                .thenThrow(new DataIntegrityViolationException("uk_reward_ledger_entries_idempotency_key"));
        when(rewardLedgerEntryRepository.findByIdempotencyKey(KEY)).thenReturn(Optional.of(stored));

        IdempotentLedgerWriter.WriteResult result = writer.insertOrRead(attempted);

        assertFalse(result.created());
        assertSame(stored, result.entry());
        verify(transactionManager).rollback(any());
    }

    @Test
    void violationWithoutStoredRowIsReported() {
        RewardLedgerEntry attempted = entry();
        when(rewardLedgerEntryRepository.saveAndFlush(attempted))
                .thenThrow(new DataIntegrityViolationException("ck_reward_ledger_entries_kind"));
        when(rewardLedgerEntryRepository.findByIdempotencyKey(KEY)).thenReturn(Optional.empty());

        IllegalStateException ex = assertThrows(IllegalStateException.class, () -> writer.insertOrRead(attempted));

        assertEquals(DataIntegrityViolationException.class, ex.getCause().getClass());
    }

    private static RewardLedgerEntry entry() {
        RewardLedgerEntry entry = new RewardLedgerEntry();
        entry.setEntryId(UUID.randomUUID());
        entry.setTournamentId(TournamentFixtures.HEAD_TO_HEAD_TOURNAMENT_ID);
        entry.setParticipantId(TournamentFixtures.participant(1));
        entry.setRewardKind(RewardKind.CREDIT);
        entry.setReason("placement");
        entry.setIdempotencyKey(KEY);
        entry.setAmount(BigDecimal.valueOf(100));
        return entry;
    }
}
