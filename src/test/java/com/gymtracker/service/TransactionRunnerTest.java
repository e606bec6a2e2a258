package com.gymtracker.service;

import com.gymtracker.exception.DateConflictException;
import com.gymtracker.exception.UpstreamFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionSystemException;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransactionRunnerTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private TransactionRunner runner;

    @BeforeEach
    void setUp() {
        runner = new TransactionRunner(transactionManager);
    }

    @Test
    void shouldCommitAndReturnResult() {
        assertThat(runner.call("create", () -> 15L)).isEqualTo(15L);

        verify(transactionManager).commit(any());
        verify(transactionManager, never()).rollback(any());
    }

    @Test
    void shouldOpenReadOnlyTransactionForReads() {
        runner.read("fetchWorkouts", () -> "ok");

        ArgumentCaptor<TransactionDefinition> definition = ArgumentCaptor.forClass(TransactionDefinition.class);
        verify(transactionManager).getTransaction(definition.capture());
        assertThat(definition.getValue().isReadOnly()).isTrue();
    }

    @Test
    void shouldConvertFailureToOpenTransaction() {
        when(transactionManager.getTransaction(any()))
                .thenThrow(new CannotCreateTransactionException("connection refused"));

        assertThatThrownBy(() -> runner.run("markCompleted", () -> { }))
                .isInstanceOf(UpstreamFailureException.class)
                .hasFieldOrPropertyWithValue("code", 503)
                .hasCauseInstanceOf(CannotCreateTransactionException.class);
    }

    @Test
    void shouldConvertCommitFailure() {
        doThrow(new TransactionSystemException("commit failed")).when(transactionManager).commit(any());

        assertThatThrownBy(() -> runner.call("create", () -> 15L))
                .isInstanceOf(UpstreamFailureException.class)
                .hasCauseInstanceOf(TransactionSystemException.class);
    }

    @Test
    void shouldRollBackAndKeepBusinessException() {
        LocalDate date = LocalDate.of(2024, 1, 5);

        assertThatThrownBy(() -> runner.run("reschedule", () -> {
            throw new DateConflictException(date);
        })).isInstanceOf(DateConflictException.class);

        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }
}
