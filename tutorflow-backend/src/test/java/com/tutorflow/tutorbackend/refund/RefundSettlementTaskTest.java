package com.tutorflow.tutorbackend.refund;

import com.tutorflow.tutorbackend.error.BillingError;
import com.tutorflow.tutorbackend.error.BillingException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.dao.PessimisticLockingFailureException;

import java.util.List;

import static org.mockito.Mockito.*;

public class RefundSettlementTaskTest {

    @Mock private RefundService refundService;

    private RefundSettlementTask task;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        task = new RefundSettlementTask(refundService);
    }

    @Test
    void providerFailureDoesNotStopTheRun() {
        when(refundService.findApprovedRefundIds()).thenReturn(List.of(1L, 2L, 3L));
        when(refundService.process(2L))
                .thenThrow(new BillingException(BillingError.PAYMENT_PROVIDER_FAILURE, "gateway down"));

        task.settleApprovedRefunds();

        verify(refundService).process(1L);
        verify(refundService).process(2L);
        verify(refundService).process(3L);
    }

    @Test
    void unexpectedErrorOnOneRefundDoesNotAbortTheBatch() {
        when(refundService.findApprovedRefundIds()).thenReturn(List.of(1L, 2L, 3L));
        when(refundService.process(1L))
                .thenThrow(new PessimisticLockingFailureException("lock wait timeout"));

        task.settleApprovedRefunds();

        verify(refundService).process(2L);
        verify(refundService).process(3L);
    }

    @Test
    void nothingApprovedMeansNoProviderCalls() {
        when(refundService.findApprovedRefundIds()).thenReturn(List.of());

        task.settleApprovedRefunds();

        verify(refundService, never()).process(anyLong());
    }
}
