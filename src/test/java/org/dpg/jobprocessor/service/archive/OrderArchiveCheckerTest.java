package org.dpg.jobprocessor.service.archive;

import org.dpg.jobprocessor.model.JobStatus;
import org.dpg.jobprocessor.model.Order;
import org.dpg.jobprocessor.model.UnitStatus;
import org.dpg.jobprocessor.repository.OrderRepository;
import org.dpg.jobprocessor.repository.UnitRepository;
import org.dpg.jobprocessor.service.job.JobStatusService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OrderArchiveCheckerTest {

    @Mock
    private UnitRepository unitRepository;
    @Mock
    private OrderRepository orderRepository;
    @Mock
    private JobStatusService jobStatusService;

    @InjectMocks
    private OrderArchiveChecker checker;

    private final JobStatus job = new JobStatus();

    @Test
    void lastArchivedUnitStampsOrder() {
        // given
        final Order order = new Order();
        order.setId(9L);
        when(unitRepository.countNotArchived(9L, UnitStatus.CANCELED)).thenReturn(0L);
        when(orderRepository.findById(9L)).thenReturn(Optional.of(order));

        // when
        final boolean complete = checker.checkOrderArchiveComplete(job, 9L);

        // then
        assertThat(complete).isTrue();
        assertThat(order.getDateArchivingComplete()).isNotNull();
        verify(orderRepository).save(order);
        verify(jobStatusService).logInfo(job, "All units in order 9 are archived.");
    }

    @Test
    void remainingUnitsLeaveOrderAlone() {
        // given
        when(unitRepository.countNotArchived(9L, UnitStatus.CANCELED)).thenReturn(2L);

        // when
        final boolean complete = checker.checkOrderArchiveComplete(job, 9L);

        // then
        assertThat(complete).isFalse();
        verify(orderRepository, never()).findById(anyLong());
    }

    @Test
    void countFailureIsLoggedAsJobError() {
        // given
        when(unitRepository.countNotArchived(anyLong(), any())).thenThrow(new IllegalStateException("timeout"));

        // when
        final boolean complete = checker.checkOrderArchiveComplete(job, 9L);

        // then
        assertThat(complete).isFalse();
        verify(jobStatusService).logError(eq(job),
                                          startsWith("Unable to determine if all units archived"));
    }
}
