package in.matchbot.application.service;

import in.matchbot.application.port.output.BotMetrics;
import in.matchbot.application.port.output.DeliveryException;
import in.matchbot.application.port.output.MessageSender;
import in.matchbot.application.port.output.ProfileRepository;
import in.matchbot.application.port.output.StorageException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BroadcastServiceTest {

    @Mock
    private ProfileRepository profiles;
    @Mock
    private MessageSender sender;
    @Mock
    private BotMetrics metrics;

    private BroadcastService service;

    @BeforeEach
    void setUp() {
        service = new BroadcastService(profiles, sender, metrics);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void run_countsFailedDeliveriesAndReportsToAdmin() {
        when(profiles.listActiveUserIds()).thenReturn(List.of(1L, 2L, 3L));
        doNothing().when(sender).send(any());
        doThrow(new DeliveryException(2L, "chat not found"))
            .when(sender).send(argThat(m -> m != null && m.userId() == 2L));

        BroadcastService.Report report = service.run(900L, "hello");

        assertEquals(2, report.delivered());
        assertEquals(3, report.total());
        verify(sender).send(argThat(m -> m.userId() == 1L && "hello".equals(m.text())));
        verify(sender).send(argThat(m -> m.userId() == 3L && "hello".equals(m.text())));
        verify(sender).send(argThat(m -> m.userId() == 900L
            && Messages.broadcastReport(2, 3).equals(m.text())));
        verify(metrics).recordBroadcast(2, 3);
    }

    @Test
    void run_emptyAudienceStillReports() {
        when(profiles.listActiveUserIds()).thenReturn(List.of());

        BroadcastService.Report report = service.run(900L, "hello");

        assertEquals(0, report.total());
        verify(sender).send(argThat(m -> m.userId() == 900L));
    }

    @Test
    void submit_runsOffTheCallerThread() throws Exception {
        when(profiles.listActiveUserIds()).thenReturn(List.of(1L));

        BroadcastService.Report report = service.submit(900L, "hi").get(5, TimeUnit.SECONDS);

        assertEquals(1, report.delivered());
        verify(sender, times(2)).send(any());
    }

    @Test
    void submit_storageFailureIsReportedToAdmin() {
        when(profiles.listActiveUserIds())
            .thenThrow(new StorageException("listActiveUserIds", "connection refused", null));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> service.submit(900L, "hi").get(5, TimeUnit.SECONDS));

        assertInstanceOf(StorageException.class, e.getCause());
        verify(metrics).recordStorageError("listActiveUserIds");
        verify(metrics, never()).recordBroadcast(anyInt(), anyInt());
        verify(sender).send(argThat(m -> m.userId() == 900L && Messages.BROADCAST_FAILED.equals(m.text())));
        verifyNoMoreInteractions(sender);
    }
}
