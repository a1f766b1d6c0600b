package com.dcaswap.dca.schedule;

import com.dcaswap.domain.AppRef;
import com.dcaswap.domain.PkpInfo;
import com.dcaswap.domain.Schedule;
import com.dcaswap.domain.ScheduleEdit;
import com.dcaswap.domain.ScheduleRepository;
import com.dcaswap.domain.TokenRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final TokenRef USDC = new TokenRef("0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913", 6, "USDC");
    private static final TokenRef AERO = new TokenRef("0x940181a94A35A4569E4529A3CDfB74e38FD98631", 18, "AERO");

    @Mock
    ScheduleRepository scheduleRepository;

    ScheduleService scheduleService;

    @BeforeEach
    void setUp() {
        scheduleService = new ScheduleService(scheduleRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("new schedule is enabled and due immediately, with the default name")
    void create_dueNow() {
        when(scheduleRepository.insert(any(Schedule.class))).thenAnswer(inv -> {
            Schedule s = inv.getArgument(0);
            s.setId("665f00000000000000000001");
            return s;
        });

        Schedule created = scheduleService.create(request(USDC, AERO, " 1 day "));

        assertThat(created.getId()).isEqualTo("665f00000000000000000001");
        assertThat(created.getName()).isEqualTo("DCASwap");
        assertThat(created.isDisabled()).isFalse();
        assertThat(created.getNextRunAt()).isEqualTo(NOW);
        assertThat(created.getCreatedAt()).isEqualTo(NOW);
        assertThat(created.getPurchaseIntervalHuman()).isEqualTo("1 day");
        assertThat(created.getPurchaseAmount()).isEqualByComparingTo("25");
    }

    @Test
    void create_sameTokenDifferentCase_rejected() {
        TokenRef usdcLower = new TokenRef(USDC.address().toLowerCase(), 6, "USDC");

        assertThatThrownBy(() -> scheduleService.create(request(USDC, usdcLower, "1 day")))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.SAME_TOKEN);
        verify(scheduleRepository, never()).insert(any(Schedule.class));
    }

    @Test
    void create_unparsableInterval_rejected() {
        assertThatThrownBy(() -> scheduleService.create(request(USDC, AERO, "every now and then")))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.INVALID_INTERVAL);
    }

    @Test
    void delete_unknown_notFound() {
        when(scheduleRepository.existsById("665f00000000000000000001")).thenReturn(false);

        assertThatThrownBy(() -> scheduleService.delete("665f00000000000000000001"))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.SCHEDULE_NOT_FOUND);
        verify(scheduleRepository, never()).deleteById(any());
    }

    @Test
    void disable_updatesFlag() {
        Schedule stored = new Schedule();
        stored.setId("665f00000000000000000001");
        stored.setDisabled(true);
        when(scheduleRepository.setDisabled("665f00000000000000000001", true, NOW)).thenReturn(true);
        when(scheduleRepository.findById("665f00000000000000000001")).thenReturn(Optional.of(stored));

        assertThat(scheduleService.disable("665f00000000000000000001").isDisabled()).isTrue();
    }

    @Test
    void enable_unknown_notFound() {
        when(scheduleRepository.setDisabled("665f00000000000000000001", false, NOW)).thenReturn(false);

        assertThatThrownBy(() -> scheduleService.enable("665f00000000000000000001"))
                .isInstanceOf(ScheduleServiceException.class);
    }

    @Test
    @DisplayName("update writes normalized editable fields and returns the stored schedule")
    void update_appliesEdit() {
        Schedule stored = new Schedule();
        stored.setId("665f00000000000000000001");
        when(scheduleRepository.applyEdit(eq("665f00000000000000000001"), any(ScheduleEdit.class), eq(NOW))).thenReturn(true);
        when(scheduleRepository.findById("665f00000000000000000001")).thenReturn(Optional.of(stored));

        Schedule updated = scheduleService.update("665f00000000000000000001",
                new ScheduleEdit("  ", new BigDecimal("40"), " 2 weeks ", USDC, AERO));

        ArgumentCaptor<ScheduleEdit> captor = ArgumentCaptor.forClass(ScheduleEdit.class);
        verify(scheduleRepository).applyEdit(eq("665f00000000000000000001"), captor.capture(), eq(NOW));
        assertThat(captor.getValue().name()).isEqualTo("DCASwap");
        assertThat(captor.getValue().purchaseIntervalHuman()).isEqualTo("2 weeks");
        assertThat(captor.getValue().purchaseAmount()).isEqualByComparingTo("40");
        assertThat(updated).isSameAs(stored);
    }

    @Test
    void update_unknown_notFound() {
        when(scheduleRepository.applyEdit(eq("665f00000000000000000009"), any(ScheduleEdit.class), eq(NOW))).thenReturn(false);

        assertThatThrownBy(() -> scheduleService.update("665f00000000000000000009",
                new ScheduleEdit(null, BigDecimal.TEN, "1 day", USDC, AERO)))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.SCHEDULE_NOT_FOUND);
    }

    @Test
    void update_sameTokenOrOversizedInterval_rejectedBeforeWrite() {
        assertThatThrownBy(() -> scheduleService.update("665f00000000000000000001",
                new ScheduleEdit(null, BigDecimal.TEN, "1 day", AERO, AERO)))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.SAME_TOKEN);
        assertThatThrownBy(() -> scheduleService.update("665f00000000000000000001",
                new ScheduleEdit(null, BigDecimal.TEN, "999999999999999 months", USDC, AERO)))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.INVALID_INTERVAL);
        verify(scheduleRepository, never()).applyEdit(any(), any(), any());
    }

    @Test
    void create_oversizedInterval_rejected() {
        assertThatThrownBy(() -> scheduleService.create(request(USDC, AERO, "99999999999 weeks")))
                .isInstanceOf(ScheduleServiceException.class)
                .extracting(e -> ((ScheduleServiceException) e).getErrorCode())
                .isEqualTo(ScheduleServiceException.INVALID_INTERVAL);
        verify(scheduleRepository, never()).insert(any(Schedule.class));
    }

    private static NewSchedule request(TokenRef tokenIn, TokenRef tokenOut, String interval) {
        return new NewSchedule(null, new AppRef(42L, 1),
                new PkpInfo("0x1111111111111111111111111111111111111111", "0xpub", "1"),
                new BigDecimal("25"), interval, tokenIn, tokenOut);
    }
}
