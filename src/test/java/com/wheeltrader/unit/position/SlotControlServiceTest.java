package com.wheeltrader.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.exception.BusinessException;
import com.wheeltrader.exception.ResourceNotFoundException;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.position.SlotControlService;
import com.wheeltrader.schedule.ScheduleManager;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SlotControlService operator controls.
 */
class SlotControlServiceTest {

    private PositionBook positionBook;
    private ScheduleManager scheduleManager;
    private DecisionLogger decisionLogger;
    private SlotControlService service;

    @BeforeEach
    void setUp() {
        positionBook = new PositionBook();
        scheduleManager = mock(ScheduleManager.class);
        decisionLogger = mock(DecisionLogger.class);
        service = new SlotControlService(positionBook, scheduleManager, new WheelProperties(), decisionLogger);
    }

    @Nested
    @DisplayName("Pause and resume")
    class PauseResume {

        @Test
        @DisplayName("pause sets PAUSED and logs the change")
        void pause() {
            assertThat(service.pause(2, "earnings")).isEqualTo(SlotControl.PAUSED);

            assertThat(positionBook.getControl(2)).isEqualTo(SlotControl.PAUSED);
            verify(decisionLogger).logSystemEvent(
                    eq(0L), eq(DecisionSource.OPERATOR), eq(2), eq(DecisionType.SLOT_CONTROL_CHANGED),
                    anyString(), anyMap(), eq(DecisionSeverity.INFO));
        }

        @Test
        @DisplayName("pausing an already paused slot changes nothing")
        void pauseTwice() {
            positionBook.setControl(2, SlotControl.PAUSED);

            assertThat(service.pause(2, null)).isEqualTo(SlotControl.PAUSED);
            verifyNoInteractions(decisionLogger);
        }

        @Test
        @DisplayName("halted slot cannot be paused")
        void pauseHalted() {
            positionBook.setControl(1, SlotControl.HALTED);

            assertThatThrownBy(() -> service.pause(1, null))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("HALTED");
        }

        @Test
        @DisplayName("resume clears HALTED with a warning")
        void resumeHalted() {
            positionBook.setControl(1, SlotControl.HALTED);

            assertThat(service.resume(1, "checked broker")).isEqualTo(SlotControl.ACTIVE);

            assertThat(positionBook.haltedCount()).isZero();
            verify(decisionLogger).logSystemEvent(
                    eq(0L), eq(DecisionSource.OPERATOR), eq(1), eq(DecisionType.SLOT_CONTROL_CHANGED),
                    anyString(), anyMap(), eq(DecisionSeverity.WARNING));
        }
    }

    @Nested
    @DisplayName("Close request")
    class CloseRequest {

        @Test
        @DisplayName("slot with a live leg moves to CLOSE_REQUESTED")
        void closeLiveLeg() {
            positionBook.put(WheelPosition.builder()
                    .slotId(3)
                    .contractId("F-P95")
                    .side(OptionSide.PUT)
                    .status(PositionStatus.OPEN)
                    .build());

            assertThat(service.requestClose(3, null)).isEqualTo(SlotControl.CLOSE_REQUESTED);
            assertThat(positionBook.getControl(3)).isEqualTo(SlotControl.CLOSE_REQUESTED);
        }

        @Test
        @DisplayName("slot without a live leg is rejected")
        void closeEmptySlot() {
            assertThatThrownBy(() -> service.requestClose(3, null))
                    .isInstanceOf(BusinessException.class)
                    .hasMessageContaining("no live leg");
        }

        @Test
        @DisplayName("halted slot cannot be closed")
        void closeHalted() {
            positionBook.setControl(3, SlotControl.HALTED);

            assertThatThrownBy(() -> service.requestClose(3, null)).isInstanceOf(BusinessException.class);
        }
    }

    @Nested
    @DisplayName("Slot lookup")
    class SlotLookup {

        @Test
        @DisplayName("slot outside the configured count is not found before the window exists")
        void unknownBeforeWindow() {
            assertThatThrownBy(() -> service.pause(5, null)).isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> service.getControl(-1)).isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("slot ids are checked against the window once initialized")
        void checkedAgainstWindow() {
            when(scheduleManager.isInitialized()).thenReturn(true);
            when(scheduleManager.getWindow()).thenReturn(ScheduleWindow.create(LocalDate.of(2026, 10, 30), 3));

            assertThat(service.getControl(2)).isEqualTo(SlotControl.ACTIVE);
            assertThatThrownBy(() -> service.getControl(3)).isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
