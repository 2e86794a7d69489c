package com.wheeltrader.oms;

import com.wheeltrader.domain.enums.IntentPurpose;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Generates order intent ids, which double as the broker correlation id.
 *
 * <p>Format: {@code {yyMMdd}W{slot}{purpose_3}{seq_4}}, e.g. {@code 261016W2RCL0007} is the
 * seventh intent of the day, the closing half of a roll in slot 2. The sequence resets daily,
 * so ids stay unique across restarts within the broker's order history.
 */
@Component
public class IntentIdGenerator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyMMdd");
    private static final int MAX_SEQUENCE = 10000;

    static final Map<IntentPurpose, String> PURPOSE_CODES = Map.of(
            IntentPurpose.OPEN, "OPN",
            IntentPurpose.CLOSE, "CLS",
            IntentPurpose.ROLL_CLOSE, "RCL",
            IntentPurpose.ROLL_OPEN, "ROP");

    private final Clock clock;
    private final AtomicInteger sequence = new AtomicInteger(0);
    private final AtomicReference<LocalDate> sequenceDate = new AtomicReference<>();

    public IntentIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(int slotId, IntentPurpose purpose) {
        LocalDate today = LocalDate.now(clock);
        LocalDate previous = sequenceDate.getAndSet(today);
        if (!today.equals(previous)) {
            sequence.set(0);
        }
        int seq = sequence.incrementAndGet() % MAX_SEQUENCE;
        return String.format("%sW%d%s%04d", DAY.format(today), slotId, PURPOSE_CODES.get(purpose), seq);
    }
}
