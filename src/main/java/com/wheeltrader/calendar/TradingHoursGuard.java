package com.wheeltrader.calendar;

import com.wheeltrader.exception.MarketClosedException;
import java.lang.reflect.Method;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Enforces {@link TradingHoursOnly}: calls made outside the regular session are refused
 * with {@link MarketClosedException} before they reach the broker.
 */
@Aspect
@Component
public class TradingHoursGuard {

    private static final Logger log = LoggerFactory.getLogger(TradingHoursGuard.class);

    private final TradingCalendarService tradingCalendarService;

    public TradingHoursGuard(TradingCalendarService tradingCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
    }

    @Around("@annotation(com.wheeltrader.calendar.TradingHoursOnly)")
    public Object guardTradingHours(ProceedingJoinPoint joinPoint) throws Throwable {
        if (tradingCalendarService.isMarketOpen()) {
            return joinPoint.proceed();
        }

        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();
        TradingHoursOnly annotation = method.getAnnotation(TradingHoursOnly.class);
        String message = String.format(
                "%s (current phase: %s)", annotation.message(), tradingCalendarService.getCurrentPhase());

        log.warn("Method {} blocked by @TradingHoursOnly: {}", method.getName(), message);
        throw new MarketClosedException(message);
    }
}
