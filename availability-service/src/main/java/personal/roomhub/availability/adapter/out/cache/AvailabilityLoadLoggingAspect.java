package personal.roomhub.availability.adapter.out.cache;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Availability Load Logging Aspect
 *
 * 가용성 조회의 전체 실행 시간 측정 (캐시 HIT이면 수 ms, MISS이면 캘린더 조회 포함)
 */
@Slf4j
@Aspect
@Component
public class AvailabilityLoadLoggingAspect {

    @Around("execution(* personal.roomhub.availability.application.port.in.GetAvailabilityUseCase.getAvailability(..))")
    public Object logAvailabilityLoad(ProceedingJoinPoint joinPoint) throws Throwable {
        long startTime = System.nanoTime();
        String methodName = joinPoint.getSignature().toShortString();
        Object[] args = joinPoint.getArgs();
        Object date = args.length > 0 ? args[0] : null;

        log.debug("Availability load started: method={}, date={}", methodName, date);

        try {
            Object result = joinPoint.proceed();
            long totalTimeMs = (System.nanoTime() - startTime) / 1_000_000;

            log.info("Availability load completed: method={}, date={}, totalTime={}ms",
                    methodName, date, totalTimeMs);
            return result;
        } catch (Throwable e) {
            long totalTimeMs = (System.nanoTime() - startTime) / 1_000_000;
            log.error("Availability load failed: method={}, date={}, totalTime={}ms, error={}",
                    methodName, date, totalTimeMs, e.getMessage());
            throw e;
        }
    }
}
