package personal.roomhub.availability.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import personal.roomhub.availability.domain.service.AvailabilityEvaluator;
import personal.roomhub.availability.domain.service.BlockNormalizer;
import personal.roomhub.availability.domain.service.BookingWindowFactory;
import personal.roomhub.availability.domain.service.BusinessClassifier;
import personal.roomhub.availability.domain.service.ConflictChecker;
import personal.roomhub.availability.domain.service.IntervalMerger;
import personal.roomhub.availability.domain.service.SlotGrid;

import java.time.Clock;

/**
 * 가용성 계산 도메인 서비스 등록
 * 도메인 서비스는 Spring 의존성이 없는 순수 클래스로 두고 여기서 Bean으로 만든다
 */
@Configuration
public class AvailabilityEngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public BookingWindowFactory bookingWindowFactory(RoomHubProperties properties, Clock clock) {
        return new BookingWindowFactory(
                properties.zoneId(),
                properties.window().openTime(),
                properties.window().closeTime(),
                clock);
    }

    @Bean
    public BlockNormalizer blockNormalizer() {
        return new BlockNormalizer();
    }

    @Bean
    public IntervalMerger intervalMerger() {
        return new IntervalMerger();
    }

    @Bean
    public AvailabilityEvaluator availabilityEvaluator() {
        return new AvailabilityEvaluator();
    }

    @Bean
    public SlotGrid slotGrid() {
        return new SlotGrid();
    }

    @Bean
    public ConflictChecker conflictChecker() {
        return new ConflictChecker();
    }

    @Bean
    public BusinessClassifier businessClassifier() {
        return new BusinessClassifier();
    }
}
