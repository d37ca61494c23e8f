package personal.roomhub.availability.application.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 회의실별 캘린더 병렬 조회용 Executor
 * 요청 단위 I/O 작업만 실행하며 상주 백그라운드 작업은 없다
 */
@Configuration
public class CalendarFetchExecutorConfig {

    @Bean(name = "calendarFetchExecutor")
    public Executor calendarFetchExecutor(RoomHubProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.fetch().poolSize());
        executor.setMaxPoolSize(properties.fetch().poolSize());
        executor.setQueueCapacity(properties.fetch().queueCapacity());
        executor.setThreadNamePrefix("calendar-fetch-");
        executor.initialize();
        return executor;
    }
}
