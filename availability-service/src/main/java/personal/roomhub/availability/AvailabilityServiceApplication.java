package personal.roomhub.availability;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import personal.roomhub.availability.application.config.RoomHubProperties;

/**
 * Availability Service Application
 * 회의실 가용성 계산/캐싱 및 예약 생성·삭제 서비스
 */
@EnableConfigurationProperties(RoomHubProperties.class)
@SpringBootApplication(
    scanBasePackages = {
        "personal.roomhub.availability",
        "personal.roomhub.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class AvailabilityServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(AvailabilityServiceApplication.class, args);
    }
}
