package personal.roomhub.availability.adapter.out.external;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import personal.roomhub.availability.application.config.RoomHubProperties;

import java.net.http.HttpClient;

/**
 * RestClient Configuration
 * 외부 캘린더 API 호출용 RestClient
 *
 * Timeout 전략:
 * - Connect Timeout: TCP 연결 실패 빠른 감지
 * - Read Timeout: 회의실별 조회 제한 시간(roomhub.fetch.timeout)보다 짧게
 */
@Configuration
public class CalendarRestClientConfig {

    @Bean
    public RestClient calendarRestClient(RoomHubProperties properties) {
        RoomHubProperties.Calendar calendar = properties.calendar();

        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_2)
                .connectTimeout(calendar.connectTimeout())
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(calendar.readTimeout());

        return RestClient.builder()
                .baseUrl(calendar.baseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
