package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.DailyAvailability;

/**
 * Get Availability UseCase (Input Port)
 * 날짜별 두 회의실 가용성 조회
 */
public interface GetAvailabilityUseCase {

    /**
     * @param date yyyy-MM-dd (운영 타임존). null 또는 공백이면 오늘
     * @return 두 회의실 스냅샷. 한 회의실 조회가 실패해도 다른 회의실 결과는 정상 반환
     * @throws personal.roomhub.common.exception.BusinessException 날짜 형식 오류(400), 설정 누락(500)
     */
    DailyAvailability getAvailability(String date);
}
