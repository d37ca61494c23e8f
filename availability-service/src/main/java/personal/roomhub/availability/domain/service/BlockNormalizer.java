package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.ReservationRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 예약 레코드를 예약 구간으로 잘라내고 길이가 0 이하인 레코드를 버린다
 * 순수 함수, 출력 순서는 보장하지 않는다
 */
public class BlockNormalizer {

    public List<ReservationRecord> normalize(List<ReservationRecord> records, BookingWindow window) {
        List<ReservationRecord> clipped = new ArrayList<>(records.size());
        for (ReservationRecord record : records) {
            Instant start = record.start().isAfter(window.start()) ? record.start() : window.start();
            Instant end = record.end().isBefore(window.end()) ? record.end() : window.end();
            if (start.isBefore(end)) {
                clipped.add(record.withBounds(start, end));
            }
        }
        return clipped;
    }
}
