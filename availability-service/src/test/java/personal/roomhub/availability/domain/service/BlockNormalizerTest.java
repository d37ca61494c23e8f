package personal.roomhub.availability.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.roomhub.availability.domain.model.BookingWindow;
import personal.roomhub.availability.domain.model.ReservationRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BlockNormalizer 단위 테스트")
class BlockNormalizerTest {

    private static final BookingWindow WINDOW = new BookingWindow(
            LocalDate.of(2025, 3, 10),
            Instant.parse("2025-03-10T09:00:00Z"),
            Instant.parse("2025-03-10T18:00:00Z"));

    private final BlockNormalizer normalizer = new BlockNormalizer();

    @Test
    @DisplayName("구간 밖으로 걸친 레코드는 구간 경계로 잘린다")
    void clipsRecordsToWindow() {
        // Given
        ReservationRecord early = record("2025-03-10T08:00:00Z", "2025-03-10T10:00:00Z", "Early");
        ReservationRecord late = record("2025-03-10T17:30:00Z", "2025-03-10T19:00:00Z", "Late");

        // When
        List<ReservationRecord> result = normalizer.normalize(List.of(early, late), WINDOW);

        // Then
        assertThat(result).hasSize(2);
        assertThat(result.get(0).start()).isEqualTo(WINDOW.start());
        assertThat(result.get(0).end()).isEqualTo(Instant.parse("2025-03-10T10:00:00Z"));
        assertThat(result.get(1).start()).isEqualTo(Instant.parse("2025-03-10T17:30:00Z"));
        assertThat(result.get(1).end()).isEqualTo(WINDOW.end());
        assertThat(result.get(0).label()).isEqualTo("Early");
    }

    @Test
    @DisplayName("구간과 겹치지 않거나 길이가 0 이하인 레코드는 버린다")
    void dropsEmptyRecords() {
        // Given
        ReservationRecord before = record("2025-03-10T07:00:00Z", "2025-03-10T09:00:00Z", "Before");
        ReservationRecord after = record("2025-03-10T18:00:00Z", "2025-03-10T19:00:00Z", "After");
        ReservationRecord zeroLength = record("2025-03-10T12:00:00Z", "2025-03-10T12:00:00Z", "Zero");
        ReservationRecord inverted = record("2025-03-10T13:00:00Z", "2025-03-10T12:00:00Z", "Inverted");

        // When
        List<ReservationRecord> result = normalizer.normalize(List.of(before, after, zeroLength, inverted), WINDOW);

        // Then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("구간 전체를 덮는 레코드는 구간과 같아진다")
    void coversWholeWindow() {
        // Given
        ReservationRecord allDay = record("2025-03-10T00:00:00Z", "2025-03-11T00:00:00Z", "All day");

        // When
        List<ReservationRecord> result = normalizer.normalize(List.of(allDay), WINDOW);

        // Then
        assertThat(result).singleElement()
                .satisfies(r -> {
                    assertThat(r.start()).isEqualTo(WINDOW.start());
                    assertThat(r.end()).isEqualTo(WINDOW.end());
                });
    }

    private ReservationRecord record(String start, String end, String label) {
        return new ReservationRecord(Instant.parse(start), Instant.parse(end), label, label + "-id");
    }
}
