package personal.roomhub.availability.domain.model;

/**
 * 공유 오피스 입주사. 이벤트 제목으로 어느 입주사 예약인지 구분한다.
 * BOOKED는 어느 입주사에도 해당하지 않는 일반 예약
 */
public enum Business {
    BAKER("Baker"),
    CLARITY("Clarity"),
    HUNCH("Hunch"),
    NAVIGATE("Navigate"),
    BOOKED("Booked");

    private final String displayName;

    Business(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
