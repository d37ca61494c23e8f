package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.Business;

import java.util.Locale;

/**
 * 이벤트 제목으로 입주사를 판별한다. 대소문자 무시, 부분 일치
 */
public class BusinessClassifier {

    public Business classify(String label) {
        if (label == null) {
            return Business.BOOKED;
        }
        String lower = label.toLowerCase(Locale.ROOT);
        for (Business business : Business.values()) {
            if (business != Business.BOOKED && lower.contains(business.getDisplayName().toLowerCase(Locale.ROOT))) {
                return business;
            }
        }
        return Business.BOOKED;
    }

    /**
     * 새 예약 이벤트 제목. 예: "[Hunch]"
     */
    public String summaryFor(String business) {
        return "[" + business.trim() + "]";
    }
}
