package personal.roomhub.availability.domain.service;

import personal.roomhub.availability.domain.model.BusyBlock;
import personal.roomhub.availability.domain.model.ReservationRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 겹치거나 맞닿은 구간을 하나의 점유 블록으로 병합한다
 *
 * 라벨 정책: 병합 시 시작 시각이 가장 빠른 레코드의 라벨을 유지하고,
 * 나머지 레코드는 eventIds에만 남긴다. 이미 병합된 목록을 다시 병합하면 그대로다.
 */
public class IntervalMerger {

    public List<BusyBlock> merge(List<ReservationRecord> intervals) {
        if (intervals.isEmpty()) {
            return List.of();
        }

        // List.sort는 stable: 시작 시각이 같으면 원래 순서 유지
        List<ReservationRecord> sorted = new ArrayList<>(intervals);
        sorted.sort(Comparator.comparing(ReservationRecord::start));

        List<BusyBlock> merged = new ArrayList<>();
        BusyBlock current = BusyBlock.from(sorted.get(0));
        for (int i = 1; i < sorted.size(); i++) {
            ReservationRecord next = sorted.get(i);
            if (!next.start().isAfter(current.end())) {
                current = current.absorb(next);
            } else {
                merged.add(current);
                current = BusyBlock.from(next);
            }
        }
        merged.add(current);
        return List.copyOf(merged);
    }
}
