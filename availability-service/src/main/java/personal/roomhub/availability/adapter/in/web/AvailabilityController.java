package personal.roomhub.availability.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.roomhub.availability.adapter.in.web.dto.AvailabilityResponse;
import personal.roomhub.availability.adapter.in.web.dto.BusyBlockResponse;
import personal.roomhub.availability.adapter.in.web.dto.RoomAvailabilityResponse;
import personal.roomhub.availability.adapter.in.web.dto.SlotBoardResponse;
import personal.roomhub.availability.application.port.in.GetAvailabilityUseCase;
import personal.roomhub.availability.application.port.in.GetSlotBoardUseCase;
import personal.roomhub.availability.application.port.in.SlotBoard;
import personal.roomhub.availability.domain.model.AvailabilitySnapshot;
import personal.roomhub.availability.domain.model.DailyAvailability;
import personal.roomhub.availability.domain.model.Room;
import personal.roomhub.availability.domain.model.SlotLabel;
import personal.roomhub.availability.domain.service.BusinessClassifier;

/**
 * Availability API Controller
 * 회의실 가용성 및 슬롯 보드 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final GetAvailabilityUseCase getAvailabilityUseCase;
    private final GetSlotBoardUseCase getSlotBoardUseCase;
    private final BusinessClassifier businessClassifier;

    /**
     * 날짜별 두 회의실 가용성 조회
     * GET /api/v1/availability?date=yyyy-MM-dd (생략 시 오늘)
     */
    @GetMapping
    public ResponseEntity<AvailabilityResponse> getAvailability(
            @RequestParam(required = false) String date
    ) {
        log.info("Get availability: date={}", date);

        DailyAvailability availability = getAvailabilityUseCase.getAvailability(date);

        AvailabilityResponse response = new AvailabilityResponse(
                toResponse(availability.talkingRoom()),
                toResponse(availability.boardRoom()),
                availability.date().toString());

        return ResponseEntity.ok(response);
    }

    /**
     * 회의실 하나의 30분 슬롯 보드 조회
     * GET /api/v1/availability/slots?room=talking&date=yyyy-MM-dd
     */
    @GetMapping("/slots")
    public ResponseEntity<SlotBoardResponse> getSlotBoard(
            @RequestParam String room,
            @RequestParam(required = false) String date
    ) {
        log.info("Get slot board: room={}, date={}", room, date);

        SlotBoard board = getSlotBoardUseCase.getSlotBoard(date, Room.fromKey(room));
        AvailabilitySnapshot snapshot = board.snapshot();

        SlotBoardResponse response = new SlotBoardResponse(
                snapshot.room().getKey(),
                board.window().date().toString(),
                board.window().start(),
                board.window().end(),
                snapshot.freeNow(),
                snapshot.nextAvailable(),
                snapshot.error(),
                board.slots().stream()
                        .map(state -> new SlotBoardResponse.SlotResponse(
                                state.slot().index(), state.slot().start(), state.slot().end(), state.busy()))
                        .toList(),
                board.labels().stream()
                        .map(this::toLabelResponse)
                        .toList());

        return ResponseEntity.ok(response);
    }

    private RoomAvailabilityResponse toResponse(AvailabilitySnapshot snapshot) {
        return new RoomAvailabilityResponse(
                snapshot.busyBlocks().stream()
                        .map(block -> BusyBlockResponse.from(block, businessClassifier.classify(block.label())))
                        .toList(),
                snapshot.freeNow(),
                snapshot.nextAvailable(),
                snapshot.error());
    }

    private SlotBoardResponse.SlotLabelResponse toLabelResponse(SlotLabel label) {
        return new SlotBoardResponse.SlotLabelResponse(
                label.slotIndex(),
                label.span(),
                label.block().label(),
                businessClassifier.classify(label.block().label()).getDisplayName(),
                label.block().start(),
                label.block().end());
    }
}
