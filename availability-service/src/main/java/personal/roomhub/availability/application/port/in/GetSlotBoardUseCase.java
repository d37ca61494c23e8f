package personal.roomhub.availability.application.port.in;

import personal.roomhub.availability.domain.model.Room;

/**
 * Get Slot Board UseCase (Input Port)
 * 회의실 하나의 30분 슬롯 보드 조회
 */
public interface GetSlotBoardUseCase {

    SlotBoard getSlotBoard(String date, Room room);
}
