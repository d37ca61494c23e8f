package personal.roomhub.availability.domain.model;

/**
 * 점유 블록 하나당 한 번만 생성되는 라벨 위치
 *
 * @param blockIndex 병합된 블록 배열에서의 위치 (중복 제거 키)
 * @param slotIndex  블록의 유효 시작 시각이 속한 슬롯
 * @param span       블록이 차지하는 슬롯 수 (1 이상, 구간 끝을 넘지 않음)
 * @param block      원본 블록
 */
public record SlotLabel(
        int blockIndex,
        int slotIndex,
        int span,
        BusyBlock block
) {
}
