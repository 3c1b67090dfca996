package kr.socialcredit.economy.domain.common;

/**
 * 게임 결과 추첨용 난수원
 * 테스트에서는 결과를 고정한 구현으로 교체한다.
 */
@FunctionalInterface
public interface GameRandom {

    /**
     * [0, bound) 범위의 균등 분포 정수
     */
    int nextInt(int bound);

    /**
     * 편향 없는 50/50 추첨
     */
    default boolean coinFlip() {
        return nextInt(2) == 0;
    }
}
