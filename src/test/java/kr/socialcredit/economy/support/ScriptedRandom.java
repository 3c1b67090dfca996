package kr.socialcredit.economy.support;

import kr.socialcredit.economy.domain.common.GameRandom;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 미리 정한 값을 순서대로 돌려주는 난수원. 값이 떨어지면 0을 돌려준다.
 */
public class ScriptedRandom implements GameRandom {

    private final Deque<Integer> values = new ArrayDeque<>();

    public ScriptedRandom then(int... next) {
        for (int value : next) {
            values.addLast(value);
        }
        return this;
    }

    @Override
    public synchronized int nextInt(int bound) {
        Integer value = values.pollFirst();
        return value == null ? 0 : Math.floorMod(value, bound);
    }
}
