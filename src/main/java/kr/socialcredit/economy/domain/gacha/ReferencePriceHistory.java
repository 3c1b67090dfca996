package kr.socialcredit.economy.domain.gacha;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 외부 기준 시세 표본 (최근 window 이내만 유지)
 */
public class ReferencePriceHistory {

    private record Sample(Instant at, double price) {}

    private final Deque<Sample> samples = new ArrayDeque<>();
    private final Duration window;

    public ReferencePriceHistory(Duration window) {
        this.window = window;
    }

    public synchronized void record(Instant at, double price) {
        if (price <= 0 || Double.isNaN(price) || Double.isInfinite(price)) {
            throw new IllegalArgumentException("시세는 양수여야 합니다: " + price);
        }
        samples.addLast(new Sample(at, price));
        prune(at);
    }

    public synchronized double current() {
        return samples.isEmpty() ? 0.0 : samples.peekLast().price();
    }

    public synchronized double average() {
        return samples.stream().mapToDouble(Sample::price).average().orElse(0.0);
    }

    /**
     * (현재 - 평균) / 평균. 표본이 없으면 0
     */
    public synchronized double changeRatio() {
        double average = average();
        if (average <= 0.0) {
            return 0.0;
        }
        return (current() - average) / average;
    }

    public synchronized int size() {
        return samples.size();
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!samples.isEmpty() && samples.peekFirst().at().isBefore(cutoff)) {
            samples.pollFirst();
        }
    }
}
