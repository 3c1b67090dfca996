package kr.socialcredit.economy.domain.blackjack;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 플레이어/딜러 패
 * 에이스는 21을 넘지 않는 한 11, 넘으면 1로 계산한다.
 */
public class Hand {

    public static final int BLACKJACK = 21;

    private final List<Card> cards = new ArrayList<>();

    public void add(Card card) {
        cards.add(card);
    }

    public int total() {
        int sum = 0;
        int aces = 0;
        for (Card card : cards) {
            if (card.rank() == Card.Rank.ACE) {
                aces++;
            } else {
                sum += card.rank().getPoints();
            }
        }
        sum += aces;
        if (aces > 0 && sum + 10 <= BLACKJACK) {
            sum += 10;
        }
        return sum;
    }

    public boolean isBust() {
        return total() > BLACKJACK;
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public Card first() {
        return cards.get(0);
    }

    @Override
    public String toString() {
        return cards.stream().map(Card::toString).collect(Collectors.joining(" "));
    }
}
