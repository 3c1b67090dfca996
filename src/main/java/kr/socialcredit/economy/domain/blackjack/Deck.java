package kr.socialcredit.economy.domain.blackjack;

import kr.socialcredit.economy.domain.common.GameRandom;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * 52장 덱. 게임마다 새로 섞어 세션에 보관한다.
 */
public class Deck {

    private final Deque<Card> cards;

    private Deck(List<Card> ordered) {
        this.cards = new ArrayDeque<>(ordered);
    }

    public static Deck shuffled(GameRandom random) {
        List<Card> cards = new ArrayList<>(52);
        for (Card.Suit suit : Card.Suit.values()) {
            for (Card.Rank rank : Card.Rank.values()) {
                cards.add(new Card(suit, rank));
            }
        }
        // Fisher-Yates
        for (int i = cards.size() - 1; i > 0; i--) {
            Collections.swap(cards, i, random.nextInt(i + 1));
        }
        return new Deck(cards);
    }

    /**
     * 주어진 순서 그대로 뽑히는 덱 (테스트용)
     */
    public static Deck stacked(List<Card> topFirst) {
        return new Deck(topFirst);
    }

    public Card draw() {
        Card card = cards.pollFirst();
        if (card == null) {
            throw new IllegalStateException("덱에 남은 카드가 없습니다");
        }
        return card;
    }

    public int remaining() {
        return cards.size();
    }
}
