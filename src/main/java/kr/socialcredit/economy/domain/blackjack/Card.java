package kr.socialcredit.economy.domain.blackjack;

/**
 * 트럼프 카드 한 장
 */
public record Card(Suit suit, Rank rank) {

    public enum Suit {
        SPADES("♠"), HEARTS("♥"), DIAMONDS("♦"), CLUBS("♣");

        private final String symbol;

        Suit(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    public enum Rank {
        TWO("2", 2), THREE("3", 3), FOUR("4", 4), FIVE("5", 5), SIX("6", 6),
        SEVEN("7", 7), EIGHT("8", 8), NINE("9", 9), TEN("10", 10),
        JACK("J", 10), QUEEN("Q", 10), KING("K", 10), ACE("A", 11);

        private final String label;
        private final int points;

        Rank(String label, int points) {
            this.label = label;
            this.points = points;
        }

        public String getLabel() {
            return label;
        }

        public int getPoints() {
            return points;
        }
    }

    @Override
    public String toString() {
        return suit.getSymbol() + rank.getLabel();
    }
}
