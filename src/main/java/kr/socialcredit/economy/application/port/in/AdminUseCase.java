package kr.socialcredit.economy.application.port.in;

import java.util.List;

public interface AdminUseCase {

    enum MassOperation {
        ADD('+'), SUBTRACT('-'), SET('=');

        private final char symbol;

        MassOperation(char symbol) {
            this.symbol = symbol;
        }

        public static MassOperation fromSymbol(char symbol) {
            for (MassOperation op : values()) {
                if (op.symbol == symbol) {
                    return op;
                }
            }
            throw new IllegalArgumentException("연산자는 +, -, = 중 하나여야 합니다: " + symbol);
        }

        public char getSymbol() {
            return symbol;
        }
    }

    record AdjustCommand(String adminId, String targetId, long delta, String reason) {}
    record MassCommand(String adminId, MassOperation operation, long amount,
                       List<String> targetIds, String reason) {}

    record AdjustResult(String targetId, long previousBalance, long newBalance) {}

    AdjustResult adjust(AdjustCommand command);

    List<AdjustResult> mass(MassCommand command);

    boolean isAdmin(String userId);
}
