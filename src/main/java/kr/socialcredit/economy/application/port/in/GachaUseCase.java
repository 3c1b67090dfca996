package kr.socialcredit.economy.application.port.in;

import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.Inventory;
import kr.socialcredit.economy.domain.gacha.OpenResult;
import kr.socialcredit.economy.domain.gacha.PurchaseResult;
import kr.socialcredit.economy.domain.gacha.SaleConfirmationSession;
import kr.socialcredit.economy.domain.gacha.SaleResult;

public interface GachaUseCase {

    PurchaseResult buy(String userId, String containerId);

    OpenResult open(String userId, String containerId);

    /**
     * 판매 확인 요청. 현재 단가를 고정한 확인 세션을 만든다.
     */
    SaleConfirmationSession requestSale(String userId, String channelId, String itemId, int quantity);

    SaleResult confirmSale(String sessionId, String actorId);

    SaleConfirmationSession cancelSale(String sessionId, String actorId);

    Inventory items(String userId);

    Inventory containers(String userId);

    ContainerBank bank();
}
