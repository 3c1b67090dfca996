package kr.socialcredit.economy.application.port.out;

import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.Inventory;

import java.time.LocalDate;

/**
 * 가챠 상태 저장소 포트 (아이템/케이스 인벤토리, 은행, 일일 카운터)
 */
public interface GachaStorePort {

    enum DailyAction {
        OPEN("open"),
        PURCHASE("purchase");

        private final String key;

        DailyAction(String key) {
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    Inventory loadItems(String userId);
    void saveItems(String userId, Inventory inventory);

    Inventory loadContainers(String userId);
    void saveContainers(String userId, Inventory inventory);

    ContainerBank loadBank();
    void saveBank(ContainerBank bank);

    int dailyCount(DailyAction action, String userId, LocalDate day);

    /**
     * @return 증가 후 값 (24시간 TTL)
     */
    int incrementDaily(DailyAction action, String userId, LocalDate day);
}
