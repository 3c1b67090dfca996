package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.CreditLedgerUseCase;
import kr.socialcredit.economy.application.port.in.GachaUseCase;
import kr.socialcredit.economy.application.port.in.PricingUseCase;
import kr.socialcredit.economy.application.port.out.GachaStorePort;
import kr.socialcredit.economy.application.port.out.GachaStorePort.DailyAction;
import kr.socialcredit.economy.domain.account.LedgerWriteException;
import kr.socialcredit.economy.domain.common.GameRandom;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.DailyLimitExceededException;
import kr.socialcredit.economy.domain.gacha.DrawResult;
import kr.socialcredit.economy.domain.gacha.InsufficientInventoryException;
import kr.socialcredit.economy.domain.gacha.Inventory;
import kr.socialcredit.economy.domain.gacha.Item;
import kr.socialcredit.economy.domain.gacha.LootContainer;
import kr.socialcredit.economy.domain.gacha.OpenResult;
import kr.socialcredit.economy.domain.gacha.PurchaseResult;
import kr.socialcredit.economy.domain.gacha.RarityTable;
import kr.socialcredit.economy.domain.gacha.SaleConfirmationSession;
import kr.socialcredit.economy.domain.gacha.SaleResult;
import kr.socialcredit.economy.domain.session.SessionId;
import kr.socialcredit.economy.infrastructure.config.EconomyProperties;
import kr.socialcredit.economy.infrastructure.lock.EconomyStateLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * 가챠 서비스 (케이스 구매/개봉, 아이템 판매)
 *
 * [한도]
 * - 케이스 개봉, 은행 구매는 각각 사용자당 하루 dailyOpenLimit / dailyPurchaseLimit 회
 * - 일일 카운터는 날짜별 키에 24시간 TTL로 저장
 *
 * [은행]
 * - 마지막 보충 후 bankRefillInterval이 지났으면 접근 시점에 모든 케이스를 bankRefillQuantity로 채움
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GachaService implements GachaUseCase {

    private final Catalog catalog;
    private final RarityTable rarityTable;
    private final GachaStorePort gachaStore;
    private final CreditLedgerUseCase creditLedger;
    private final PricingUseCase pricing;
    private final SessionRegistry sessionRegistry;
    private final EconomyStateLock stateLock;
    private final GameRandom gameRandom;
    private final EconomyProperties properties;
    private final Clock clock;

    @Override
    public PurchaseResult buy(String userId, String containerId) {
        LootContainer container = catalog.container(containerId);
        int limit = properties.getGacha().getDailyPurchaseLimit();

        return stateLock.executeWithLock("gacha:buy:" + userId, () -> {
            LocalDate today = LocalDate.now(clock);
            if (gachaStore.dailyCount(DailyAction.PURCHASE, userId, today) >= limit) {
                throw new DailyLimitExceededException("케이스 구매", limit);
            }
            ContainerBank bank = loadBank();
            bank.take(containerId);
            gachaStore.saveBank(bank);

            long balance;
            try {
                balance = container.price() > 0
                        ? creditLedger.withdraw(userId, container.price(), "케이스 구매: " + containerId)
                        : creditLedger.getBalance(userId);
            } catch (RuntimeException e) {
                restoreBank(bank, containerId, e);
                throw e;
            }

            boolean containerGranted = false;
            int purchasesToday;
            try {
                Inventory containers = gachaStore.loadContainers(userId);
                containers.add(containerId, 1);
                gachaStore.saveContainers(userId, containers);
                containerGranted = true;
                purchasesToday = gachaStore.incrementDaily(DailyAction.PURCHASE, userId, today);
            } catch (RuntimeException e) {
                rollbackPurchase(userId, container, bank, containerGranted, e);
                throw e;
            }

            log.info("[가챠] 케이스 구매: user={}, container={}, price={}, bankStock={}",
                    userId, containerId, container.price(), bank.stockOf(containerId));
            return new PurchaseResult(userId, container, container.price(), balance,
                    bank.stockOf(containerId), purchasesToday);
        });
    }

    @Override
    public OpenResult open(String userId, String containerId) {
        LootContainer container = catalog.container(containerId);
        List<Item> pool = catalog.poolFor(container);
        if (pool.isEmpty()) {
            throw new IllegalStateException("케이스에 들어 있는 아이템이 없습니다: " + containerId);
        }
        int limit = properties.getGacha().getDailyOpenLimit();
        int drawCount = properties.getGacha().getDrawsPerContainer();

        return stateLock.executeWithLock("gacha:open:" + userId, () -> {
            LocalDate today = LocalDate.now(clock);
            if (gachaStore.dailyCount(DailyAction.OPEN, userId, today) >= limit) {
                throw new DailyLimitExceededException("케이스 개봉", limit);
            }

            Inventory containers = gachaStore.loadContainers(userId);
            containers.remove(containerId, 1);
            gachaStore.saveContainers(userId, containers);

            List<DrawResult> draws = new ArrayList<>(drawCount);
            boolean itemsGranted = false;
            int opensToday;
            try {
                Inventory items = gachaStore.loadItems(userId);
                for (int i = 0; i < drawCount; i++) {
                    Item item = rarityTable.draw(pool, gameRandom);
                    boolean first = !items.contains(item.id());
                    items.add(item.id(), 1);
                    draws.add(new DrawResult(item, first));
                }
                gachaStore.saveItems(userId, items);
                itemsGranted = true;
                opensToday = gachaStore.incrementDaily(DailyAction.OPEN, userId, today);
            } catch (RuntimeException e) {
                rollbackOpen(userId, containerId, itemsGranted ? draws : List.of(), e);
                throw e;
            }

            log.info("[가챠] 케이스 개봉: user={}, container={}, items={}", userId, containerId,
                    draws.stream().map(d -> d.item().id()).toList());
            return new OpenResult(userId, container, draws, opensToday, containers.countOf(containerId));
        });
    }

    @Override
    public SaleConfirmationSession requestSale(String userId, String channelId, String itemId, int quantity) {
        catalog.item(itemId);
        if (quantity <= 0) {
            throw new IllegalArgumentException("판매 수량은 0보다 커야 합니다");
        }

        return stateLock.executeWithLock("gacha:sale:" + userId, () -> {
            int held = gachaStore.loadItems(userId).countOf(itemId);
            if (held < quantity) {
                throw InsufficientInventoryException.of(itemId, quantity, held);
            }
            long unitPrice = pricing.priceOf(itemId);
            return sessionRegistry.register(SaleConfirmationSession.request(
                    SessionId.generate(userId, sessionRegistry.now()),
                    userId,
                    channelId,
                    itemId,
                    quantity,
                    unitPrice,
                    sessionRegistry.now(),
                    properties.getSession().getSaleTtl()
            ));
        });
    }

    @Override
    public SaleResult confirmSale(String sessionId, String actorId) {
        return stateLock.executeWithLock("gacha:confirm:" + sessionId, () -> {
            SaleConfirmationSession session =
                    sessionRegistry.requireOwned(sessionId, actorId, SaleConfirmationSession.class);
            session.confirm();
            sessionRegistry.resolve(sessionId);

            String sellerId = session.getOwnerId();
            Inventory items = gachaStore.loadItems(sellerId);
            items.remove(session.getItemId(), session.getQuantity());
            gachaStore.saveItems(sellerId, items);

            long proceeds = session.proceeds();
            long balance;
            try {
                balance = proceeds > 0
                        ? creditLedger.adjust(sellerId, proceeds, "아이템 판매: " + session.getItemId() + " x" + session.getQuantity())
                        : creditLedger.getBalance(sellerId);
            } catch (LedgerWriteException e) {
                items.add(session.getItemId(), session.getQuantity());
                gachaStore.saveItems(sellerId, items);
                throw e;
            }

            log.info("[가챠] 아이템 판매: user={}, item={}, qty={}, unitPrice={}, proceeds={}",
                    sellerId, session.getItemId(), session.getQuantity(), session.getUnitPrice(), proceeds);
            return new SaleResult(sellerId, catalog.item(session.getItemId()), session.getQuantity(),
                    session.getUnitPrice(), proceeds, balance, items.countOf(session.getItemId()));
        });
    }

    @Override
    public SaleConfirmationSession cancelSale(String sessionId, String actorId) {
        return stateLock.executeWithLock("gacha:cancel:" + sessionId, () -> {
            SaleConfirmationSession session =
                    sessionRegistry.requireOwned(sessionId, actorId, SaleConfirmationSession.class);
            session.cancel();
            sessionRegistry.resolve(sessionId);
            return session;
        });
    }

    @Override
    public Inventory items(String userId) {
        return gachaStore.loadItems(userId);
    }

    @Override
    public Inventory containers(String userId) {
        return gachaStore.loadContainers(userId);
    }

    @Override
    public ContainerBank bank() {
        return stateLock.executeWithLock("gacha:bank", this::loadBank);
    }

    // 구매 중 쓰기 실패: 지급한 케이스, 차감한 대금, 은행 재고 순으로 되돌림
    private void rollbackPurchase(String userId, LootContainer container, ContainerBank bank,
                                  boolean containerGranted, RuntimeException cause) {
        String containerId = container.id();
        if (containerGranted) {
            compensate(cause, "케이스 회수", () -> {
                Inventory containers = gachaStore.loadContainers(userId);
                containers.remove(containerId, 1);
                gachaStore.saveContainers(userId, containers);
            });
        }
        if (container.price() > 0) {
            compensate(cause, "구매 대금 환불", () ->
                    creditLedger.adjust(userId, container.price(), "케이스 구매 실패 환불: " + containerId));
        }
        restoreBank(bank, containerId, cause);
    }

    private void restoreBank(ContainerBank bank, String containerId, RuntimeException cause) {
        compensate(cause, "은행 재고 복구", () -> {
            bank.putBack(containerId);
            gachaStore.saveBank(bank);
        });
    }

    // 개봉 중 쓰기 실패: 지급한 아이템을 회수하고 케이스를 돌려줌
    private void rollbackOpen(String userId, String containerId, List<DrawResult> grantedDraws,
                              RuntimeException cause) {
        if (!grantedDraws.isEmpty()) {
            compensate(cause, "아이템 회수", () -> {
                Inventory items = gachaStore.loadItems(userId);
                grantedDraws.forEach(draw -> items.remove(draw.item().id(), 1));
                gachaStore.saveItems(userId, items);
            });
        }
        compensate(cause, "케이스 복구", () -> {
            Inventory containers = gachaStore.loadContainers(userId);
            containers.add(containerId, 1);
            gachaStore.saveContainers(userId, containers);
        });
    }

    private void compensate(RuntimeException cause, String action, Runnable compensation) {
        try {
            compensation.run();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.error("[가챠] 보상 처리 실패: action={}, cause={}", action, cause.getMessage(), e);
        }
    }

    private ContainerBank loadBank() {
        ContainerBank bank = gachaStore.loadBank();
        EconomyProperties.Gacha config = properties.getGacha();
        boolean refilled = bank.refillIfDue(clock.instant(), config.getBankRefillInterval(),
                config.getBankRefillQuantity(), catalog.containers().stream().map(LootContainer::id).toList());
        if (refilled) {
            gachaStore.saveBank(bank);
            log.info("[가챠] 은행 보충: stock={}", bank.getStock());
        }
        return bank;
    }
}
