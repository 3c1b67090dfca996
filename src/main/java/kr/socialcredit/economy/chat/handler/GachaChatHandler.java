package kr.socialcredit.economy.chat.handler;

import kr.socialcredit.economy.application.port.in.GachaUseCase;
import kr.socialcredit.economy.application.port.in.PricingUseCase;
import kr.socialcredit.economy.application.port.in.PricingUseCase.ReferenceSnapshot;
import kr.socialcredit.economy.application.port.out.MessageAction;
import kr.socialcredit.economy.application.port.out.MessagingPort;
import kr.socialcredit.economy.application.service.SessionRegistry;
import kr.socialcredit.economy.chat.ActionIds;
import kr.socialcredit.economy.chat.ChatActionEvent;
import kr.socialcredit.economy.chat.ChatActionHandler;
import kr.socialcredit.economy.chat.ChatArguments;
import kr.socialcredit.economy.chat.ChatCommandEvent;
import kr.socialcredit.economy.chat.ChatCommandHandler;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.DrawResult;
import kr.socialcredit.economy.domain.gacha.Inventory;
import kr.socialcredit.economy.domain.gacha.Item;
import kr.socialcredit.economy.domain.gacha.LootContainer;
import kr.socialcredit.economy.domain.gacha.OpenResult;
import kr.socialcredit.economy.domain.gacha.PurchaseResult;
import kr.socialcredit.economy.domain.gacha.SaleConfirmationSession;
import kr.socialcredit.economy.domain.gacha.SaleResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static kr.socialcredit.economy.chat.ChatArguments.mention;

/**
 * 케이스/아이템 명령
 * !cases, !buycase, !opencase, !inventory, !sell, !prices
 */
@Component
@RequiredArgsConstructor
public class GachaChatHandler implements ChatCommandHandler, ChatActionHandler {

    private final GachaUseCase gachaUseCase;
    private final PricingUseCase pricingUseCase;
    private final SessionRegistry sessionRegistry;
    private final MessagingPort messagingPort;
    private final Catalog catalog;

    @Override
    public Set<String> commands() {
        return Set.of("cases", "buycase", "opencase", "inventory", "sell", "prices");
    }

    @Override
    public Set<String> actions() {
        return Set.of(ActionIds.SALE_CONFIRM, ActionIds.SALE_CANCEL);
    }

    @Override
    public void handle(String command, List<String> args, ChatCommandEvent event) {
        switch (command) {
            case "cases" -> cases(event);
            case "buycase" -> buy(args, event);
            case "opencase" -> open(args, event);
            case "inventory" -> inventory(args, event);
            case "sell" -> sell(args, event);
            case "prices" -> prices(event);
            default -> throw new IllegalArgumentException("지원하지 않는 명령입니다: " + command);
        }
    }

    @Override
    public void handle(String action, String payload, ChatActionEvent event) {
        if (ActionIds.SALE_CONFIRM.equals(action)) {
            SaleResult result = gachaUseCase.confirmSale(payload, event.actorId());
            messagingPort.editMessage(event.channelId(), event.sourceMessageId(), String.format(
                    "💸 %s %s x%d 판매 완료! **%,d** 크레딧 획득 (잔액 %,d, 남은 수량 %d)",
                    mention(result.sellerId()), result.item().name(), result.quantity(),
                    result.proceeds(), result.balanceAfter(), result.remaining()), List.of());
            return;
        }
        SaleConfirmationSession cancelled = gachaUseCase.cancelSale(payload, event.actorId());
        messagingPort.editMessage(event.channelId(), event.sourceMessageId(),
                String.format("🚫 %s 판매를 취소했습니다", catalog.item(cancelled.getItemId()).name()), List.of());
    }

    private void cases(ChatCommandEvent event) {
        ContainerBank bank = gachaUseCase.bank();
        StringBuilder sb = new StringBuilder("📦 **케이스 목록**\n");
        catalog.containers().stream()
                .sorted(Comparator.comparing(LootContainer::id))
                .forEach(c -> sb.append(String.format("• `%s` %s: %,d 크레딧 (재고 %d)\n",
                        c.id(), c.name(), c.price(), bank.stockOf(c.id()))));
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }

    private void buy(List<String> args, ChatCommandEvent event) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("사용법: `!buycase 케이스ID`");
        }
        PurchaseResult result = gachaUseCase.buy(event.authorId(), args.get(0));
        messagingPort.sendMessage(event.channelId(), String.format(
                "🛒 %s %s 구매 완료 (-%,d, 잔액 %,d)\n은행 재고 %d | 오늘 구매 %d회",
                mention(result.userId()), result.container().name(), result.pricePaid(), result.balanceAfter(),
                result.bankStockAfter(), result.purchasesToday()));
    }

    private void open(List<String> args, ChatCommandEvent event) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("사용법: `!opencase 케이스ID`");
        }
        OpenResult result = gachaUseCase.open(event.authorId(), args.get(0));
        StringBuilder sb = new StringBuilder(String.format("🎁 %s %s 개봉!\n",
                mention(result.userId()), result.container().name()));
        for (DrawResult draw : result.draws()) {
            Item item = draw.item();
            sb.append(String.format("• [%s] %s%s\n", item.rarity().getLabel(), item.name(),
                    draw.firstAcquisition() ? " ✨NEW" : ""));
        }
        sb.append(String.format("오늘 개봉 %d회 | 남은 케이스 %d", result.opensToday(), result.remainingContainers()));
        messagingPort.sendMessage(event.channelId(), sb.toString());
    }

    private void inventory(List<String> args, ChatCommandEvent event) {
        String userId = args.isEmpty() ? event.authorId() : ChatArguments.userId(args.get(0));
        Inventory items = gachaUseCase.items(userId);
        Inventory containers = gachaUseCase.containers(userId);
        if (items.isEmpty() && containers.isEmpty()) {
            messagingPort.sendMessage(event.channelId(), mention(userId) + " 의 인벤토리가 비어 있습니다");
            return;
        }
        StringBuilder sb = new StringBuilder(String.format("🎒 %s 의 인벤토리\n", mention(userId)));
        for (Map.Entry<String, Integer> entry : containers.asMap().entrySet()) {
            sb.append(String.format("📦 %s x%d\n", catalog.container(entry.getKey()).name(), entry.getValue()));
        }
        for (Map.Entry<String, Integer> entry : items.asMap().entrySet()) {
            Item item = catalog.item(entry.getKey());
            sb.append(String.format("• `%s` [%s] %s x%d\n", item.id(), item.rarity().getLabel(), item.name(), entry.getValue()));
        }
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }

    private void sell(List<String> args, ChatCommandEvent event) {
        if (args.isEmpty() || args.size() > 2) {
            throw new IllegalArgumentException("사용법: `!sell 아이템ID [수량]`");
        }
        int quantity = args.size() == 2 ? ChatArguments.quantity(args.get(1)) : 1;
        SaleConfirmationSession session =
                gachaUseCase.requestSale(event.authorId(), event.channelId(), args.get(0), quantity);
        Item item = catalog.item(session.getItemId());

        String text = String.format("💱 %s %s x%d 을(를) **%,d** 크레딧에 판매할까요? (개당 %,d의 절반)",
                mention(session.getOwnerId()), item.name(), session.getQuantity(), session.proceeds(), session.getUnitPrice());
        String messageId = messagingPort.sendMessageWithActions(event.channelId(), text, List.of(
                MessageAction.success(ActionIds.of(ActionIds.SALE_CONFIRM, session.getId()), "판매"),
                MessageAction.secondary(ActionIds.of(ActionIds.SALE_CANCEL, session.getId()), "취소")));
        sessionRegistry.attachMessage(session.getId(), messageId);
    }

    private void prices(ChatCommandEvent event) {
        ReferenceSnapshot reference = pricingUseCase.reference();
        Map<String, Long> prices = pricingUseCase.prices();
        StringBuilder sb = new StringBuilder(String.format(
                "📈 기준 시세 %.2f (24h 평균 %.2f, 변동 %+.2f%%)\n",
                reference.current(), reference.average24h(), reference.changeRatio() * 100));
        catalog.items().stream()
                .sorted(Comparator.comparing((Item i) -> i.rarity().ordinal()).reversed().thenComparing(Item::id))
                .forEach(item -> sb.append(String.format("• [%s] %s: %,d\n",
                        item.rarity().getLabel(), item.name(), prices.getOrDefault(item.id(), 0L))));
        messagingPort.sendMessage(event.channelId(), sb.toString().trim());
    }
}
