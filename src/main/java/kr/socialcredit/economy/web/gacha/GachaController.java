package kr.socialcredit.economy.web.gacha;

import kr.socialcredit.economy.application.port.in.GachaUseCase;
import kr.socialcredit.economy.application.port.in.PricingUseCase;
import kr.socialcredit.economy.application.port.in.PricingUseCase.ReferenceSnapshot;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.ContainerBank;
import kr.socialcredit.economy.domain.gacha.Item;
import kr.socialcredit.economy.web.gacha.dto.BankResponse;
import kr.socialcredit.economy.web.gacha.dto.InventoryResponse;
import kr.socialcredit.economy.web.gacha.dto.PriceResponse;
import kr.socialcredit.economy.web.gacha.dto.PriceResponse.ItemPrice;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/gacha")
@RequiredArgsConstructor
public class GachaController {

    private final GachaUseCase gachaUseCase;
    private final PricingUseCase pricingUseCase;
    private final Catalog catalog;

    /**
     * 은행 재고 (조회 시 보충 주기가 지났으면 보충된다)
     */
    @GetMapping("/bank")
    public ResponseEntity<BankResponse> bank() {
        ContainerBank bank = gachaUseCase.bank();
        return ResponseEntity.ok(new BankResponse(bank.getStock(), bank.getLastRefilled()));
    }

    @GetMapping("/prices")
    public ResponseEntity<PriceResponse> prices() {
        ReferenceSnapshot reference = pricingUseCase.reference();
        Map<String, Long> prices = pricingUseCase.prices();
        List<ItemPrice> items = catalog.items().stream()
                .sorted(Comparator.comparing(Item::id))
                .map(item -> new ItemPrice(item.id(), item.name(), item.rarity().getLabel(),
                        prices.getOrDefault(item.id(), 0L)))
                .toList();
        return ResponseEntity.ok(new PriceResponse(
                reference.current(), reference.average24h(), reference.changeRatio(), items));
    }

    @GetMapping("/inventory/{userId}")
    public ResponseEntity<InventoryResponse> inventory(@PathVariable String userId) {
        return ResponseEntity.ok(new InventoryResponse(userId,
                gachaUseCase.items(userId).asMap(),
                gachaUseCase.containers(userId).asMap()));
    }
}
