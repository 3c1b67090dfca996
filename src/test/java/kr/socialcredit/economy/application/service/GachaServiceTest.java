package kr.socialcredit.economy.application.service;

import kr.socialcredit.economy.application.port.in.PricingUseCase;
import kr.socialcredit.economy.application.port.out.TransientStoreException;
import kr.socialcredit.economy.domain.account.InsufficientBalanceException;
import kr.socialcredit.economy.domain.gacha.Catalog;
import kr.socialcredit.economy.domain.gacha.ContainerNotFoundException;
import kr.socialcredit.economy.domain.gacha.DailyLimitExceededException;
import kr.socialcredit.economy.domain.gacha.Inventory;
import kr.socialcredit.economy.domain.gacha.InsufficientInventoryException;
import kr.socialcredit.economy.domain.gacha.OpenResult;
import kr.socialcredit.economy.domain.gacha.OutOfStockException;
import kr.socialcredit.economy.domain.gacha.PurchaseResult;
import kr.socialcredit.economy.domain.gacha.RarityTable;
import kr.socialcredit.economy.domain.gacha.SaleConfirmationSession;
import kr.socialcredit.economy.domain.gacha.SaleResult;
import kr.socialcredit.economy.domain.session.NotSessionOwnerException;
import kr.socialcredit.economy.domain.session.SessionNotFoundException;
import kr.socialcredit.economy.support.EconomyFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("가챠 서비스 테스트")
class GachaServiceTest {

    private EconomyFixture fixture;
    private PricingUseCase pricing;
    private GachaService gachaService;
    private final Catalog catalog = EconomyFixture.sampleCatalog();

    @BeforeEach
    void setUp() {
        fixture = new EconomyFixture();
        pricing = mock(PricingUseCase.class);
        gachaService = new GachaService(catalog, RarityTable.standard(), fixture.gachaStore, fixture.ledger,
                pricing, fixture.registry, fixture.lock, fixture.random, fixture.properties, fixture.clock);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Nested
    @DisplayName("은행 구매")
    class Buy {

        @Test
        @DisplayName("구매하면 가격만큼 차감되고 은행 재고가 줄고 케이스가 인벤토리에 들어간다")
        void buy() {
            fixture.seed("u", 200L);

            PurchaseResult result = gachaService.buy("u", "origins");

            assertThat(result.pricePaid()).isEqualTo(50L);
            assertThat(result.balanceAfter()).isEqualTo(150L);
            assertThat(result.bankStockAfter()).isEqualTo(fixture.properties.getGacha().getBankRefillQuantity() - 1);
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(1);
            assertThat(result.purchasesToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("일일 구매 한도를 넘으면 거절")
        void dailyLimit() {
            fixture.seed("u", 1_000L);
            fixture.properties.getGacha().setDailyPurchaseLimit(2);

            gachaService.buy("u", "origins");
            gachaService.buy("u", "origins");

            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(DailyLimitExceededException.class);
            assertThat(fixture.balanceOf("u")).isEqualTo(900L);
        }

        @Test
        @DisplayName("일일 카운터는 24시간 TTL로 저장된다")
        void dailyCounterTtl() {
            fixture.seed("u", 1_000L);

            gachaService.buy("u", "origins");

            String key = "daily:purchase:u:" + LocalDate.now(fixture.clock);
            assertThat(fixture.store.ttlOf(key)).contains(Duration.ofHours(24));
        }

        @Test
        @DisplayName("기본 한도에서 다섯 번째 구매는 성공하고 여섯 번째는 거절")
        void defaultDailyLimitBoundary() {
            fixture.seed("u", 1_000L);

            for (int i = 1; i <= 5; i++) {
                assertThat(gachaService.buy("u", "origins").purchasesToday()).isEqualTo(i);
            }

            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(DailyLimitExceededException.class);
        }

        @Test
        @DisplayName("은행의 마지막 재고를 사면 재고가 0이 된다")
        void lastUnit() {
            fixture.seed("u", 1_000L);
            fixture.properties.getGacha().setBankRefillQuantity(1);

            PurchaseResult result = gachaService.buy("u", "origins");

            assertThat(result.bankStockAfter()).isZero();
        }

        @Test
        @DisplayName("은행 재고가 없으면 거절하고 잔액은 그대로")
        void outOfStock() {
            fixture.seed("u", 1_000L);
            fixture.properties.getGacha().setBankRefillQuantity(1);
            gachaService.buy("u", "origins");

            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(OutOfStockException.class);
            assertThat(fixture.balanceOf("u")).isEqualTo(950L);
        }

        @Test
        @DisplayName("은행 재고는 보충 주기가 지나면 다시 채워진다")
        void bankRefill() {
            fixture.seed("u", 1_000L);
            fixture.properties.getGacha().setBankRefillQuantity(1);
            gachaService.buy("u", "origins");

            fixture.clock.advance(fixture.properties.getGacha().getBankRefillInterval());

            assertThat(gachaService.bank().stockOf("origins")).isEqualTo(1);
        }

        @Test
        @DisplayName("잔액 부족이면 인벤토리와 은행이 바뀌지 않는다")
        void insufficient() {
            fixture.seed("u", 10L);

            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(InsufficientBalanceException.class);
            assertThat(gachaService.containers("u").isEmpty()).isTrue();
            assertThat(gachaService.bank().stockOf("origins"))
                    .isEqualTo(fixture.properties.getGacha().getBankRefillQuantity());
        }

        @Test
        @DisplayName("은행 재고 저장이 실패하면 차감도 지급도 일어나지 않는다")
        void bankWriteFails() {
            // given
            fixture.seed("u", 200L);
            int stock = gachaService.bank().stockOf("origins");
            fixture.store.failWritesFor("bank:");

            // when & then
            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(TransientStoreException.class);
            fixture.store.failWritesFor(null);
            assertThat(fixture.balanceOf("u")).isEqualTo(200L);
            assertThat(gachaService.containers("u").isEmpty()).isTrue();
            assertThat(gachaService.bank().stockOf("origins")).isEqualTo(stock);
        }

        @Test
        @DisplayName("케이스 지급이 실패하면 대금이 환불되고 은행 재고가 돌아온다")
        void containerWriteFails() {
            // given
            fixture.seed("u", 200L);
            int stock = gachaService.bank().stockOf("origins");
            fixture.store.failWritesFor("case_inventory:");

            // when & then
            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(TransientStoreException.class);
            fixture.store.failWritesFor(null);
            assertThat(fixture.balanceOf("u")).isEqualTo(200L);
            assertThat(gachaService.containers("u").isEmpty()).isTrue();
            assertThat(gachaService.bank().stockOf("origins")).isEqualTo(stock);
        }

        @Test
        @DisplayName("일일 카운터 기록이 실패하면 케이스 회수, 환불, 재고 복구까지 모두 되돌린다")
        void dailyCounterWriteFails() {
            // given
            fixture.seed("u", 200L);
            int stock = gachaService.bank().stockOf("origins");
            fixture.store.failWritesFor("daily:");

            // when & then
            assertThatThrownBy(() -> gachaService.buy("u", "origins"))
                    .isInstanceOf(TransientStoreException.class);
            fixture.store.failWritesFor(null);
            assertThat(fixture.balanceOf("u")).isEqualTo(200L);
            assertThat(gachaService.containers("u").isEmpty()).isTrue();
            assertThat(gachaService.bank().stockOf("origins")).isEqualTo(stock);

            // 복구 후 정상 구매는 첫 구매로 집계
            assertThat(gachaService.buy("u", "origins").purchasesToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("무료 케이스는 잔액 없이도 받을 수 있다")
        void freeContainer() {
            PurchaseResult result = gachaService.buy("u", "free");

            assertThat(result.pricePaid()).isZero();
            assertThat(gachaService.containers("u").countOf("free")).isEqualTo(1);
        }

        @Test
        @DisplayName("없는 케이스는 거절")
        void unknownContainer() {
            assertThatThrownBy(() -> gachaService.buy("u", "nope"))
                    .isInstanceOf(ContainerNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("케이스 개봉")
    class Open {

        @Test
        @DisplayName("개봉하면 케이스가 하나 줄고 설정된 수만큼 아이템을 얻는다")
        void open() {
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 2)));

            OpenResult result = gachaService.open("u", "origins");

            int draws = fixture.properties.getGacha().getDrawsPerContainer();
            assertThat(result.draws()).hasSize(draws);
            assertThat(result.remainingContainers()).isEqualTo(1);
            assertThat(result.draws()).allMatch(d -> catalog.container("origins").contains(d.item()));
            assertThat(gachaService.items("u").asMap().values().stream().mapToInt(Integer::intValue).sum())
                    .isEqualTo(draws);
        }

        @Test
        @DisplayName("처음 얻은 아이템만 신규로 표시된다")
        void firstAcquisition() {
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 1)));
            // 난수가 모두 0 → 매번 같은 커먼 아이템

            OpenResult result = gachaService.open("u", "origins");

            assertThat(result.draws().get(0).firstAcquisition()).isTrue();
            assertThat(result.draws().subList(1, result.draws().size()))
                    .noneMatch(d -> d.firstAcquisition());
        }

        @Test
        @DisplayName("케이스가 없으면 개봉할 수 없다")
        void noContainer() {
            assertThatThrownBy(() -> gachaService.open("u", "origins"))
                    .isInstanceOf(InsufficientInventoryException.class);
            assertThat(gachaService.items("u").isEmpty()).isTrue();
        }

        @Test
        @DisplayName("케이스 차감 저장이 실패하면 아이템이 지급되지 않고, 반복해도 중복 지급되지 않는다")
        void containerWriteFails() {
            // given
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 1)));
            fixture.store.failWritesFor("case_inventory:");

            // when
            for (int i = 0; i < 3; i++) {
                assertThatThrownBy(() -> gachaService.open("u", "origins"))
                        .isInstanceOf(TransientStoreException.class);
            }

            // then
            fixture.store.failWritesFor(null);
            assertThat(gachaService.items("u").isEmpty()).isTrue();
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(1);
            assertThat(gachaService.open("u", "origins").opensToday()).isEqualTo(1);
        }

        @Test
        @DisplayName("아이템 저장이 실패하면 케이스를 돌려준다")
        void itemWriteFails() {
            // given
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 1)));
            fixture.store.failWritesFor("inventory:");

            // when & then
            assertThatThrownBy(() -> gachaService.open("u", "origins"))
                    .isInstanceOf(TransientStoreException.class);
            fixture.store.failWritesFor(null);
            assertThat(gachaService.items("u").isEmpty()).isTrue();
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(1);
        }

        @Test
        @DisplayName("일일 카운터 기록이 실패하면 지급한 아이템을 회수하고 케이스를 돌려준다")
        void dailyCounterWriteFails() {
            // given
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 1)));
            fixture.gachaStore.saveItems("u", Inventory.of(Map.of("c01", 1)));
            fixture.store.failWritesFor("daily:");

            // when & then
            assertThatThrownBy(() -> gachaService.open("u", "origins"))
                    .isInstanceOf(TransientStoreException.class);
            fixture.store.failWritesFor(null);
            assertThat(gachaService.items("u").asMap()).containsExactly(Map.entry("c01", 1));
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(1);
        }

        @Test
        @DisplayName("기본 한도에서 다섯 번째 개봉은 성공하고 여섯 번째는 거절")
        void defaultDailyLimitBoundary() {
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 6)));

            for (int i = 1; i <= 5; i++) {
                assertThat(gachaService.open("u", "origins").opensToday()).isEqualTo(i);
            }

            assertThatThrownBy(() -> gachaService.open("u", "origins"))
                    .isInstanceOf(DailyLimitExceededException.class);
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(1);
        }

        @Test
        @DisplayName("일일 개봉 한도를 넘으면 거절")
        void dailyLimit() {
            fixture.properties.getGacha().setDailyOpenLimit(1);
            fixture.gachaStore.saveContainers("u", Inventory.of(Map.of("origins", 3)));
            gachaService.open("u", "origins");

            assertThatThrownBy(() -> gachaService.open("u", "origins"))
                    .isInstanceOf(DailyLimitExceededException.class);
            assertThat(gachaService.containers("u").countOf("origins")).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("아이템 판매")
    class Sell {

        @BeforeEach
        void givenItems() {
            fixture.gachaStore.saveItems("u", Inventory.of(Map.of("e01", 5)));
            when(pricing.priceOf("e01")).thenReturn(100L);
        }

        @Test
        @DisplayName("단가 100인 아이템 3개를 팔면 150 크레딧을 받고 3개가 줄어든다")
        void confirm() {
            SaleConfirmationSession session = gachaService.requestSale("u", "ch", "e01", 3);

            SaleResult result = gachaService.confirmSale(session.getId(), "u");

            assertThat(result.proceeds()).isEqualTo(150L);
            assertThat(result.remaining()).isEqualTo(2);
            assertThat(fixture.balanceOf("u")).isEqualTo(150L);
            assertThat(gachaService.items("u").countOf("e01")).isEqualTo(2);
        }

        @Test
        @DisplayName("보유량보다 많이 팔려고 하면 거절되고 아무것도 바뀌지 않는다")
        void moreThanHeld() {
            assertThatThrownBy(() -> gachaService.requestSale("u", "ch", "e01", 6))
                    .isInstanceOf(InsufficientInventoryException.class);

            assertThat(gachaService.items("u").countOf("e01")).isEqualTo(5);
            assertThat(fixture.balanceOf("u")).isZero();
            assertThat(fixture.registry.activeCount()).isZero();
        }

        @Test
        @DisplayName("판매 요청 이후 시세가 바뀌어도 요청 시점 단가로 정산된다")
        void priceLockedAtRequest() {
            SaleConfirmationSession session = gachaService.requestSale("u", "ch", "e01", 2);
            when(pricing.priceOf("e01")).thenReturn(1_000L);

            SaleResult result = gachaService.confirmSale(session.getId(), "u");

            assertThat(result.unitPrice()).isEqualTo(100L);
            assertThat(result.proceeds()).isEqualTo(100L);
        }

        @Test
        @DisplayName("판매자가 아닌 사람은 확인할 수 없다")
        void confirm_NotOwner() {
            SaleConfirmationSession session = gachaService.requestSale("u", "ch", "e01", 1);

            assertThatThrownBy(() -> gachaService.confirmSale(session.getId(), "other"))
                    .isInstanceOf(NotSessionOwnerException.class);
            assertThat(gachaService.items("u").countOf("e01")).isEqualTo(5);
        }

        @Test
        @DisplayName("판매자가 아닌 사람은 취소할 수 없고, 판매자는 이후에도 확인할 수 있다")
        void cancel_NotOwner() {
            // given
            SaleConfirmationSession session = gachaService.requestSale("u", "ch", "e01", 1);

            // when & then
            assertThatThrownBy(() -> gachaService.cancelSale(session.getId(), "other"))
                    .isInstanceOf(NotSessionOwnerException.class);

            SaleResult result = gachaService.confirmSale(session.getId(), "u");
            assertThat(result.proceeds()).isEqualTo(50L);
            assertThat(gachaService.items("u").countOf("e01")).isEqualTo(4);
        }

        @Test
        @DisplayName("취소하면 인벤토리와 잔액이 그대로이고 다시 확인할 수 없다")
        void cancel() {
            SaleConfirmationSession session = gachaService.requestSale("u", "ch", "e01", 1);

            gachaService.cancelSale(session.getId(), "u");

            assertThat(gachaService.items("u").countOf("e01")).isEqualTo(5);
            assertThatThrownBy(() -> gachaService.confirmSale(session.getId(), "u"))
                    .isInstanceOf(SessionNotFoundException.class);
        }
    }
}
