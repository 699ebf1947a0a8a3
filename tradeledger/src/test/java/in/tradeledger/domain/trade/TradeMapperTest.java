package in.tradeledger.domain.trade;

import in.tradeledger.domain.broker.BrokerIds;
import in.tradeledger.fixtures.RawTradeFixtures;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TradeMapper.
 *
 * Tests:
 * - Side inversion (1 -> buy, anything else -> sell)
 * - Fee doubling, missing fee stored as zero
 * - Fields copied verbatim
 * - Unrealized executions rejected
 */
class TradeMapperTest {

    @Test
    void testSideOneMapsToBuy() {
        Trade trade = TradeMapper.fromRemote(BrokerIds.TOPSTEP,
            RawTradeFixtures.realized(1L, "2024-03-15T09:30:00Z", 1));

        assertEquals(Trade.SIDE_BUY, trade.side());
    }

    @Test
    void testOtherSidesMapToSell() {
        assertEquals(Trade.SIDE_SELL, TradeMapper.sideOf(0));
        assertEquals(Trade.SIDE_SELL, TradeMapper.sideOf(2));
        assertEquals(Trade.SIDE_SELL, TradeMapper.sideOf(-1));
    }

    @Test
    void testFeesAreDoubled() {
        Trade trade = TradeMapper.fromRemote(BrokerIds.TOPSTEP,
            RawTradeFixtures.realized(1L, "2024-03-15T09:30:00Z", 0));

        assertEquals(0, new BigDecimal("2.80").compareTo(trade.fees()));
    }

    @Test
    void testFieldsCopiedVerbatim() {
        RawTrade raw = RawTradeFixtures.realized(42L, "2024-03-15T09:30:00.123+00:00", 0);

        Trade trade = TradeMapper.fromRemote(BrokerIds.TOPSTEP, raw);

        assertEquals(BrokerIds.TOPSTEP, trade.broker());
        assertEquals(raw.accountId(), trade.accountId());
        assertEquals(42L, trade.orderId());
        assertEquals("2024-03-15T09:30:00.123+00:00", trade.creationTimestamp());
        assertEquals(raw.contractId(), trade.contractId());
        assertEquals(raw.price(), trade.price());
        assertEquals(raw.profitAndLoss(), trade.profitAndLoss());
        assertEquals(raw.size(), trade.size());
    }

    @Test
    void testMissingFeesStoredAsZero() {
        RawTrade raw = new RawTrade(70L, 7L, RawTradeFixtures.ACCOUNT_ID, "CON.F.US.EP.M25",
            "2024-03-15T09:30:00Z", new BigDecimal("5000"), new BigDecimal("25"), null,
            1, BigDecimal.ONE, false);

        Trade trade = TradeMapper.fromRemote(BrokerIds.TOPSTEP, raw);

        assertNotNull(trade.fees());
        assertEquals(0, BigDecimal.ZERO.compareTo(trade.fees()));
    }

    @Test
    void testUnrealizedRejected() {
        RawTrade raw = RawTradeFixtures.unrealized(3L, "2024-03-15T09:30:00Z");

        assertFalse(raw.isRealized());
        assertThrows(IllegalArgumentException.class, () -> TradeMapper.fromRemote(BrokerIds.TOPSTEP, raw));
    }
}
