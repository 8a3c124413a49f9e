package com.stratlab.engine;

import com.stratlab.core.model.CommissionAttribution;
import com.stratlab.core.model.EquityPoint;
import com.stratlab.core.model.ExitReason;
import com.stratlab.core.model.Trade;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for portfolio cash, position and trade accounting.
 */
class PortfolioTest {

    private static final double EPS = 1e-9;
    private static final LocalDate D1 = LocalDate.of(2024, 3, 1);
    private static final LocalDate D2 = LocalDate.of(2024, 3, 8);

    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        portfolio = new Portfolio(100_000, 0.001);
    }

    @Nested
    @DisplayName("Opening and Closing")
    class OpenCloseTests {

        @Test
        @DisplayName("Open debits cost plus commission")
        void openDebitsCash() {
            assertTrue(portfolio.openPosition("AAPL", D1, 50, 100, null, null, null));

            assertEquals(100_000 - 50 * 100 * 1.001, portfolio.getCash(), EPS);
            assertEquals(5.0, portfolio.getTotalCommission(), EPS);
            assertTrue(portfolio.hasPosition("AAPL"));
            assertEquals(5000.0, portfolio.getTotalPositionCost(), EPS);
        }

        @Test
        @DisplayName("Close credits proceeds minus commission and records one trade")
        void closeCreditsCash() {
            portfolio.openPosition("AAPL", D1, 50, 100, null, null, null);
            double cashBefore = portfolio.getCash();

            Optional<Trade> trade = portfolio.closePosition("AAPL", D2, 55);

            assertTrue(trade.isPresent());
            assertEquals(cashBefore + 55 * 100 * 0.999, portfolio.getCash(), EPS);
            assertEquals(100_489.5, portfolio.getCash(), EPS);
            assertFalse(portfolio.hasPosition("AAPL"));
            assertEquals(1, portfolio.getTrades().size());
            assertEquals(ExitReason.SIGNAL, trade.get().exitReason());
            assertEquals(10.5, portfolio.getTotalCommission(), EPS);
        }

        @Test
        @DisplayName("Per-trade commission: pnl of 100 shares from 50 to 55")
        void perTradeCommission() {
            portfolio.openPosition("AAPL", D1, 50, 100, null, null, null);
            Trade trade = portfolio.closePosition("AAPL", D2, 55).orElseThrow();

            assertEquals(10.5, trade.commission(), EPS);
            assertEquals(489.5, trade.pnl(), EPS);
            // cash gain equals the trade pnl
            assertEquals(portfolio.getCash() - 100_000, trade.pnl(), EPS);
            assertEquals(7, trade.holdingDays());
        }

        @Test
        @DisplayName("Cumulative commission: trade carries the running total")
        void cumulativeCommission() {
            Portfolio legacy = new Portfolio(100_000, 0.001, CommissionAttribution.CUMULATIVE);
            legacy.openPosition("AAPL", D1, 50, 100, null, null, null);
            Trade first = legacy.closePosition("AAPL", D2, 55).orElseThrow();
            assertEquals(5.0, first.commission(), EPS);
            assertEquals(495.0, first.pnl(), EPS);

            legacy.openPosition("AAPL", D2, 50, 100, null, null, null);
            Trade second = legacy.closePosition("AAPL", D2.plusDays(1), 50).orElseThrow();
            assertEquals(5.0 + 5.5 + 5.0, second.commission(), EPS);
        }

        @Test
        @DisplayName("One position per ticker")
        void onePositionPerTicker() {
            assertTrue(portfolio.openPosition("AAPL", D1, 50, 10, null, null, null));
            double cash = portfolio.getCash();

            assertFalse(portfolio.openPosition("AAPL", D2, 60, 10, null, null, null));
            assertEquals(cash, portfolio.getCash());
            assertEquals(50.0, portfolio.getPosition("AAPL").orElseThrow().getEntryPrice());

            assertTrue(portfolio.openPosition("MSFT", D1, 60, 10, null, null, null));
            assertEquals(2, portfolio.getPositions().size());
        }

        @Test
        @DisplayName("Rejects non-positive quantity and insufficient cash")
        void rejectsInvalidOpen() {
            assertFalse(portfolio.openPosition("AAPL", D1, 50, 0, null, null, null));
            assertFalse(portfolio.openPosition("AAPL", D1, 50, -5, null, null, null));
            // 2000 x 50 = 100,000 plus commission exceeds cash
            assertFalse(portfolio.openPosition("AAPL", D1, 50, 2000, null, null, null));

            assertEquals(100_000, portfolio.getCash());
            assertEquals(0, portfolio.getTotalCommission());
            assertFalse(portfolio.hasPosition("AAPL"));
        }

        @Test
        @DisplayName("Closing without a position is a no-op")
        void closeWithoutPosition() {
            assertTrue(portfolio.closePosition("AAPL", D1, 50).isEmpty());
            assertEquals(100_000, portfolio.getCash());
            assertTrue(portfolio.getTrades().isEmpty());
        }
    }

    @Nested
    @DisplayName("Stops and Targets")
    class StopTests {

        @Test
        @DisplayName("Trailing stop only ratchets up")
        void trailingStopRatchets() {
            portfolio.openPosition("AAPL", D1, 100, 10, null, null, 10.0);

            portfolio.updateTrailingStop("AAPL", 110);
            assertEquals(99.0, portfolio.getPosition("AAPL").orElseThrow().getStopLoss(), EPS);

            double previous = 99.0;
            for (double price : new double[]{110, 105, 105, 90, 50}) {
                portfolio.updateTrailingStop("AAPL", price);
                double stop = portfolio.getPosition("AAPL").orElseThrow().getStopLoss();
                assertTrue(stop >= previous, "stop fell from " + previous + " to " + stop);
                previous = stop;
            }
            assertEquals(99.0, previous, EPS);

            portfolio.updateTrailingStop("AAPL", 120);
            assertEquals(108.0, portfolio.getPosition("AAPL").orElseThrow().getStopLoss(), EPS);
        }

        @Test
        @DisplayName("Trailing stop starts from a fixed stop")
        void trailingAboveFixedStop() {
            portfolio.openPosition("AAPL", D1, 100, 10, 95.0, null, 10.0);

            portfolio.updateTrailingStop("AAPL", 100);
            assertEquals(95.0, portfolio.getPosition("AAPL").orElseThrow().getStopLoss(), EPS);
            portfolio.updateTrailingStop("AAPL", 110);
            assertEquals(99.0, portfolio.getPosition("AAPL").orElseThrow().getStopLoss(), EPS);
        }

        @Test
        @DisplayName("Positions without trailing percentage are untouched")
        void noTrailing() {
            portfolio.openPosition("AAPL", D1, 100, 10, 95.0, null, null);
            portfolio.updateTrailingStop("AAPL", 200);
            assertEquals(95.0, portfolio.getPosition("AAPL").orElseThrow().getStopLoss(), EPS);

            portfolio.openPosition("MSFT", D1, 100, 10, null, null, 0.0);
            assertNull(portfolio.getPosition("MSFT").orElseThrow().getTrailingStopPct());
        }

        @Test
        @DisplayName("Stop-loss tests the low, take-profit the close")
        void exitConditions() {
            portfolio.openPosition("AAPL", D1, 100, 10, 95.0, 115.0, null);

            assertEquals(Optional.empty(), portfolio.checkExitConditions("AAPL", 100, 96));
            assertEquals(Optional.of(ExitReason.STOP_LOSS), portfolio.checkExitConditions("AAPL", 100, 95));
            assertEquals(Optional.of(ExitReason.TAKE_PROFIT), portfolio.checkExitConditions("AAPL", 115, 110));
            assertEquals(Optional.empty(), portfolio.checkExitConditions("AAPL", 114, 96));
        }

        @Test
        @DisplayName("Stop-loss wins when both trigger")
        void stopWins() {
            portfolio.openPosition("AAPL", D1, 100, 10, 95.0, 115.0, null);
            assertEquals(Optional.of(ExitReason.STOP_LOSS), portfolio.checkExitConditions("AAPL", 120, 90));
        }

        @Test
        @DisplayName("No exit for a ticker without a position")
        void noPosition() {
            assertEquals(Optional.empty(), portfolio.checkExitConditions("AAPL", 1, 1));
        }
    }

    @Nested
    @DisplayName("Equity")
    class EquityTests {

        @Test
        @DisplayName("Equity is cash plus marked positions")
        void marksToMarket() {
            portfolio.openPosition("AAPL", D1, 50, 100, null, null, null);

            EquityPoint point = portfolio.recordEquity(D1, Map.of("AAPL", 60.0));

            assertEquals(94_995 + 6000, point.equity(), EPS);
            assertEquals(94_995, point.cash(), EPS);
            assertEquals(6000, point.positionsValue(), EPS);
            assertEquals(1, portfolio.getEquityCurve().size());
        }

        @Test
        @DisplayName("Position without a price is valued at entry")
        void missingPriceUsesEntry() {
            portfolio.openPosition("AAPL", D1, 50, 100, null, null, null);

            EquityPoint point = portfolio.recordEquity(D1, Map.of("MSFT", 10.0));

            assertEquals(94_995 + 5000, point.equity(), EPS);
        }

        @Test
        @DisplayName("Statistics summarize closed trades")
        void statistics() {
            portfolio.openPosition("AAPL", D1, 50, 100, null, null, null);
            portfolio.closePosition("AAPL", D2, 55);

            var stats = portfolio.getStatistics();
            assertEquals(1, stats.totalTrades());
            assertEquals(1, stats.winningTrades());
            assertEquals(489.5, stats.totalPnl(), EPS);
            assertEquals(10.5, stats.totalCommission(), EPS);
        }
    }
}
