package com.anchorinsights.metrics.filter;

import com.anchorinsights.common.model.LiquidityTrend;
import com.anchorinsights.metrics.corridor.CorridorAggregator;
import com.anchorinsights.metrics.dto.CorridorMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.anchorinsights.metrics.support.FakeLedgerDataSource.payment;
import static org.junit.jupiter.api.Assertions.*;

class CorridorFilterTest {

    static CorridorMetrics corridor(String sourceCode, double successRate, double volume) {
        return new CorridorMetrics(sourceCode + ":GISSUER->XLM:native", sourceCode, "XLM", successRate,
                                   10, 10, 0, 600, 450, 1500, 2400, volume, volume * 0.1,
                                   LiquidityTrend.DECREASING, 80, "2024-05-01T12:00:00Z");
    }

    @Nested
    @DisplayName("matching")
    class MatchTests {

        @Test
        @DisplayName("empty filter passes everything")
        void none() {
            assertTrue(CorridorFilter.none().matches(corridor("USD", 0, 0)));
        }

        @Test
        @DisplayName("volume bounds are inclusive")
        void inclusiveVolume() {
            CorridorFilter filter = new CorridorFilter(null, null, 100.0, 200.0, null, null);

            assertTrue(filter.matches(corridor("USD", 100, 100.0)));
            assertTrue(filter.matches(corridor("USD", 100, 200.0)));
            assertFalse(filter.matches(corridor("USD", 100, 99.99)));
            assertFalse(filter.matches(corridor("USD", 100, 200.01)));
        }

        @Test
        @DisplayName("success rate bounds are inclusive")
        void inclusiveSuccessRate() {
            CorridorFilter filter = new CorridorFilter(95.0, 99.0, null, null, null, null);

            assertTrue(filter.matches(corridor("USD", 95.0, 1)));
            assertTrue(filter.matches(corridor("USD", 99.0, 1)));
            assertFalse(filter.matches(corridor("USD", 100.0, 1)));
        }

        @Test
        @DisplayName("asset code is a case-insensitive substring of either asset")
        void assetCode() {
            CorridorFilter usd = new CorridorFilter(null, null, null, null, "usd", null);
            CorridorFilter xlm = new CorridorFilter(null, null, null, null, "xlm", null);

            assertTrue(usd.matches(corridor("USDC", 100, 1)));
            assertFalse(usd.matches(corridor("EUR", 100, 1)));
            assertTrue(xlm.matches(corridor("EUR", 100, 1)));
        }

        @Test
        @DisplayName("issuer text and the native issuer marker never match")
        void issuerNotMatched() {
            CorridorMetrics aggregated = new CorridorAggregator()
                .aggregate(List.of(payment("USD", "GABCISSUER", "10")))
                .get(0);

            assertEquals("USD", aggregated.sourceAsset());
            assertEquals("XLM", aggregated.destinationAsset());
            assertFalse(new CorridorFilter(null, null, null, null, "gabc", null).matches(aggregated));
            assertFalse(new CorridorFilter(null, null, null, null, "native", null).matches(aggregated));
            assertTrue(new CorridorFilter(null, null, null, null, "usd", null).matches(aggregated));
        }

        @Test
        @DisplayName("time period does not narrow the result")
        void timePeriodIgnored() {
            CorridorFilter filter = new CorridorFilter(null, null, null, null, null, "7d");

            assertEquals(2, filter.apply(List.of(corridor("A", 1, 1), corridor("B", 2, 2))).size());
        }
    }

    @Nested
    @DisplayName("fingerprint")
    class FingerprintTests {

        @Test
        @DisplayName("absent filter renders every field as None")
        void allAbsent() {
            assertEquals("sr_min:None_sr_max:None_vol_min:None_vol_max:None_asset:None_period:None",
                         CorridorFilter.none().fingerprint());
        }

        @Test
        @DisplayName("absent asset code differs from empty asset code")
        void absentVersusEmpty() {
            CorridorFilter empty = new CorridorFilter(null, null, null, null, "", null);

            assertNotEquals(CorridorFilter.none().fingerprint(), empty.fingerprint());
            assertTrue(empty.fingerprint().contains("_asset:Some(\"\")"));
        }

        @Test
        @DisplayName("present values render with explicit markers")
        void present() {
            CorridorFilter filter = new CorridorFilter(95.0, null, 1000.5, null, "USD", "24h");

            assertEquals("sr_min:Some(95.0)_sr_max:None_vol_min:Some(1000.5)_vol_max:None"
                             + "_asset:Some(\"USD\")_period:Some(\"24h\")",
                         filter.fingerprint());
        }
    }
}
